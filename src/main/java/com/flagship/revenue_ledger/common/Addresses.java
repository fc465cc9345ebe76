package com.flagship.revenue_ledger.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Address format rules shared by ledgers, claimants, owners and deployment output.
 *
 * An address is {@code 0x} followed by 40 hex digits. The all-zero address is
 * rejected. Addresses are compared in lower case, so mixed-case (checksummed)
 * input maps to the same identity.
 */
public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null
                && ADDRESS_PATTERN.matcher(address).matches()
                && !ZERO_ADDRESS.equalsIgnoreCase(address);
    }

    /**
     * Validates and lower-cases an address.
     *
     * @param role what the address identifies, used in the error message
     * @throws InvalidAddressException if the address is malformed
     */
    public static String normalize(String role, String address) {
        if (!isValid(address)) {
            throw new InvalidAddressException(role, address);
        }
        return address.toLowerCase(Locale.ROOT);
    }
}
