package com.flagship.revenue_ledger.common;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

/**
 * Raised when an owner, claimant or ledger identity is not a well-formed address.
 */
public class InvalidAddressException extends RevenueLedgerException {

    public InvalidAddressException(String role, String address) {
        super(ErrorCategory.VALIDATION,
                String.format("Invalid %s address: %s", role, address),
                details("role", role, "address", address));
    }
}
