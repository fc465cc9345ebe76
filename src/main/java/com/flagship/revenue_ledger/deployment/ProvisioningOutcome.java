package com.flagship.revenue_ledger.deployment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Three-way result of a provisioning attempt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProvisioningOutcome {

    public enum Kind {
        SUCCEEDED,
        FAILED,
        AMBIGUOUS
    }

    Kind kind;
    String ledgerAddress;
    String reason;

    public static ProvisioningOutcome succeeded(String ledgerAddress) {
        return new ProvisioningOutcome(Kind.SUCCEEDED, ledgerAddress, null);
    }

    public static ProvisioningOutcome failed(String reason) {
        return new ProvisioningOutcome(Kind.FAILED, null, reason);
    }

    public static ProvisioningOutcome ambiguous(String reason) {
        return new ProvisioningOutcome(Kind.AMBIGUOUS, null, reason);
    }
}
