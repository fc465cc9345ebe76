package com.flagship.revenue_ledger.allocation;

import lombok.Value;

/**
 * One row of a {@link ShareTable}: a claimant and its basis-point share.
 */
@Value
public class ClaimantShare {
    String claimant;
    int shares;

    public static ClaimantShare of(String claimant, int shares) {
        return new ClaimantShare(claimant, shares);
    }
}
