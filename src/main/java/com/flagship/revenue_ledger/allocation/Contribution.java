package com.flagship.revenue_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A weighted funding input: who contributed and how much.
 * Amounts are in the funding unit (fiat), not in settlement units.
 */
@Value
public class Contribution {
    String claimantId;
    BigDecimal amount;

    public static Contribution of(String claimantId, BigDecimal amount) {
        return new Contribution(claimantId, amount);
    }

    public static Contribution of(String claimantId, long amount) {
        return new Contribution(claimantId, BigDecimal.valueOf(amount));
    }
}
