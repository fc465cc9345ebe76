package com.flagship.revenue_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;

/**
 * Result of {@link Ledger#release(String)}: the updated ledger and what was booked.
 */
@Value
public class LedgerRelease {
    Ledger ledger;
    String claimant;
    BigInteger amount;

    /**
     * True when this release was the one that exhausted every claimant's cap share.
     */
    boolean capReached;
}
