package com.flagship.revenue_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * A completed pull payment and the transfer that delivered it.
 */
@Value
public class ReleaseReceipt {
    UUID id;
    String ledgerAddress;
    String claimant;
    BigInteger amount;
    BigInteger releasedTotal;
    String transferReference;
    boolean capReached;
    Instant createdAt;
}
