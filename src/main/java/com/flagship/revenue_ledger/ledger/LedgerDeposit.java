package com.flagship.revenue_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded revenue deposit. The idempotency key is unique per ledger.
 */
@Value
public class LedgerDeposit {
    UUID id;
    String ledgerAddress;
    BigInteger amount;
    String idempotencyKey;
    Instant createdAt;
}
