package com.flagship.revenue_ledger.transfer;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Proof that a transfer fully succeeded. {@code reference} identifies it in
 * the collaborator's own records.
 */
@Value
public class TransferReceipt {
    String reference;
    BigInteger amount;
    Instant completedAt;
}
