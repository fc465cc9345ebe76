package com.flagship.revenue_ledger.ledger;

import lombok.Value;

/**
 * Outcome of a deposit call. {@code duplicate} is true when the idempotency
 * key had already been used and nothing changed.
 */
@Value
public class DepositResult {
    LedgerDeposit deposit;
    Ledger ledger;
    boolean duplicate;
}
