package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.math.BigInteger;

/**
 * An idempotency key was reused for a deposit with a different amount.
 */
public class DepositKeyConflictException extends RevenueLedgerException {

    public DepositKeyConflictException(String ledgerAddress, String idempotencyKey,
                                       BigInteger originalAmount, BigInteger requestedAmount) {
        super(ErrorCategory.CONFLICT,
                String.format("Idempotency key %s was already used on ledger %s for amount %s",
                        idempotencyKey, ledgerAddress, originalAmount),
                details("ledger", ledgerAddress, "idempotency_key", idempotencyKey,
                        "original_amount", originalAmount, "requested_amount", requestedAmount));
    }
}
