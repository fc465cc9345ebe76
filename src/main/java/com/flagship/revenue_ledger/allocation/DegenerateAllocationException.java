package com.flagship.revenue_ledger.allocation;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.math.BigDecimal;

/**
 * The contribution set is so skewed that at least one claimant would end up
 * with zero (or negative) basis points. The caller has to pick another
 * allocation strategy or reject the round.
 */
public class DegenerateAllocationException extends RevenueLedgerException {

    public DegenerateAllocationException(String claimant, BigDecimal amount, int shares) {
        super(ErrorCategory.DEGENERATE_ALLOCATION,
                String.format("Degenerate allocation: claimant %s contributing %s would receive %d shares",
                        claimant, amount.toPlainString(), shares),
                details("claimant", claimant, "amount", amount.toPlainString(), "shares", shares));
    }
}
