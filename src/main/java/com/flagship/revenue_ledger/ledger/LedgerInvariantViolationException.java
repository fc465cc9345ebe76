package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.Map;

/**
 * A ledger operation would have produced an inconsistent state.
 *
 * Unreachable in a correct build. When raised, the whole operation aborts
 * and its transaction rolls back; nothing is clamped.
 */
public class LedgerInvariantViolationException extends RevenueLedgerException {

    public LedgerInvariantViolationException(String invariant, Map<String, ?> context) {
        super(ErrorCategory.INVARIANT_VIOLATION, "Ledger invariant violated: " + invariant, context);
    }
}
