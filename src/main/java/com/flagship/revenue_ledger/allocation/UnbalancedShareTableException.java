package com.flagship.revenue_ledger.allocation;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

public class UnbalancedShareTableException extends RevenueLedgerException {

    public UnbalancedShareTableException(int totalShares) {
        super(ErrorCategory.VALIDATION,
                String.format("Shares must sum to %d, got %d", ShareTable.TOTAL_SHARES, totalShares),
                details("total_shares", totalShares, "expected", ShareTable.TOTAL_SHARES));
    }
}
