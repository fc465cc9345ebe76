package com.flagship.revenue_ledger.allocation;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.Map;

public class EmptyContributionsException extends RevenueLedgerException {

    public EmptyContributionsException() {
        super(ErrorCategory.VALIDATION, "Cannot allocate shares: no contributions", Map.of());
    }
}
