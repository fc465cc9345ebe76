package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

public class LedgerPausedException extends RevenueLedgerException {

    public LedgerPausedException(String ledgerAddress, String operation) {
        super(ErrorCategory.WITHDRAWAL,
                String.format("Ledger %s is paused, %s rejected", ledgerAddress, operation),
                details("ledger", ledgerAddress, "operation", operation));
    }
}
