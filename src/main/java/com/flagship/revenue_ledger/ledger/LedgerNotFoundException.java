package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

public class LedgerNotFoundException extends RevenueLedgerException {

    public LedgerNotFoundException(String ledgerAddress) {
        super(ErrorCategory.NOT_FOUND, "Ledger not found: " + ledgerAddress,
                details("ledger", ledgerAddress));
    }
}
