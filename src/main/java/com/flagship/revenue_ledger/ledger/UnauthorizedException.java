package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

public class UnauthorizedException extends RevenueLedgerException {

    public UnauthorizedException(String ledgerAddress, String caller, String operation) {
        super(ErrorCategory.UNAUTHORIZED,
                String.format("Caller %s is not the administrator of ledger %s, %s rejected",
                        caller, ledgerAddress, operation),
                details("ledger", ledgerAddress, "caller", caller, "operation", operation));
    }
}
