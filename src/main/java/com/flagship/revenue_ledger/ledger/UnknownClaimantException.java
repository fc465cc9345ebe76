package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

public class UnknownClaimantException extends RevenueLedgerException {

    public UnknownClaimantException(String ledgerAddress, String claimant) {
        super(ErrorCategory.WITHDRAWAL,
                String.format("Account %s has no shares in ledger %s", claimant, ledgerAddress),
                details("ledger", ledgerAddress, "claimant", claimant));
    }
}
