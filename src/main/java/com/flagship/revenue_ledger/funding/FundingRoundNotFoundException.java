package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

public class FundingRoundNotFoundException extends RevenueLedgerException {

    public FundingRoundNotFoundException(UUID roundId) {
        super(ErrorCategory.NOT_FOUND, "Funding round not found: " + roundId, details("round_id", roundId));
    }
}
