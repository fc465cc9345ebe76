package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

public class RoundNotFundingException extends RevenueLedgerException {

    public RoundNotFundingException(UUID roundId, FundingStatus status) {
        super(ErrorCategory.CONFLICT,
                String.format("Round %s is no longer accepting contributions, status: %s", roundId, status),
                details("round_id", roundId, "status", status));
    }
}
