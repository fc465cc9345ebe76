package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

public class ContributionRejectedException extends RevenueLedgerException {

    public ContributionRejectedException(UUID roundId, String reason) {
        super(ErrorCategory.VALIDATION, "Contribution rejected: " + reason,
                details("round_id", roundId, "reason", reason));
    }
}
