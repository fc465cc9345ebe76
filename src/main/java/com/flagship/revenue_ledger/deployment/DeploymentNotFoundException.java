package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

public class DeploymentNotFoundException extends RevenueLedgerException {

    public DeploymentNotFoundException(UUID roundId) {
        super(ErrorCategory.NOT_FOUND, "No deployment record for round " + roundId,
                details("round_id", roundId));
    }
}
