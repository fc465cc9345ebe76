package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

public class DeploymentInProgressException extends RevenueLedgerException {

    public DeploymentInProgressException(UUID roundId) {
        super(ErrorCategory.CONFLICT,
                String.format("A deployment attempt for round %s is already in progress", roundId),
                details("round_id", roundId));
    }
}
