package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

/**
 * Provisioning failed and is known not to have created a ledger.
 * The record is FAILED and can be retried.
 */
public class DeploymentFailedException extends RevenueLedgerException {

    public DeploymentFailedException(UUID roundId, String reason) {
        super(ErrorCategory.DEPLOYMENT_FAILED,
                String.format("Deployment for round %s failed: %s", roundId, reason),
                details("round_id", roundId, "reason", reason));
    }
}
