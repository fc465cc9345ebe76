package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

/**
 * The provisioner may have created a ledger that was not captured.
 * Requires manual reconciliation; retrying could provision a duplicate.
 */
public class AmbiguousDeploymentException extends RevenueLedgerException {

    public AmbiguousDeploymentException(UUID roundId, String reason) {
        this(roundId, reason, null);
    }

    public AmbiguousDeploymentException(UUID roundId, String reason, Throwable cause) {
        super(ErrorCategory.AMBIGUOUS_DEPLOYMENT,
                String.format("Deployment outcome for round %s is unknown, reconciliation required: %s",
                        roundId, reason),
                details("round_id", roundId, "reason", reason, "reconciliation_required", true),
                cause);
    }
}
