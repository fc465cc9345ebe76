package com.flagship.revenue_ledger.deployment;

/**
 * Lifecycle of a round's ledger deployment.
 *
 * PENDING -> DEPLOYED | FAILED | AMBIGUOUS
 * FAILED -> PENDING (explicit retry)
 * AMBIGUOUS -> DEPLOYED | FAILED (manual reconciliation only)
 */
public enum DeploymentStatus {
    PENDING,
    DEPLOYED,
    /** Known not to have provisioned anything. Retryable. */
    FAILED,
    /** The provisioner may or may not have created a ledger. Never retried automatically. */
    AMBIGUOUS
}
