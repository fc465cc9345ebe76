package com.flagship.revenue_ledger.exception;

/**
 * Broad classification of domain errors.
 *
 * The category tells a caller what to do next: correct the input, retry,
 * or escalate to manual reconciliation.
 */
public enum ErrorCategory {
    /** Bad input, rejected before any state mutation. Correct and resend. */
    VALIDATION,
    NOT_FOUND,
    /** The request conflicts with current state (already deployed, attempt in flight). */
    CONFLICT,
    UNAUTHORIZED,
    /** Release rejected: nothing due, cap reached, ledger paused, unknown claimant. */
    WITHDRAWAL,
    /** Rounding correction cannot keep every share positive. */
    DEGENERATE_ALLOCATION,
    /** Provisioning failed with a known-clean outcome. Retryable. */
    DEPLOYMENT_FAILED,
    /** Provisioning outcome unknown. Never retried automatically. */
    AMBIGUOUS_DEPLOYMENT,
    /** The value transfer collaborator rejected a transfer. */
    TRANSFER_FAILED,
    /** A defect: the operation would have broken a ledger invariant. */
    INVARIANT_VIOLATION
}
