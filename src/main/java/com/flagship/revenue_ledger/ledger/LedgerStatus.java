package com.flagship.revenue_ledger.ledger;

/**
 * Operational state of a ledger. Only the administrator moves between states;
 * there is no automatic unpausing.
 */
public enum LedgerStatus {
    /**
     * Accepting deposits and releases.
     */
    ACTIVE,

    /**
     * Deposits and releases are rejected until the administrator unpauses.
     */
    PAUSED
}
