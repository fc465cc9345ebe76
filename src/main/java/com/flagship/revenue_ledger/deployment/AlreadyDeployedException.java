package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

/**
 * The round already has a deployed ledger. Nothing was provisioned.
 */
public class AlreadyDeployedException extends RevenueLedgerException {

    private final String ledgerAddress;

    public AlreadyDeployedException(UUID roundId, String ledgerAddress) {
        super(ErrorCategory.CONFLICT,
                String.format("Round %s is already deployed at %s", roundId, ledgerAddress),
                details("round_id", roundId, "ledger", ledgerAddress));
        this.ledgerAddress = ledgerAddress;
    }

    public String getLedgerAddress() {
        return ledgerAddress;
    }
}
