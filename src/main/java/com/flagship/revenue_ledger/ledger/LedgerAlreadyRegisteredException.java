package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.util.UUID;

public class LedgerAlreadyRegisteredException extends RevenueLedgerException {

    public LedgerAlreadyRegisteredException(String ledgerAddress, UUID roundId) {
        super(ErrorCategory.CONFLICT,
                String.format("A ledger is already registered for address %s or round %s", ledgerAddress, roundId),
                details("ledger", ledgerAddress, "round_id", roundId));
    }
}
