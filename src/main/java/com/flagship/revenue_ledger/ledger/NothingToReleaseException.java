package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.math.BigInteger;

/**
 * The claimant is not due any payment right now. No state was changed.
 */
public class NothingToReleaseException extends RevenueLedgerException {

    public NothingToReleaseException(String ledgerAddress, String claimant, BigInteger released) {
        this(String.format("Account %s is not due payment from ledger %s", claimant, ledgerAddress),
                ledgerAddress, claimant, released);
    }

    protected NothingToReleaseException(String message, String ledgerAddress, String claimant, BigInteger released) {
        super(ErrorCategory.WITHDRAWAL, message,
                details("ledger", ledgerAddress, "claimant", claimant, "released", released));
    }
}
