package com.flagship.revenue_ledger.ledger;

import java.math.BigInteger;

/**
 * The claimant has already been paid its full share of the repayment cap.
 * Further deposits will never make it due again.
 */
public class RepaymentCapReachedException extends NothingToReleaseException {

    public RepaymentCapReachedException(String ledgerAddress, String claimant, BigInteger released) {
        super(String.format("Repayment cap reached for account %s in ledger %s", claimant, ledgerAddress),
                ledgerAddress, claimant, released);
    }
}
