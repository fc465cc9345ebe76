package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.exception.RevenueLedgerException;
import lombok.Value;

/**
 * What a contribution led to. When the contribution reached the goal,
 * {@code deploymentAttempted} is true and either {@code ledgerAddress} or
 * {@code deploymentFailure} is set; the contribution itself is committed in
 * both cases.
 */
@Value
public class FundingOutcome {
    ContributionReceipt contribution;
    FundingRound round;
    boolean deploymentAttempted;
    String ledgerAddress;
    RevenueLedgerException deploymentFailure;

    static FundingOutcome contributed(ContributionReceipt contribution) {
        return new FundingOutcome(contribution, contribution.getRound(), false, null, null);
    }

    static FundingOutcome deployed(ContributionReceipt contribution, FundingRound round, String ledgerAddress) {
        return new FundingOutcome(contribution, round, true, ledgerAddress, null);
    }

    static FundingOutcome deploymentFailed(ContributionReceipt contribution, FundingRound round,
                                           RevenueLedgerException failure) {
        return new FundingOutcome(contribution, round, true, null, failure);
    }

    public boolean isDeployed() {
        return ledgerAddress != null;
    }
}
