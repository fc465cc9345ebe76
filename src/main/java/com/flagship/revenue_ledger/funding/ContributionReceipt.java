package com.flagship.revenue_ledger.funding;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a committed contribution. {@code goalClaimed} is true only for
 * the one contribution that reached the funding target.
 */
@Value
public class ContributionReceipt {
    Long contributionId;
    String contributorAddress;
    BigDecimal amount;
    FundingRound round;
    boolean goalClaimed;
}
