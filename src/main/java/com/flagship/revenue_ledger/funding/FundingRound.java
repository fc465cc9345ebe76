package com.flagship.revenue_ledger.funding;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A crowd-funding round that turns into a ledger once its target is met.
 *
 * Immutable. {@code goalReachedAt} is claimed once, by the contribution that
 * first brings {@code currentFunding} to the target; that contribution's
 * caller owns the deployment. The round goes LIVE only when a ledger address
 * has been recorded.
 */
@Value
public class FundingRound {

    /** Fiat amounts are stored as NUMERIC(19,2). */
    public static final int FIAT_SCALE = 2;

    UUID id;
    String ownerAddress;
    BigDecimal fundingTarget;
    BigDecimal currentFunding;
    int contributionCount;
    FundingStatus status;
    Instant goalReachedAt;
    String ledgerAddress;
    Instant createdAt;
    Instant updatedAt;

    public static FundingRound open(String ownerAddress, BigDecimal fundingTarget) {
        if (fundingTarget == null || fundingTarget.signum() <= 0) {
            throw new IllegalArgumentException("Funding target must be greater than zero");
        }
        if (exceedsFiatScale(fundingTarget)) {
            throw new IllegalArgumentException("Funding target may have at most " + FIAT_SCALE + " decimal places");
        }
        Instant now = Instant.now();
        return new FundingRound(UUID.randomUUID(), ownerAddress, fundingTarget, BigDecimal.ZERO, 0,
            FundingStatus.FUNDING, null, null, now, now);
    }

    public BigDecimal remaining() {
        return fundingTarget.subtract(currentFunding).max(BigDecimal.ZERO);
    }

    public boolean isGoalReached() {
        return currentFunding.compareTo(fundingTarget) >= 0;
    }

    public boolean isLive() {
        return status == FundingStatus.LIVE;
    }

    /**
     * Adds a contribution and claims the goal if this one reaches it.
     *
     * @throws RoundNotFundingException if the round is LIVE
     * @throws ContributionRejectedException if the owner contributes, the amount has sub-cent precision
     *         or the target would be exceeded
     */
    public FundingRound contribute(String contributor, BigDecimal amount) {
        if (status != FundingStatus.FUNDING) {
            throw new RoundNotFundingException(id, status);
        }
        if (ownerAddress.equals(contributor)) {
            throw new ContributionRejectedException(id, "the round owner cannot contribute to their own round");
        }
        if (exceedsFiatScale(amount)) {
            throw new ContributionRejectedException(id,
                "amount may have at most " + FIAT_SCALE + " decimal places");
        }
        BigDecimal newTotal = currentFunding.add(amount);
        if (newTotal.compareTo(fundingTarget) > 0) {
            throw new ContributionRejectedException(id,
                "contribution would exceed the funding target, available: " + remaining().toPlainString());
        }
        Instant now = Instant.now();
        Instant reachedAt = goalReachedAt == null && newTotal.compareTo(fundingTarget) >= 0 ? now : goalReachedAt;
        return new FundingRound(id, ownerAddress, fundingTarget, newTotal, contributionCount + 1,
            status, reachedAt, ledgerAddress, createdAt, now);
    }

    /**
     * @throws IllegalStateException if the goal was never reached or a different ledger is already recorded
     */
    public FundingRound goLive(String address) {
        if (goalReachedAt == null) {
            throw new IllegalStateException("Round " + id + " cannot go live before reaching its goal");
        }
        if (status == FundingStatus.LIVE) {
            if (address.equals(ledgerAddress)) {
                return this;
            }
            throw new IllegalStateException(String.format(
                "Round %s is already live with ledger %s", id, ledgerAddress));
        }
        return new FundingRound(id, ownerAddress, fundingTarget, currentFunding, contributionCount,
            FundingStatus.LIVE, goalReachedAt, address, createdAt, Instant.now());
    }

    static boolean exceedsFiatScale(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() > FIAT_SCALE;
    }
}
