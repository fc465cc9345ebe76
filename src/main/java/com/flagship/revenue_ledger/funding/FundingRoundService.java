package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.allocation.Contribution;
import com.flagship.revenue_ledger.common.Addresses;
import com.flagship.revenue_ledger.deployment.DeploymentResult;
import com.flagship.revenue_ledger.deployment.DeploymentResultRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Persistent funding round state. Each method is its own transaction and
 * locks the round row before changing it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundingRoundService implements DeploymentResultRecorder {

    private final FundingRoundRepository roundRepository;
    private final ContributionRepository contributionRepository;
    private final FundingProperties properties;

    @Transactional
    public FundingRound open(String ownerAddress, BigDecimal fundingTarget) {
        String owner = Addresses.normalize("owner", ownerAddress);
        FundingRound round = FundingRound.open(owner, fundingTarget);
        FundingRound saved = roundRepository.save(FundingRoundEntity.fromDomain(round)).toDomain();
        log.info("Opened funding round: roundId={}, owner={}, target={}", saved.getId(), owner, fundingTarget);
        return saved;
    }

    @Transactional(readOnly = true)
    public FundingRound getRound(UUID roundId) {
        return roundRepository.findById(roundId)
                .map(FundingRoundEntity::toDomain)
                .orElseThrow(() -> new FundingRoundNotFoundException(roundId));
    }

    /**
     * Records a contribution and, if it reaches the target, claims the goal.
     * Commits before any deployment starts.
     *
     * @throws ContributionRejectedException if the amount is below the minimum, the owner
     *         contributes, or the target would be exceeded
     * @throws RoundNotFundingException if the round is already LIVE
     */
    @Transactional
    public ContributionReceipt recordContribution(UUID roundId, String contributorAddress, BigDecimal amount) {
        String contributor = Addresses.normalize("contributor", contributorAddress);
        if (amount == null || amount.compareTo(properties.getMinimumContribution()) < 0) {
            throw new ContributionRejectedException(roundId,
                    "minimum contribution is " + properties.getMinimumContribution().toPlainString());
        }

        FundingRoundEntity entity = roundRepository.findByIdForUpdate(roundId)
                .orElseThrow(() -> new FundingRoundNotFoundException(roundId));
        FundingRound before = entity.toDomain();
        FundingRound after = before.contribute(contributor, amount);

        ContributionEntity contribution = contributionRepository.save(
                ContributionEntity.create(roundId, contributor, amount));
        entity.updateFromDomain(after);
        roundRepository.save(entity);

        boolean goalClaimed = before.getGoalReachedAt() == null && after.getGoalReachedAt() != null;
        log.info("Contribution recorded: roundId={}, contributor={}, amount={}, funding={}/{}, goalClaimed={}",
                roundId, contributor, amount, after.getCurrentFunding(), after.getFundingTarget(), goalClaimed);
        return new ContributionReceipt(contribution.getId(), contributor, amount, after, goalClaimed);
    }

    /**
     * Contributions in arrival order, one entry per contribution.
     */
    @Transactional(readOnly = true)
    public List<Contribution> contributions(UUID roundId) {
        return contributionRepository.findByRoundIdOrderByIdAsc(roundId).stream()
                .map(ContributionEntity::toContribution)
                .toList();
    }

    /**
     * Moves the round to LIVE once its ledger is deployed. Other outcomes
     * leave the round in FUNDING for a retry or a reconciliation. Repeated
     * calls with the same address are no-ops. Deployments started outside a
     * funding round are ignored.
     */
    @Override
    @Transactional
    public void recordDeploymentResult(DeploymentResult result) {
        if (!result.isDeployed()) {
            log.warn("Round stays in funding after deployment outcome: roundId={}, status={}, reason={}",
                    result.getRoundId(), result.getStatus(), result.getReason());
            return;
        }
        FundingRoundEntity entity = roundRepository.findByIdForUpdate(result.getRoundId()).orElse(null);
        if (entity == null) {
            log.debug("Deployment is not tied to a funding round: roundId={}", result.getRoundId());
            return;
        }
        FundingRound current = entity.toDomain();
        if (current.isLive() && result.getLedgerAddress().equals(current.getLedgerAddress())) {
            return;
        }
        FundingRound live = current.goLive(result.getLedgerAddress());
        entity.updateFromDomain(live);
        roundRepository.save(entity);
        log.info("Round is live: roundId={}, ledger={}", live.getId(), live.getLedgerAddress());
    }
}
