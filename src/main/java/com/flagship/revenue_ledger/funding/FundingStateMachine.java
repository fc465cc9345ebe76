package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.allocation.CapConverter;
import com.flagship.revenue_ledger.allocation.Contribution;
import com.flagship.revenue_ledger.allocation.ShareAllocator;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.deployment.AlreadyDeployedException;
import com.flagship.revenue_ledger.deployment.DeploymentOrchestrator;
import com.flagship.revenue_ledger.deployment.DeploymentResult;
import com.flagship.revenue_ledger.deployment.DeploymentStatus;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

/**
 * Funding to Live transition of a round.
 *
 * The contribution that reaches the target claims the goal in its own
 * transaction; only that caller runs the deployment, synchronously and after
 * the commit. A deployment failure leaves the round in FUNDING and is reported
 * back in the {@link FundingOutcome}. The round becomes LIVE through
 * {@link FundingRoundService#recordDeploymentResult}, which the orchestrator
 * calls once the ledger is committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundingStateMachine {

    private final FundingRoundService roundService;
    private final DeploymentOrchestrator orchestrator;
    private final ShareAllocator allocator;
    private final CapConverter capConverter;
    private final LedgerMetrics metrics;

    public FundingOutcome contribute(UUID roundId, String contributor, BigDecimal amount) {
        MDC.put(CorrelationContext.ROUND_MDC_KEY, roundId.toString());
        try {
            ContributionReceipt receipt;
            try {
                receipt = roundService.recordContribution(roundId, contributor, amount);
            } catch (RevenueLedgerException e) {
                metrics.recordContribution(e.getCategory().name());
                throw e;
            }
            metrics.recordContribution("accepted");

            if (!receipt.isGoalClaimed()) {
                return FundingOutcome.contributed(receipt);
            }

            log.info("Funding goal reached, deploying ledger: roundId={}, funding={}",
                    roundId, receipt.getRound().getCurrentFunding());
            try {
                String ledgerAddress = deployRound(receipt.getRound());
                return FundingOutcome.deployed(receipt, roundService.getRound(roundId), ledgerAddress);
            } catch (RevenueLedgerException e) {
                log.warn("Deployment after funding goal failed, round stays in funding: roundId={}, category={}, reason={}",
                        roundId, e.getCategory(), e.getMessage());
                return FundingOutcome.deploymentFailed(receipt, roundService.getRound(roundId), e);
            }
        } finally {
            MDC.remove(CorrelationContext.ROUND_MDC_KEY);
        }
    }

    /**
     * Re-runs deployment for a round whose goal was reached but which is not
     * live. Without a deployment record (allocation failed before any attempt)
     * the full deployment runs; after a FAILED attempt the orchestrator
     * retries with the stored parameters. A round whose ledger exists but was
     * not yet marked live is repaired.
     *
     * @throws IllegalStateException if the goal has not been reached
     */
    public FundingRound retryDeployment(UUID roundId) {
        FundingRound round = roundService.getRound(roundId);
        if (round.isLive()) {
            return round;
        }
        if (round.getGoalReachedAt() == null) {
            throw new IllegalStateException("Round " + roundId + " has not reached its funding goal");
        }

        try {
            if (orchestrator.find(roundId).isPresent()) {
                orchestrator.retry(roundId);
            } else {
                deployRound(round);
            }
        } catch (AlreadyDeployedException e) {
            log.warn("Round already has a ledger, marking live: roundId={}, ledger={}", roundId, e.getLedgerAddress());
            roundService.recordDeploymentResult(
                    new DeploymentResult(roundId, DeploymentStatus.DEPLOYED, e.getLedgerAddress(), null));
        }
        return roundService.getRound(roundId);
    }

    private String deployRound(FundingRound round) {
        List<Contribution> contributions = ShareAllocator.aggregate(roundService.contributions(round.getId()));
        ShareTable shareTable = allocator.allocate(contributions);
        BigInteger repaymentCap = capConverter.computeCap(round.getFundingTarget());
        return orchestrator.deploy(round.getId(), round.getOwnerAddress(), shareTable, repaymentCap);
    }
}
