package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.allocation.CapConverter;
import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.allocation.UnbalancedShareTableException;
import com.flagship.revenue_ledger.common.Addresses;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Provisions one ledger per funding round, at most once.
 *
 * Each attempt runs in three steps:
 * <ol>
 *   <li>commit a PENDING record (the intent)</li>
 *   <li>run the provisioner outside any transaction</li>
 *   <li>commit the outcome: DEPLOYED with the ledger registered, FAILED, or AMBIGUOUS</li>
 * </ol>
 * Attempts for the same round are serialized by an in-process lock and by the
 * PENDING row itself, which other instances see. An AMBIGUOUS record is never
 * retried automatically; it waits for {@link #reconcile}.
 */
@Service
@Slf4j
public class DeploymentOrchestrator {

    private final DeploymentPersistenceService persistence;
    private final LedgerProvisioner provisioner;
    private final CapConverter capConverter;
    private final ProvisionerProperties properties;
    private final LedgerMetrics metrics;
    private final List<DeploymentResultRecorder> recorders;

    private final ConcurrentMap<UUID, ReentrantLock> roundLocks = new ConcurrentHashMap<>();

    public DeploymentOrchestrator(DeploymentPersistenceService persistence,
                                  LedgerProvisioner provisioner,
                                  CapConverter capConverter,
                                  ProvisionerProperties properties,
                                  LedgerMetrics metrics,
                                  List<DeploymentResultRecorder> recorders) {
        this.persistence = persistence;
        this.provisioner = provisioner;
        this.capConverter = capConverter;
        this.properties = properties;
        this.metrics = metrics;
        this.recorders = List.copyOf(recorders);
    }

    /**
     * Deploys the ledger for a round and returns its address.
     *
     * @throws com.flagship.revenue_ledger.common.InvalidAddressException if the owner or a payee is malformed
     * @throws UnbalancedShareTableException if the shares do not add up to 10000
     * @throws AlreadyDeployedException if the round already has a ledger
     * @throws DeploymentInProgressException if another attempt for the round is in flight
     * @throws DeploymentFailedException if provisioning failed cleanly (retryable)
     * @throws AmbiguousDeploymentException if the outcome is unknown (needs reconciliation)
     */
    public String deploy(UUID roundId, String owner, ShareTable shareTable, BigInteger repaymentCap) {
        if (roundId == null) {
            throw new IllegalArgumentException("Round id is required");
        }
        String normalizedOwner = Addresses.normalize("owner", owner);
        ShareTable normalizedTable = normalizePayees(shareTable);
        if (!normalizedTable.isBalanced()) {
            throw new UnbalancedShareTableException(normalizedTable.totalShares());
        }
        if (repaymentCap == null || repaymentCap.signum() <= 0) {
            throw new IllegalArgumentException("Repayment cap must be positive");
        }

        return withRoundLock(roundId, () -> {
            persistence.find(roundId).ifPresent(this::rejectExisting);
            DeploymentRecord pending = persistence.createPending(
                    DeploymentRecord.pending(roundId, normalizedOwner, normalizedTable, repaymentCap));
            log.info("Deployment intent recorded: roundId={}, payees={}, repaymentCap={}",
                    roundId, normalizedTable.size(), repaymentCap);
            return attempt(pending);
        });
    }

    /**
     * Re-runs a FAILED deployment with its stored parameters.
     *
     * @throws DeploymentNotFoundException if the round was never deployed
     * @throws AlreadyDeployedException if the round is DEPLOYED
     * @throws AmbiguousDeploymentException if the round is AMBIGUOUS
     * @throws DeploymentInProgressException if the round is PENDING
     */
    public String retry(UUID roundId) {
        return withRoundLock(roundId, () -> {
            DeploymentRecord existing = persistence.find(roundId)
                    .orElseThrow(() -> new DeploymentNotFoundException(roundId));
            if (existing.getStatus() != DeploymentStatus.FAILED) {
                rejectExisting(existing);
            }
            DeploymentRecord restarted = persistence.restart(roundId);
            log.info("Retrying deployment: roundId={}, attempt={}, previousFailure={}",
                    roundId, restarted.getAttempts(), existing.getFailureReason());
            return attempt(restarted);
        });
    }

    /**
     * Resolves an AMBIGUOUS record after an operator has checked what the
     * provisioner actually did.
     *
     * @param observedAddress the ledger that was provisioned, or {@code null} if none was
     * @throws IllegalStateException unless the record is AMBIGUOUS
     */
    public DeploymentRecord reconcile(UUID roundId, String observedAddress) {
        return withRoundLock(roundId, () -> {
            DeploymentRecord existing = persistence.find(roundId)
                    .orElseThrow(() -> new DeploymentNotFoundException(roundId));
            if (existing.getStatus() != DeploymentStatus.AMBIGUOUS) {
                throw new IllegalStateException(String.format(
                        "Only AMBIGUOUS deployments can be reconciled: round %s is %s", roundId, existing.getStatus()));
            }

            DeploymentRecord resolved;
            if (observedAddress == null || observedAddress.isBlank()) {
                resolved = persistence.recordFailure(existing.markFailed("reconciled: nothing was provisioned"));
                log.warn("Reconciled ambiguous deployment as not provisioned: roundId={}", roundId);
            } else {
                String address = Addresses.normalize("ledger", observedAddress);
                resolved = persistence.completeDeployment(existing.markDeployed(address));
                log.warn("Reconciled ambiguous deployment as deployed: roundId={}, ledger={}", roundId, address);
            }
            metrics.recordDeployment("reconciled_" + resolved.getStatus().name().toLowerCase(Locale.ROOT));
            notifyRecorders(resolved);
            return resolved;
        });
    }

    public Optional<DeploymentRecord> find(UUID roundId) {
        return persistence.find(roundId);
    }

    public DeploymentRecord findRecord(UUID roundId) {
        return find(roundId).orElseThrow(() -> new DeploymentNotFoundException(roundId));
    }

    private String attempt(DeploymentRecord pending) {
        UUID roundId = pending.getRoundId();
        long startTime = System.currentTimeMillis();
        ShareTable table = pending.getShareTable();
        ProvisioningRequest request = new ProvisioningRequest(roundId, pending.getOwnerAddress(),
                table.claimants(), table.shares(), capConverter.toSettlementUnits(pending.getRepaymentCap()));

        ProvisioningOutcome outcome;
        try {
            outcome = provisioner.provision(request);
        } catch (RuntimeException e) {
            log.error("Provisioner raised unexpectedly: roundId={}", roundId, e);
            outcome = ProvisioningOutcome.ambiguous("provisioner raised " + e.getClass().getSimpleName()
                    + ": " + e.getMessage());
        }
        long duration = System.currentTimeMillis() - startTime;
        metrics.recordLatency("provision", duration);

        switch (outcome.getKind()) {
            case SUCCEEDED -> {
                DeploymentRecord deployed = pending.markDeployed(outcome.getLedgerAddress());
                try {
                    persistence.completeDeployment(deployed);
                } catch (RuntimeException e) {
                    String reason = "ledger provisioned at " + outcome.getLedgerAddress()
                            + " but the result could not be recorded: " + e.getMessage();
                    markAmbiguousAfterError(pending, reason, e);
                    metrics.recordDeployment("ambiguous");
                    throw new AmbiguousDeploymentException(roundId, reason, e);
                }
                metrics.recordDeployment("deployed");
                log.info("Ledger deployed: roundId={}, ledger={}, attempt={}, duration={}ms",
                        roundId, deployed.getLedgerAddress(), deployed.getAttempts(), duration);
                notifyRecorders(deployed);
                return deployed.getLedgerAddress();
            }
            case FAILED -> {
                DeploymentRecord failed = persistence.recordFailure(pending.markFailed(outcome.getReason()));
                metrics.recordDeployment("failed");
                log.warn("Deployment failed: roundId={}, attempt={}, reason={}",
                        roundId, failed.getAttempts(), failed.getFailureReason());
                notifyRecorders(failed);
                throw new DeploymentFailedException(roundId, outcome.getReason());
            }
            default -> {
                DeploymentRecord ambiguous = persistence.recordAmbiguous(pending.markAmbiguous(outcome.getReason()));
                metrics.recordDeployment("ambiguous");
                log.error("Deployment outcome unknown, reconciliation required: roundId={}, reason={}",
                        roundId, outcome.getReason());
                notifyRecorders(ambiguous);
                throw new AmbiguousDeploymentException(roundId, outcome.getReason());
            }
        }
    }

    private void markAmbiguousAfterError(DeploymentRecord pending, String reason, RuntimeException cause) {
        try {
            persistence.recordAmbiguous(pending.markAmbiguous(reason));
        } catch (RuntimeException e) {
            log.error("Could not record ambiguous deployment, record stays PENDING: roundId={}, reason={}",
                    pending.getRoundId(), reason, e);
            cause.addSuppressed(e);
        }
    }

    /**
     * Throws the exception matching an existing record that blocks a new attempt.
     */
    private void rejectExisting(DeploymentRecord existing) {
        UUID roundId = existing.getRoundId();
        switch (existing.getStatus()) {
            case DEPLOYED -> throw new AlreadyDeployedException(roundId, existing.getLedgerAddress());
            case AMBIGUOUS -> throw new AmbiguousDeploymentException(roundId, existing.getFailureReason());
            case PENDING -> {
                Instant staleBefore = Instant.now().minus(properties.getPendingStaleAfter());
                if (existing.getUpdatedAt().isBefore(staleBefore)) {
                    // No live attempt owns it: the previous run died between intent and outcome.
                    String reason = "attempt started at " + existing.getUpdatedAt() + " never recorded an outcome";
                    persistence.recordAmbiguous(existing.markAmbiguous(reason));
                    metrics.recordDeployment("ambiguous");
                    log.error("Found abandoned deployment attempt: roundId={}, startedAt={}",
                            roundId, existing.getUpdatedAt());
                    throw new AmbiguousDeploymentException(roundId, reason);
                }
                throw new DeploymentInProgressException(roundId);
            }
            case FAILED -> throw new IllegalStateException(String.format(
                    "Deployment of round %s failed earlier; use retry", roundId));
        }
    }

    private ShareTable normalizePayees(ShareTable shareTable) {
        if (shareTable == null) {
            throw new IllegalArgumentException("Share table is required");
        }
        return ShareTable.of(shareTable.getEntries().stream()
                .map(entry -> ClaimantShare.of(Addresses.normalize("payee", entry.getClaimant()), entry.getShares()))
                .toList());
    }

    private void notifyRecorders(DeploymentRecord record) {
        DeploymentResult result = DeploymentResult.of(record);
        for (DeploymentResultRecorder recorder : recorders) {
            try {
                recorder.recordDeploymentResult(result);
            } catch (RuntimeException e) {
                log.error("Deployment result recorder failed: roundId={}, status={}, recorder={}",
                        result.getRoundId(), result.getStatus(), recorder.getClass().getSimpleName(), e);
                throw e;
            }
        }
    }

    /**
     * Runs the action while holding the round's in-process lock. Entries are
     * removed once released, so the map only holds rounds with a live attempt.
     */
    private <T> T withRoundLock(UUID roundId, Supplier<T> action) {
        ReentrantLock lock = acquireRoundLock(roundId);
        MDC.put(CorrelationContext.ROUND_MDC_KEY, roundId.toString());
        try {
            return action.get();
        } finally {
            MDC.remove(CorrelationContext.ROUND_MDC_KEY);
            roundLocks.remove(roundId, lock);
            lock.unlock();
        }
    }

    private ReentrantLock acquireRoundLock(UUID roundId) {
        while (true) {
            ReentrantLock lock = roundLocks.computeIfAbsent(roundId, id -> new ReentrantLock());
            if (!lock.tryLock()) {
                throw new DeploymentInProgressException(roundId);
            }
            if (roundLocks.get(roundId) == lock) {
                return lock;
            }
            // Released and removed by its previous holder after we looked it up
            lock.unlock();
        }
    }

    int activeRoundLocks() {
        return roundLocks.size();
    }
}
