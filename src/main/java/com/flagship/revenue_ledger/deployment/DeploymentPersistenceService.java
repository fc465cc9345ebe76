package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.deployment.event.LedgerDeployedEvent;
import com.flagship.revenue_ledger.deployment.event.LedgerDeploymentAmbiguousEvent;
import com.flagship.revenue_ledger.deployment.event.LedgerDeploymentFailedEvent;
import com.flagship.revenue_ledger.ledger.LedgerService;
import com.flagship.revenue_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Short transactions around the deployment record.
 *
 * The provisioner runs between these calls and never inside a database
 * transaction: intent is committed before it starts and the outcome is
 * committed after it returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentPersistenceService {

    private final DeploymentRecordRepository repository;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;

    @Transactional(readOnly = true)
    public Optional<DeploymentRecord> find(UUID roundId) {
        return repository.findById(roundId).map(DeploymentRecordEntity::toDomain);
    }

    /**
     * Inserts a PENDING record. A concurrent insert for the same round from
     * another instance fails on the primary key.
     *
     * @throws DeploymentInProgressException if a record for the round appeared concurrently
     */
    @Transactional
    public DeploymentRecord createPending(DeploymentRecord record) {
        try {
            DeploymentRecord saved = repository.saveAndFlush(DeploymentRecordEntity.fromDomain(record)).toDomain();
            log.debug("Persisted deployment intent for round {}", record.getRoundId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DeploymentInProgressException(record.getRoundId());
        }
    }

    /**
     * Moves a FAILED record back to PENDING for another attempt.
     */
    @Transactional
    public DeploymentRecord restart(UUID roundId) {
        DeploymentRecordEntity entity = lock(roundId);
        DeploymentRecord restarted = entity.toDomain().restart();
        entity.updateFromDomain(restarted);
        repository.save(entity);
        return restarted;
    }

    /**
     * Records DEPLOYED, registers the ledger and writes LedgerDeployed, all
     * in one transaction.
     */
    @Transactional
    public DeploymentRecord completeDeployment(DeploymentRecord deployed) {
        DeploymentRecordEntity entity = lock(deployed.getRoundId());
        entity.updateFromDomain(deployed);
        repository.save(entity);

        ledgerService.register(deployed.getLedgerAddress(), deployed.getRoundId(), deployed.getOwnerAddress(),
                deployed.getShareTable(), deployed.getRepaymentCap());

        outboxService.saveEvent(OutboxService.DEPLOYMENT_AGGREGATE, deployed.getRoundId().toString(),
                LedgerDeployedEvent.EVENT_TYPE, LedgerDeployedEvent.from(deployed));
        return deployed;
    }

    @Transactional
    public DeploymentRecord recordFailure(DeploymentRecord failed) {
        DeploymentRecordEntity entity = lock(failed.getRoundId());
        entity.updateFromDomain(failed);
        repository.save(entity);

        outboxService.saveEvent(OutboxService.DEPLOYMENT_AGGREGATE, failed.getRoundId().toString(),
                LedgerDeploymentFailedEvent.EVENT_TYPE, LedgerDeploymentFailedEvent.from(failed));
        return failed;
    }

    @Transactional
    public DeploymentRecord recordAmbiguous(DeploymentRecord ambiguous) {
        DeploymentRecordEntity entity = lock(ambiguous.getRoundId());
        entity.updateFromDomain(ambiguous);
        repository.save(entity);

        outboxService.saveEvent(OutboxService.DEPLOYMENT_AGGREGATE, ambiguous.getRoundId().toString(),
                LedgerDeploymentAmbiguousEvent.EVENT_TYPE, LedgerDeploymentAmbiguousEvent.from(ambiguous));
        return ambiguous;
    }

    @Transactional(readOnly = true)
    public long countAmbiguous() {
        return repository.countByStatus(DeploymentStatus.AMBIGUOUS);
    }

    private DeploymentRecordEntity lock(UUID roundId) {
        return repository.findByRoundIdForUpdate(roundId)
                .orElseThrow(() -> new DeploymentNotFoundException(roundId));
    }
}
