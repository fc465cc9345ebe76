package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for deployment records, keyed by round id.
 *
 * The share table and cap are write-once; status fields change only via
 * {@link #updateFromDomain(DeploymentRecord)}. Implements {@link Persistable}
 * so that saving a new record with an assigned id is an INSERT (and a
 * concurrent duplicate hits the primary key) rather than a merge.
 */
@Entity
@Table(
    name = "deployment_records",
    indexes = @Index(name = "idx_deployment_records_status", columnList = "status")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeploymentRecordEntity implements Persistable<UUID> {

    @Id
    @Column(name = "round_id", nullable = false, updatable = false)
    private UUID roundId;

    @Column(name = "owner_address", nullable = false, updatable = false, length = 42)
    private String ownerAddress;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_shares", joinColumns = @JoinColumn(name = "round_id"))
    @OrderColumn(name = "position")
    private List<DeploymentShareEmbeddable> shares = new ArrayList<>();

    @Column(name = "repayment_cap", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger repaymentCap;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeploymentStatus status;

    @Column(name = "ledger_address", length = 42)
    private String ledgerAddress;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean newRecord;

    @Override
    public UUID getId() {
        return roundId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newRecord = false;
    }

    static DeploymentRecordEntity fromDomain(DeploymentRecord record) {
        DeploymentRecordEntity entity = new DeploymentRecordEntity();
        entity.newRecord = true;
        entity.roundId = record.getRoundId();
        entity.ownerAddress = record.getOwnerAddress();
        for (ClaimantShare entry : record.getShareTable().getEntries()) {
            entity.shares.add(new DeploymentShareEmbeddable(entry.getClaimant(), entry.getShares()));
        }
        entity.repaymentCap = record.getRepaymentCap();
        entity.status = record.getStatus();
        entity.ledgerAddress = record.getLedgerAddress();
        entity.failureReason = record.getFailureReason();
        entity.attempts = record.getAttempts();
        entity.createdAt = record.getCreatedAt();
        entity.updatedAt = record.getUpdatedAt();
        return entity;
    }

    public DeploymentRecord toDomain() {
        ShareTable table = ShareTable.of(shares.stream()
            .map(row -> ClaimantShare.of(row.getClaimantAddress(), row.getShares()))
            .toList());
        return new DeploymentRecord(roundId, ownerAddress, table, repaymentCap, status,
            ledgerAddress, failureReason, attempts, createdAt, updatedAt);
    }

    /**
     * Applies a status transition. Rejects transitions the domain model does not allow.
     */
    void updateFromDomain(DeploymentRecord record) {
        if (!roundId.equals(record.getRoundId())) {
            throw new IllegalArgumentException("Cannot update record " + roundId + " from " + record.getRoundId());
        }
        if (status != record.getStatus() && !toDomain().canTransitionTo(record.getStatus())) {
            throw new IllegalStateException(String.format(
                "Invalid deployment transition for round %s: %s -> %s", roundId, status, record.getStatus()));
        }
        this.status = record.getStatus();
        this.ledgerAddress = record.getLedgerAddress();
        this.failureReason = record.getFailureReason();
        this.attempts = record.getAttempts();
        this.updatedAt = record.getUpdatedAt();
    }
}
