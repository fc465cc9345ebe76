package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for a ledger.
 *
 * Write-once fields (share table, cap, administrator, round) are
 * {@code updatable = false}; the mutable accounting fields change only through
 * {@link #updateFromDomain(Ledger)}. No setters. The address is assigned by
 * the provisioner, so {@link Persistable} marks fresh entities as new to get
 * an INSERT instead of a merge.
 */
@Entity
@Table(
    name = "ledgers",
    indexes = {
        @Index(name = "idx_ledgers_round_id", columnList = "round_id", unique = true),
        @Index(name = "idx_ledgers_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntity implements Persistable<String> {

    @Id
    @Column(nullable = false, updatable = false, length = 42)
    private String address;

    @Column(name = "round_id", nullable = false, updatable = false)
    private UUID roundId;

    @Column(nullable = false, updatable = false, length = 42)
    private String administrator;

    @Column(name = "repayment_cap", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger repaymentCap;

    @Column(name = "total_received", nullable = false, precision = 78, scale = 0)
    private BigInteger totalReceived;

    @Column(name = "total_released", nullable = false, precision = 78, scale = 0)
    private BigInteger totalReleased;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LedgerStatus status;

    @Column(name = "cap_reached_at")
    private Instant capReachedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "ledger", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<LedgerClaimantEntity> claimants = new ArrayList<>();

    @Transient
    private boolean newLedger;

    @Override
    public String getId() {
        return address;
    }

    @Override
    public boolean isNew() {
        return newLedger;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newLedger = false;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LedgerEntity fromDomain(Ledger ledger) {
        LedgerEntity entity = new LedgerEntity();
        entity.newLedger = true;
        entity.address = ledger.getAddress();
        entity.roundId = ledger.getRoundId();
        entity.administrator = ledger.getAdministrator();
        entity.repaymentCap = ledger.getRepaymentCap();
        entity.totalReceived = ledger.getTotalReceived();
        entity.totalReleased = ledger.getTotalReleased();
        entity.status = ledger.getStatus();
        entity.capReachedAt = ledger.getCapReachedAt();
        List<ClaimantShare> entries = ledger.getShareTable().getEntries();
        for (int i = 0; i < entries.size(); i++) {
            ClaimantShare entry = entries.get(i);
            entity.claimants.add(new LedgerClaimantEntity(
                entity, entry.getClaimant(), entry.getShares(), i, ledger.releasedTo(entry.getClaimant())));
        }
        return entity;
    }

    public Ledger toDomain() {
        List<ClaimantShare> entries = new ArrayList<>(claimants.size());
        Map<String, BigInteger> released = new LinkedHashMap<>();
        for (LedgerClaimantEntity claimant : claimants) {
            entries.add(ClaimantShare.of(claimant.getClaimantAddress(), claimant.getShares()));
            released.put(claimant.getClaimantAddress(), claimant.getReleased());
        }
        return new Ledger(
            address,
            roundId,
            administrator,
            ShareTable.of(entries),
            repaymentCap,
            totalReceived,
            Collections.unmodifiableMap(released),
            totalReleased,
            status,
            capReachedAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable accounting state from the domain object.
     * Shares, cap and administrator cannot change once the ledger exists.
     */
    void updateFromDomain(Ledger ledger) {
        if (!address.equals(ledger.getAddress())) {
            throw new IllegalArgumentException("Cannot update ledger " + address + " from " + ledger.getAddress());
        }
        if (ledger.getRepaymentCap().compareTo(repaymentCap) != 0) {
            throw new IllegalStateException("Repayment cap of ledger " + address + " is immutable");
        }
        this.totalReceived = ledger.getTotalReceived();
        this.totalReleased = ledger.getTotalReleased();
        this.status = ledger.getStatus();
        this.capReachedAt = ledger.getCapReachedAt();
        for (LedgerClaimantEntity claimant : claimants) {
            claimant.updateReleased(ledger.releasedTo(claimant.getClaimantAddress()));
        }
    }
}
