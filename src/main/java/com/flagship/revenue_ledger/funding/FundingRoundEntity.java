package com.flagship.revenue_ledger.funding;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "funding_rounds",
    indexes = @Index(name = "idx_funding_rounds_status", columnList = "status")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundingRoundEntity implements Persistable<UUID> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_address", nullable = false, updatable = false, length = 42)
    private String ownerAddress;

    @Column(name = "funding_target", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal fundingTarget;

    @Column(name = "current_funding", nullable = false, precision = 19, scale = 2)
    private BigDecimal currentFunding;

    @Column(name = "contribution_count", nullable = false)
    private int contributionCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FundingStatus status;

    @Column(name = "goal_reached_at")
    private Instant goalReachedAt;

    @Column(name = "ledger_address", length = 42)
    private String ledgerAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean newRound;

    @Override
    public boolean isNew() {
        return newRound;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newRound = false;
    }

    public static FundingRoundEntity fromDomain(FundingRound round) {
        FundingRoundEntity entity = new FundingRoundEntity();
        entity.id = round.getId();
        entity.ownerAddress = round.getOwnerAddress();
        entity.fundingTarget = round.getFundingTarget();
        entity.createdAt = round.getCreatedAt();
        entity.newRound = true;
        entity.copyState(round);
        return entity;
    }

    public FundingRound toDomain() {
        return new FundingRound(id, ownerAddress, fundingTarget, currentFunding, contributionCount,
            status, goalReachedAt, ledgerAddress, createdAt, updatedAt);
    }

    /**
     * @throws IllegalStateException if the update would move funding backwards or un-claim the goal
     */
    public void updateFromDomain(FundingRound round) {
        if (round.getCurrentFunding().compareTo(currentFunding) < 0) {
            throw new IllegalStateException("Current funding cannot decrease for round " + id);
        }
        if (goalReachedAt != null && !goalReachedAt.equals(round.getGoalReachedAt())) {
            throw new IllegalStateException("Goal claim cannot change for round " + id);
        }
        copyState(round);
    }

    private void copyState(FundingRound round) {
        this.currentFunding = round.getCurrentFunding();
        this.contributionCount = round.getContributionCount();
        this.status = round.getStatus();
        this.goalReachedAt = round.getGoalReachedAt();
        this.ledgerAddress = round.getLedgerAddress();
        this.updatedAt = round.getUpdatedAt();
    }
}
