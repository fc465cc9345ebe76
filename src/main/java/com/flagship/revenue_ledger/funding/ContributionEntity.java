package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.allocation.Contribution;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only contribution row. The generated id preserves arrival order,
 * which the allocator uses as the tie-break for drift correction.
 */
@Entity
@Table(
    name = "contributions",
    indexes = @Index(name = "idx_contributions_round_id", columnList = "round_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContributionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_id", nullable = false, updatable = false)
    private UUID roundId;

    @Column(name = "contributor_address", nullable = false, updatable = false, length = 42)
    private String contributorAddress;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ContributionEntity create(UUID roundId, String contributorAddress, BigDecimal amount) {
        ContributionEntity entity = new ContributionEntity();
        entity.roundId = roundId;
        entity.contributorAddress = contributorAddress;
        entity.amount = amount;
        entity.createdAt = Instant.now();
        return entity;
    }

    public Contribution toContribution() {
        return Contribution.of(contributorAddress, amount);
    }
}
