package com.flagship.revenue_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row written in the same transaction as a release and its transfer.
 */
@Entity
@Table(
    name = "ledger_releases",
    indexes = @Index(name = "idx_ledger_releases_ledger", columnList = "ledger_address, claimant_address")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerReleaseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "ledger_address", nullable = false, updatable = false, length = 42)
    private String ledgerAddress;

    @Column(name = "claimant_address", nullable = false, updatable = false, length = 42)
    private String claimantAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(name = "transfer_reference", nullable = false, updatable = false)
    private String transferReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LedgerReleaseEntity create(String ledgerAddress, String claimantAddress, BigInteger amount,
                                      String transferReference) {
        LedgerReleaseEntity entity = new LedgerReleaseEntity();
        entity.id = UUID.randomUUID();
        entity.ledgerAddress = ledgerAddress;
        entity.claimantAddress = claimantAddress;
        entity.amount = amount;
        entity.transferReference = transferReference;
        entity.createdAt = Instant.now();
        return entity;
    }
}
