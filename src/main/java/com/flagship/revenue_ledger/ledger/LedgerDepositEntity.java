package com.flagship.revenue_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a deposit. The unique (ledger, key) pair is the
 * database-level idempotency guard.
 */
@Entity
@Table(
    name = "ledger_deposits",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_ledger_deposits_key", columnNames = {"ledger_address", "idempotency_key"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerDepositEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "ledger_address", nullable = false, updatable = false, length = 42)
    private String ledgerAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LedgerDepositEntity create(String ledgerAddress, BigInteger amount, String idempotencyKey) {
        LedgerDepositEntity entity = new LedgerDepositEntity();
        entity.id = UUID.randomUUID();
        entity.ledgerAddress = ledgerAddress;
        entity.amount = amount;
        entity.idempotencyKey = idempotencyKey;
        entity.createdAt = Instant.now();
        return entity;
    }

    public LedgerDeposit toDomain() {
        return new LedgerDeposit(id, ledgerAddress, amount, idempotencyKey, createdAt);
    }
}
