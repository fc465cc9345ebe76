package com.flagship.revenue_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.UUID;

/**
 * One claimant row of a ledger: its fixed share and how much it has been paid.
 * Only {@code released} is ever updated.
 */
@Entity
@Table(name = "ledger_claimants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerClaimantEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ledger_address", nullable = false, updatable = false)
    private LedgerEntity ledger;

    @Column(name = "claimant_address", nullable = false, updatable = false, length = 42)
    private String claimantAddress;

    @Column(nullable = false, updatable = false)
    private int shares;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger released;

    LedgerClaimantEntity(LedgerEntity ledger, String claimantAddress, int shares, int position, BigInteger released) {
        this.id = UUID.randomUUID();
        this.ledger = ledger;
        this.claimantAddress = claimantAddress;
        this.shares = shares;
        this.position = position;
        this.released = released;
    }

    /**
     * Released amounts only grow; a smaller value means the caller lost track of state.
     */
    void updateReleased(BigInteger newReleased) {
        if (newReleased.compareTo(this.released) < 0) {
            throw new IllegalStateException(String.format(
                "Released amount for %s in ledger %s cannot decrease: %s -> %s",
                claimantAddress, ledger.getAddress(), this.released, newReleased));
        }
        this.released = newReleased;
    }
}
