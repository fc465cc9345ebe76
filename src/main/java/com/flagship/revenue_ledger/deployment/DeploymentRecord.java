package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.allocation.ShareTable;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Deployment intent and outcome for one funding round.
 *
 * Immutable with explicit, validated transitions. The record is written as
 * PENDING before the provisioner is invoked and updated with the outcome
 * afterwards, so a crash in between leaves visible evidence.
 */
@Value
public class DeploymentRecord {
    UUID roundId;
    String ownerAddress;
    ShareTable shareTable;
    BigInteger repaymentCap;
    DeploymentStatus status;
    String ledgerAddress;
    String failureReason;
    int attempts;
    Instant createdAt;
    Instant updatedAt;

    public static DeploymentRecord pending(UUID roundId, String ownerAddress, ShareTable shareTable,
                                           BigInteger repaymentCap) {
        Instant now = Instant.now();
        return new DeploymentRecord(roundId, ownerAddress, shareTable, repaymentCap,
            DeploymentStatus.PENDING, null, null, 1, now, now);
    }

    /**
     * Starts another attempt after a clean failure.
     *
     * @throws IllegalStateException unless FAILED
     */
    public DeploymentRecord restart() {
        requireStatus("restart", DeploymentStatus.FAILED);
        return new DeploymentRecord(roundId, ownerAddress, shareTable, repaymentCap,
            DeploymentStatus.PENDING, null, null, attempts + 1, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException unless PENDING or AMBIGUOUS
     */
    public DeploymentRecord markDeployed(String address) {
        requireStatus("mark deployed", DeploymentStatus.PENDING, DeploymentStatus.AMBIGUOUS);
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Deployed ledger address is required");
        }
        return new DeploymentRecord(roundId, ownerAddress, shareTable, repaymentCap,
            DeploymentStatus.DEPLOYED, address, null, attempts, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException unless PENDING or AMBIGUOUS
     */
    public DeploymentRecord markFailed(String reason) {
        requireStatus("mark failed", DeploymentStatus.PENDING, DeploymentStatus.AMBIGUOUS);
        return new DeploymentRecord(roundId, ownerAddress, shareTable, repaymentCap,
            DeploymentStatus.FAILED, null, reason, attempts, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException unless PENDING
     */
    public DeploymentRecord markAmbiguous(String reason) {
        requireStatus("mark ambiguous", DeploymentStatus.PENDING);
        return new DeploymentRecord(roundId, ownerAddress, shareTable, repaymentCap,
            DeploymentStatus.AMBIGUOUS, null, reason, attempts, createdAt, Instant.now());
    }

    public boolean isDeployed() {
        return status == DeploymentStatus.DEPLOYED;
    }

    public boolean canTransitionTo(DeploymentStatus target) {
        return switch (status) {
            case PENDING -> target != DeploymentStatus.PENDING;
            case FAILED -> target == DeploymentStatus.PENDING;
            case AMBIGUOUS -> target == DeploymentStatus.DEPLOYED || target == DeploymentStatus.FAILED;
            case DEPLOYED -> false;
        };
    }

    private void requireStatus(String action, DeploymentStatus... allowed) {
        for (DeploymentStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new IllegalStateException(String.format(
            "Cannot %s deployment of round %s in %s status", action, roundId, status));
    }
}
