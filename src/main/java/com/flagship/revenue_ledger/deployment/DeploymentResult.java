package com.flagship.revenue_ledger.deployment;

import lombok.Value;

import java.util.UUID;

/**
 * Persisted outcome of a deployment attempt, handed to {@link DeploymentResultRecorder}s.
 */
@Value
public class DeploymentResult {
    UUID roundId;
    DeploymentStatus status;
    String ledgerAddress;
    String reason;

    public static DeploymentResult of(DeploymentRecord record) {
        return new DeploymentResult(record.getRoundId(), record.getStatus(),
                record.getLedgerAddress(), record.getFailureReason());
    }

    public boolean isDeployed() {
        return status == DeploymentStatus.DEPLOYED;
    }
}
