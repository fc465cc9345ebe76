package com.flagship.revenue_ledger.deployment.event;

import com.flagship.revenue_ledger.deployment.DeploymentRecord;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class LedgerDeployedEvent implements DeploymentEvent {
    UUID eventId;
    UUID roundId;
    String ledgerAddress;
    String ownerAddress;
    List<String> payees;
    List<Integer> shares;
    BigInteger repaymentCap;
    int attempts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerDeployed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerDeployedEvent from(DeploymentRecord record) {
        return new LedgerDeployedEvent(
            UUID.randomUUID(),
            record.getRoundId(),
            record.getLedgerAddress(),
            record.getOwnerAddress(),
            record.getShareTable().claimants(),
            record.getShareTable().shares(),
            record.getRepaymentCap(),
            record.getAttempts(),
            Instant.now()
        );
    }
}
