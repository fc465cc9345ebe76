package com.flagship.revenue_ledger.deployment.event;

import com.flagship.revenue_ledger.deployment.DeploymentRecord;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LedgerDeploymentFailedEvent implements DeploymentEvent {
    UUID eventId;
    UUID roundId;
    String reason;
    int attempts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerDeploymentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerDeploymentFailedEvent from(DeploymentRecord record) {
        return new LedgerDeploymentFailedEvent(UUID.randomUUID(), record.getRoundId(),
            record.getFailureReason(), record.getAttempts(), Instant.now());
    }
}
