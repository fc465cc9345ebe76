package com.flagship.revenue_ledger.deployment.event;

import com.flagship.revenue_ledger.deployment.DeploymentRecord;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Operators must reconcile this round by hand.
 */
@Value
public class LedgerDeploymentAmbiguousEvent implements DeploymentEvent {
    UUID eventId;
    UUID roundId;
    String reason;
    int attempts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerDeploymentAmbiguous";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerDeploymentAmbiguousEvent from(DeploymentRecord record) {
        return new LedgerDeploymentAmbiguousEvent(UUID.randomUUID(), record.getRoundId(),
            record.getFailureReason(), record.getAttempts(), Instant.now());
    }
}
