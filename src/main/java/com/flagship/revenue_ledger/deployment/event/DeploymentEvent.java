package com.flagship.revenue_ledger.deployment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Deployment events are keyed by round id.
 */
public interface DeploymentEvent {

    UUID getEventId();

    UUID getRoundId();

    Instant getOccurredAt();

    String getEventType();
}
