package com.flagship.revenue_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of ledger events written to the outbox.
 * The ledger address is the aggregate id and the Kafka key.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    String getLedgerAddress();

    Instant getOccurredAt();

    String getEventType();
}
