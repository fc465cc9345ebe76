package com.flagship.revenue_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger or deployment event waiting in the outbox.
 *
 * Written in the same transaction as the state change it describes and
 * published to Kafka later by {@link OutboxPublisher}. Immutable.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Ledger" or "Deployment"
    String aggregateId;        // ledger address or round id
    String eventType;          // e.g. "RevenueReleased"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
