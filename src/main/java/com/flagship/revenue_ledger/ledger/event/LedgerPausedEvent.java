package com.flagship.revenue_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LedgerPausedEvent implements LedgerEvent {
    UUID eventId;
    String ledgerAddress;
    String pausedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerPaused";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerPausedEvent of(String ledgerAddress, String caller) {
        return new LedgerPausedEvent(UUID.randomUUID(), ledgerAddress, caller, Instant.now());
    }
}
