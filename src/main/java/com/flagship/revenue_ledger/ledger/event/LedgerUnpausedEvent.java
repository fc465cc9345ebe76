package com.flagship.revenue_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LedgerUnpausedEvent implements LedgerEvent {
    UUID eventId;
    String ledgerAddress;
    String unpausedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerUnpaused";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerUnpausedEvent of(String ledgerAddress, String caller) {
        return new LedgerUnpausedEvent(UUID.randomUUID(), ledgerAddress, caller, Instant.now());
    }
}
