package com.flagship.revenue_ledger.ledger.event;

import com.flagship.revenue_ledger.ledger.Ledger;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Every claimant has been paid its full share of the repayment cap.
 * Emitted once per ledger.
 */
@Value
public class CapReachedEvent implements LedgerEvent {
    UUID eventId;
    String ledgerAddress;
    BigInteger repaymentCap;
    BigInteger totalReleased;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CapReached";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CapReachedEvent from(Ledger ledger) {
        return new CapReachedEvent(
            UUID.randomUUID(),
            ledger.getAddress(),
            ledger.getRepaymentCap(),
            ledger.getTotalReleased(),
            ledger.getCapReachedAt()
        );
    }
}
