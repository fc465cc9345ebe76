package com.flagship.revenue_ledger.ledger.event;

import com.flagship.revenue_ledger.ledger.Ledger;
import com.flagship.revenue_ledger.ledger.LedgerDeposit;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Revenue was deposited into a ledger.
 */
@Value
public class RevenueReceivedEvent implements LedgerEvent {
    UUID eventId;
    String ledgerAddress;
    UUID depositId;
    BigInteger amount;
    BigInteger totalReceived;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RevenueReceived";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RevenueReceivedEvent from(LedgerDeposit deposit, Ledger ledger) {
        return new RevenueReceivedEvent(
            UUID.randomUUID(),
            ledger.getAddress(),
            deposit.getId(),
            deposit.getAmount(),
            ledger.getTotalReceived(),
            Instant.now()
        );
    }
}
