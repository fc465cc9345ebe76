package com.flagship.revenue_ledger.ledger.event;

import com.flagship.revenue_ledger.ledger.ReleaseReceipt;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * A claimant pulled its pending payment. Carries the transfer reference so
 * consumers can match it with the payout.
 */
@Value
public class RevenueReleasedEvent implements LedgerEvent {
    UUID eventId;
    String ledgerAddress;
    String claimant;
    BigInteger amount;
    BigInteger releasedTotal;
    String transferReference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RevenueReleased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RevenueReleasedEvent from(ReleaseReceipt receipt) {
        return new RevenueReleasedEvent(
            UUID.randomUUID(),
            receipt.getLedgerAddress(),
            receipt.getClaimant(),
            receipt.getAmount(),
            receipt.getReleasedTotal(),
            receipt.getTransferReference(),
            Instant.now()
        );
    }
}
