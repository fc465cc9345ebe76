package com.flagship.revenue_ledger.journal;

import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * A single debit or credit line. Immutable once written.
 */
@Value
public class JournalEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    BigInteger amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
