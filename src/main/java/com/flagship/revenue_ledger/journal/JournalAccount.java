package com.flagship.revenue_ledger.journal;

import lombok.Value;

import java.util.UUID;

/**
 * An account in the settlement journal.
 * Account numbers are derived from addresses, e.g. {@code wallet:0xabc...}.
 */
@Value
public class JournalAccount {
    UUID id;
    String accountNumber;
    AccountType accountType;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY
    }
}
