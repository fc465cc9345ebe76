package com.flagship.revenue_ledger.journal;

/**
 * Side of a journal entry in double-entry accounting.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
