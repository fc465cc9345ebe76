package com.flagship.revenue_ledger.journal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Posts balanced transactions to the settlement journal.
 *
 * Invariants:
 * 1. Debits equal credits (checked here and by a deferred constraint trigger)
 * 2. Entries are append-only
 * 3. Balances are derived from entries, never stored
 *
 * Plain JDBC; amounts are bound as NUMERIC.
 */
@Service
public class JournalService {

    private final JdbcTemplate jdbcTemplate;

    public JournalService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return id of the created journal transaction
     * @throws IllegalArgumentException if the transaction is unbalanced or names an unknown account
     */
    @Transactional
    public UUID postTransaction(JournalTransaction request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Journal transaction is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        validateAccountsExist(request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO journal_transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getDescription()
        );

        for (JournalTransaction.Line debit : request.getDebits()) {
            createEntry(transactionId, debit, EntryType.DEBIT);
        }
        for (JournalTransaction.Line credit : request.getCredits()) {
            createEntry(transactionId, credit, EntryType.CREDIT);
        }

        // The deferred trigger re-checks the balance at commit.
        return transactionId;
    }

    private void createEntry(UUID transactionId, JournalTransaction.Line line, EntryType entryType) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            line.getAccountId(),
            new BigDecimal(line.getAmount()),
            entryType.name(),
            line.getDescription()
        );
    }

    private void validateAccountsExist(JournalTransaction request) {
        List<UUID> accountIds = new ArrayList<>();
        request.getDebits().forEach(line -> accountIds.add(line.getAccountId()));
        request.getCredits().forEach(line -> accountIds.add(line.getAccountId()));

        for (UUID accountId : accountIds) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM journal_accounts WHERE id = ?",
                Integer.class,
                accountId
            );
            if (count == null || count == 0) {
                throw new IllegalArgumentException("Journal account not found: " + accountId);
            }
        }
    }

    /**
     * Derived balance. ASSET accounts grow with debits, LIABILITY and EQUITY with credits.
     */
    public BigInteger getAccountBalance(UUID accountId) {
        String accountType = jdbcTemplate.queryForObject(
            "SELECT account_type FROM journal_accounts WHERE id = ?",
            String.class,
            accountId
        );
        if (accountType == null) {
            throw new IllegalArgumentException("Journal account not found: " + accountId);
        }

        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE " +
            "  WHEN ? = 'ASSET' THEN CASE WHEN entry_type = 'DEBIT' THEN amount ELSE -amount END " +
            "  WHEN ? IN ('LIABILITY', 'EQUITY') THEN CASE WHEN entry_type = 'CREDIT' THEN amount ELSE -amount END " +
            "  ELSE 0 END), 0) " +
            "FROM journal_entries WHERE account_id = ?",
            BigDecimal.class,
            accountType,
            accountType,
            accountId
        );
        return balance != null ? balance.toBigIntegerExact() : BigInteger.ZERO;
    }

    public List<JournalEntry> getEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, entry_type, description, sequence_number " +
            "FROM journal_entries WHERE transaction_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            transactionId
        );
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getBigDecimal("amount").toBigIntegerExact(),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
