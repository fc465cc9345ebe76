package com.flagship.revenue_ledger.journal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates and looks up journal accounts by account number.
 */
@Service
public class JournalAccountService {

    private final JdbcTemplate jdbcTemplate;

    public JournalAccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the id of the account with this number, creating it on first use.
     * Concurrent callers racing on the same number end up with the same row.
     */
    @Transactional
    public UUID ensureAccount(String accountNumber, JournalAccount.AccountType accountType) {
        jdbcTemplate.update(
            "INSERT INTO journal_accounts (id, account_number, account_type, created_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT (account_number) DO NOTHING",
            UUID.randomUUID(),
            accountNumber,
            accountType.name()
        );
        return findAccount(accountNumber)
            .map(JournalAccount::getId)
            .orElseThrow(() -> new IllegalStateException("Journal account vanished: " + accountNumber));
    }

    public Optional<JournalAccount> findAccount(String accountNumber) {
        List<JournalAccount> accounts = jdbcTemplate.query(
            "SELECT id, account_number, account_type FROM journal_accounts WHERE account_number = ?",
            (rs, rowNum) -> new JournalAccount(
                UUID.fromString(rs.getString("id")),
                rs.getString("account_number"),
                JournalAccount.AccountType.valueOf(rs.getString("account_type"))),
            accountNumber
        );
        return accounts.stream().findFirst();
    }
}
