package com.flagship.revenue_ledger.journal;

import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Request to post a balanced set of journal lines.
 *
 * Invariant: sum of debits equals sum of credits.
 */
@Value
public class JournalTransaction {
    String description;
    List<Line> debits;
    List<Line> credits;

    public boolean isBalanced() {
        return getDebitTotal().equals(getCreditTotal());
    }

    public BigInteger getDebitTotal() {
        return debits.stream().map(Line::getAmount).reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger getCreditTotal() {
        return credits.stream().map(Line::getAmount).reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Shorthand for the common one-debit one-credit movement.
     */
    public static JournalTransaction transfer(String description, UUID debitAccount, UUID creditAccount,
                                              BigInteger amount) {
        return new JournalTransaction(description,
            List.of(Line.of(debitAccount, amount, description)),
            List.of(Line.of(creditAccount, amount, description)));
    }

    @Value
    public static class Line {
        UUID accountId;
        BigInteger amount;
        String description;

        private Line(UUID accountId, BigInteger amount, String description) {
            this.accountId = Objects.requireNonNull(accountId);
            this.amount = Objects.requireNonNull(amount);
            if (amount.signum() <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.description = description;
        }

        public static Line of(UUID accountId, BigInteger amount, String description) {
            return new Line(accountId, amount, description);
        }
    }
}
