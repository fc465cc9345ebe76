package com.flagship.revenue_ledger.transfer;

import com.flagship.revenue_ledger.journal.JournalAccount;
import com.flagship.revenue_ledger.journal.JournalAccountService;
import com.flagship.revenue_ledger.journal.JournalService;
import com.flagship.revenue_ledger.journal.JournalTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Default transfer collaborator, backed by the double-entry journal.
 *
 * Accounts per ledger and claimant:
 * - {@code ledger-cash:<ledger>} (ASSET): revenue the ledger has received
 * - {@code ledger-payable:<ledger>} (LIABILITY): received revenue not yet paid out
 * - {@code wallet:<claimant>} (LIABILITY): value paid out and owed to the claimant
 *
 * A deposit debits cash and credits payable; a payout debits payable and
 * credits the claimant's wallet. The payable balance therefore always equals
 * totalReceived - totalReleased of the ledger.
 *
 * MANDATORY propagation: bookings share the deposit or release transaction,
 * so the journal lines and the ledger bookkeeping commit or roll back together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JournalTransferGateway implements ValueTransferGateway {

    static final String WALLET_PREFIX = "wallet:";
    static final String PAYABLE_PREFIX = "ledger-payable:";
    static final String CASH_PREFIX = "ledger-cash:";

    private final JournalService journalService;
    private final JournalAccountService accountService;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferReceipt transfer(TransferInstruction instruction) {
        try {
            UUID payable = accountService.ensureAccount(
                PAYABLE_PREFIX + instruction.getLedgerAddress(), JournalAccount.AccountType.LIABILITY);
            UUID wallet = accountService.ensureAccount(
                WALLET_PREFIX + instruction.getRecipient(), JournalAccount.AccountType.LIABILITY);

            UUID transactionId = journalService.postTransaction(JournalTransaction.transfer(
                String.format("Release from %s to %s", instruction.getLedgerAddress(), instruction.getRecipient()),
                payable,
                wallet,
                instruction.getAmount()));

            log.debug("Posted payout journal transaction: txId={}, amount={}", transactionId, instruction.getAmount());
            return new TransferReceipt(transactionId.toString(), instruction.getAmount(), Instant.now());
        } catch (DataAccessException | IllegalArgumentException e) {
            throw new TransferFailedException(instruction, e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordDeposit(String ledgerAddress, BigInteger amount, UUID depositId) {
        UUID cash = accountService.ensureAccount(CASH_PREFIX + ledgerAddress, JournalAccount.AccountType.ASSET);
        UUID payable = accountService.ensureAccount(PAYABLE_PREFIX + ledgerAddress, JournalAccount.AccountType.LIABILITY);

        UUID transactionId = journalService.postTransaction(JournalTransaction.transfer(
            String.format("Deposit %s into %s", depositId, ledgerAddress),
            cash,
            payable,
            amount));
        log.debug("Posted deposit journal transaction: txId={}, amount={}", transactionId, amount);
    }
}
