package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.common.Addresses;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;
import com.flagship.revenue_ledger.ledger.event.CapReachedEvent;
import com.flagship.revenue_ledger.ledger.event.LedgerPausedEvent;
import com.flagship.revenue_ledger.ledger.event.LedgerUnpausedEvent;
import com.flagship.revenue_ledger.ledger.event.RevenueReceivedEvent;
import com.flagship.revenue_ledger.ledger.event.RevenueReleasedEvent;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.transfer.TransferInstruction;
import com.flagship.revenue_ledger.transfer.TransferReceipt;
import com.flagship.revenue_ledger.transfer.ValueTransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent ledger operations.
 *
 * Every mutation loads the ledger row with SELECT ... FOR UPDATE, applies
 * the immutable {@link Ledger} transition, and writes the new state, its
 * audit row and its outbox event in the same transaction. For releases the
 * transfer collaborator is called inside that transaction too, after the new
 * state has been computed and validated, so bookkeeping and payout commit or
 * roll back together and a concurrent release for the same claimant waits on
 * the row lock and then sees the updated {@code released} value.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final LedgerDepositRepository depositRepository;
    private final LedgerReleaseRepository releaseRepository;
    private final DepositIdempotencyService idempotencyService;
    private final ValueTransferGateway transferGateway;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Creates the ledger for a successfully provisioned round. Joins the
     * caller's transaction so the deployment record and the ledger commit together.
     *
     * @throws LedgerAlreadyRegisteredException if the address or round already has a ledger
     */
    @Transactional
    public Ledger register(String ledgerAddress, UUID roundId, String administrator,
                           ShareTable shareTable, BigInteger repaymentCap) {
        String address = Addresses.normalize("ledger", ledgerAddress);
        String admin = Addresses.normalize("administrator", administrator);

        if (ledgerRepository.existsById(address) || ledgerRepository.existsByRoundId(roundId)) {
            throw new LedgerAlreadyRegisteredException(address, roundId);
        }

        Ledger ledger = Ledger.create(address, roundId, admin, shareTable, repaymentCap);
        Ledger saved = ledgerRepository.save(LedgerEntity.fromDomain(ledger)).toDomain();

        log.info("Registered ledger: address={}, roundId={}, claimants={}, repaymentCap={}",
                address, roundId, shareTable.size(), repaymentCap);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Ledger> findLedger(String ledgerAddress) {
        return ledgerRepository.findById(lowerCase(ledgerAddress)).map(LedgerEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Ledger> findByRoundId(UUID roundId) {
        return ledgerRepository.findByRoundId(roundId).map(LedgerEntity::toDomain);
    }

    /**
     * @throws LedgerNotFoundException if no ledger has this address
     */
    @Transactional(readOnly = true)
    public Ledger getLedger(String ledgerAddress) {
        return findLedger(ledgerAddress).orElseThrow(() -> new LedgerNotFoundException(ledgerAddress));
    }

    /**
     * Pure read. Zero for accounts that hold no shares.
     */
    @Transactional(readOnly = true)
    public BigInteger pendingPayment(String ledgerAddress, String claimant) {
        return getLedger(ledgerAddress).pendingPayment(lowerCase(claimant));
    }

    /**
     * Records incoming revenue. A repeated idempotency key returns the
     * original deposit and leaves the ledger untouched.
     *
     * @throws LedgerNotFoundException if the ledger does not exist
     * @throws LedgerPausedException if the ledger is paused
     * @throws DepositKeyConflictException if the key was used for a different amount
     * @throws IllegalArgumentException if the amount is not positive or the key is blank
     */
    @Transactional
    public DepositResult deposit(String ledgerAddress, BigInteger amount, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String address = Addresses.normalize("ledger", ledgerAddress);
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive");
        }
        MDC.put(CorrelationContext.LEDGER_MDC_KEY, address);

        try {
            Optional<UUID> known = idempotencyService.checkIdempotencyKey(address, idempotencyKey);
            if (known.isPresent()) {
                Optional<LedgerDepositEntity> original = depositRepository.findById(known.get());
                if (original.isPresent()) {
                    metrics.recordIdempotencyHit();
                    return duplicate(original.get(), amount, getLedger(address));
                }
            }
            metrics.recordIdempotencyMiss();

            LedgerEntity entity = lockLedger(address);

            // Re-check under the lock: two requests with the same key may both have missed above.
            Optional<LedgerDepositEntity> raced =
                    depositRepository.findByLedgerAddressAndIdempotencyKey(address, idempotencyKey);
            if (raced.isPresent()) {
                return duplicate(raced.get(), amount, entity.toDomain());
            }

            Ledger updated = entity.toDomain().deposit(amount);
            entity.updateFromDomain(updated);
            ledgerRepository.save(entity);

            LedgerDeposit deposit = depositRepository
                    .save(LedgerDepositEntity.create(address, amount, idempotencyKey))
                    .toDomain();
            transferGateway.recordDeposit(address, amount, deposit.getId());

            outboxService.saveEvent(OutboxService.LEDGER_AGGREGATE, address,
                    RevenueReceivedEvent.EVENT_TYPE, RevenueReceivedEvent.from(deposit, updated));
            idempotencyService.storeIdempotencyKey(address, idempotencyKey, deposit.getId());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordDeposit("success");
            metrics.recordLatency("deposit", duration);
            log.info("Deposit recorded: amount={}, totalReceived={}, duration={}ms",
                    amount, updated.getTotalReceived(), duration);

            return new DepositResult(deposit, updated, false);

        } catch (RevenueLedgerException e) {
            metrics.recordDeposit(e.getCategory().name());
            log.warn("Deposit rejected: category={}, reason={}", e.getCategory(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LEDGER_MDC_KEY);
        }
    }

    /**
     * Pays the claimant everything currently due.
     *
     * @throws LedgerNotFoundException if the ledger does not exist
     * @throws LedgerPausedException if the ledger is paused
     * @throws UnknownClaimantException if the account holds no shares
     * @throws NothingToReleaseException if nothing is due (subtype
     *         {@link RepaymentCapReachedException} once the claimant's cap share is paid out)
     * @throws com.flagship.revenue_ledger.transfer.TransferFailedException if the payout failed;
     *         nothing was booked
     */
    @Transactional
    public ReleaseReceipt release(String ledgerAddress, String claimant) {
        long startTime = System.currentTimeMillis();
        String address = Addresses.normalize("ledger", ledgerAddress);
        String account = lowerCase(claimant);
        MDC.put(CorrelationContext.LEDGER_MDC_KEY, address);
        MDC.put(CorrelationContext.CLAIMANT_MDC_KEY, account);

        try {
            LedgerEntity entity = lockLedger(address);
            LedgerRelease release = entity.toDomain().release(account);
            Ledger updated = release.getLedger();

            TransferReceipt transfer = transferGateway.transfer(
                    new TransferInstruction(address, account, release.getAmount()));

            entity.updateFromDomain(updated);
            ledgerRepository.save(entity);

            LedgerReleaseEntity audit = releaseRepository.save(LedgerReleaseEntity.create(
                    address, account, release.getAmount(), transfer.getReference()));

            ReleaseReceipt receipt = new ReleaseReceipt(
                    audit.getId(),
                    address,
                    account,
                    release.getAmount(),
                    updated.releasedTo(account),
                    transfer.getReference(),
                    release.isCapReached(),
                    audit.getCreatedAt());

            outboxService.saveEvent(OutboxService.LEDGER_AGGREGATE, address,
                    RevenueReleasedEvent.EVENT_TYPE, RevenueReleasedEvent.from(receipt));
            if (release.isCapReached()) {
                outboxService.saveEvent(OutboxService.LEDGER_AGGREGATE, address,
                        CapReachedEvent.EVENT_TYPE, CapReachedEvent.from(updated));
                log.info("Repayment cap reached: repaymentCap={}, totalReleased={}",
                        updated.getRepaymentCap(), updated.getTotalReleased());
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRelease("success");
            metrics.recordReleasedAmount(release.getAmount());
            metrics.recordLatency("release", duration);
            log.info("Released payment: amount={}, released={}, totalReleased={}, transferRef={}, duration={}ms",
                    release.getAmount(), receipt.getReleasedTotal(), updated.getTotalReleased(),
                    transfer.getReference(), duration);

            return receipt;

        } catch (LedgerInvariantViolationException e) {
            metrics.recordRelease(e.getCategory().name());
            log.error("Release aborted on invariant violation: details={}", e.getDetails(), e);
            throw e;
        } catch (RevenueLedgerException e) {
            metrics.recordRelease(e.getCategory().name());
            log.warn("Release rejected: category={}, reason={}", e.getCategory(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LEDGER_MDC_KEY);
            MDC.remove(CorrelationContext.CLAIMANT_MDC_KEY);
        }
    }

    /**
     * @throws UnauthorizedException if the caller is not the administrator
     * @throws IllegalStateException if the ledger is already paused
     */
    @Transactional
    public Ledger pause(String ledgerAddress, String caller) {
        String address = Addresses.normalize("ledger", ledgerAddress);
        LedgerEntity entity = lockLedger(address);
        Ledger paused = entity.toDomain().pause(caller);
        entity.updateFromDomain(paused);
        ledgerRepository.save(entity);

        outboxService.saveEvent(OutboxService.LEDGER_AGGREGATE, address,
                LedgerPausedEvent.EVENT_TYPE, LedgerPausedEvent.of(address, lowerCase(caller)));
        log.info("Ledger paused: ledger={}, caller={}", address, caller);
        return paused;
    }

    /**
     * @throws UnauthorizedException if the caller is not the administrator
     * @throws IllegalStateException if the ledger is not paused
     */
    @Transactional
    public Ledger unpause(String ledgerAddress, String caller) {
        String address = Addresses.normalize("ledger", ledgerAddress);
        LedgerEntity entity = lockLedger(address);
        Ledger active = entity.toDomain().unpause(caller);
        entity.updateFromDomain(active);
        ledgerRepository.save(entity);

        outboxService.saveEvent(OutboxService.LEDGER_AGGREGATE, address,
                LedgerUnpausedEvent.EVENT_TYPE, LedgerUnpausedEvent.of(address, lowerCase(caller)));
        log.info("Ledger unpaused: ledger={}, caller={}", address, caller);
        return active;
    }

    private LedgerEntity lockLedger(String address) {
        return ledgerRepository.findByAddressForUpdate(address)
                .orElseThrow(() -> new LedgerNotFoundException(address));
    }

    private DepositResult duplicate(LedgerDepositEntity original, BigInteger requestedAmount, Ledger ledger) {
        if (original.getAmount().compareTo(requestedAmount) != 0) {
            throw new DepositKeyConflictException(original.getLedgerAddress(), original.getIdempotencyKey(),
                    original.getAmount(), requestedAmount);
        }
        metrics.recordDeposit("duplicate");
        log.info("Idempotency key already used, returning existing deposit: depositId={}", original.getId());
        return new DepositResult(original.toDomain(), ledger, true);
    }

    private static String lowerCase(String address) {
        return address == null ? null : address.toLowerCase(Locale.ROOT);
    }
}
