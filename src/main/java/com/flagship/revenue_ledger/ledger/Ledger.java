package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Revenue-splitting ledger: the accounting engine for one funded round.
 *
 * Immutable. Every operation validates the transition and returns a new
 * instance; callers persist the result. Amounts are integers in the smallest
 * settlement unit and every division floors.
 *
 * Invariants (checked on every transition):
 * 1. totalReleased <= repaymentCap
 * 2. released[c] never decreases and never exceeds c's entitlement ceiling
 * 3. totalReleased == sum(released)
 * 4. shareTable and repaymentCap never change
 */
@Value
public class Ledger {

    private static final BigInteger TOTAL_SHARES = BigInteger.valueOf(ShareTable.TOTAL_SHARES);

    String address;
    UUID roundId;
    String administrator;
    ShareTable shareTable;
    BigInteger repaymentCap;
    BigInteger totalReceived;
    Map<String, BigInteger> released;
    BigInteger totalReleased;
    LedgerStatus status;
    Instant capReachedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE ledger with nothing received or released.
     */
    public static Ledger create(String address, UUID roundId, String administrator,
                                ShareTable shareTable, BigInteger repaymentCap) {
        if (!shareTable.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Shares must sum to %d, got %d", ShareTable.TOTAL_SHARES, shareTable.totalShares()));
        }
        if (repaymentCap == null || repaymentCap.signum() <= 0) {
            throw new IllegalArgumentException("Repayment cap must be greater than zero");
        }
        Map<String, BigInteger> released = new LinkedHashMap<>();
        for (ClaimantShare entry : shareTable.getEntries()) {
            released.put(entry.getClaimant(), BigInteger.ZERO);
        }
        Instant now = Instant.now();
        return new Ledger(address, roundId, administrator, shareTable, repaymentCap,
            BigInteger.ZERO, Collections.unmodifiableMap(released), BigInteger.ZERO,
            LedgerStatus.ACTIVE, null, now, now);
    }

    // ==================== Views ====================

    public boolean isClaimant(String claimant) {
        return shareTable.contains(claimant);
    }

    public BigInteger releasedTo(String claimant) {
        return released.getOrDefault(claimant, BigInteger.ZERO);
    }

    /**
     * The claimant's share of the repayment cap: floor(cap * shares / 10000).
     */
    public BigInteger capCeiling(String claimant) {
        return proportion(repaymentCap, claimant);
    }

    /**
     * Most the claimant could have been paid so far:
     * min(floor(totalReceived * shares / 10000), capCeiling).
     */
    public BigInteger entitlementCeiling(String claimant) {
        return proportion(totalReceived, claimant).min(capCeiling(claimant));
    }

    /**
     * Amount the claimant could release now. Zero for unknown accounts.
     */
    public BigInteger pendingPayment(String claimant) {
        if (!isClaimant(claimant)) {
            return BigInteger.ZERO;
        }
        return entitlementCeiling(claimant).subtract(releasedTo(claimant)).max(BigInteger.ZERO);
    }

    public BigInteger remainingCap() {
        return repaymentCap.subtract(totalReleased).max(BigInteger.ZERO);
    }

    public boolean isCapReached() {
        return capReachedAt != null;
    }

    public boolean isPaused() {
        return status == LedgerStatus.PAUSED;
    }

    // ==================== Transitions ====================

    /**
     * Records incoming revenue. Per-claimant entitlement is derived lazily at release time.
     *
     * @throws LedgerPausedException if the ledger is paused
     * @throws IllegalArgumentException if the amount is not positive
     */
    public Ledger deposit(BigInteger amount) {
        requireActive("deposit");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive");
        }
        return new Ledger(address, roundId, administrator, shareTable, repaymentCap,
            totalReceived.add(amount), released, totalReleased, status, capReachedAt,
            createdAt, Instant.now());
    }

    /**
     * Computes and books the claimant's pending payment.
     *
     * The returned ledger already reflects the release; the caller must
     * transfer {@link LedgerRelease#getAmount()} in the same unit of work as
     * persisting it.
     *
     * @throws LedgerPausedException if the ledger is paused
     * @throws UnknownClaimantException if the claimant holds no shares
     * @throws RepaymentCapReachedException if the claimant's cap share is exhausted
     * @throws NothingToReleaseException if nothing is due yet
     */
    public LedgerRelease release(String claimant) {
        requireActive("release");
        if (!isClaimant(claimant)) {
            throw new UnknownClaimantException(address, claimant);
        }

        BigInteger alreadyReleased = releasedTo(claimant);
        BigInteger amount = pendingPayment(claimant);
        if (amount.signum() <= 0) {
            if (alreadyReleased.compareTo(capCeiling(claimant)) >= 0) {
                throw new RepaymentCapReachedException(address, claimant, alreadyReleased);
            }
            throw new NothingToReleaseException(address, claimant, alreadyReleased);
        }

        BigInteger newReleased = alreadyReleased.add(amount);
        BigInteger newTotalReleased = totalReleased.add(amount);
        if (newReleased.compareTo(entitlementCeiling(claimant)) > 0) {
            throw new LedgerInvariantViolationException("released exceeds entitlement ceiling", Map.of(
                "ledger", address, "claimant", claimant,
                "released", newReleased, "ceiling", entitlementCeiling(claimant)));
        }
        if (newTotalReleased.compareTo(repaymentCap) > 0) {
            throw new LedgerInvariantViolationException("totalReleased exceeds repayment cap", Map.of(
                "ledger", address, "claimant", claimant,
                "total_released", newTotalReleased, "repayment_cap", repaymentCap));
        }

        Map<String, BigInteger> updated = new LinkedHashMap<>(released);
        updated.put(claimant, newReleased);
        BigInteger sum = updated.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        if (sum.compareTo(newTotalReleased) != 0) {
            throw new LedgerInvariantViolationException("totalReleased differs from sum of releases", Map.of(
                "ledger", address, "total_released", newTotalReleased, "sum_released", sum));
        }

        Instant now = Instant.now();
        boolean capReachedNow = capReachedAt == null && allCeilingsReached(updated);
        Ledger next = new Ledger(address, roundId, administrator, shareTable, repaymentCap,
            totalReceived, Collections.unmodifiableMap(updated), newTotalReleased, status,
            capReachedNow ? now : capReachedAt, createdAt, now);
        return new LedgerRelease(next, claimant, amount, capReachedNow);
    }

    /**
     * @throws UnauthorizedException if the caller is not the administrator
     * @throws IllegalStateException if already paused
     */
    public Ledger pause(String caller) {
        requireAdministrator(caller, "pause");
        if (status == LedgerStatus.PAUSED) {
            throw new IllegalStateException("Ledger " + address + " is already paused");
        }
        return withStatus(LedgerStatus.PAUSED);
    }

    /**
     * @throws UnauthorizedException if the caller is not the administrator
     * @throws IllegalStateException if not paused
     */
    public Ledger unpause(String caller) {
        requireAdministrator(caller, "unpause");
        if (status != LedgerStatus.PAUSED) {
            throw new IllegalStateException("Ledger " + address + " is not paused");
        }
        return withStatus(LedgerStatus.ACTIVE);
    }

    // ==================== Helpers ====================

    private BigInteger proportion(BigInteger amount, String claimant) {
        return shareTable.sharesOf(claimant)
            .map(shares -> amount.multiply(BigInteger.valueOf(shares)).divide(TOTAL_SHARES))
            .orElse(BigInteger.ZERO);
    }

    private boolean allCeilingsReached(Map<String, BigInteger> releasedAfter) {
        return shareTable.claimants().stream()
            .allMatch(c -> releasedAfter.getOrDefault(c, BigInteger.ZERO).compareTo(capCeiling(c)) >= 0);
    }

    private void requireActive(String operation) {
        if (status == LedgerStatus.PAUSED) {
            throw new LedgerPausedException(address, operation);
        }
    }

    private void requireAdministrator(String caller, String operation) {
        if (caller == null || !caller.equalsIgnoreCase(administrator)) {
            throw new UnauthorizedException(address, caller, operation);
        }
    }

    private Ledger withStatus(LedgerStatus newStatus) {
        return new Ledger(address, roundId, administrator, shareTable, repaymentCap,
            totalReceived, released, totalReleased, newStatus, capReachedAt, createdAt, Instant.now());
    }
}
