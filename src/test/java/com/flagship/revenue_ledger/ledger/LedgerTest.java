package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LedgerTest {

    private static final String ADMIN = "0x00000000000000000000000000000000000000ad";
    private static final String A = "0x000000000000000000000000000000000000000a";
    private static final String B = "0x000000000000000000000000000000000000000b";
    private static final BigInteger UNIT = BigInteger.TEN.pow(18);

    private Ledger ledger;

    @BeforeEach
    void setUp() {
        ShareTable table = ShareTable.of(List.of(ClaimantShare.of(A, 6000), ClaimantShare.of(B, 4000)));
        ledger = Ledger.create("0x00000000000000000000000000000000000000ff", UUID.randomUUID(), ADMIN,
                table, UNIT.multiply(BigInteger.valueOf(6)));
    }

    private static BigInteger units(String decimal) {
        return new BigDecimal(decimal).movePointRight(18).toBigIntegerExact();
    }

    @Nested
    @DisplayName("Pending payments")
    class PendingPayments {

        @Test
        @DisplayName("A deposit of 1 unit entitles 0.6 and 0.4")
        void deposit_SplitsByShares() {
            Ledger funded = ledger.deposit(UNIT);

            assertEquals(units("0.6"), funded.pendingPayment(A));
            assertEquals(units("0.4"), funded.pendingPayment(B));
        }

        @Test
        @DisplayName("Releasing pays the pending amount and resets it until the next deposit")
        void release_ResetsPending() {
            LedgerRelease release = ledger.deposit(UNIT).release(A);

            assertEquals(units("0.6"), release.getAmount());
            assertEquals(units("0.6"), release.getLedger().releasedTo(A));
            assertEquals(BigInteger.ZERO, release.getLedger().pendingPayment(A));
            assertEquals(units("0.4"), release.getLedger().pendingPayment(B));

            Ledger again = release.getLedger().deposit(UNIT);
            assertEquals(units("0.6"), again.pendingPayment(A));
        }

        @Test
        @DisplayName("Unknown accounts have nothing pending")
        void pendingPayment_UnknownClaimant() {
            assertEquals(BigInteger.ZERO, ledger.deposit(UNIT).pendingPayment("0x0000000000000000000000000000000000000123"));
        }

        @Test
        @DisplayName("Pending amounts floor to the smallest unit")
        void pendingPayment_Floors() {
            Ledger funded = ledger.deposit(BigInteger.valueOf(3));

            // 3 * 6000 / 10000 = 1.8 -> 1, 3 * 4000 / 10000 = 1.2 -> 1
            assertEquals(BigInteger.ONE, funded.pendingPayment(A));
            assertEquals(BigInteger.ONE, funded.pendingPayment(B));
        }
    }

    @Nested
    @DisplayName("Repayment cap")
    class RepaymentCap {

        @Test
        @DisplayName("Deposits beyond the cap never raise payouts past it")
        void deposits_BeyondCap() {
            Ledger funded = ledger.deposit(UNIT.multiply(BigInteger.valueOf(20)));
            assertEquals(units("3.6"), funded.pendingPayment(A));
            assertEquals(units("2.4"), funded.pendingPayment(B));

            LedgerRelease first = funded.release(A);
            LedgerRelease second = first.getLedger().release(B);
            Ledger exhausted = second.getLedger();

            assertFalse(first.isCapReached());
            assertTrue(second.isCapReached());
            assertTrue(exhausted.isCapReached());
            assertEquals(exhausted.getRepaymentCap(), exhausted.getTotalReleased());
            assertEquals(BigInteger.ZERO, exhausted.remainingCap());

            Ledger more = exhausted.deposit(UNIT.multiply(BigInteger.valueOf(100)));
            assertEquals(BigInteger.ZERO, more.pendingPayment(A));
            assertEquals(BigInteger.ZERO, more.pendingPayment(B));
            assertThrows(RepaymentCapReachedException.class, () -> more.release(A));
        }

        @Test
        @DisplayName("Random deposit and release sequences keep every invariant")
        void randomSequences_PreserveInvariants() {
            Random random = new Random(7);
            for (int run = 0; run < 50; run++) {
                Ledger current = ledger;
                BigInteger previousA = BigInteger.ZERO;
                BigInteger previousB = BigInteger.ZERO;
                for (int step = 0; step < 40; step++) {
                    if (random.nextBoolean()) {
                        current = current.deposit(UNIT.divide(BigInteger.valueOf(1 + random.nextInt(5))));
                    } else {
                        String claimant = random.nextBoolean() ? A : B;
                        if (current.pendingPayment(claimant).signum() > 0) {
                            current = current.release(claimant).getLedger();
                        }
                    }

                    assertTrue(current.getTotalReleased().compareTo(current.getRepaymentCap()) <= 0);
                    assertEquals(current.getTotalReleased(), current.releasedTo(A).add(current.releasedTo(B)));
                    assertTrue(current.releasedTo(A).compareTo(previousA) >= 0);
                    assertTrue(current.releasedTo(B).compareTo(previousB) >= 0);
                    assertTrue(current.releasedTo(A).compareTo(current.capCeiling(A)) <= 0);
                    assertTrue(current.releasedTo(B).compareTo(current.capCeiling(B)) <= 0);
                    previousA = current.releasedTo(A);
                    previousB = current.releasedTo(B);
                }
            }
        }
    }

    @Nested
    @DisplayName("Release errors")
    class ReleaseErrors {

        @Test
        void release_NothingDue() {
            assertThrows(NothingToReleaseException.class, () -> ledger.release(A));
        }

        @Test
        void release_UnknownClaimant() {
            Ledger funded = ledger.deposit(UNIT);
            assertThrows(UnknownClaimantException.class,
                    () -> funded.release("0x0000000000000000000000000000000000000123"));
        }

        @Test
        void deposit_NonPositive() {
            assertThrows(IllegalArgumentException.class, () -> ledger.deposit(BigInteger.ZERO));
            assertThrows(IllegalArgumentException.class, () -> ledger.deposit(BigInteger.valueOf(-1)));
        }
    }

    @Nested
    @DisplayName("Pause")
    class Pause {

        @Test
        @DisplayName("Paused ledgers reject deposits and releases until unpaused")
        void pause_BlocksDepositsAndReleases() {
            Ledger paused = ledger.deposit(UNIT).pause(ADMIN);

            assertTrue(paused.isPaused());
            assertThrows(LedgerPausedException.class, () -> paused.deposit(UNIT));
            assertThrows(LedgerPausedException.class, () -> paused.release(A));
            assertEquals(units("0.6"), paused.pendingPayment(A));

            Ledger resumed = paused.unpause(ADMIN);
            assertEquals(units("0.6"), resumed.release(A).getAmount());
        }

        @Test
        @DisplayName("Only the administrator may pause or unpause")
        void pause_RequiresAdministrator() {
            assertThrows(UnauthorizedException.class, () -> ledger.pause(A));
            Ledger paused = ledger.pause(ADMIN);
            assertThrows(UnauthorizedException.class, () -> paused.unpause(B));
        }

        @Test
        @DisplayName("Pausing twice or unpausing an active ledger is a state error")
        void pause_WrongState() {
            assertThrows(IllegalStateException.class, () -> ledger.unpause(ADMIN));
            Ledger paused = ledger.pause(ADMIN);
            assertThrows(IllegalStateException.class, () -> paused.pause(ADMIN));
        }
    }

    @Test
    @DisplayName("Creation rejects unbalanced tables and non-positive caps")
    void create_Validation() {
        ShareTable unbalanced = ShareTable.of(List.of(ClaimantShare.of(A, 5000)));
        ShareTable balanced = ShareTable.of(List.of(ClaimantShare.of(A, 10_000)));

        assertThrows(IllegalArgumentException.class,
                () -> Ledger.create("0x01", UUID.randomUUID(), ADMIN, unbalanced, UNIT));
        assertThrows(IllegalArgumentException.class,
                () -> Ledger.create("0x01", UUID.randomUUID(), ADMIN, balanced, BigInteger.ZERO));
    }
}
