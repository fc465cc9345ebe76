package com.flagship.revenue_ledger.simulation;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.ledger.DepositResult;
import com.flagship.revenue_ledger.ledger.Ledger;
import com.flagship.revenue_ledger.ledger.LedgerDeposit;
import com.flagship.revenue_ledger.ledger.LedgerPausedException;
import com.flagship.revenue_ledger.ledger.LedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PayoutSimulatorTest {

    private static final String LEDGER = "0x00000000000000000000000000000000000000ff";
    private static final String ADMIN = "0x00000000000000000000000000000000000000ad";
    private static final String A = "0x000000000000000000000000000000000000000a";
    private static final String B = "0x000000000000000000000000000000000000000b";

    @Mock
    private LedgerService ledgerService;

    @InjectMocks
    private PayoutSimulator simulator;

    private final Ledger empty = Ledger.create(LEDGER, UUID.randomUUID(), ADMIN,
            ShareTable.of(List.of(ClaimantShare.of(A, 6000), ClaimantShare.of(B, 4000))),
            BigInteger.valueOf(1_000_000));

    private DepositResult depositOf(BigInteger amount) {
        return new DepositResult(new LedgerDeposit(UUID.randomUUID(), LEDGER, amount, "k", Instant.now()),
                empty.deposit(amount), false);
    }

    @Test
    @DisplayName("Each amount becomes its own deposit and pending payments are reported")
    void simulate_DepositsAndReportsPending() {
        when(ledgerService.deposit(eq(LEDGER), any(), anyString()))
                .thenAnswer(inv -> depositOf(inv.getArgument(1)));
        when(ledgerService.getLedger(LEDGER)).thenReturn(empty.deposit(BigInteger.valueOf(1000)));

        SimulationReport report = simulator.simulate(LEDGER, List.of(BigInteger.valueOf(400), BigInteger.valueOf(600)));

        assertEquals(2, report.getDeposits().size());
        assertEquals(BigInteger.valueOf(600), report.getPendingByClaimant().get(A));
        assertEquals(BigInteger.valueOf(400), report.getPendingByClaimant().get(B));

        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        verify(ledgerService, times(2)).deposit(eq(LEDGER), any(), keys.capture());
        assertTrue(keys.getAllValues().stream().allMatch(k -> k.startsWith(PayoutSimulator.KEY_PREFIX)));
        assertNotEquals(keys.getAllValues().get(0), keys.getAllValues().get(1));
    }

    @Test
    @DisplayName("Ledger rules still apply to simulated revenue")
    void simulate_PausedLedger() {
        when(ledgerService.deposit(eq(LEDGER), any(), anyString()))
                .thenThrow(new LedgerPausedException(LEDGER, "deposit"));

        assertThrows(LedgerPausedException.class, () -> simulator.simulate(LEDGER, List.of(BigInteger.TEN)));
    }

    @Test
    void simulate_RequiresAmounts() {
        assertThrows(IllegalArgumentException.class, () -> simulator.simulate(LEDGER, List.of()));
        verifyNoInteractions(ledgerService);
    }
}
