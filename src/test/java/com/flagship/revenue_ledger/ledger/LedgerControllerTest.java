package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.config.JacksonConfig;
import com.flagship.revenue_ledger.transfer.TransferFailedException;
import com.flagship.revenue_ledger.transfer.TransferInstruction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of ledger operations and their error categories.
 */
@WebMvcTest(LedgerController.class)
@Import(JacksonConfig.class)
class LedgerControllerTest {

    private static final String LEDGER = "0x00000000000000000000000000000000000000ff";
    private static final String ADMIN = "0x00000000000000000000000000000000000000ad";
    private static final String A = "0x000000000000000000000000000000000000000a";
    private static final String B = "0x000000000000000000000000000000000000000b";
    private static final BigInteger UNIT = BigInteger.TEN.pow(18);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerService ledgerService;

    private final Ledger ledger = Ledger.create(LEDGER, UUID.randomUUID(), ADMIN,
            ShareTable.of(List.of(ClaimantShare.of(A, 6000), ClaimantShare.of(B, 4000))),
            UNIT.multiply(BigInteger.valueOf(6)));

    @Test
    @DisplayName("Ledger snapshot renders amounts as strings with per-claimant figures")
    void getLedger() throws Exception {
        when(ledgerService.getLedger(LEDGER)).thenReturn(ledger.deposit(UNIT));

        mockMvc.perform(get("/api/ledgers/{address}", LEDGER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repayment_cap").value("6000000000000000000"))
                .andExpect(jsonPath("$.total_shares").value(10000))
                .andExpect(jsonPath("$.claimants[0].address").value(A))
                .andExpect(jsonPath("$.claimants[0].pending").value("600000000000000000"))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    @DisplayName("A new deposit returns 201, a repeated key returns 200")
    void deposit_CreatedThenDuplicate() throws Exception {
        Ledger funded = ledger.deposit(UNIT);
        LedgerDeposit deposit = new LedgerDeposit(UUID.randomUUID(), LEDGER, UNIT, "key-1", Instant.now());
        when(ledgerService.deposit(LEDGER, UNIT, "key-1"))
                .thenReturn(new DepositResult(deposit, funded, false))
                .thenReturn(new DepositResult(deposit, funded, true));

        String body = "{\"amount\": \"1000000000000000000\"}";
        mockMvc.perform(post("/api/ledgers/{address}/deposits", LEDGER)
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.deposit_id").value(deposit.getId().toString()))
                .andExpect(jsonPath("$.duplicate").value(false));

        mockMvc.perform(post("/api/ledgers/{address}/deposits", LEDGER)
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    void deposit_MissingIdempotencyKey() throws Exception {
        mockMvc.perform(post("/api/ledgers/{address}/deposits", LEDGER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));

        verifyNoInteractions(ledgerService);
    }

    @Test
    void deposit_NonPositiveAmount() throws Exception {
        mockMvc.perform(post("/api/ledgers/{address}/deposits", LEDGER)
                        .header("Idempotency-Key", "key-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.amount").exists());
    }

    @Test
    @DisplayName("Deposits to a paused ledger are a 409 WITHDRAWAL error")
    void deposit_Paused() throws Exception {
        when(ledgerService.deposit(eq(LEDGER), any(), eq("key-3")))
                .thenThrow(new LedgerPausedException(LEDGER, "deposit"));

        mockMvc.perform(post("/api/ledgers/{address}/deposits", LEDGER)
                        .header("Idempotency-Key", "key-3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("WITHDRAWAL"));
    }

    @Test
    void release_Success() throws Exception {
        when(ledgerService.release(LEDGER, A)).thenReturn(new ReleaseReceipt(UUID.randomUUID(), LEDGER, A,
                UNIT, UNIT, "txn-1", false, Instant.now()));

        mockMvc.perform(post("/api/ledgers/{address}/claimants/{claimant}/release", LEDGER, A))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(UNIT.toString()));
    }

    @Test
    void release_NothingDue() throws Exception {
        when(ledgerService.release(LEDGER, A)).thenThrow(new NothingToReleaseException(LEDGER, A, BigInteger.ZERO));

        mockMvc.perform(post("/api/ledgers/{address}/claimants/{claimant}/release", LEDGER, A))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("WITHDRAWAL"))
                .andExpect(jsonPath("$.details.claimant").value(A));
    }

    @Test
    void release_TransferFailed() throws Exception {
        when(ledgerService.release(LEDGER, A)).thenThrow(new TransferFailedException(
                new TransferInstruction(LEDGER, A, UNIT), new IllegalStateException("rejected")));

        mockMvc.perform(post("/api/ledgers/{address}/claimants/{claimant}/release", LEDGER, A))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("TRANSFER_FAILED"));
    }

    @Test
    void pause_Unauthorized() throws Exception {
        when(ledgerService.pause(LEDGER, A)).thenThrow(new UnauthorizedException(LEDGER, A, "pause"));

        mockMvc.perform(post("/api/ledgers/{address}/pause", LEDGER).header("X-Caller-Address", A))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void pause_ByAdministrator() throws Exception {
        when(ledgerService.pause(LEDGER, ADMIN)).thenReturn(ledger.pause(ADMIN));

        mockMvc.perform(post("/api/ledgers/{address}/pause", LEDGER).header("X-Caller-Address", ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAUSED"));
    }

    @Test
    void pendingPayment_UnknownLedger() throws Exception {
        when(ledgerService.pendingPayment(LEDGER, A)).thenThrow(new LedgerNotFoundException(LEDGER));

        mockMvc.perform(get("/api/ledgers/{address}/claimants/{claimant}/pending", LEDGER, A))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }
}
