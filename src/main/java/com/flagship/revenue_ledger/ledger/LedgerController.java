package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.ledger.dto.DepositRequest;
import com.flagship.revenue_ledger.ledger.dto.DepositResponse;
import com.flagship.revenue_ledger.ledger.dto.LedgerResponse;
import com.flagship.revenue_ledger.ledger.dto.PendingPaymentResponse;
import com.flagship.revenue_ledger.ledger.dto.ReleaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * REST surface of a ledger: snapshot, pending amounts, deposits, pull
 * releases and administrator pause/unpause.
 *
 * Deposits require an {@code Idempotency-Key} header; a repeated key returns
 * 200 with the original deposit instead of 201. Pause and unpause identify
 * the caller through {@code X-Caller-Address}.
 */
@RestController
@RequestMapping("/api/ledgers")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String CALLER_HEADER = "X-Caller-Address";

    private final LedgerService ledgerService;

    @GetMapping("/{address}")
    public ResponseEntity<LedgerResponse> getLedger(@PathVariable("address") String address) {
        return ResponseEntity.ok(LedgerResponse.from(ledgerService.getLedger(address)));
    }

    @GetMapping("/{address}/claimants/{claimant}/pending")
    public ResponseEntity<PendingPaymentResponse> pendingPayment(@PathVariable("address") String address,
                                                                 @PathVariable("claimant") String claimant) {
        BigInteger pending = ledgerService.pendingPayment(address, claimant);
        return ResponseEntity.ok(new PendingPaymentResponse(address, claimant, pending));
    }

    @PostMapping("/{address}/deposits")
    public ResponseEntity<DepositResponse> deposit(@PathVariable("address") String address,
                                                   @Valid @RequestBody DepositRequest request,
                                                   @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        log.info("Received deposit request: ledger={}, amount={}, idempotencyKey={}",
                address, request.getAmount(), idempotencyKey);

        DepositResult result = ledgerService.deposit(address, request.getAmount(), idempotencyKey);
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(DepositResponse.from(result));
    }

    @PostMapping("/{address}/claimants/{claimant}/release")
    public ResponseEntity<ReleaseResponse> release(@PathVariable("address") String address,
                                                   @PathVariable("claimant") String claimant) {
        ReleaseReceipt receipt = ledgerService.release(address, claimant);
        return ResponseEntity.ok(ReleaseResponse.from(receipt));
    }

    @PostMapping("/{address}/pause")
    public ResponseEntity<LedgerResponse> pause(@PathVariable("address") String address,
                                                @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(LedgerResponse.from(ledgerService.pause(address, caller)));
    }

    @PostMapping("/{address}/unpause")
    public ResponseEntity<LedgerResponse> unpause(@PathVariable("address") String address,
                                                  @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(LedgerResponse.from(ledgerService.unpause(address, caller)));
    }
}
