package com.flagship.revenue_ledger.simulation;

import com.flagship.revenue_ledger.ledger.DepositResult;
import com.flagship.revenue_ledger.ledger.Ledger;
import com.flagship.revenue_ledger.ledger.LedgerDeposit;
import com.flagship.revenue_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Injects revenue into a deployed ledger to exercise distribution.
 *
 * Each amount is a separate deposit with its own generated idempotency key,
 * so the normal ledger rules (positive amount, ACTIVE status) apply. Deposits
 * made before a rejected one stay committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutSimulator {

    static final String KEY_PREFIX = "sim-";

    private final LedgerService ledgerService;

    public SimulationReport simulate(String ledgerAddress, List<BigInteger> amounts) {
        if (amounts == null || amounts.isEmpty()) {
            throw new IllegalArgumentException("At least one payout amount is required");
        }

        List<LedgerDeposit> deposits = new ArrayList<>();
        for (BigInteger amount : amounts) {
            DepositResult result = ledgerService.deposit(ledgerAddress, amount, KEY_PREFIX + UUID.randomUUID());
            deposits.add(result.getDeposit());
        }

        Ledger ledger = ledgerService.getLedger(ledgerAddress);
        Map<String, BigInteger> pending = new LinkedHashMap<>();
        for (String claimant : ledger.getShareTable().claimants()) {
            pending.put(claimant, ledger.pendingPayment(claimant));
        }

        log.info("Simulated payouts: ledger={}, deposits={}, totalReceived={}",
                ledger.getAddress(), deposits.size(), ledger.getTotalReceived());
        return new SimulationReport(ledger, List.copyOf(deposits), Collections.unmodifiableMap(pending));
    }
}
