package com.flagship.revenue_ledger.simulation;

import com.flagship.revenue_ledger.simulation.dto.SimulatePayoutsRequest;
import com.flagship.revenue_ledger.simulation.dto.SimulationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational harness, only registered when {@code simulator.enabled=true}.
 */
@RestController
@RequestMapping("/api/simulator")
@ConditionalOnProperty(name = "simulator.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SimulatorController {

    private final PayoutSimulator simulator;

    @PostMapping("/ledgers/{address}/payouts")
    public ResponseEntity<SimulationResponse> simulatePayouts(@PathVariable("address") String address,
                                                              @Valid @RequestBody SimulatePayoutsRequest request) {
        log.info("Received payout simulation: ledger={}, deposits={}", address, request.getAmounts().size());
        return ResponseEntity.ok(SimulationResponse.from(simulator.simulate(address, request.getAmounts())));
    }
}
