package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.deployment.dto.DeploymentResponse;
import com.flagship.revenue_ledger.deployment.dto.ReconcileRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/deployments")
@RequiredArgsConstructor
@Slf4j
public class DeploymentController {

    private final DeploymentOrchestrator orchestrator;

    @GetMapping("/{roundId}")
    public ResponseEntity<DeploymentResponse> getDeployment(@PathVariable("roundId") UUID roundId) {
        return ResponseEntity.ok(DeploymentResponse.from(orchestrator.findRecord(roundId)));
    }

    @PostMapping("/{roundId}/reconcile")
    public ResponseEntity<DeploymentResponse> reconcile(@PathVariable("roundId") UUID roundId,
                                                        @RequestBody ReconcileRequest request) {
        log.info("Received reconciliation: roundId={}, ledgerAddress={}", roundId, request.getLedgerAddress());
        DeploymentRecord resolved = orchestrator.reconcile(roundId, request.getLedgerAddress());
        return ResponseEntity.ok(DeploymentResponse.from(resolved));
    }
}
