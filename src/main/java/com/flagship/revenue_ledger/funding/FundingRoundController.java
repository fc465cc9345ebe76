package com.flagship.revenue_ledger.funding;

import com.flagship.revenue_ledger.funding.dto.ContributionRequest;
import com.flagship.revenue_ledger.funding.dto.ContributionResponse;
import com.flagship.revenue_ledger.funding.dto.OpenRoundRequest;
import com.flagship.revenue_ledger.funding.dto.RoundResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/rounds")
@RequiredArgsConstructor
@Slf4j
public class FundingRoundController {

    private final FundingRoundService roundService;
    private final FundingStateMachine stateMachine;

    @PostMapping
    public ResponseEntity<RoundResponse> openRound(@Valid @RequestBody OpenRoundRequest request) {
        log.info("Received open round request: owner={}, target={}",
                request.getOwnerAddress(), request.getFundingTarget());
        FundingRound round = roundService.open(request.getOwnerAddress(), request.getFundingTarget());
        return ResponseEntity.status(HttpStatus.CREATED).body(RoundResponse.from(round));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RoundResponse> getRound(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(RoundResponse.from(roundService.getRound(id)));
    }

    /**
     * 201 whenever the contribution is recorded, including when the
     * deployment it triggered failed.
     */
    @PostMapping("/{id}/contributions")
    public ResponseEntity<ContributionResponse> contribute(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody ContributionRequest request) {
        log.info("Received contribution: roundId={}, contributor={}, amount={}",
                id, request.getContributorAddress(), request.getAmount());
        FundingOutcome outcome = stateMachine.contribute(id, request.getContributorAddress(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContributionResponse.from(outcome));
    }

    @PostMapping("/{id}/deployment/retry")
    public ResponseEntity<RoundResponse> retryDeployment(@PathVariable("id") UUID id) {
        log.info("Received deployment retry: roundId={}", id);
        return ResponseEntity.ok(RoundResponse.from(stateMachine.retryDeployment(id)));
    }
}
