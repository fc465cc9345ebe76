package com.flagship.revenue_ledger.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;
import com.flagship.revenue_ledger.funding.FundingOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A contribution that reached the goal but whose deployment failed is still
 * accepted; the failure is reported in {@code deployment_error}.
 */
@Value
@Builder
public class ContributionResponse {

    @JsonProperty("contribution_id")
    Long contributionId;

    @JsonProperty("contributor_address")
    String contributorAddress;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("round")
    RoundResponse round;

    @JsonProperty("goal_reached")
    boolean goalReached;

    @JsonProperty("ledger_deployed")
    boolean ledgerDeployed;

    @JsonProperty("ledger_address")
    String ledgerAddress;

    @JsonProperty("deployment_error")
    DeploymentError deploymentError;

    @Value
    public static class DeploymentError {
        @JsonProperty("error")
        String error;

        @JsonProperty("message")
        String message;

        @JsonProperty("details")
        Map<String, String> details;

        static DeploymentError from(RevenueLedgerException e) {
            return new DeploymentError(e.getCategory().name(), e.getMessage(), e.getDetails());
        }
    }

    public static ContributionResponse from(FundingOutcome outcome) {
        return ContributionResponse.builder()
            .contributionId(outcome.getContribution().getContributionId())
            .contributorAddress(outcome.getContribution().getContributorAddress())
            .amount(outcome.getContribution().getAmount())
            .round(RoundResponse.from(outcome.getRound()))
            .goalReached(outcome.getContribution().isGoalClaimed())
            .ledgerDeployed(outcome.isDeployed())
            .ledgerAddress(outcome.getLedgerAddress())
            .deploymentError(outcome.getDeploymentFailure() == null
                ? null : DeploymentError.from(outcome.getDeploymentFailure()))
            .build();
    }
}
