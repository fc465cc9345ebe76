package com.flagship.revenue_ledger.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.funding.FundingRound;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RoundResponse {

    @JsonProperty("round_id")
    UUID roundId;

    @JsonProperty("owner_address")
    String ownerAddress;

    @JsonProperty("funding_target")
    BigDecimal fundingTarget;

    @JsonProperty("current_funding")
    BigDecimal currentFunding;

    @JsonProperty("contribution_count")
    int contributionCount;

    @JsonProperty("status")
    String status;

    @JsonProperty("goal_reached_at")
    Instant goalReachedAt;

    @JsonProperty("ledger_address")
    String ledgerAddress;

    @JsonProperty("created_at")
    Instant createdAt;

    public static RoundResponse from(FundingRound round) {
        return RoundResponse.builder()
            .roundId(round.getId())
            .ownerAddress(round.getOwnerAddress())
            .fundingTarget(round.getFundingTarget())
            .currentFunding(round.getCurrentFunding())
            .contributionCount(round.getContributionCount())
            .status(round.getStatus().name())
            .goalReachedAt(round.getGoalReachedAt())
            .ledgerAddress(round.getLedgerAddress())
            .createdAt(round.getCreatedAt())
            .build();
    }
}
