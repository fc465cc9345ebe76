package com.flagship.revenue_ledger.deployment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.deployment.DeploymentRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DeploymentResponse {

    @JsonProperty("round_id")
    UUID roundId;

    @JsonProperty("status")
    String status;

    @JsonProperty("ledger_address")
    String ledgerAddress;

    @JsonProperty("owner_address")
    String ownerAddress;

    @JsonProperty("payees")
    List<String> payees;

    @JsonProperty("shares")
    List<Integer> shares;

    @JsonProperty("repayment_cap")
    BigInteger repaymentCap;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static DeploymentResponse from(DeploymentRecord record) {
        return DeploymentResponse.builder()
            .roundId(record.getRoundId())
            .status(record.getStatus().name())
            .ledgerAddress(record.getLedgerAddress())
            .ownerAddress(record.getOwnerAddress())
            .payees(record.getShareTable().claimants())
            .shares(record.getShareTable().shares())
            .repaymentCap(record.getRepaymentCap())
            .failureReason(record.getFailureReason())
            .attempts(record.getAttempts())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
