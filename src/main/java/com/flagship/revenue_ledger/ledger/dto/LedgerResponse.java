package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.ledger.Ledger;
import com.flagship.revenue_ledger.ledger.LedgerStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Ledger snapshot including per-claimant figures.
 */
@Value
@Builder
public class LedgerResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("round_id")
    UUID roundId;

    @JsonProperty("administrator")
    String administrator;

    @JsonProperty("status")
    LedgerStatus status;

    @JsonProperty("repayment_cap")
    BigInteger repaymentCap;

    @JsonProperty("total_received")
    BigInteger totalReceived;

    @JsonProperty("total_released")
    BigInteger totalReleased;

    @JsonProperty("remaining_cap")
    BigInteger remainingCap;

    @JsonProperty("total_shares")
    int totalShares;

    @JsonProperty("cap_reached_at")
    Instant capReachedAt;

    @JsonProperty("claimants")
    List<ClaimantView> claimants;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @Value
    public static class ClaimantView {

        @JsonProperty("address")
        String address;

        @JsonProperty("shares")
        int shares;

        @JsonProperty("released")
        BigInteger released;

        @JsonProperty("pending")
        BigInteger pending;

        @JsonProperty("cap_ceiling")
        BigInteger capCeiling;
    }

    public static LedgerResponse from(Ledger ledger) {
        ShareTable table = ledger.getShareTable();
        List<ClaimantView> claimants = table.getEntries().stream()
            .map(entry -> new ClaimantView(
                entry.getClaimant(),
                entry.getShares(),
                ledger.releasedTo(entry.getClaimant()),
                ledger.pendingPayment(entry.getClaimant()),
                ledger.capCeiling(entry.getClaimant())))
            .toList();

        return LedgerResponse.builder()
            .address(ledger.getAddress())
            .roundId(ledger.getRoundId())
            .administrator(ledger.getAdministrator())
            .status(ledger.getStatus())
            .repaymentCap(ledger.getRepaymentCap())
            .totalReceived(ledger.getTotalReceived())
            .totalReleased(ledger.getTotalReleased())
            .remainingCap(ledger.remainingCap())
            .totalShares(table.totalShares())
            .capReachedAt(ledger.getCapReachedAt())
            .claimants(claimants)
            .createdAt(ledger.getCreatedAt())
            .updatedAt(ledger.getUpdatedAt())
            .build();
    }
}
