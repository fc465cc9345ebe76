package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.ReleaseReceipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReleaseResponse {

    @JsonProperty("release_id")
    UUID releaseId;

    @JsonProperty("ledger_address")
    String ledgerAddress;

    @JsonProperty("claimant")
    String claimant;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("released_total")
    BigInteger releasedTotal;

    @JsonProperty("transfer_reference")
    String transferReference;

    @JsonProperty("cap_reached")
    boolean capReached;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ReleaseResponse from(ReleaseReceipt receipt) {
        return ReleaseResponse.builder()
            .releaseId(receipt.getId())
            .ledgerAddress(receipt.getLedgerAddress())
            .claimant(receipt.getClaimant())
            .amount(receipt.getAmount())
            .releasedTotal(receipt.getReleasedTotal())
            .transferReference(receipt.getTransferReference())
            .capReached(receipt.isCapReached())
            .createdAt(receipt.getCreatedAt())
            .build();
    }
}
