package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.DepositResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("deposit_id")
    UUID depositId;

    @JsonProperty("ledger_address")
    String ledgerAddress;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("total_received")
    BigInteger totalReceived;

    @JsonProperty("duplicate")
    boolean duplicate;

    @JsonProperty("created_at")
    Instant createdAt;

    public static DepositResponse from(DepositResult result) {
        return DepositResponse.builder()
            .depositId(result.getDeposit().getId())
            .ledgerAddress(result.getDeposit().getLedgerAddress())
            .amount(result.getDeposit().getAmount())
            .totalReceived(result.getLedger().getTotalReceived())
            .duplicate(result.isDuplicate())
            .createdAt(result.getDeposit().getCreatedAt())
            .build();
    }
}
