package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class PendingPaymentResponse {

    @JsonProperty("ledger_address")
    String ledgerAddress;

    @JsonProperty("claimant")
    String claimant;

    @JsonProperty("pending")
    BigInteger pending;
}
