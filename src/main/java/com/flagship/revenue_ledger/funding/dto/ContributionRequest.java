package com.flagship.revenue_ledger.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ContributionRequest {

    @NotBlank(message = "Contributor address is required")
    @JsonProperty("contributor_address")
    String contributorAddress;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount may have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;
}
