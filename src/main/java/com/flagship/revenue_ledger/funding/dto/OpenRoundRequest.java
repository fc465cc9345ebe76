package com.flagship.revenue_ledger.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class OpenRoundRequest {

    @NotBlank(message = "Owner address is required")
    @JsonProperty("owner_address")
    String ownerAddress;

    @NotNull(message = "Funding target is required")
    @Positive(message = "Funding target must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Funding target may have at most 2 decimal places")
    @JsonProperty("funding_target")
    BigDecimal fundingTarget;
}
