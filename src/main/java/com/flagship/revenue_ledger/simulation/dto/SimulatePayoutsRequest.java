package com.flagship.revenue_ledger.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
public class SimulatePayoutsRequest {

    @NotEmpty(message = "At least one amount is required")
    @JsonProperty("amounts")
    List<@NotNull @Positive BigInteger> amounts;
}
