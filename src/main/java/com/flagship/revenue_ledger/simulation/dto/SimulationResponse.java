package com.flagship.revenue_ledger.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.LedgerDeposit;
import com.flagship.revenue_ledger.ledger.dto.LedgerResponse;
import com.flagship.revenue_ledger.simulation.SimulationReport;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
public class SimulationResponse {

    @JsonProperty("deposit_ids")
    List<UUID> depositIds;

    @JsonProperty("pending")
    Map<String, BigInteger> pending;

    @JsonProperty("ledger")
    LedgerResponse ledger;

    public static SimulationResponse from(SimulationReport report) {
        return new SimulationResponse(
            report.getDeposits().stream().map(LedgerDeposit::getId).toList(),
            report.getPendingByClaimant(),
            LedgerResponse.from(report.getLedger()));
    }
}
