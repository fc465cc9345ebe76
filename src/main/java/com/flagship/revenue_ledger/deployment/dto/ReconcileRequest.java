package com.flagship.revenue_ledger.deployment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Operator's finding for an ambiguous deployment. A {@code null} address
 * asserts that nothing was provisioned.
 */
@Value
public class ReconcileRequest {

    @JsonProperty("ledger_address")
    String ledgerAddress;
}
