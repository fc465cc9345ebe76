package com.flagship.revenue_ledger.simulation;

import com.flagship.revenue_ledger.ledger.Ledger;
import com.flagship.revenue_ledger.ledger.LedgerDeposit;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

@Value
public class SimulationReport {
    Ledger ledger;
    List<LedgerDeposit> deposits;
    Map<String, BigInteger> pendingByClaimant;
}
