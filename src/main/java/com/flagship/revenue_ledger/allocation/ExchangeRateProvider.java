package com.flagship.revenue_ledger.allocation;

import java.math.BigDecimal;

/**
 * Source of the funding-unit per settlement-unit rate used when a ledger is deployed.
 * The rate is read once per deployment; later rate changes never touch an existing cap.
 */
public interface ExchangeRateProvider {

    BigDecimal currentRate();
}
