package com.flagship.revenue_ledger.allocation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@RequiredArgsConstructor
public class ConfiguredExchangeRateProvider implements ExchangeRateProvider {

    private final CapProperties capProperties;

    @Override
    public BigDecimal currentRate() {
        return capProperties.getExchangeRate();
    }
}
