package com.flagship.revenue_ledger.allocation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts a funding target into a repayment cap in the smallest settlement unit.
 *
 * cap = floor(target * multiplier / rate * 10^decimals)
 *
 * Example: target 1,000,000 at 1.2x and 200,000 per unit gives 6 units,
 * i.e. 6 * 10^18 with 18 decimals.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapConverter {

    private final CapProperties capProperties;
    private final ExchangeRateProvider exchangeRateProvider;

    /**
     * Computes the cap with the configured multiplier and the current exchange rate.
     */
    public BigInteger computeCap(BigDecimal fundingTarget) {
        BigDecimal rate = exchangeRateProvider.currentRate();
        BigInteger cap = computeCap(fundingTarget, capProperties.getMultiplier(), rate);
        log.info("Computed repayment cap: target={}, multiplier={}, rate={}, cap={}",
            fundingTarget, capProperties.getMultiplier(), rate, cap);
        return cap;
    }

    /**
     * @throws InvalidRateException if the exchange rate is missing or not positive
     * @throws IllegalArgumentException if target or multiplier is not positive
     */
    public BigInteger computeCap(BigDecimal fundingTarget, BigDecimal capMultiplier, BigDecimal exchangeRate) {
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            throw new InvalidRateException(exchangeRate);
        }
        if (fundingTarget == null || fundingTarget.signum() <= 0) {
            throw new IllegalArgumentException("Funding target must be positive");
        }
        if (capMultiplier == null || capMultiplier.signum() <= 0) {
            throw new IllegalArgumentException("Cap multiplier must be positive");
        }
        int decimals = capProperties.getSettlementDecimals();
        return fundingTarget.multiply(capMultiplier)
            .divide(exchangeRate, decimals, RoundingMode.DOWN)
            .movePointRight(decimals)
            .toBigIntegerExact();
    }

    /**
     * Renders an amount in smallest units as a decimal string in settlement units,
     * e.g. 6000000000000000000 → "6" with 18 decimals.
     */
    public String toSettlementUnits(BigInteger amount) {
        BigDecimal units = new BigDecimal(amount, capProperties.getSettlementDecimals()).stripTrailingZeros();
        return units.scale() < 0 ? units.setScale(0).toPlainString() : units.toPlainString();
    }
}
