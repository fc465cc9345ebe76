package com.flagship.revenue_ledger.allocation;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Repayment cap settings, validated once at startup.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "revenue-ledger.cap")
public class CapProperties {

    /**
     * Multiple of the funding target that investors may be repaid, e.g. 1.2 for 120%.
     */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal multiplier = new BigDecimal("1.2");

    /**
     * Funding units per settlement unit, used when no live rate source is configured.
     */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal exchangeRate = new BigDecimal("200000");

    /**
     * Decimal places of the settlement currency (18 for ether/wei).
     */
    @Min(0)
    @Max(36)
    private int settlementDecimals = 18;
}
