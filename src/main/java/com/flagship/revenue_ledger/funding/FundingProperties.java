package com.flagship.revenue_ledger.funding;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "revenue-ledger.funding")
public class FundingProperties {

    /**
     * Smallest accepted contribution, in the funding currency.
     */
    @NotNull
    @Positive
    private BigDecimal minimumContribution = new BigDecimal("1000");
}
