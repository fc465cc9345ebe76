package com.flagship.revenue_ledger.allocation;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

import java.math.BigDecimal;

public class InvalidRateException extends RevenueLedgerException {

    public InvalidRateException(BigDecimal exchangeRate) {
        super(ErrorCategory.VALIDATION,
                "Exchange rate must be positive, got " + exchangeRate,
                details("exchange_rate", exchangeRate == null ? null : exchangeRate.toPlainString()));
    }
}
