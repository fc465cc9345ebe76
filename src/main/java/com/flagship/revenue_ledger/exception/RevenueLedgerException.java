package com.flagship.revenue_ledger.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all domain errors raised by the revenue ledger.
 *
 * Carries a {@link ErrorCategory} and a map of structured details
 * (ledger, claimant, amount, round ...) so callers can decide whether to
 * retry, correct their input or escalate.
 */
@Getter
public abstract class RevenueLedgerException extends RuntimeException {

    private final ErrorCategory category;
    private final Map<String, String> details;

    protected RevenueLedgerException(ErrorCategory category, String message, Map<String, ?> details) {
        this(category, message, details, null);
    }

    protected RevenueLedgerException(ErrorCategory category, String message,
                                     Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.details = toStringMap(details);
    }

    /**
     * Builds a details map from alternating keys and values. Null values are kept.
     */
    protected static Map<String, Object> details(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("details expects key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return map;
    }

    private static Map<String, String> toStringMap(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        details.forEach((key, value) -> copy.put(key, value == null ? null : value.toString()));
        return Collections.unmodifiableMap(copy);
    }
}
