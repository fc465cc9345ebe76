package com.flagship.revenue_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used in log lines.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header or is
 * generated per request; the business keys are put by the services for the
 * duration of one operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LEDGER_MDC_KEY = "ledgerAddress";
    public static final String ROUND_MDC_KEY = "roundId";
    public static final String CLAIMANT_MDC_KEY = "claimant";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        clearBusinessKeys();
    }

    /**
     * Short ids read better in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void clearBusinessKeys() {
        MDC.remove(LEDGER_MDC_KEY);
        MDC.remove(ROUND_MDC_KEY);
        MDC.remove(CLAIMANT_MDC_KEY);
    }
}
