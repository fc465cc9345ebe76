package com.flagship.revenue_ledger.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for ledger, deployment and funding operations.
 *
 * - ledger.deposits / ledger.releases: counters tagged by status
 * - ledger.released.amount: summary of released amounts (smallest units)
 * - ledger.operation.latency: timer tagged by operation
 * - deployment.attempts: counter tagged by outcome
 * - funding.contributions: counter tagged by status
 * - deployment.ambiguous: gauge of deployments awaiting reconciliation
 * - idempotency.cache: hit/miss of the deposit key fast path
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary releasedAmount;
    private final AtomicLong ambiguousDeployments = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.releasedAmount = DistributionSummary.builder("ledger.released.amount")
                .description("Amounts released to claimants, in smallest settlement units")
                .register(registry);
        Gauge.builder("deployment.ambiguous", ambiguousDeployments, AtomicLong::get)
                .description("Deployments whose outcome is unknown and need reconciliation")
                .register(registry);
    }

    public void recordDeposit(String status) {
        registry.counter("ledger.deposits", "status", sanitizeTag(status)).increment();
    }

    public void recordRelease(String status) {
        registry.counter("ledger.releases", "status", sanitizeTag(status)).increment();
    }

    public void recordReleasedAmount(BigInteger amount) {
        releasedAmount.record(amount.doubleValue());
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordDeployment(String outcome) {
        registry.counter("deployment.attempts", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordContribution(String status) {
        registry.counter("funding.contributions", "status", sanitizeTag(status)).increment();
    }

    public void setAmbiguousDeployments(long count) {
        ambiguousDeployments.set(count);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
