package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.deployment.DeploymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need database queries, so a Prometheus scrape
 * never hits the database: the outbox backlog and the number of deployments
 * waiting for reconciliation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final DeploymentPersistenceService deploymentPersistence;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        refreshAmbiguousDeployments();
    }

    void refreshAmbiguousDeployments() {
        try {
            long ambiguous = deploymentPersistence.countAmbiguous();
            ledgerMetrics.setAmbiguousDeployments(ambiguous);
            if (ambiguous > 0) {
                log.debug("{} deployment(s) awaiting reconciliation", ambiguous);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to refresh deployment metrics: {}", e.getMessage());
        }
    }
}
