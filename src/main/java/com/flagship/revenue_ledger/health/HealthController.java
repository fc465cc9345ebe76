package com.flagship.revenue_ledger.health;

import com.flagship.revenue_ledger.deployment.DeploymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint for load balancers; needs no authorization.
 *
 * Returns 503 when the database is unreachable. Ambiguous deployments are
 * reported but do not fail the check: they need an operator, not a restart.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final DeploymentPersistenceService deploymentPersistence;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        try {
            long ambiguous = deploymentPersistence.countAmbiguous();
            response.put("ambiguous_deployments", ambiguous);
            response.put("deployments", ambiguous > 0 ? "RECONCILIATION_REQUIRED" : "UP");
        } catch (DataAccessException e) {
            log.warn("Could not count ambiguous deployments: {}", e.getMessage());
            response.put("deployments", "UNKNOWN");
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
