package com.flagship.reconciliation.health;

import com.flagship.reconciliation.matching.MatchIndex;
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
 * Simple health check endpoint for liveness/readiness probes.
 * Reports database connectivity and the number of indexed PENDING transactions.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final MatchIndex matchIndex;

    public HealthController(DataSource dataSource, MatchIndex matchIndex) {
        this.dataSource = dataSource;
        this.matchIndex = matchIndex;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("pendingIndexed", matchIndex.size());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
