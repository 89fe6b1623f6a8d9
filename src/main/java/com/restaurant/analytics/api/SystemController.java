package com.restaurant.analytics.api;

import com.restaurant.analytics.infrastructure.persistence.AnalyticsQueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Service banner and database health check.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final AnalyticsQueryExecutor queryExecutor;

    @Value("${app.name:Restaurant Analytics API}")
    private String appName;

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", appName, "version", appVersion));
    }

    /**
     * 200 when the database answers, 503 otherwise.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        try {
            queryExecutor.ping();
            return ResponseEntity.ok(Map.of("status", "healthy", "database", "connected"));
        } catch (Exception e) {
            log.warn("Health check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "unhealthy", "database", "disconnected"));
        }
    }
}
