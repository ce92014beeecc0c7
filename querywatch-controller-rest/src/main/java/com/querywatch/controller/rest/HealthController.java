package com.querywatch.controller.rest;

import com.querywatch.service.core.error.LogStoreException;
import com.querywatch.service.core.service.QueryLogRetrievalService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness ({@code /health}) and readiness ({@code /ready}, which round-trips the store). */
@RestController
@RequiredArgsConstructor
public class HealthController {
    private final QueryLogRetrievalService service;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        try {
            service.ping();
        } catch (LogStoreException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of(
                            "status", "unhealthy",
                            "error", "database_unavailable",
                            "message", e.operation().publicMessage()));
        }
        return ResponseEntity.ok(Map.of("status", "ready", "checks", Map.of("database", "ok")));
    }
}
