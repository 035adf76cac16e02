package com.todos.api.controller;

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthCheckController {

    private final MongoTemplate mongoTemplate;

    /**
     * Liveness: never touches the database.
     */
    @GetMapping("/healthz")
    public Map<String, String> healthCheck() {
        return Map.of("status", "ok");
    }

    /**
     * Readiness: pings MongoDB once, without retrying.
     */
    @GetMapping("/readyz")
    public ResponseEntity<Map<String, Object>> databaseHealthCheck() {
        Map<String, Object> health = new HashMap<>();
        try {
            mongoTemplate.getDb().runCommand(new Document("ping", 1));
            health.put("status", "ok");
            health.put("database", mongoTemplate.getDb().getName());
            return ResponseEntity.ok(health);
        } catch (Exception e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            health.put("status", "unavailable");
            health.put("error", String.valueOf(e.getMessage()));
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
        }
    }
}
