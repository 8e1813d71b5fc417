package com.linecommerce.api.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for load balancers: healthy only while the database answers.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    @Value("${spring.application.name:commerce-api}")
    private String serviceName;

    @Value("${app.version:0.1.0}")
    private String version;

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("service", serviceName);
        body.put("version", version);

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            body.put("status", "healthy");
            body.put("database", "connected");
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.error("Health check failed: database unreachable", e);
            body.put("status", "unhealthy");
            body.put("database", "disconnected");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
