package com.ama.nipreset.controller.api;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ama.nipreset.config.NipResetProperties;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Liveness and database checks for load balancers.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health", description = "Service and database checks")
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final NipResetProperties properties;

    @GetMapping("/health")
    @Operation(summary = "Service health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("service", properties.getServiceName());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/db-health")
    @Operation(summary = "Database health", description = "Runs SELECT 1 against the token ledger database")
    public ResponseEntity<Map<String, Object>> dbHealth() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return ResponseEntity.ok(Map.of("ok", true, "db", one != null && one == 1));
        } catch (Exception e) {
            log.error("NIP_HEALTH: database check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("ok", false, "db", false));
        }
    }
}
