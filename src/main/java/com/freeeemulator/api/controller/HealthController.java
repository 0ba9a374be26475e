package com.freeeemulator.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check. Needs no token.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health")
public class HealthController {

    private final DataSource dataSource;

    @GetMapping("/health")
    @Operation(summary = "Report whether the emulator and its database are up")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = checkDatabase();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", databaseUp ? "OK" : "DOWN");
        response.put("database", databaseUp ? "UP" : "DOWN");

        if (!databaseUp) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
