package com.flagship.etl_agent.health;

import com.flagship.etl_agent.dispatch.DispatchAdapters;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 *
 * Backends report whether they are enabled, not whether their transport is up:
 * a disabled backend is a deployment choice, not an outage.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final DispatchAdapters dispatchAdapters;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("backends", dispatchAdapters.status());
        return ResponseEntity.ok(response);
    }
}
