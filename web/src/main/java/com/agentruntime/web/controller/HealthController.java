/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import com.agentruntime.web.lifecycle.RunnerLifecycle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health and discovery endpoints. All are unauthenticated and cheap.
 */
@RestController
public class HealthController {

    private final RunnerLifecycle lifecycle;

    @Value("${agent.service.service-name:agent-service}")
    private String serviceName;

    @Value("${agent.service.mode:daemon_thread}")
    private String mode;

    @Value("${agent.service.endpoint-path:/process}")
    private String endpointPath;

    public HealthController(RunnerLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    /** GET /health - JSON health summary, used by the detached readiness probe. */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", serviceName);
        health.put("mode", mode);
        health.put("runner", lifecycle.isReady() ? "ready" : "not_ready");
        return ResponseEntity.ok(health);
    }

    /** GET /readiness - "success" once the service accepts traffic. */
    @GetMapping("/readiness")
    public ResponseEntity<String> readiness() {
        if (lifecycle.isReady()) {
            return ResponseEntity.ok("success");
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Service not ready");
    }

    /** GET /liveness - "success" while a runner is attached. */
    @GetMapping("/liveness")
    public ResponseEntity<String> liveness() {
        if (lifecycle.getRunner() != null) {
            return ResponseEntity.ok("success");
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Runner not available");
    }

    /** GET / - service metadata and endpoint map. */
    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("process", endpointPath);
        endpoints.put("health", "/health");
        endpoints.put("readiness", "/readiness");
        endpoints.put("liveness", "/liveness");
        if ("detached_process".equals(mode)) {
            endpoints.put("admin_status", "/admin/status");
            endpoints.put("admin_shutdown", "/admin/shutdown");
        } else if ("standalone".equals(mode)) {
            endpoints.put("config", "/config");
        }

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", serviceName);
        info.put("mode", mode);
        info.put("handler", lifecycle.getRunner().getHandlerType().getName());
        info.put("endpoints", endpoints);
        return info;
    }
}
