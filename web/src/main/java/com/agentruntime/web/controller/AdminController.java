/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process administration of a detached child: remote shutdown and status.
 */
@RestController
@ConditionalOnProperty(name = "agent.service.mode", havingValue = "detached_process")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    static final long SHUTDOWN_DELAY_MS = 1000;

    private final ConfigurableApplicationContext context;

    public AdminController(ConfigurableApplicationContext context) {
        this.context = context;
    }

    /** POST /admin/shutdown - answer first, close the context one second later. */
    @PostMapping("/admin/shutdown")
    public Map<String, Object> shutdown() {
        log.info("Shutdown requested through /admin/shutdown");
        Thread closer = new Thread(() -> {
            try {
                Thread.sleep(SHUTDOWN_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            context.close();
        }, "agent-admin-shutdown");
        closer.setDaemon(false);
        closer.start();
        return Map.of("message", "Shutdown initiated");
    }

    /** GET /admin/status - pid, memory, cpu and uptime of this process. */
    @GetMapping("/admin/status")
    public Map<String, Object> status() {
        RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
        Runtime rt = Runtime.getRuntime();

        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("heap_used", rt.totalMemory() - rt.freeMemory());
        memory.put("heap_committed", rt.totalMemory());
        memory.put("heap_max", rt.maxMemory());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("pid", ProcessHandle.current().pid());
        status.put("status", "running");
        status.put("memory_usage", memory);
        status.put("cpu_percent", cpuPercent());
        status.put("uptime", runtime.getUptime() / 1000.0);
        status.put("start_time", Instant.ofEpochMilli(runtime.getStartTime()).toString());
        return status;
    }

    private double cpuPercent() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            double load = sun.getProcessCpuLoad();
            return load < 0 ? 0.0 : Math.round(load * 1000.0) / 10.0;
        }
        return 0.0;
    }
}
