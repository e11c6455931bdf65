/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.lifecycle;

import com.agentruntime.server.engine.Runner;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Ties the hosted {@link Runner} to the application context.
 *
 * <p>A managed runner (detached child process) is started before the web
 * server opens its port and closed when the context closes. An unmanaged
 * runner belongs to the deploying code and is left alone. Either way the
 * service reports ready only between {@link ApplicationReadyEvent} and
 * {@link ContextClosedEvent}.</p>
 */
@Component
public class RunnerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RunnerLifecycle.class);

    private final Runner runner;
    private final boolean managed;
    private final String serviceName;
    private final Instant createdAt = Instant.now();
    private volatile boolean ready;

    public RunnerLifecycle(Runner runner,
                           @Value("${agent.runner.managed:false}") boolean managed,
                           @Value("${agent.service.service-name:agent-service}") String serviceName) {
        this.runner = runner;
        this.managed = managed;
        this.serviceName = serviceName;
    }

    @PostConstruct
    public void init() {
        if (managed) {
            runner.start();
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        ready = true;
        log.info("Service '{}' ready, handler {}", serviceName, runner.getHandlerType().getName());
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        ready = false;
        log.info("Service '{}' shutting down", serviceName);
        if (managed) {
            runner.close();
        }
    }

    public boolean isReady() { return ready; }

    public boolean isManaged() { return managed; }

    public Instant getCreatedAt() { return createdAt; }

    public Runner getRunner() { return runner; }
}
