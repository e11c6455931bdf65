/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation of the agent endpoint.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>agent.requests.total</td><td>Counter</td><td>outcome (completed, failed, rejected)</td></tr>
 *   <tr><td>agent.events.total</td><td>Counter</td><td>response_type</td></tr>
 *   <tr><td>agent.streams.active</td><td>Gauge</td><td>-</td></tr>
 *   <tr><td>agent.stream.duration</td><td>Timer</td><td>response_type, outcome</td></tr>
 * </table>
 */
public class AgentMetrics {

    private static final Logger log = LoggerFactory.getLogger(AgentMetrics.class);

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_REJECTED = "rejected";

    private final MeterRegistry registry;
    private final AtomicInteger activeStreams = new AtomicInteger(0);
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("agent.streams.active", activeStreams, AtomicInteger::get)
                .description("Event streams currently being served")
                .register(registry);
        log.debug("AgentMetrics registered with {}", registry.getClass().getSimpleName());
    }

    public void streamStarted() {
        activeStreams.incrementAndGet();
    }

    /** Record the end of a stream with its outcome and duration. */
    public void streamFinished(String responseType, String outcome, long events, long durationMs) {
        activeStreams.decrementAndGet();
        requestCounter(outcome).increment();
        counters.computeIfAbsent("events|" + responseType, k ->
                Counter.builder("agent.events.total")
                        .description("Events emitted to clients")
                        .tag("response_type", responseType)
                        .register(registry)
        ).increment(events);
        timers.computeIfAbsent(responseType + "|" + outcome, k ->
                Timer.builder("agent.stream.duration")
                        .description("Time from request to terminal envelope")
                        .tag("response_type", responseType)
                        .tag("outcome", outcome)
                        .register(registry)
        ).record(durationMs, TimeUnit.MILLISECONDS);
    }

    /** A request refused before any event was produced. */
    public void requestRejected() {
        requestCounter(OUTCOME_REJECTED).increment();
    }

    public int getActiveStreams() { return activeStreams.get(); }

    public MeterRegistry getRegistry() { return registry; }

    private Counter requestCounter(String outcome) {
        return counters.computeIfAbsent("requests|" + outcome, k ->
                Counter.builder("agent.requests.total")
                        .description("Agent requests by outcome")
                        .tag("outcome", outcome)
                        .register(registry));
    }
}
