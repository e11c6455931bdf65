/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.service;

import com.agentruntime.common.exception.AgentRuntimeException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.AgentResponse;
import com.agentruntime.common.model.ErrorInfo;
import com.agentruntime.common.model.Event;
import com.agentruntime.common.model.RunStatus;
import com.agentruntime.common.util.JsonUtil;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.EventStream;
import com.agentruntime.web.metrics.AgentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Translates runner event streams into HTTP responses.
 *
 * <pre>
 *   servlet thread:  parse ─► runner.streamQuery() ─► SseEmitter returned
 *   stream thread:   hasNext()/next() ─► "data:&lt;json&gt;\n\n" ─► ... ─► terminal envelope ─► complete
 * </pre>
 *
 * <p>Once the first frame may have been written the HTTP status is fixed at
 * 200, so any later failure is reported as a synthetic {@code failed}
 * envelope frame. When the emitter times out, errors or is completed by the
 * container, the event stream is closed so a stream thread waiting on the
 * handler is released.</p>
 */
@Service
public class AgentStreamService {

    private static final Logger log = LoggerFactory.getLogger(AgentStreamService.class);

    public static final String RESPONSE_SSE = "sse";
    public static final String RESPONSE_JSON = "json";

    private final Runner runner;
    private final ExecutorService executor;
    private final AgentMetrics metrics;
    private final long streamTimeoutMs;

    public AgentStreamService(Runner runner,
                              @Qualifier("agentStreamExecutor") ExecutorService executor,
                              AgentMetrics metrics,
                              @Value("${agent.service.stream-timeout:300000}") long streamTimeoutMs) {
        this.runner = runner;
        this.executor = executor;
        this.metrics = metrics;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    // ─── SSE ────────────────────────────────────────────────────────

    /**
     * Open the event stream and pump it into an emitter on the stream
     * executor.
     *
     * @throws com.agentruntime.common.exception.ValidationException if the request is invalid
     */
    public SseEmitter stream(AgentRequest request) {
        EventStream events = runner.streamQuery(request);
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        emitter.onTimeout(() -> {
            log.warn("Stream for session {} timed out after {} ms", request.getSessionId(), streamTimeoutMs);
            cancel(events, cancelled);
        });
        emitter.onError(t -> {
            log.info("Stream for session {} ended by the client: {}", request.getSessionId(), t.toString());
            cancel(events, cancelled);
        });
        emitter.onCompletion(() -> cancel(events, cancelled));

        metrics.streamStarted();
        try {
            executor.execute(() -> pump(events, emitter, cancelled));
        } catch (RejectedExecutionException e) {
            events.close();
            metrics.streamFinished(RESPONSE_SSE, AgentMetrics.OUTCOME_FAILED, 0, 0);
            throw new AgentRuntimeException("ART_BUSY", "No stream thread available", e);
        }
        return emitter;
    }

    void pump(EventStream events, SseEmitter emitter, AtomicBoolean cancelled) {
        long start = System.currentTimeMillis();
        long count = 0;
        String outcome = AgentMetrics.OUTCOME_FAILED;
        String responseId = null;
        Long lastSequence = null;
        try {
            while (!cancelled.get() && events.hasNext()) {
                Event event = events.next();
                if (cancelled.get()) {
                    break;
                }
                emitter.send(SseEmitter.event().data(JsonUtil.toJson(event)));
                count++;
                lastSequence = event.getSequenceNumber();
                if (event instanceof AgentResponse response) {
                    responseId = response.getId();
                    if (response.isTerminal()) {
                        outcome = response.getStatus() == RunStatus.COMPLETED
                                ? AgentMetrics.OUTCOME_COMPLETED : AgentMetrics.OUTCOME_FAILED;
                    }
                }
            }
            if (cancelled.get()) {
                log.info("Stream {} cancelled after {} event(s)", responseId, count);
            }
            emitter.complete();
        } catch (IOException e) {
            log.info("Client disconnected from stream {} after {} event(s): {}", responseId, count, e.getMessage());
            emitter.completeWithError(e);
        } catch (VirtualMachineError e) {
            emitter.completeWithError(e);
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Stream {} failed after {} event(s): {}", responseId, count, e.getMessage(), e);
            AgentResponse failure = AgentResponse.failure(responseId, ErrorInfo.of(e));
            failure.setSequenceNumber(lastSequence != null ? lastSequence + 1 : 0L);
            sendFailure(emitter, failure);
        } finally {
            events.close();
            metrics.streamFinished(RESPONSE_SSE, outcome, count, System.currentTimeMillis() - start);
        }
    }

    /** Stop pumping and release the event stream. Safe to call from any thread, more than once. */
    void cancel(EventStream events, AtomicBoolean cancelled) {
        if (cancelled.compareAndSet(false, true)) {
            events.close();
        }
    }

    private void sendFailure(SseEmitter emitter, AgentResponse failure) {
        try {
            emitter.send(SseEmitter.event().data(JsonUtil.toJson(failure)));
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.warn("Could not deliver failure frame: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }

    // ─── JSON ───────────────────────────────────────────────────────

    /**
     * Drain the stream and return the terminal envelope.
     *
     * @throws com.agentruntime.common.exception.ValidationException if the request is invalid
     */
    public AgentResponse collect(AgentRequest request) {
        EventStream events = runner.streamQuery(request);
        long start = System.currentTimeMillis();
        long count = 0;
        AgentResponse last = null;
        metrics.streamStarted();
        try (events) {
            while (events.hasNext()) {
                Event event = events.next();
                count++;
                if (event instanceof AgentResponse response) {
                    last = response;
                }
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Collecting stream failed after {} event(s): {}", count, e.getMessage(), e);
            if (last == null || !last.isTerminal()) {
                last = AgentResponse.failure(last != null ? last.getId() : null, ErrorInfo.of(e));
            }
        }
        String outcome = last != null && last.getStatus() == RunStatus.COMPLETED
                ? AgentMetrics.OUTCOME_COMPLETED : AgentMetrics.OUTCOME_FAILED;
        metrics.streamFinished(RESPONSE_JSON, outcome, count, System.currentTimeMillis() - start);
        return last;
    }
}
