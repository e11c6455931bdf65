/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.service;

import com.agentruntime.common.exception.AgentRuntimeException;
import com.agentruntime.common.exception.ValidationException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.AgentResponse;
import com.agentruntime.common.model.Event;
import com.agentruntime.common.model.Message;
import com.agentruntime.common.model.RunStatus;
import com.agentruntime.common.util.JsonUtil;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.AbstractEventStream;
import com.agentruntime.server.handler.EventStream;
import com.agentruntime.server.handler.QueryHandlers;
import com.agentruntime.web.metrics.AgentMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentStreamServiceTest {

    private SimpleMeterRegistry registry;
    private AgentMetrics metrics;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AgentMetrics(registry);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AgentStreamService service(Runner runner) {
        return new AgentStreamService(runner, executor, metrics, 5000);
    }

    private static AgentRequest request(String text) {
        return new AgentRequest(List.of(Message.userText(text)));
    }

    private double requests(String outcome) {
        return registry.get("agent.requests.total").tag("outcome", outcome).counter().count();
    }

    private static String frame(SseEmitter.SseEventBuilder builder) {
        return builder.build().stream()
                .map(ResponseBodyEmitter.DataWithMediaType::getData)
                .map(String::valueOf)
                .collect(Collectors.joining());
    }

    private static Map<String, Object> payload(String frame) {
        String json = frame.substring("data:".length()).trim();
        return JsonUtil.fromJson(json, new TypeReference<Map<String, Object>>() {});
    }

    /** Yields one created envelope, then fails on the next pull. */
    private static EventStream brokenStream(AtomicBoolean closed) {
        return new AbstractEventStream() {
            private boolean first = true;

            @Override
            protected Event computeNext() {
                if (first) {
                    first = false;
                    AgentResponse created = new AgentResponse("s1");
                    created.setSequenceNumber(0L);
                    return created;
                }
                throw new IllegalStateException("pipe burst");
            }

            @Override
            protected void onClose() {
                closed.set(true);
            }
        };
    }

    // ===== JSON =====

    @Test
    void shouldCollectTerminalEnvelope() {
        AgentStreamService service = service(new Runner(QueryHandlers.function((r, req) -> Message.text("ok"))));

        AgentResponse response = service.collect(request("hi"));

        assertEquals(RunStatus.COMPLETED, response.getStatus());
        assertEquals("ok", response.getOutput().get(0).getText());
        assertEquals(1.0, requests(AgentMetrics.OUTCOME_COMPLETED));
        assertEquals(0, metrics.getActiveStreams());
    }

    @Test
    void shouldCollectFailedEnvelope() {
        AgentStreamService service = service(new Runner(QueryHandlers.function((r, req) -> {
            throw new IllegalArgumentException("boom");
        })));

        AgentResponse response = service.collect(request("hi"));

        assertEquals(RunStatus.FAILED, response.getStatus());
        assertEquals("boom", response.getError().getMessage());
        assertEquals(1.0, requests(AgentMetrics.OUTCOME_FAILED));
    }

    @Test
    void shouldRejectInvalidRequestBeforeStreaming() {
        AgentStreamService service = service(new Runner(QueryHandlers.function((r, req) -> Message.text("ok"))));

        assertThrows(ValidationException.class, () -> service.stream(new AgentRequest()));
        assertEquals(0, metrics.getActiveStreams());
    }

    // ===== SSE pump =====

    @Test
    void shouldSendEveryEventThenComplete() throws Exception {
        Runner runner = new Runner(QueryHandlers.function((r, req) -> Message.text("ok")));
        SseEmitter emitter = mock(SseEmitter.class);
        metrics.streamStarted();

        service(runner).pump(runner.streamQuery(request("hi")), emitter, new AtomicBoolean(false));

        ArgumentCaptor<SseEmitter.SseEventBuilder> frames = ArgumentCaptor.forClass(SseEmitter.SseEventBuilder.class);
        verify(emitter, times(4)).send(frames.capture());
        verify(emitter).complete();
        assertEquals("completed", payload(frame(frames.getAllValues().get(3))).get("status"));
        assertEquals(1.0, requests(AgentMetrics.OUTCOME_COMPLETED));
        assertEquals(4.0, registry.get("agent.events.total").tag("response_type", "sse").counter().count());
    }

    @Test
    void shouldSendSyntheticFailureWhenStreamBreaks() throws Exception {
        SseEmitter emitter = mock(SseEmitter.class);
        AtomicBoolean closed = new AtomicBoolean();
        metrics.streamStarted();

        service(mock(Runner.class)).pump(brokenStream(closed), emitter, new AtomicBoolean(false));

        ArgumentCaptor<SseEmitter.SseEventBuilder> frames = ArgumentCaptor.forClass(SseEmitter.SseEventBuilder.class);
        verify(emitter, times(2)).send(frames.capture());
        verify(emitter).complete();
        Map<String, Object> failure = payload(frame(frames.getAllValues().get(1)));
        assertEquals("failed", failure.get("status"));
        assertEquals(1, ((Number) failure.get("sequence_number")).intValue());
        assertTrue(closed.get());
        assertEquals(1.0, requests(AgentMetrics.OUTCOME_FAILED));
    }

    @Test
    void shouldSendSyntheticFailureWhenStreamThrowsError() throws Exception {
        SseEmitter emitter = mock(SseEmitter.class);
        EventStream events = mock(EventStream.class);
        when(events.hasNext()).thenReturn(true);
        when(events.next()).thenThrow(new AssertionError("bad state"));
        metrics.streamStarted();

        service(mock(Runner.class)).pump(events, emitter, new AtomicBoolean(false));

        ArgumentCaptor<SseEmitter.SseEventBuilder> frames = ArgumentCaptor.forClass(SseEmitter.SseEventBuilder.class);
        verify(emitter).send(frames.capture());
        verify(emitter).complete();
        verify(events).close();
        Map<String, Object> failure = payload(frame(frames.getValue()));
        assertEquals("failed", failure.get("status"));
        assertEquals(0, ((Number) failure.get("sequence_number")).intValue());
        assertEquals("AssertionError", ((Map<?, ?>) failure.get("error")).get("code"));
        assertEquals(0, metrics.getActiveStreams());
    }

    @Test
    void shouldReleaseStreamThreadWhenCancelledWhileHandlerIsSilent() throws Exception {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        Runner runner = new Runner(QueryHandlers.asyncGenerator((r, req, sink) -> pending));
        SseEmitter emitter = mock(SseEmitter.class);
        EventStream events = runner.streamQuery(request("hi"));
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AgentStreamService service = service(runner);
        metrics.streamStarted();

        executor.execute(() -> service.pump(events, emitter, cancelled));
        verify(emitter, timeout(2000).times(2)).send(any(SseEmitter.SseEventBuilder.class));

        service.cancel(events, cancelled);

        verify(emitter, timeout(2000)).complete();
        verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
        verify(emitter, never()).completeWithError(any());
    }

    @Test
    void shouldStopWhenClientDisconnects() throws Exception {
        Runner runner = new Runner(QueryHandlers.function((r, req) -> Message.text("ok")));
        SseEmitter emitter = mock(SseEmitter.class);
        IOException broken = new IOException("Broken pipe");
        doThrow(broken).when(emitter).send(any(SseEmitter.SseEventBuilder.class));
        metrics.streamStarted();

        service(runner).pump(runner.streamQuery(request("hi")), emitter, new AtomicBoolean(false));

        verify(emitter, times(1)).send(any(SseEmitter.SseEventBuilder.class));
        verify(emitter).completeWithError(broken);
        verify(emitter, never()).complete();
        assertEquals(0, metrics.getActiveStreams());
    }

    @Test
    void shouldStopPumpingWhenCancelled() throws Exception {
        Runner runner = new Runner(QueryHandlers.function((r, req) -> Message.text("ok")));
        SseEmitter emitter = mock(SseEmitter.class);
        metrics.streamStarted();

        service(runner).pump(runner.streamQuery(request("hi")), emitter, new AtomicBoolean(true));

        verify(emitter, never()).send(any(SseEmitter.SseEventBuilder.class));
        verify(emitter).complete();
    }

    @Test
    void shouldReportBusyWhenExecutorRejects() {
        ExecutorService rejecting = mock(ExecutorService.class);
        doThrow(new RejectedExecutionException("full")).when(rejecting).execute(any(Runnable.class));
        Runner runner = new Runner(QueryHandlers.function((r, req) -> Message.text("ok")));
        AgentStreamService service = new AgentStreamService(runner, rejecting, metrics, 5000);

        AgentRuntimeException ex = assertThrows(AgentRuntimeException.class, () -> service.stream(request("hi")));

        assertEquals("ART_BUSY", ex.getErrorCode());
        assertEquals(0, metrics.getActiveStreams());
    }
}
