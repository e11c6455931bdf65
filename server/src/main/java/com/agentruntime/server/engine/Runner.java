/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.engine;

import com.agentruntime.common.exception.AgentRuntimeException;
import com.agentruntime.common.exception.ValidationException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.AgentResponse;
import com.agentruntime.common.model.ErrorInfo;
import com.agentruntime.common.model.Event;
import com.agentruntime.common.model.Message;
import com.agentruntime.common.model.RunStatus;
import com.agentruntime.server.deploy.DeployManager;
import com.agentruntime.server.deploy.DeploymentConfig;
import com.agentruntime.server.deploy.DeploymentRecord;
import com.agentruntime.server.handler.AbstractEventStream;
import com.agentruntime.server.handler.DelegatingQueryHandler;
import com.agentruntime.server.handler.EventStream;
import com.agentruntime.server.handler.QueryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives an agent handler and wraps its output in the streaming protocol.
 *
 * <p>Every stream returned by {@link #streamQuery} has the same shape,
 * whatever the handler does:</p>
 * <pre>
 *   seq 0        response  created
 *   seq 1        response  in_progress
 *   seq 2..n-1   copies of the handler events, stamped in order
 *   seq n        response  completed | failed   (always last)
 * </pre>
 *
 * <p>Sequence numbers are per stream; concurrent streams are independent.
 * Handler failures, {@code Error}s included, become the {@code failed}
 * envelope; only a {@code VirtualMachineError} escapes the stream. An invalid
 * request fails the call itself. A stream closed while the handler is still
 * running ends without a terminal envelope.</p>
 *
 * <p>The runner is also the unit of deployment: {@link #deploy} hands it to a
 * {@link DeployManager} and remembers the manager under the record's id.</p>
 */
public class Runner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    private final QueryHandler handler;
    private final RunnerHook initHook;
    private final RunnerHook shutdownHook;

    private final Map<String, DeployManager> deployments = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdownDone = new AtomicBoolean(false);

    public Runner(QueryHandler handler) {
        this(handler, null, null);
    }

    public Runner(QueryHandler handler, RunnerHook initHook, RunnerHook shutdownHook) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.initHook = initHook;
        this.shutdownHook = shutdownHook;
    }

    // ─── Lifecycle ──────────────────────────────────────────────────

    /**
     * Run the init hook. Further calls do nothing. If the hook fails the
     * shutdown hook runs before the failure is rethrown.
     */
    public Runner start() {
        if (!started.compareAndSet(false, true) || initHook == null) {
            return this;
        }
        try {
            initHook.apply(this);
            log.info("Runner for {} initialized", getHandlerType().getSimpleName());
        } catch (Exception e) {
            log.error("Runner init hook failed: {}", e.getMessage(), e);
            runShutdownHook();
            if (e instanceof AgentRuntimeException are) throw are;
            throw new AgentRuntimeException("ART_RUNNER_INIT", "Runner init hook failed: " + e.getMessage(), e);
        }
        return this;
    }

    /** Run the shutdown hook once. Its failures are logged, not thrown. */
    @Override
    public void close() {
        runShutdownHook();
    }

    private void runShutdownHook() {
        if (!shutdownDone.compareAndSet(false, true) || shutdownHook == null) {
            return;
        }
        try {
            shutdownHook.apply(this);
            log.info("Runner for {} shut down", getHandlerType().getSimpleName());
        } catch (Exception e) {
            log.error("Runner shutdown hook failed: {}", e.getMessage(), e);
        }
    }

    // ─── Query ──────────────────────────────────────────────────────

    /**
     * Parse the wire map and open an event stream for it.
     *
     * @throws ValidationException if the map is not a valid request
     */
    public EventStream streamQuery(Map<String, ?> body) {
        return streamQuery(AgentRequest.fromMap(body), null);
    }

    public EventStream streamQuery(AgentRequest request) {
        return streamQuery(request, null);
    }

    /**
     * Open an event stream for the request. Nothing runs until the first
     * pull; the handler is invoked on the pull after {@code in_progress}.
     *
     * @param userId overrides the request's {@code user_id} when not null
     * @throws ValidationException if the request is missing or malformed
     */
    public EventStream streamQuery(AgentRequest request, String userId) {
        if (request == null) {
            throw new ValidationException("Request is required");
        }
        request.validate();
        if (request.getSessionId() == null || request.getSessionId().isEmpty()) {
            request.setSessionId(UUID.randomUUID().toString());
        }
        if (userId != null) {
            request.setUserId(userId);
        } else if (request.getUserId() == null) {
            request.setUserId("");
        }
        return new RunnerEventStream(request);
    }

    /** Drain a stream and return its terminal envelope. */
    public AgentResponse query(AgentRequest request) {
        AgentResponse last = null;
        try (EventStream events = streamQuery(request)) {
            while (events.hasNext()) {
                Event event = events.next();
                if (event instanceof AgentResponse response) {
                    last = response;
                }
            }
        }
        return last;
    }

    // ─── Deployment ─────────────────────────────────────────────────

    /**
     * Deploy this runner through the given manager. Blocking modes return
     * after the service exited and are not tracked.
     */
    public DeploymentRecord deploy(DeployManager manager, DeploymentConfig config) {
        DeploymentRecord record = manager.deploy(this, config);
        if (manager.isRunning()) {
            deployments.put(record.getDeployId(), manager);
        }
        return record;
    }

    /** Stop a tracked deployment. Unknown ids are ignored. */
    public void stop(String deployId) {
        DeployManager manager = deployments.remove(deployId);
        if (manager == null) {
            log.warn("No deployment with id '{}', nothing to stop", deployId);
            return;
        }
        manager.stop();
    }

    public Set<String> getDeployIds() {
        return Collections.unmodifiableSet(deployments.keySet());
    }

    public DeployManager getDeployManager(String deployId) {
        return deployments.get(deployId);
    }

    // ─── Accessors ──────────────────────────────────────────────────

    public QueryHandler getHandler() { return handler; }

    /** Class of the user's handler, looking through the shape adapters. */
    public Class<?> getHandlerType() {
        if (handler instanceof DelegatingQueryHandler delegating) {
            return delegating.getDelegate().getClass();
        }
        return handler.getClass();
    }

    public boolean isStarted() { return started.get(); }

    // ─── Stream ─────────────────────────────────────────────────────

    private enum Phase { CREATED, IN_PROGRESS, HANDLER, DONE }

    private final class RunnerEventStream extends AbstractEventStream {

        private final AgentRequest request;
        private final AgentResponse response;
        private final SequenceNumberGenerator sequence = new SequenceNumberGenerator();
        private Phase phase = Phase.CREATED;
        private volatile EventStream handlerEvents;

        RunnerEventStream(AgentRequest request) {
            this.request = request;
            this.response = new AgentResponse(request.getSessionId());
        }

        @Override
        protected Event computeNext() {
            switch (phase) {
                case CREATED:
                    phase = Phase.IN_PROGRESS;
                    log.debug("Stream {} created for session {}", response.getId(), request.getSessionId());
                    return emitEnvelope();
                case IN_PROGRESS:
                    phase = Phase.HANDLER;
                    response.inProgress();
                    return emitEnvelope();
                case HANDLER:
                    return pullHandler();
                default:
                    return endOfData();
            }
        }

        private Event pullHandler() {
            try {
                if (handlerEvents == null) {
                    handlerEvents = handler.open(Runner.this, request);
                    if (isClosed()) {
                        closeHandler();
                    }
                }
                if (handlerEvents.hasNext()) {
                    Event event = handlerEvents.next().copy();
                    sequence.stamp(event);
                    if (isCompletedMessage(event)) {
                        response.addNewMessage((Message) event);
                    }
                    return event;
                }
                closeHandler();
                if (isClosed()) {
                    log.debug("Stream {} closed before the handler finished", response.getId());
                    return endOfData();
                }
                response.completed();
            } catch (VirtualMachineError e) {
                closeHandler();
                throw e;
            } catch (RuntimeException | Error e) {
                closeHandler();
                if (isClosed()) {
                    log.debug("Stream {} closed, handler ended with {}", response.getId(), e.toString());
                    return endOfData();
                }
                log.warn("Handler {} failed in stream {}: {}",
                        getHandlerType().getSimpleName(), response.getId(), e.toString());
                response.failed(ErrorInfo.of(e));
            }
            phase = Phase.DONE;
            return emitEnvelope();
        }

        private boolean isCompletedMessage(Event event) {
            return event instanceof Message && event.getStatus() == RunStatus.COMPLETED;
        }

        private AgentResponse emitEnvelope() {
            return sequence.stamp(response.snapshot());
        }

        private void closeHandler() {
            if (handlerEvents != null) {
                handlerEvents.close();
            }
        }

        @Override
        protected void onClose() {
            closeHandler();
        }
    }
}
