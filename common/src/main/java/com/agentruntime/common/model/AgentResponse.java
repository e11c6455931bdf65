/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The response envelope of one request.
 *
 * <p>Lifecycle: {@code created → in_progress → completed | failed}. The
 * terminal transition happens exactly once; a second one is rejected.
 * Every completed message the handler produces, whatever its type, is
 * accumulated in {@link #getOutput()}.</p>
 *
 * <p>The same envelope is emitted several times on a stream, so emitters
 * publish {@link #snapshot()} copies rather than the live instance.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentResponse extends Event {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("output")
    private List<Message> output = new ArrayList<>();

    @JsonProperty("error")
    private ErrorInfo error;

    public AgentResponse() {
        super();
        this.createdAt = Instant.now();
    }

    public AgentResponse(String sessionId) {
        this();
        this.sessionId = sessionId;
    }

    /** Standalone failed envelope, used when a failure happens outside the runner. */
    public static AgentResponse failure(String id, ErrorInfo error) {
        AgentResponse r = new AgentResponse();
        if (id != null) r.setId(id);
        r.failed(error);
        return r;
    }

    @Override
    public String getObject() { return "response"; }

    @Override
    protected String idPrefix() { return "response"; }

    // ─── Transitions ────────────────────────────────────────────────

    public AgentResponse inProgress() {
        requireNotTerminal("in_progress");
        this.status = RunStatus.IN_PROGRESS;
        return this;
    }

    public AgentResponse addNewMessage(Message message) {
        requireNotTerminal("add message");
        output.add(message);
        return this;
    }

    public AgentResponse completed() {
        requireNotTerminal("completed");
        this.status = RunStatus.COMPLETED;
        this.completedAt = Instant.now();
        return this;
    }

    public AgentResponse failed(ErrorInfo error) {
        requireNotTerminal("failed");
        this.status = RunStatus.FAILED;
        this.error = error;
        this.completedAt = Instant.now();
        return this;
    }

    /**
     * Copy of the current state. The output list is copied; the messages in
     * it are shared since completed messages are not mutated afterwards.
     */
    public AgentResponse snapshot() {
        AgentResponse copy = new AgentResponse();
        copy.id = id;
        copy.status = status;
        copy.sequenceNumber = sequenceNumber;
        copy.sessionId = sessionId;
        copy.createdAt = createdAt;
        copy.completedAt = completedAt;
        copy.output = new ArrayList<>(output);
        copy.error = error;
        return copy;
    }

    @Override
    public AgentResponse copy() {
        return snapshot();
    }

    private void requireNotTerminal(String transition) {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("Response " + id + " is already " + status.getValue() +
                    ", cannot apply '" + transition + "'");
        }
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public List<Message> getOutput() { return Collections.unmodifiableList(output); }
    public void setOutput(List<Message> output) { this.output = output != null ? new ArrayList<>(output) : new ArrayList<>(); }

    public ErrorInfo getError() { return error; }
    public void setError(ErrorInfo error) { this.error = error; }

    @Override
    public String toString() {
        return "AgentResponse{id='" + id + "', status=" + status + ", seq=" + sequenceNumber +
               ", sessionId='" + sessionId + "', output=" + output.size() + ", error=" + error + "}";
    }
}
