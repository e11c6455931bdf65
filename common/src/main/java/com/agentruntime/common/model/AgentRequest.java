/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.agentruntime.common.exception.ValidationException;
import com.agentruntime.common.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Canonical agent request.
 *
 * <p>Built once per inbound call from parsed wire data. After it is handed to
 * a handler it is only touched once more, by the runner, to backfill
 * {@code session_id} and {@code user_id} when they are absent.</p>
 *
 * <pre>
 * {
 *   "input":      [ {"role": "user", "content": [{"type": "text", "text": "hi"}]} ],
 *   "session_id": "optional",
 *   "user_id":    "optional",
 *   "stream":     true,
 *   "tools":      [ {...} ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentRequest {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("input")
    private List<Message> input;

    @JsonProperty("tools")
    private List<Map<String, Object>> tools;

    @JsonProperty("stream")
    private boolean stream = true;

    public AgentRequest() {}

    public AgentRequest(List<Message> input) {
        this.input = input != null ? new ArrayList<>(input) : null;
    }

    // ─── Parsing ────────────────────────────────────────────────────

    /**
     * Parse and validate a request from already-decoded JSON.
     *
     * @throws ValidationException if the body is missing or malformed
     */
    public static AgentRequest fromMap(Map<String, ?> body) {
        if (body == null) {
            throw new ValidationException("Request body is required");
        }
        AgentRequest request;
        try {
            request = JsonUtil.mapper().convertValue(body, AgentRequest.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid request format: " + rootMessage(e), e);
        }
        request.validate();
        return request;
    }

    /**
     * Parse and validate a request from raw JSON text.
     *
     * @throws ValidationException if the text is not a valid request
     */
    public static AgentRequest fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Request body is required");
        }
        AgentRequest request;
        try {
            request = JsonUtil.mapper().readValue(json, AgentRequest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid request format: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        request.validate();
        return request;
    }

    /**
     * Check the required shape.
     *
     * @throws ValidationException if {@code input} is missing or holds a null item
     */
    public void validate() {
        if (input == null) {
            throw new ValidationException("Field 'input' is required");
        }
        for (int i = 0; i < input.size(); i++) {
            Message item = input.get(i);
            if (item == null) {
                throw new ValidationException("Field 'input[" + i + "]' must be a message object");
            }
            if (item.getType() == null) {
                throw new ValidationException("Field 'input[" + i + "].type' must not be null");
            }
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null) t = t.getCause();
        if (t instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return t.getMessage();
    }

    // --- Getters and Setters ---
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public List<Message> getInput() { return input; }
    public void setInput(List<Message> input) { this.input = input; }

    public List<Map<String, Object>> getTools() { return tools; }
    public void setTools(List<Map<String, Object>> tools) { this.tools = tools; }

    public boolean isStream() { return stream; }
    public void setStream(boolean stream) { this.stream = stream; }

    @Override
    public String toString() {
        return "AgentRequest{sessionId='" + sessionId + "', userId='" + userId +
               "', input=" + (input != null ? input.size() : 0) + " item(s), stream=" + stream + "}";
    }
}
