/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A message-like event: plain message, function call, function call output or
 * reasoning. Also used as the item type of a request's {@code input}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message extends Event {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    @JsonProperty("type")
    private MessageType type = MessageType.MESSAGE;

    @JsonProperty("role")
    private String role;

    @JsonProperty("content")
    private List<Content> content = new ArrayList<>();

    public Message() {
        super();
    }

    public Message(MessageType type, String role) {
        super();
        this.type = type;
        this.role = role;
    }

    // --- Factories for handler output ---

    /** A completed assistant text message. */
    public static Message text(String text) {
        Message m = new Message(MessageType.MESSAGE, ROLE_ASSISTANT);
        m.addContent(Content.text(text));
        m.setStatus(RunStatus.COMPLETED);
        return m;
    }

    /** A completed user text message, mostly for building requests. */
    public static Message userText(String text) {
        Message m = new Message(MessageType.MESSAGE, ROLE_USER);
        m.addContent(Content.text(text));
        m.setStatus(RunStatus.COMPLETED);
        return m;
    }

    public static Message functionCall(String callId, String name, String arguments) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("call_id", callId);
        data.put("name", name);
        data.put("arguments", arguments);
        Message m = new Message(MessageType.FUNCTION_CALL, ROLE_ASSISTANT);
        m.addContent(Content.data(data));
        m.setStatus(RunStatus.COMPLETED);
        return m;
    }

    public static Message functionCallOutput(String callId, String output) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("call_id", callId);
        data.put("output", output);
        Message m = new Message(MessageType.FUNCTION_CALL_OUTPUT, ROLE_TOOL);
        m.addContent(Content.data(data));
        m.setStatus(RunStatus.COMPLETED);
        return m;
    }

    public static Message reasoning(String text) {
        Message m = new Message(MessageType.REASONING, ROLE_ASSISTANT);
        m.addContent(Content.text(text));
        m.setStatus(RunStatus.COMPLETED);
        return m;
    }

    @Override
    public String getObject() { return "message"; }

    @Override
    protected String idPrefix() { return "msg"; }

    public Message addContent(Content part) {
        if (content == null) content = new ArrayList<>();
        content.add(part);
        return this;
    }

    @Override
    public Message copy() {
        Message m = new Message(type, role);
        m.id = id;
        m.status = status;
        m.sequenceNumber = sequenceNumber;
        m.content = content != null ? new ArrayList<>(content) : null;
        return m;
    }

    /** Concatenated text of all text parts, or {@code null} if there are none. */
    @JsonIgnore
    public String getText() {
        if (content == null) return null;
        StringBuilder sb = new StringBuilder();
        boolean found = false;
        for (Content part : content) {
            if (Content.TYPE_TEXT.equals(part.getType()) && part.getText() != null) {
                sb.append(part.getText());
                found = true;
            }
        }
        return found ? sb.toString() : null;
    }

    public MessageType getType() { return type; }
    public void setType(MessageType type) { this.type = type; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public List<Content> getContent() { return content; }
    public void setContent(List<Content> content) { this.content = content; }

    @Override
    public String toString() {
        return "Message{id='" + id + "', type=" + type + ", role='" + role + "', status=" + status +
               ", seq=" + sequenceNumber + ", content=" + content + "}";
    }
}
