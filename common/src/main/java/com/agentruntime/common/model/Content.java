/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One content part of a message: either {@code text} or structured {@code data}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Content {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_DATA = "data";

    @JsonProperty("type")
    private String type;

    @JsonProperty("text")
    private String text;

    @JsonProperty("data")
    private Map<String, Object> data;

    public Content() {}

    public static Content text(String text) {
        Content c = new Content();
        c.type = TYPE_TEXT;
        c.text = text;
        return c;
    }

    public static Content data(Map<String, Object> data) {
        Content c = new Content();
        c.type = TYPE_DATA;
        c.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        return c;
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public Map<String, Object> getData() { return data; }
    public void setData(Map<String, Object> data) { this.data = data; }

    @Override
    public String toString() {
        return TYPE_TEXT.equals(type) ? "Content{text='" + text + "'}" : "Content{type='" + type + "', data=" + data + "}";
    }
}
