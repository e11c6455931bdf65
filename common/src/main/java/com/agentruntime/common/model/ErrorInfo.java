/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.agentruntime.common.exception.HandlerException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error payload of a failed envelope: {code, message}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorInfo {

    @JsonProperty("code")
    private String code;

    @JsonProperty("message")
    private String message;

    public ErrorInfo() {}

    public ErrorInfo(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorInfo of(Throwable error) {
        Throwable root = error;
        // Adapters wrap user exceptions; report the user's exception
        while (root.getCause() != null && root instanceof HandlerException) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.toString();
        return new ErrorInfo(root.getClass().getSimpleName(), message);
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    @Override
    public String toString() {
        return "ErrorInfo{code='" + code + "', message='" + message + "'}";
    }
}
