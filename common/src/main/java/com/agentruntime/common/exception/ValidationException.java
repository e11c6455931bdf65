/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

/**
 * Malformed or incomplete request. Raised before any event is streamed,
 * so the service surface can still answer with an HTTP 4xx.
 */
public class ValidationException extends AgentRuntimeException {
    public ValidationException(String message) {
        super("ART_VALIDATION", message);
    }

    public ValidationException(String message, Throwable cause) {
        super("ART_VALIDATION", message, cause);
    }
}
