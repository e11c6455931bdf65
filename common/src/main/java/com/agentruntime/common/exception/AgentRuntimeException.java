/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

/**
 * Base exception for all agent runtime errors.
 */
public class AgentRuntimeException extends RuntimeException {
    private final String errorCode;

    public AgentRuntimeException(String message) {
        super(message);
        this.errorCode = "ART_GENERIC";
    }

    public AgentRuntimeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AgentRuntimeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
