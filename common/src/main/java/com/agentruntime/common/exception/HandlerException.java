/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

/**
 * Failure raised by the wrapped agent logic. Always contained to the event
 * stream as a failed envelope; never surfaces as a transport error.
 */
public class HandlerException extends AgentRuntimeException {
    public HandlerException(String message) {
        super("ART_HANDLER_FAILED", message);
    }

    public HandlerException(String message, Throwable cause) {
        super("ART_HANDLER_FAILED", message, cause);
    }
}
