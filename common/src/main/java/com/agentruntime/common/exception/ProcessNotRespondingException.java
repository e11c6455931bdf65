/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

/**
 * The server thread or child process died, or never opened its port.
 * Handled exactly like a readiness timeout.
 */
public class ProcessNotRespondingException extends DeploymentTimeoutException {
    public ProcessNotRespondingException(String message) {
        super("ART_PROCESS_NOT_RESPONDING", message, null);
    }

    public ProcessNotRespondingException(String message, Throwable cause) {
        super("ART_PROCESS_NOT_RESPONDING", message, cause);
    }
}
