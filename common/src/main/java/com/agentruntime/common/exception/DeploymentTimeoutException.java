/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

import java.time.Duration;

/**
 * The deployed service did not become ready within the startup timeout.
 */
public class DeploymentTimeoutException extends AgentRuntimeException {
    public DeploymentTimeoutException(String target, Duration timeout) {
        super("ART_DEPLOY_TIMEOUT",
              "Service at " + target + " did not become ready within " + timeout.toMillis() + " ms");
    }

    protected DeploymentTimeoutException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
