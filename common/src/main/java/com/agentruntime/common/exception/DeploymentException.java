/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

public class DeploymentException extends AgentRuntimeException {
    public DeploymentException(String message) {
        super("ART_DEPLOY_FAILED", message);
    }

    public DeploymentException(String message, Throwable cause) {
        super("ART_DEPLOY_FAILED", message, cause);
    }
}
