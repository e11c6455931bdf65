/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

public class AlreadyRunningException extends AgentRuntimeException {
    public AlreadyRunningException(String deployId, String state) {
        super("ART_ALREADY_RUNNING",
              "Service is already running (deploy_id='" + deployId + "', state=" + state + ")");
    }
}
