/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.exception;

import java.time.Duration;

/**
 * A server thread or process did not exit within the shutdown timeout.
 * Deployment managers log this and still return to IDLE.
 */
public class ShutdownTimeoutException extends AgentRuntimeException {
    public ShutdownTimeoutException(String target, Duration timeout) {
        super("ART_SHUTDOWN_TIMEOUT",
              target + " did not terminate within " + timeout.toMillis() + " ms, potential resource leak");
    }
}
