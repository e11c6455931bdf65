/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

/**
 * Lifecycle of a deployed service, owned by its {@link DeployManager}.
 *
 * <pre>
 *   IDLE ──deploy──► STARTING ──ready──► RUNNING ──stop──► STOPPING ──► IDLE
 *                       └──────failure──────────────────────────────────┘
 * </pre>
 */
public enum ServiceState {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING
}
