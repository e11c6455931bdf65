/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.server.engine.Runner;

/**
 * Synchronous single-result agent.
 */
@FunctionalInterface
public interface FunctionHandler {

    Event apply(Runner runner, AgentRequest request) throws Exception;
}
