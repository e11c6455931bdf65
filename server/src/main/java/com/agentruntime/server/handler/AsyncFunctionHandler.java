/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.server.engine.Runner;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous single-result agent.
 */
@FunctionalInterface
public interface AsyncFunctionHandler {

    CompletionStage<? extends Event> apply(Runner runner, AgentRequest request);
}
