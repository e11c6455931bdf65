/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.server.engine.Runner;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous incrementally-yielding agent.
 *
 * <p>The handler pushes events into the sink from any thread and completes
 * the returned stage when it is done. Completing it exceptionally fails the
 * stream after the events already pushed.</p>
 */
@FunctionalInterface
public interface AsyncGeneratorHandler {

    CompletionStage<Void> apply(Runner runner, AgentRequest request, EventSink sink);
}
