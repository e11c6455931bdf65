/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.server.engine.Runner;

/**
 * The agent as seen by the {@link Runner}: given a request, open a lazy
 * sequence of events.
 *
 * <p>Implementations must not do any work in {@link #open}; the handler is
 * invoked on the first pull of the returned stream. Agents are usually
 * written against one of the four shapes and adapted through
 * {@link QueryHandlers}:</p>
 * <ul>
 *   <li>{@link FunctionHandler} returns one event</li>
 *   <li>{@link AsyncFunctionHandler} completes a future with one event</li>
 *   <li>{@link GeneratorHandler} returns an iterator of events</li>
 *   <li>{@link AsyncGeneratorHandler} pushes events into an {@link EventSink}</li>
 * </ul>
 */
@FunctionalInterface
public interface QueryHandler {

    EventStream open(Runner runner, AgentRequest request);
}
