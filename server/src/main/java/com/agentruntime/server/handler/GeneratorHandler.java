/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.server.engine.Runner;

import java.util.Iterator;

/**
 * Synchronous incrementally-yielding agent. The iterator is drained on the
 * consumer's thread, one element per pull.
 */
@FunctionalInterface
public interface GeneratorHandler {

    Iterator<? extends Event> apply(Runner runner, AgentRequest request) throws Exception;
}
