/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.Event;

/**
 * Receives the events of an {@link AsyncGeneratorHandler}.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Publish one event.
     *
     * @throws IllegalStateException if the stream was closed or already finished
     */
    void emit(Event event);
}
