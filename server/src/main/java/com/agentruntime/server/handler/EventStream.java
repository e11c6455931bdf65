/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.Event;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A lazy, finite, non-restartable sequence of events.
 *
 * <p>Work happens only inside {@link #hasNext()} / {@link #next()}: the first
 * pull invokes the handler, each further pull asks it for one more element.
 * Exceptions raised by the handler surface from those calls unchanged
 * (checked ones wrapped in a {@code HandlerException}).</p>
 *
 * <p>{@link #close()} releases the stream early; after it no further events
 * are produced.</p>
 */
public interface EventStream extends Iterator<Event>, AutoCloseable {

    @Override
    void close();

    /** View as a sequential {@link Stream}; closing the stream closes this. */
    default Stream<Event> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this,
                        Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }
}
