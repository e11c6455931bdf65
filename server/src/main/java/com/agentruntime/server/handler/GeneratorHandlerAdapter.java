/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.exception.HandlerException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.server.engine.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;

/**
 * Adapts a {@link GeneratorHandler}: the iterator is obtained on the first
 * pull and drained one element per pull. An iterator that is also
 * {@link AutoCloseable} is closed with the stream.
 */
public class GeneratorHandlerAdapter implements DelegatingQueryHandler {

    private static final Logger log = LoggerFactory.getLogger(GeneratorHandlerAdapter.class);

    private final GeneratorHandler delegate;

    public GeneratorHandlerAdapter(GeneratorHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public EventStream open(Runner runner, AgentRequest request) {
        return new AbstractEventStream() {
            private Iterator<? extends Event> source;

            @Override
            protected Event computeNext() throws Exception {
                if (source == null) {
                    source = delegate.apply(runner, request);
                    if (source == null) {
                        throw new HandlerException("Generator handler returned no iterator");
                    }
                }
                return source.hasNext() ? source.next() : endOfData();
            }

            @Override
            protected void onClose() {
                if (source instanceof AutoCloseable closeable) {
                    try {
                        closeable.close();
                    } catch (Exception e) {
                        log.warn("Failed to close generator of {}: {}", delegate.getClass().getName(), e.getMessage());
                    }
                }
            }
        };
    }

    @Override
    public Object getDelegate() { return delegate; }
}
