/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.server.engine.Runner;

import java.util.Objects;

/**
 * Adapts a {@link FunctionHandler}: invoked once on the first pull, its return
 * value is the only element of the stream.
 */
public class FunctionHandlerAdapter implements DelegatingQueryHandler {

    private final FunctionHandler delegate;

    public FunctionHandlerAdapter(FunctionHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public EventStream open(Runner runner, AgentRequest request) {
        return new AbstractEventStream() {
            private boolean invoked;

            @Override
            protected Event computeNext() throws Exception {
                if (invoked) {
                    return endOfData();
                }
                invoked = true;
                return delegate.apply(runner, request);
            }
        };
    }

    @Override
    public Object getDelegate() { return delegate; }
}
