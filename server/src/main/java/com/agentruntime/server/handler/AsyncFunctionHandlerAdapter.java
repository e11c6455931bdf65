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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Adapts an {@link AsyncFunctionHandler}: invoked once on the first pull,
 * which then waits for the returned stage.
 */
public class AsyncFunctionHandlerAdapter implements DelegatingQueryHandler {

    private final AsyncFunctionHandler delegate;

    public AsyncFunctionHandlerAdapter(AsyncFunctionHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public EventStream open(Runner runner, AgentRequest request) {
        return new AbstractEventStream() {
            private boolean invoked;
            private volatile CompletableFuture<? extends Event> pending;

            @Override
            protected Event computeNext() throws Exception {
                if (invoked) {
                    return endOfData();
                }
                invoked = true;
                CompletionStage<? extends Event> stage = delegate.apply(runner, request);
                if (stage == null) {
                    throw new HandlerException("Async handler returned no future");
                }
                pending = stage.toCompletableFuture();
                return await(pending);
            }

            @Override
            protected void onClose() {
                if (pending != null && !pending.isDone()) {
                    pending.cancel(false);
                }
            }
        };
    }

    static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception ex) throw ex;
            throw new HandlerException(cause.toString(), cause);
        }
    }

    @Override
    public Object getDelegate() { return delegate; }
}
