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
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Adapts an {@link AsyncGeneratorHandler} into a pull stream.
 *
 * <pre>
 *   handler thread(s)                     consumer thread
 *   ─────────────────                     ───────────────
 *   sink.emit(e1) ──┐
 *   sink.emit(e2) ──┼──► [ queue ] ──► hasNext()/next()
 *   stage completes ┘      (item | end | error)
 * </pre>
 *
 * <p>The handler is invoked on the first pull. Events pushed after the stage
 * completed or after the stream was closed are rejected. Closing the stream
 * from another thread drops queued events and wakes a blocked consumer.</p>
 */
public class AsyncGeneratorHandlerAdapter implements DelegatingQueryHandler {

    private final AsyncGeneratorHandler delegate;

    public AsyncGeneratorHandlerAdapter(AsyncGeneratorHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public EventStream open(Runner runner, AgentRequest request) {
        return new QueueEventStream(runner, request);
    }

    @Override
    public Object getDelegate() { return delegate; }

    private record Signal(Event event, Throwable error, boolean end) {
        static Signal item(Event event) { return new Signal(event, null, false); }
        static Signal failure(Throwable error) { return new Signal(null, error, true); }
        static Signal completion() { return new Signal(null, null, true); }
    }

    private final class QueueEventStream extends AbstractEventStream implements EventSink {

        private final Runner runner;
        private final AgentRequest request;
        private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
        private volatile boolean finished;
        private volatile CompletableFuture<Void> completion;

        QueueEventStream(Runner runner, AgentRequest request) {
            this.runner = runner;
            this.request = request;
        }

        @Override
        protected Event computeNext() throws Exception {
            if (completion == null) {
                CompletionStage<Void> stage = delegate.apply(runner, request, this);
                if (stage == null) {
                    throw new HandlerException("Async generator returned no future");
                }
                completion = stage.toCompletableFuture();
                completion.whenComplete((ignored, error) -> finish(error));
            }
            Signal signal = queue.take();
            if (signal.error() != null) {
                Throwable cause = signal.error();
                if (cause instanceof CompletionException && cause.getCause() != null) {
                    cause = cause.getCause();
                }
                if (cause instanceof Exception ex) throw ex;
                throw new HandlerException(cause.toString(), cause);
            }
            return signal.end() ? endOfData() : signal.event();
        }

        @Override
        public synchronized void emit(Event event) {
            if (finished || isClosed()) {
                throw new IllegalStateException("Event stream is closed, cannot emit " + event);
            }
            if (event == null) {
                throw new IllegalArgumentException("Cannot emit a null event");
            }
            queue.add(Signal.item(event));
        }

        private synchronized void finish(Throwable error) {
            if (finished) return;
            finished = true;
            queue.add(error != null ? Signal.failure(error) : Signal.completion());
        }

        @Override
        protected void onClose() {
            synchronized (this) {
                if (!finished) {
                    finished = true;
                    queue.clear();
                    queue.add(Signal.completion());
                }
            }
            CompletableFuture<Void> running = completion;
            if (running != null && !running.isDone()) {
                running.cancel(false);
            }
        }
    }
}
