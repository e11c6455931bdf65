/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.exception.HandlerException;
import com.agentruntime.common.model.Event;

import java.util.NoSuchElementException;

/**
 * Pull-based skeleton for {@link EventStream}s. Subclasses implement
 * {@link #computeNext()} and call {@link #endOfData()} when exhausted.
 *
 * <p>Pulling is single-threaded. {@link #close()} may be called from any
 * thread; a subclass blocked in {@code computeNext} must wake up in
 * {@link #onClose()}.</p>
 */
public abstract class AbstractEventStream implements EventStream {

    private enum State { NOT_READY, READY, DONE, FAILED }

    private State state = State.NOT_READY;
    private Event next;
    private volatile boolean closed;

    /**
     * Produce the next event, or return {@link #endOfData()}.
     * This is the only place where the stream may block.
     */
    protected abstract Event computeNext() throws Exception;

    /** Called once when the stream is closed or exhausted. */
    protected void onClose() {
    }

    protected final Event endOfData() {
        state = State.DONE;
        return null;
    }

    @Override
    public final boolean hasNext() {
        switch (state) {
            case READY:
                return true;
            case DONE:
                return false;
            case FAILED:
                throw new IllegalStateException("Event stream already failed");
            default:
                break;
        }
        if (closed) {
            state = State.DONE;
            return false;
        }
        state = State.FAILED;
        try {
            next = computeNext();
        } catch (RuntimeException e) {
            close();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new HandlerException("Interrupted while waiting for the next event", e);
        } catch (Exception e) {
            close();
            throw new HandlerException(e.getMessage(), e);
        } catch (VirtualMachineError e) {
            close();
            throw e;
        } catch (Error e) {
            close();
            throw new HandlerException(e.toString(), e);
        }
        if (state == State.DONE) {
            close();
            return false;
        }
        if (next == null) {
            close();
            throw new HandlerException("Handler produced a null event");
        }
        state = State.READY;
        return true;
    }

    @Override
    public final Event next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        state = State.NOT_READY;
        Event result = next;
        next = null;
        return result;
    }

    @Override
    public final synchronized void close() {
        if (closed) return;
        closed = true;
        onClose();
    }

    protected boolean isClosed() {
        return closed;
    }
}
