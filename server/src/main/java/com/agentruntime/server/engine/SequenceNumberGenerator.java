/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.engine;

import com.agentruntime.common.model.Event;

/**
 * Hands out 0, 1, 2, ... for the events of one stream.
 * One instance per stream; never shared between concurrent requests.
 */
public class SequenceNumberGenerator {

    private long next;

    public SequenceNumberGenerator() {
        this(0L);
    }

    public SequenceNumberGenerator(long origin) {
        this.next = origin;
    }

    public long next() {
        return next++;
    }

    /** Stamp the event with the next number and return it. */
    public <E extends Event> E stamp(E event) {
        event.setSequenceNumber(next());
        return event;
    }

    /** Value the next call to {@link #next()} will return. */
    public long peek() {
        return next;
    }
}
