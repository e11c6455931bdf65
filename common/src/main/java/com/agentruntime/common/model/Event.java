/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.agentruntime.common.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * One unit of agent output on a stream.
 *
 * <p>Every event carries an {@code object} discriminator, a {@link RunStatus}
 * and the {@code sequence_number} stamped by the stream's sequencer. Within one
 * stream the sequence numbers are contiguous and strictly increasing from 0.</p>
 *
 * <p>The runner stamps a {@link #copy()} of every event a handler yields, so a
 * handler may yield the same instance more than once.</p>
 */
public abstract class Event {

    @JsonProperty("id")
    protected String id;

    @JsonProperty("status")
    protected RunStatus status = RunStatus.CREATED;

    @JsonProperty("sequence_number")
    protected Long sequenceNumber;

    protected Event() {
        this.id = newId(idPrefix());
    }

    /** Discriminator written as the {@code object} field. */
    @JsonProperty("object")
    public abstract String getObject();

    protected abstract String idPrefix();

    protected static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }

    public Long getSequenceNumber() { return sequenceNumber; }
    public void setSequenceNumber(Long sequenceNumber) { this.sequenceNumber = sequenceNumber; }

    /**
     * Independent copy carrying the same id, status and sequence number.
     * Subclasses with mutable state override this; the default goes through JSON.
     */
    public Event copy() {
        return JsonUtil.copy(this);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
