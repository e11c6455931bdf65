/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status carried by every event. COMPLETED and FAILED are terminal.
 */
public enum RunStatus {
    CREATED("created"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static RunStatus fromValue(String value) {
        for (RunStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
