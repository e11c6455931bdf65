/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the service runs relative to the caller.
 */
public enum DeploymentMode {

    /** Embedded web server on a worker thread of the calling JVM. */
    DAEMON_THREAD("daemon_thread"),
    /** Separate child JVM, tracked by PID file. */
    DETACHED_PROCESS("detached_process"),
    /** The calling thread becomes the server and blocks until it exits. */
    STANDALONE("standalone");

    private final String value;

    DeploymentMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static DeploymentMode fromValue(String value) {
        if (value == null) return null;
        for (DeploymentMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown deployment mode: " + value);
    }
}
