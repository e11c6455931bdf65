/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

/**
 * A {@link QueryHandler} that adapts a user-supplied handler shape.
 */
public interface DelegatingQueryHandler extends QueryHandler {

    /** The wrapped user handler. */
    Object getDelegate();
}
