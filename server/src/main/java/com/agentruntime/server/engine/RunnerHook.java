/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.engine;

import java.util.concurrent.ExecutionException;

/**
 * Init or shutdown callback of a {@link Runner}. Runs on the caller's thread.
 */
@FunctionalInterface
public interface RunnerHook {

    void apply(Runner runner) throws Exception;

    /** Adapt an asynchronous hook; the returned hook waits for it to finish. */
    static RunnerHook async(AsyncRunnerHook hook) {
        return runner -> {
            try {
                hook.apply(runner).toCompletableFuture().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Exception ex) throw ex;
                throw e;
            }
        };
    }
}
