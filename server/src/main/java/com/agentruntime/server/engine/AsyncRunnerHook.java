/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.engine;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous init or shutdown callback. Wrap with {@link RunnerHook#async(AsyncRunnerHook)}.
 */
@FunctionalInterface
public interface AsyncRunnerHook {

    CompletionStage<Void> apply(Runner runner);
}
