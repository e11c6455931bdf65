/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.handler;

import com.agentruntime.common.exception.ValidationException;

/**
 * Factories turning each handler shape into a {@link QueryHandler}.
 *
 * <pre>
 *   Runner runner = new Runner(QueryHandlers.function((r, req) -> Message.text("ok")));
 *   Runner runner = new Runner(QueryHandlers.generator((r, req) -> events.iterator()));
 * </pre>
 */
public final class QueryHandlers {

    private QueryHandlers() {}

    public static QueryHandler function(FunctionHandler handler) {
        return new FunctionHandlerAdapter(handler);
    }

    public static QueryHandler asyncFunction(AsyncFunctionHandler handler) {
        return new AsyncFunctionHandlerAdapter(handler);
    }

    public static QueryHandler generator(GeneratorHandler handler) {
        return new GeneratorHandlerAdapter(handler);
    }

    public static QueryHandler asyncGenerator(AsyncGeneratorHandler handler) {
        return new AsyncGeneratorHandlerAdapter(handler);
    }

    /**
     * Wrap an instance of any handler shape. Used when a handler is rebuilt
     * by class name, e.g. inside a detached child process.
     *
     * @throws ValidationException if the instance implements none of the shapes
     */
    public static QueryHandler adapt(Object instance) {
        if (instance instanceof QueryHandler handler) {
            return handler;
        }
        if (instance instanceof FunctionHandler handler) {
            return function(handler);
        }
        if (instance instanceof AsyncFunctionHandler handler) {
            return asyncFunction(handler);
        }
        if (instance instanceof GeneratorHandler handler) {
            return generator(handler);
        }
        if (instance instanceof AsyncGeneratorHandler handler) {
            return asyncGenerator(handler);
        }
        throw new ValidationException("Not a handler: " +
                (instance == null ? "null" : instance.getClass().getName()));
    }
}
