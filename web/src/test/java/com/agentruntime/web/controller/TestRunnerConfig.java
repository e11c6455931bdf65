/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.common.model.Message;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.QueryHandlers;
import com.agentruntime.web.AgentServiceApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Runner used by the web tests: echoes the first input text, yields two
 * chunks for "stream", a tool round trip for "tools", and fails for "fail"
 * and "assert". Imported, not scanned, so that servers started by the deploy
 * tests do not pick it up.
 */
public class TestRunnerConfig {

    @Bean(name = AgentServiceApplication.RUNNER_BEAN)
    public Runner agentRunner() {
        return new Runner(QueryHandlers.generator((runner, request) -> events(request).iterator()));
    }

    private static List<Event> events(AgentRequest request) {
        String text = request.getInput().get(0).getText();
        if ("fail".equals(text)) {
            throw new IllegalArgumentException("boom");
        }
        if ("assert".equals(text)) {
            throw new AssertionError("bad state");
        }
        if ("tools".equals(text)) {
            return List.of(
                    Message.reasoning("look up the weather"),
                    Message.functionCall("call_1", "get_weather", "{\"city\":\"Paris\"}"),
                    Message.functionCallOutput("call_1", "sunny"),
                    Message.text("It is sunny in Paris"));
        }
        if ("stream".equals(text)) {
            return List.of(Message.text("Hello"), Message.text("World"));
        }
        return List.of(Message.text("echo: " + text));
    }
}
