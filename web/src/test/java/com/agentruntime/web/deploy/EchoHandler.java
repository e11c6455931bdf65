/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Event;
import com.agentruntime.common.model.Message;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.FunctionHandler;

/** Handler that can be rebuilt by class name in a child JVM. */
public class EchoHandler implements FunctionHandler {

    @Override
    public Event apply(Runner runner, AgentRequest request) {
        return Message.text("echo: " + request.getInput().get(0).getText());
    }
}
