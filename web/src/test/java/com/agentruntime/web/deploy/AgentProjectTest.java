/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.AgentResponse;
import com.agentruntime.common.model.Message;
import com.agentruntime.server.engine.Runner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentProjectTest {

    @TempDir
    Path tempDir;

    private static AgentProject project(String handlerClass) {
        AgentProject project = new AgentProject();
        project.setHandlerClass(handlerClass);
        project.setHost("127.0.0.1");
        project.setPort(8123);
        project.setEndpointPath("/agent");
        project.setResponseType("json");
        project.setStream(false);
        project.setEnvironment(Map.of("MODEL", "small"));
        return project;
    }

    @Test
    void shouldSaveAndLoadProjectFile() {
        project(EchoHandler.class.getName()).save(tempDir);

        AgentProject loaded = AgentProject.load(tempDir);

        assertEquals(EchoHandler.class.getName(), loaded.getHandlerClass());
        assertEquals(8123, loaded.getPort());
        assertEquals("/agent", loaded.getEndpointPath());
        assertEquals("json", loaded.getResponseType());
        assertFalse(loaded.isStream());
        assertEquals("small", loaded.getEnvironment().get("MODEL"));
    }

    @Test
    void shouldFailToLoadMissingProject() {
        assertThrows(DeploymentException.class, () -> AgentProject.load(tempDir.resolve("nowhere")));
    }

    @Test
    void shouldRebuildRunnerFromClassName() {
        Runner runner = project(EchoHandler.class.getName()).createRunner();

        AgentResponse response = runner.query(new AgentRequest(List.of(Message.userText("hi"))));

        assertEquals(EchoHandler.class, runner.getHandlerType());
        assertEquals("echo: hi", response.getOutput().get(0).getText());
    }

    @Test
    void shouldRejectUnknownHandlerClass() {
        DeploymentException ex = assertThrows(DeploymentException.class,
                () -> project("com.example.Missing").createRunner());

        assertTrue(ex.getMessage().contains("com.example.Missing"));
    }

    @Test
    void shouldDescribeChildServiceAsArguments() {
        List<String> arguments = project(EchoHandler.class.getName()).toArguments();

        assertTrue(arguments.contains("--server.port=8123"));
        assertTrue(arguments.contains("--agent.service.mode=detached_process"));
        assertTrue(arguments.contains("--agent.service.endpoint-path=/agent"));
        assertTrue(arguments.contains("--agent.service.stream=false"));
    }
}
