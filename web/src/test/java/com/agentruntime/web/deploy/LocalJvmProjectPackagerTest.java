/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.exception.ValidationException;
import com.agentruntime.common.model.AgentRequest;
import com.agentruntime.common.model.Message;
import com.agentruntime.server.deploy.DeploymentConfig;
import com.agentruntime.server.deploy.DeploymentMode;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.FunctionHandler;
import com.agentruntime.server.handler.QueryHandlers;
import com.agentruntime.web.AgentServiceApplication;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalJvmProjectPackagerTest {

    @TempDir
    Path tempDir;

    private DeploymentConfig config() {
        return DeploymentConfig.builder()
                .mode(DeploymentMode.DETACHED_PROCESS)
                .host("127.0.0.1")
                .port(8200)
                .extraPackages(List.of("/opt/agents/tools.jar"))
                .build();
    }

    @Test
    void shouldWriteProjectAndChildCommand() {
        LocalJvmProjectPackager packager = new LocalJvmProjectPackager(tempDir);

        PackagedProject packaged = packager.packageProject(
                new Runner(QueryHandlers.function(new EchoHandler())), config());

        assertTrue(packaged.getProjectDir().startsWith(tempDir));
        assertTrue(Files.exists(packaged.getProjectDir().resolve(AgentProject.FILE_NAME)));
        AgentProject project = AgentProject.load(packaged.getProjectDir());
        assertEquals(EchoHandler.class.getName(), project.getHandlerClass());
        assertEquals(8200, project.getPort());

        List<String> command = packaged.getCommand();
        assertTrue(command.get(0).endsWith("java"));
        assertEquals("-cp", command.get(1));
        assertTrue(command.get(2).endsWith("/opt/agents/tools.jar"));
        assertEquals(AgentServiceApplication.class.getName(), command.get(3));
        assertEquals(AgentServiceApplication.PROJECT_DIR_ARG + packaged.getProjectDir().toAbsolutePath(), command.get(4));
    }

    @Test
    void shouldRejectLambdaHandler() {
        LocalJvmProjectPackager packager = new LocalJvmProjectPackager(tempDir);
        Runner runner = new Runner(QueryHandlers.function((r, req) -> Message.text("ok")));

        assertThrows(ValidationException.class, () -> packager.packageProject(runner, config()));
    }

    @Test
    void shouldRejectAnonymousHandler() {
        FunctionHandler anonymous = new FunctionHandler() {
            @Override
            public Message apply(Runner runner, AgentRequest request) {
                return Message.text("ok");
            }
        };

        assertThrows(ValidationException.class,
                () -> LocalJvmProjectPackager.checkRebuildable(anonymous.getClass()));
    }

    @Test
    void shouldRejectHandlerWithoutNoArgConstructor() {
        assertThrows(ValidationException.class,
                () -> LocalJvmProjectPackager.checkRebuildable(NeedsArgument.class));
        assertThrows(ValidationException.class,
                () -> LocalJvmProjectPackager.checkRebuildable(Hidden.class));
    }

    @Test
    void shouldAcceptPublicTopLevelHandler() {
        assertDoesNotThrow(() -> LocalJvmProjectPackager.checkRebuildable(EchoHandler.class));
    }

    public static class NeedsArgument extends EchoHandler {
        public NeedsArgument(String name) {
        }
    }

    static class Hidden extends EchoHandler {
    }
}
