/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.exception.AlreadyRunningException;
import com.agentruntime.common.exception.DeploymentTimeoutException;
import com.agentruntime.server.deploy.DeploymentConfig;
import com.agentruntime.server.deploy.DeploymentMode;
import com.agentruntime.server.deploy.DeploymentRecord;
import com.agentruntime.server.deploy.ServiceState;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.QueryHandlers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * daemon_thread deployments against a real embedded server.
 */
class DaemonDeploymentTest {

    private static final String BODY =
            "{\"input\":[{\"role\":\"user\",\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}]}";

    private final HttpClient http = HttpClient.newHttpClient();
    private Runner runner;
    private LocalDeployManager manager;
    private int port;

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        runner = new Runner(QueryHandlers.function(new EchoHandler()));
        port = freePort();
        manager = new LocalDeployManager("127.0.0.1", port, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        if (manager.getState() != ServiceState.IDLE) {
            manager.stop();
        }
    }

    private DeploymentConfig daemon() {
        return DeploymentConfig.builder()
                .mode(DeploymentMode.DAEMON_THREAD)
                .deployTimeout(Duration.ofSeconds(30))
                .build();
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.ofString(BODY))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void shouldServeStreamAndJson() throws Exception {
        DeploymentRecord record = manager.deploy(runner, daemon());

        assertEquals("daemon_127.0.0.1_" + port, record.getDeployId());
        assertEquals("http://127.0.0.1:" + port, manager.getServiceUrl());
        assertTrue(manager.isServiceRunning());

        HttpResponse<String> sse = post("/process");
        assertEquals(200, sse.statusCode());
        assertTrue(sse.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));
        long frames = sse.body().lines().filter(line -> line.startsWith("data:")).count();
        assertEquals(4, frames);
        assertTrue(sse.body().contains("echo: hi"));

        HttpResponse<String> json = post("/process?response_type=json");
        assertEquals(200, json.statusCode());
        assertTrue(json.body().contains("\"status\":\"completed\""));
        assertTrue(json.body().contains("\"sequence_number\":3"));
    }

    @Test
    void shouldRejectSecondDeployAndRedeployAfterStop() {
        manager.deploy(runner, daemon());

        assertThrows(AlreadyRunningException.class, () -> manager.deploy(runner, daemon()));

        manager.stop();
        assertNull(manager.getServiceUrl());
        assertFalse(manager.isServiceRunning());

        manager.deploy(runner, daemon());
        assertTrue(manager.isRunning());
    }

    @Test
    void shouldFailWhenPortIsTaken() throws Exception {
        try (ServerSocket taken = new ServerSocket(port, 50, InetAddress.getByName("127.0.0.1"))) {
            assertTrue(taken.isBound());

            assertThrows(DeploymentTimeoutException.class, () -> manager.deploy(runner, daemon()));

            assertEquals(ServiceState.IDLE, manager.getState());
            assertFalse(manager.isRunning());
        }
    }
}
