/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.common.util.JsonUtil;
import com.agentruntime.server.deploy.DeploymentMode;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.server.handler.QueryHandler;
import com.agentruntime.server.handler.QueryHandlers;
import com.agentruntime.web.AgentServiceApplication;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code agent-project.json}, the description a detached child
 * process rebuilds its service from.
 *
 * <pre>
 * {
 *   "handler_class":  "com.example.EchoAgent",
 *   "host": "127.0.0.1", "port": 8000,
 *   "endpoint_path":  "/process",
 *   "response_type":  "sse",
 *   "stream":         true,
 *   "requirements":   ["..."],
 *   "extra_packages": ["/opt/libs/tools.jar"],
 *   "environment":    {"KEY": "value"},
 *   "created_at":     "2026-01-01T00:00:00Z"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentProject {

    public static final String FILE_NAME = "agent-project.json";

    @JsonProperty("handler_class")
    private String handlerClass;

    @JsonProperty("host")
    private String host;

    @JsonProperty("port")
    private int port;

    @JsonProperty("endpoint_path")
    private String endpointPath = "/process";

    @JsonProperty("response_type")
    private String responseType = "sse";

    @JsonProperty("stream")
    private boolean stream = true;

    @JsonProperty("requirements")
    private List<String> requirements = new ArrayList<>();

    @JsonProperty("extra_packages")
    private List<String> extraPackages = new ArrayList<>();

    @JsonProperty("environment")
    private Map<String, String> environment = new LinkedHashMap<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    public AgentProject() {}

    // ─── Persistence ────────────────────────────────────────────────

    public static AgentProject load(Path projectDir) {
        Path file = projectDir.resolve(FILE_NAME);
        try {
            return JsonUtil.fromFile(file.toFile(), AgentProject.class);
        } catch (IOException e) {
            throw new DeploymentException("Cannot read project file " + file + ": " + e.getMessage(), e);
        }
    }

    public Path save(Path projectDir) {
        Path file = projectDir.resolve(FILE_NAME);
        try {
            JsonUtil.toFile(file.toFile(), this);
            return file;
        } catch (IOException e) {
            throw new DeploymentException("Cannot write project file " + file + ": " + e.getMessage(), e);
        }
    }

    // ─── Child side ─────────────────────────────────────────────────

    /**
     * Instantiate the handler class through its no-arg constructor and wrap
     * it in a new, unstarted runner.
     */
    public Runner createRunner() {
        try {
            Class<?> type = Class.forName(handlerClass);
            Object instance = type.getDeclaredConstructor().newInstance();
            QueryHandler handler = QueryHandlers.adapt(instance);
            return new Runner(handler);
        } catch (ClassNotFoundException e) {
            throw new DeploymentException("Handler class not found on the classpath: " + handlerClass, e);
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new DeploymentException("Cannot instantiate handler " + handlerClass + ": " + e.getMessage(), e);
        } catch (InvocationTargetException e) {
            throw new DeploymentException("Constructor of handler " + handlerClass + " failed: " +
                    e.getTargetException().getMessage(), e.getTargetException());
        }
    }

    /** Command-line arguments configuring the child's service surface. */
    public List<String> toArguments() {
        return List.of(AgentServiceApplication.toArguments(AgentServiceApplication.serviceProperties(
                DeploymentMode.DETACHED_PROCESS, host, port, endpointPath, responseType, stream)));
    }

    // --- Getters and Setters ---
    public String getHandlerClass() { return handlerClass; }
    public void setHandlerClass(String handlerClass) { this.handlerClass = handlerClass; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getEndpointPath() { return endpointPath; }
    public void setEndpointPath(String endpointPath) { this.endpointPath = endpointPath; }

    public String getResponseType() { return responseType; }
    public void setResponseType(String responseType) { this.responseType = responseType; }

    public boolean isStream() { return stream; }
    public void setStream(boolean stream) { this.stream = stream; }

    public List<String> getRequirements() { return requirements; }
    public void setRequirements(List<String> requirements) { this.requirements = requirements; }

    public List<String> getExtraPackages() { return extraPackages; }
    public void setExtraPackages(List<String> extraPackages) { this.extraPackages = extraPackages; }

    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
