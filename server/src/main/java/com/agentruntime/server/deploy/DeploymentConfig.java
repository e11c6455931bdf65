/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options of a single deployment. Built with {@link #builder()}; immutable.
 *
 * <pre>
 *   DeploymentConfig config = DeploymentConfig.builder()
 *           .mode(DeploymentMode.DETACHED_PROCESS)
 *           .port(8090)
 *           .responseType("json")
 *           .environment(Map.of("OPENAI_API_KEY", key))
 *           .deployTimeout(Duration.ofSeconds(60))
 *           .build();
 * </pre>
 *
 * <p>{@code host} and {@code port} are optional; when unset the deploy
 * manager's own values apply.</p>
 */
public final class DeploymentConfig {

    public static final String RESPONSE_SSE = "sse";
    public static final String RESPONSE_JSON = "json";

    private final DeploymentMode mode;
    private final String host;
    private final Integer port;
    private final String endpointPath;
    private final String responseType;
    private final boolean stream;
    private final List<String> requirements;
    private final List<String> extraPackages;
    private final Map<String, String> environment;
    private final Duration deployTimeout;
    private final boolean healthCheck;
    private final Path pidDir;

    private DeploymentConfig(Builder b) {
        this.mode = b.mode;
        this.host = b.host;
        this.port = b.port;
        this.endpointPath = b.endpointPath;
        this.responseType = b.responseType;
        this.stream = b.stream;
        this.requirements = Collections.unmodifiableList(new ArrayList<>(b.requirements));
        this.extraPackages = Collections.unmodifiableList(new ArrayList<>(b.extraPackages));
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(b.environment));
        this.deployTimeout = b.deployTimeout;
        this.healthCheck = b.healthCheck;
        this.pidDir = b.pidDir;
    }

    public static Builder builder() { return new Builder(); }

    public static DeploymentConfig defaults() { return builder().build(); }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode).host(host).port(port)
                .endpointPath(endpointPath).responseType(responseType).stream(stream)
                .requirements(requirements).extraPackages(extraPackages).environment(environment)
                .deployTimeout(deployTimeout).healthCheck(healthCheck).pidDir(pidDir);
    }

    public DeploymentMode getMode() { return mode; }
    public String getHost() { return host; }
    public Integer getPort() { return port; }
    public String getEndpointPath() { return endpointPath; }
    public String getResponseType() { return responseType; }
    public boolean isStream() { return stream; }
    public List<String> getRequirements() { return requirements; }
    public List<String> getExtraPackages() { return extraPackages; }
    public Map<String, String> getEnvironment() { return environment; }
    public Duration getDeployTimeout() { return deployTimeout; }
    public boolean isHealthCheck() { return healthCheck; }
    public Path getPidDir() { return pidDir; }

    @Override
    public String toString() {
        return "DeploymentConfig{mode=" + mode.getValue() + ", host=" + host + ", port=" + port +
               ", endpointPath='" + endpointPath + "', responseType=" + responseType +
               ", deployTimeout=" + deployTimeout + "}";
    }

    // ─── Builder ────────────────────────────────────────────────────

    public static final class Builder {
        private DeploymentMode mode = DeploymentMode.DAEMON_THREAD;
        private String host;
        private Integer port;
        private String endpointPath = "/process";
        private String responseType = RESPONSE_SSE;
        private boolean stream = true;
        private List<String> requirements = List.of();
        private List<String> extraPackages = List.of();
        private Map<String, String> environment = Map.of();
        private Duration deployTimeout = Duration.ofSeconds(30);
        private boolean healthCheck = true;
        private Path pidDir = Path.of(System.getProperty("java.io.tmpdir"), "agent-runtime");

        private Builder() {}

        public Builder mode(DeploymentMode mode) {
            if (mode == null) throw new IllegalArgumentException("mode must not be null");
            this.mode = mode;
            return this;
        }

        public Builder host(String host) { this.host = host; return this; }

        public Builder port(Integer port) {
            if (port != null && (port < 1 || port > 65535)) {
                throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder endpointPath(String endpointPath) {
            if (endpointPath == null || endpointPath.isBlank()) {
                throw new IllegalArgumentException("endpointPath must not be blank");
            }
            this.endpointPath = endpointPath.startsWith("/") ? endpointPath : "/" + endpointPath;
            return this;
        }

        public Builder responseType(String responseType) {
            if (!RESPONSE_SSE.equals(responseType) && !RESPONSE_JSON.equals(responseType)) {
                throw new IllegalArgumentException("responseType must be 'sse' or 'json': " + responseType);
            }
            this.responseType = responseType;
            return this;
        }

        public Builder stream(boolean stream) { this.stream = stream; return this; }

        public Builder requirements(List<String> requirements) {
            this.requirements = requirements != null ? requirements : List.of();
            return this;
        }

        public Builder extraPackages(List<String> extraPackages) {
            this.extraPackages = extraPackages != null ? extraPackages : List.of();
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Map.of();
            return this;
        }

        public Builder deployTimeout(Duration deployTimeout) {
            if (deployTimeout == null || deployTimeout.isNegative() || deployTimeout.isZero()) {
                throw new IllegalArgumentException("deployTimeout must be positive");
            }
            this.deployTimeout = deployTimeout;
            return this;
        }

        public Builder healthCheck(boolean healthCheck) { this.healthCheck = healthCheck; return this; }

        public Builder pidDir(Path pidDir) {
            if (pidDir == null) throw new IllegalArgumentException("pidDir must not be null");
            this.pidDir = pidDir;
            return this;
        }

        public DeploymentConfig build() { return new DeploymentConfig(this); }
    }
}
