/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of a successful deployment.
 */
public final class DeploymentRecord {

    private final String deployId;
    private final DeploymentMode mode;
    private final String host;
    private final int port;
    private final Long pid;
    private final String url;

    public DeploymentRecord(String deployId, DeploymentMode mode, String host, int port, Long pid, String url) {
        this.deployId = Objects.requireNonNull(deployId, "deployId");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.host = host;
        this.port = port;
        this.pid = pid;
        this.url = url;
    }

    public static String daemonId(String host, int port) { return "daemon_" + host + "_" + port; }
    public static String standaloneId(String host, int port) { return "standalone_" + host + "_" + port; }
    public static String detachedId(long pid) { return "detached_" + pid; }

    public String getDeployId() { return deployId; }
    public DeploymentMode getMode() { return mode; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public Long getPid() { return pid; }
    public String getUrl() { return url; }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("deploy_id", deployId);
        m.put("mode", mode.getValue());
        m.put("host", host);
        m.put("port", port);
        m.put("pid", pid);
        m.put("url", url);
        return m;
    }

    @Override
    public String toString() {
        return "DeploymentRecord{deployId='" + deployId + "', mode=" + mode.getValue() + ", url='" + url + "'" +
               (pid != null ? ", pid=" + pid : "") + "}";
    }
}
