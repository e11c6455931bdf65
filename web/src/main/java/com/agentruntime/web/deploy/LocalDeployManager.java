/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.common.exception.DeploymentTimeoutException;
import com.agentruntime.common.exception.ProcessNotRespondingException;
import com.agentruntime.common.exception.ShutdownTimeoutException;
import com.agentruntime.server.deploy.DeployManager;
import com.agentruntime.server.deploy.DeploymentConfig;
import com.agentruntime.server.deploy.DeploymentMode;
import com.agentruntime.server.deploy.DeploymentRecord;
import com.agentruntime.server.deploy.ProcessManager;
import com.agentruntime.server.deploy.ReadinessProbe;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.web.AgentServiceApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Deploys a runner on this machine.
 *
 * <table>
 *   <tr><th>Mode</th><th>Service runs in</th><th>Ready when</th></tr>
 *   <tr><td>daemon_thread</td><td>embedded server on a worker thread</td><td>server started and port open</td></tr>
 *   <tr><td>detached_process</td><td>child JVM, PID file in pid-dir</td><td>child alive, port open, /health 200</td></tr>
 *   <tr><td>standalone</td><td>embedded server on the calling thread; deploy blocks</td><td>server started</td></tr>
 * </table>
 *
 * <p>Readiness is polled every 100 ms up to {@code deploy_timeout}. Stopping
 * waits at most the shutdown timeout; requests still in flight then are not
 * waited for.</p>
 */
public class LocalDeployManager extends DeployManager {

    private static final Logger log = LoggerFactory.getLogger(LocalDeployManager.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8000;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    static final String CHILD_LOG_FILE = "agent-service.log";

    private final String host;
    private final int port;
    private final Duration shutdownTimeout;
    private final ReadinessProbe probe;
    private final ProcessManager processManager;
    private final ProjectPackager packager;

    private volatile EmbeddedServer server;
    private volatile Long pid;
    private volatile Path pidFile;

    public LocalDeployManager() {
        this(DEFAULT_HOST, DEFAULT_PORT);
    }

    public LocalDeployManager(String host, int port) {
        this(host, port, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public LocalDeployManager(String host, int port, Duration shutdownTimeout) {
        this(host, port, shutdownTimeout, new ReadinessProbe(), new ProcessManager(),
             new LocalJvmProjectPackager(Path.of(System.getProperty("java.io.tmpdir"), "agent-runtime", "projects")));
    }

    public LocalDeployManager(String host, int port, Duration shutdownTimeout, ReadinessProbe probe,
                              ProcessManager processManager, ProjectPackager packager) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        this.host = host;
        this.port = port;
        this.shutdownTimeout = shutdownTimeout;
        this.probe = probe;
        this.processManager = processManager;
        this.packager = packager;
    }

    @Override
    protected DeploymentRecord doDeploy(Runner runner, DeploymentConfig config) {
        String targetHost = config.getHost() != null ? config.getHost() : host;
        int targetPort = config.getPort() != null ? config.getPort() : port;
        switch (config.getMode()) {
            case DAEMON_THREAD:
                return deployDaemon(runner, config, targetHost, targetPort);
            case DETACHED_PROCESS:
                return deployDetached(runner, config, targetHost, targetPort);
            case STANDALONE:
                return deployStandalone(runner, config, targetHost, targetPort);
            default:
                throw new DeploymentException("Unsupported deployment mode: " + config.getMode());
        }
    }

    // ─── daemon_thread ──────────────────────────────────────────────

    private DeploymentRecord deployDaemon(Runner runner, DeploymentConfig config, String h, int p) {
        EmbeddedServer embedded = new EmbeddedServer(runner, serviceProperties(DeploymentMode.DAEMON_THREAD, config, h, p));
        server = embedded;
        embedded.startInBackground();
        try {
            probe.waitFor(h + ":" + p, config.getDeployTimeout(),
                    () -> embedded.isStarted() && probe.isPortOpen(h, p),
                    embedded::isAlive);
        } catch (RuntimeException e) {
            stopServer(embedded);
            server = null;
            Throwable cause = embedded.getFailure();
            if (cause != null && e instanceof DeploymentTimeoutException) {
                throw new ProcessNotRespondingException(
                        "Embedded server on " + h + ":" + p + " failed to start: " + cause.getMessage(), cause);
            }
            throw e;
        }
        return new DeploymentRecord(DeploymentRecord.daemonId(h, p), DeploymentMode.DAEMON_THREAD,
                h, p, null, url(h, p));
    }

    // ─── detached_process ───────────────────────────────────────────

    private DeploymentRecord deployDetached(Runner runner, DeploymentConfig config, String h, int p) {
        DeploymentConfig resolved = config.toBuilder().host(h).port(p).build();
        PackagedProject project = packager.packageProject(runner, resolved);
        Process process = processManager.start(project.getCommand(), config.getEnvironment(),
                project.getProjectDir(), project.getProjectDir().resolve(CHILD_LOG_FILE));
        long childPid = process.pid();
        String deployId = DeploymentRecord.detachedId(childPid);
        Path file = processManager.writePidFile(config.getPidDir(), deployId, childPid);

        try {
            probe.waitFor(h + ":" + p, config.getDeployTimeout(),
                    () -> probe.isPortOpen(h, p) && (!config.isHealthCheck() || probe.isHealthy(h, p)),
                    process::isAlive);
        } catch (RuntimeException e) {
            log.error("Detached service pid={} not ready, see {}", childPid,
                    project.getProjectDir().resolve(CHILD_LOG_FILE));
            processManager.kill(childPid);
            processManager.removePidFile(file);
            throw e;
        }
        pid = childPid;
        pidFile = file;
        log.info("Detached service pid={} serving {} (PID file {})", childPid, project.getProjectDir(), file);
        return new DeploymentRecord(deployId, DeploymentMode.DETACHED_PROCESS, h, p, childPid, url(h, p));
    }

    // ─── standalone ─────────────────────────────────────────────────

    private DeploymentRecord deployStandalone(Runner runner, DeploymentConfig config, String h, int p) {
        EmbeddedServer embedded = new EmbeddedServer(runner, serviceProperties(DeploymentMode.STANDALONE, config, h, p));
        DeploymentRecord record = new DeploymentRecord(DeploymentRecord.standaloneId(h, p), DeploymentMode.STANDALONE,
                h, p, null, url(h, p));
        server = embedded;
        try {
            embedded.runForeground(() -> {
                markRunning(record);
                log.info("Standalone service serving at {}, blocking until it exits", record.getUrl());
            });
        } finally {
            server = null;
            markStopped();
        }
        if (embedded.getFailure() != null) {
            throw new ProcessNotRespondingException(
                    "Standalone server on " + h + ":" + p + " failed: " + embedded.getFailure().getMessage(),
                    embedded.getFailure());
        }
        return record;
    }

    // ─── stop ───────────────────────────────────────────────────────

    @Override
    protected void doStop(DeploymentRecord record) {
        EmbeddedServer embedded = server;
        if (embedded != null) {
            stopServer(embedded);
            server = null;
        }
        if (pid != null) {
            stopDetached(pid);
        }
    }

    private void stopServer(EmbeddedServer embedded) {
        embedded.signalExit();
        if (embedded.getThread() == Thread.currentThread()) {
            return;
        }
        if (!embedded.awaitTermination(shutdownTimeout)) {
            log.warn(new ShutdownTimeoutException(embedded.getName(), shutdownTimeout).getMessage());
        }
    }

    private void stopDetached(long childPid) {
        try {
            processManager.stopProcessGracefully(childPid, shutdownTimeout);
        } catch (ShutdownTimeoutException e) {
            log.warn(e.getMessage());
        } finally {
            if (pidFile != null) {
                processManager.removePidFile(pidFile);
            }
            pid = null;
            pidFile = null;
        }
    }

    /**
     * daemon_thread and standalone: server started and port reachable;
     * detached_process: child PID alive.
     */
    @Override
    public boolean isServiceRunning() {
        Long childPid = pid;
        if (childPid != null) {
            return processManager.isProcessRunning(childPid);
        }
        EmbeddedServer embedded = server;
        DeploymentRecord record = getRecord();
        return embedded != null && embedded.isStarted() && record != null
                && probe.isPortOpen(record.getHost(), record.getPort());
    }

    // ─── Helpers ────────────────────────────────────────────────────

    private Map<String, Object> serviceProperties(DeploymentMode mode, DeploymentConfig config, String h, int p) {
        return AgentServiceApplication.serviceProperties(mode, h, p,
                config.getEndpointPath(), config.getResponseType(), config.isStream());
    }

    private static String url(String h, int p) {
        return "http://" + h + ":" + p;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public Long getPid() { return pid; }
    public Path getPidFile() { return pidFile; }
}
