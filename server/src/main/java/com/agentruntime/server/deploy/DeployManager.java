/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import com.agentruntime.common.exception.AlreadyRunningException;
import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.server.engine.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of deployment targets. Owns the {@link ServiceState} machine;
 * subclasses only start and stop the actual service.
 *
 * <pre>
 *   deploy():  IDLE → STARTING → doDeploy() → RUNNING        (failure → IDLE)
 *   stop():    RUNNING → STOPPING → doStop() → IDLE          (always ends IDLE)
 * </pre>
 *
 * <p>A subclass whose {@link #doDeploy} blocks for the lifetime of the
 * service calls {@link #markRunning} once ready and {@link #markStopped}
 * before returning.</p>
 */
public abstract class DeployManager {

    private static final Logger log = LoggerFactory.getLogger(DeployManager.class);

    private final Object stateLock = new Object();
    private volatile ServiceState state = ServiceState.IDLE;
    private volatile DeploymentRecord record;

    /**
     * Deploy the runner's handler as a network service.
     *
     * @throws AlreadyRunningException if a deployment is active or in progress
     * @throws com.agentruntime.common.exception.DeploymentTimeoutException if readiness is not reached in time
     * @throws DeploymentException for any other failure
     */
    public final DeploymentRecord deploy(Runner runner, DeploymentConfig config) {
        Objects.requireNonNull(runner, "runner");
        Objects.requireNonNull(config, "config");
        synchronized (stateLock) {
            if (state != ServiceState.IDLE) {
                throw new AlreadyRunningException(getDeployId(), state.name());
            }
            state = ServiceState.STARTING;
            record = null;
        }
        log.info("Deploying {} in {} mode", runner.getHandlerType().getSimpleName(), config.getMode().getValue());
        try {
            DeploymentRecord result = doDeploy(runner, config);
            synchronized (stateLock) {
                if (state == ServiceState.STARTING) {
                    record = result;
                    state = ServiceState.RUNNING;
                }
            }
            log.info("Deployment {} at {} is {}", result.getDeployId(), result.getUrl(), state);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to deploy service: {}", e.getMessage());
            markStopped();
            throw e;
        } catch (Exception e) {
            log.error("Failed to deploy service: {}", e.getMessage(), e);
            markStopped();
            throw new DeploymentException("Failed to deploy service: " + e.getMessage(), e);
        }
    }

    /**
     * Stop the deployed service. Calling it when nothing runs only logs a
     * warning. Always ends in {@link ServiceState#IDLE}.
     */
    public final void stop() {
        DeploymentRecord current;
        synchronized (stateLock) {
            if (state == ServiceState.IDLE) {
                log.warn("Service is not running, nothing to stop");
                return;
            }
            if (state == ServiceState.STOPPING) {
                log.warn("Service {} is already stopping", getDeployId());
                return;
            }
            if (state == ServiceState.STARTING) {
                log.warn("Service is still starting, stop ignored");
                return;
            }
            state = ServiceState.STOPPING;
            current = record;
        }
        log.info("Stopping deployment {}", current != null ? current.getDeployId() : "(unknown)");
        try {
            doStop(current);
        } finally {
            markStopped();
        }
        log.info("Deployment {} stopped", current != null ? current.getDeployId() : "(unknown)");
    }

    // ─── Subclass contract ──────────────────────────────────────────

    /** Start the service and return once it is ready (or, for blocking modes, once it exited). */
    protected abstract DeploymentRecord doDeploy(Runner runner, DeploymentConfig config) throws Exception;

    /** Stop the service. Must not throw for a service that is already gone. */
    protected abstract void doStop(DeploymentRecord record);

    /** Probe whether the service actually answers. Defaults to the tracked state. */
    public boolean isServiceRunning() {
        return isRunning();
    }

    /** Record readiness from inside a blocking {@link #doDeploy}. */
    protected final void markRunning(DeploymentRecord running) {
        synchronized (stateLock) {
            record = running;
            state = ServiceState.RUNNING;
        }
    }

    protected final void markStopped() {
        synchronized (stateLock) {
            state = ServiceState.IDLE;
            record = null;
        }
    }

    // ─── Status ─────────────────────────────────────────────────────

    public ServiceState getState() { return state; }

    public boolean isRunning() { return state == ServiceState.RUNNING; }

    public DeploymentRecord getRecord() { return record; }

    public String getDeployId() {
        DeploymentRecord r = record;
        return r != null ? r.getDeployId() : null;
    }

    public String getServiceUrl() {
        DeploymentRecord r = record;
        return r != null && isRunning() ? r.getUrl() : null;
    }

    public Map<String, Object> getDeploymentInfo() {
        DeploymentRecord r = record;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("deploy_id", r != null ? r.getDeployId() : null);
        m.put("mode", r != null ? r.getMode().getValue() : null);
        m.put("host", r != null ? r.getHost() : null);
        m.put("port", r != null ? r.getPort() : null);
        m.put("pid", r != null ? r.getPid() : null);
        m.put("url", r != null ? r.getUrl() : null);
        m.put("state", state.name());
        m.put("is_running", r != null && isServiceRunning());
        return m;
    }
}
