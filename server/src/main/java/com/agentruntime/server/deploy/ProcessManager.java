/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.common.exception.ShutdownTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts, tracks and stops child processes of detached deployments.
 *
 * <p>A child is identified by its PID only, so a deployment can be stopped
 * from a JVM other than the one that started it. The PID is persisted in
 * {@code <pid-dir>/<deploy-id>.pid}.</p>
 */
public class ProcessManager {

    private static final Logger log = LoggerFactory.getLogger(ProcessManager.class);

    private static final Duration FORCE_KILL_GRACE = Duration.ofSeconds(2);

    /**
     * Start a child process.
     *
     * @param command     program and arguments
     * @param environment variables added to the inherited environment
     * @param workDir     working directory, or null for the current one
     * @param logFile     file receiving stdout and stderr (appended)
     * @throws DeploymentException if the process cannot be started
     */
    public Process start(List<String> command, Map<String, String> environment, Path workDir, Path logFile) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(environment);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        try {
            Files.createDirectories(logFile.toAbsolutePath().getParent());
            Process process = pb.start();
            log.info("Started process pid={} (output: {})", process.pid(), logFile);
            return process;
        } catch (IOException e) {
            throw new DeploymentException("Failed to start process " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    // ─── PID files ──────────────────────────────────────────────────

    public Path pidFile(Path pidDir, String deployId) {
        return pidDir.resolve(deployId + ".pid");
    }

    public Path writePidFile(Path pidDir, String deployId, long pid) {
        Path file = pidFile(pidDir, deployId);
        try {
            Files.createDirectories(pidDir);
            Files.writeString(file, Long.toString(pid), StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new DeploymentException("Failed to write PID file " + file + ": " + e.getMessage(), e);
        }
    }

    /** PID stored in the file, or null when the file is missing or unreadable. */
    public Long readPidFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Long.parseLong(Files.readString(file, StandardCharsets.UTF_8).trim());
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable PID file {}: {}", file, e.getMessage());
            return null;
        }
    }

    public void removePidFile(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Removed PID file {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to remove PID file {}: {}", file, e.getMessage());
        }
    }

    // ─── Process control ────────────────────────────────────────────

    public boolean isProcessRunning(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    /**
     * Ask the process to terminate and wait up to {@code timeout}. If it is
     * still alive afterwards it is force-killed and a
     * {@link ShutdownTimeoutException} is thrown.
     */
    public void stopProcessGracefully(long pid, Duration timeout) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            log.info("Process {} is not running", pid);
            return;
        }
        ProcessHandle process = handle.get();
        process.destroy();
        if (awaitExit(process, timeout)) {
            log.info("Process {} terminated", pid);
            return;
        }
        log.warn("Process {} did not terminate within {} ms, killing it", pid, timeout.toMillis());
        process.destroyForcibly();
        awaitExit(process, FORCE_KILL_GRACE);
        throw new ShutdownTimeoutException("Process " + pid, timeout);
    }

    /** Force-kill without waiting for a graceful exit. */
    public void kill(long pid) {
        ProcessHandle.of(pid).ifPresent(p -> {
            if (p.isAlive()) {
                p.destroyForcibly();
                log.info("Process {} force-killed", pid);
            }
        });
    }

    private boolean awaitExit(ProcessHandle process, Duration timeout) {
        try {
            process.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !process.isAlive();
        } catch (ExecutionException e) {
            log.warn("Waiting for process {} failed: {}", process.pid(), e.getMessage());
            return !process.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }
}
