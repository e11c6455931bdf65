/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessManagerTest {

    private final ProcessManager processManager = new ProcessManager();

    @TempDir
    Path tempDir;

    // ===== PID files =====

    @Test
    void shouldWriteAndReadPidFile() {
        Path file = processManager.writePidFile(tempDir.resolve("pids"), "detached_42", 42L);

        assertEquals(tempDir.resolve("pids").resolve("detached_42.pid"), file);
        assertEquals(42L, processManager.readPidFile(file));

        processManager.removePidFile(file);
        assertFalse(Files.exists(file));
        assertNull(processManager.readPidFile(file));
    }

    @Test
    void shouldIgnoreGarbagePidFile() throws Exception {
        Path file = tempDir.resolve("broken.pid");
        Files.writeString(file, "not-a-pid");

        assertNull(processManager.readPidFile(file));
    }

    @Test
    void shouldRemoveMissingPidFileQuietly() {
        assertDoesNotThrow(() -> processManager.removePidFile(tempDir.resolve("missing.pid")));
    }

    // ===== Processes =====

    @Test
    void shouldSeeOwnProcessRunning() {
        assertTrue(processManager.isProcessRunning(ProcessHandle.current().pid()));
    }

    @Test
    void shouldTreatUnknownProcessAsStopped() {
        assertDoesNotThrow(() -> processManager.stopProcessGracefully(Long.MAX_VALUE, Duration.ofMillis(100)));
        assertFalse(processManager.isProcessRunning(Long.MAX_VALUE));
    }

    @Test
    void shouldStartAndStopChildProcess() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sleep")), "needs /bin/sleep");
        Path log = tempDir.resolve("logs").resolve("child.log");

        Process process = processManager.start(List.of("/bin/sleep", "30"), Map.of("AGENT_TEST", "1"), tempDir, log);

        assertTrue(processManager.isProcessRunning(process.pid()));
        assertTrue(Files.exists(log));

        processManager.stopProcessGracefully(process.pid(), Duration.ofSeconds(5));

        assertTrue(process.waitFor(5, TimeUnit.SECONDS));
        assertFalse(processManager.isProcessRunning(process.pid()));
    }
}
