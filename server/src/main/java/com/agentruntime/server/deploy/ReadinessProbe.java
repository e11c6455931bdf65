/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.server.deploy;

import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.common.exception.DeploymentTimeoutException;
import com.agentruntime.common.exception.ProcessNotRespondingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Polls a starting service until it is ready.
 *
 * <p>Readiness is a successful TCP connect to (host, port), optionally
 * combined with other conditions by the caller. Each connect attempt is
 * bounded by {@link #CONNECT_TIMEOUT}; attempts repeat every
 * {@link #POLL_INTERVAL} until the deadline.</p>
 */
public class ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(ReadinessProbe.class);

    public static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    public static final Duration CONNECT_TIMEOUT = Duration.ofMillis(100);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(2);

    private final HttpClient httpClient;

    public ReadinessProbe() {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(HEALTH_TIMEOUT)
                .build();
    }

    /** True when something accepts TCP connections on (host, port). */
    public boolean isPortOpen(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) CONNECT_TIMEOUT.toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /** True when {@code GET http://host:port/health} answers 200. */
    public boolean isHealthy(String host, int port) {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://" + host + ":" + port + "/health"))
                .timeout(HEALTH_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Health check of {}:{} failed: {}", host, port, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Block until {@code ready} holds, polling every {@link #POLL_INTERVAL}.
     *
     * @param target  description used in error messages, e.g. {@code 127.0.0.1:8000}
     * @param timeout overall deadline
     * @param ready   readiness condition
     * @param alive   liveness of whatever is starting; false aborts the wait
     * @throws ProcessNotRespondingException if {@code alive} turns false first
     * @throws DeploymentTimeoutException    if the deadline passes
     */
    public void waitFor(String target, Duration timeout, BooleanSupplier ready, BooleanSupplier alive) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        while (true) {
            if (!alive.getAsBoolean()) {
                throw new ProcessNotRespondingException(
                        "Service at " + target + " exited before becoming ready");
            }
            attempts++;
            if (ready.getAsBoolean()) {
                log.debug("Service at {} ready after {} probe(s)", target, attempts);
                return;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Service at {} not ready after {} probe(s)", target, attempts);
                throw new DeploymentTimeoutException(target, timeout);
            }
            try {
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeploymentException("Interrupted while waiting for " + target, e);
            }
        }
    }
}
