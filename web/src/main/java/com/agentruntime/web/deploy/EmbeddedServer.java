/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.server.engine.Runner;
import com.agentruntime.web.AgentServiceApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One Spring Boot web server hosting a runner inside this JVM.
 *
 * <pre>
 *   run():  SpringApplication.run ─► started ─► await exit signal ─► context.close() ─► terminated
 *                   └─ failure (e.g. port in use) ────────────────────────────────────┘
 * </pre>
 *
 * <p>{@link #startInBackground()} runs it on a dedicated daemon thread;
 * {@link #runForeground(Runnable)} runs it on the caller's thread. The
 * server also exits when its context is closed from elsewhere, e.g. by JVM
 * shutdown.</p>
 */
public class EmbeddedServer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedServer.class);

    private final Runner runner;
    private final Map<String, Object> properties;
    private final String name;

    private final CountDownLatch exitSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile ConfigurableApplicationContext context;
    private volatile boolean started;
    private volatile Throwable failure;
    private volatile Thread thread;

    public EmbeddedServer(Runner runner, Map<String, Object> properties) {
        this.runner = runner;
        this.properties = Map.copyOf(properties);
        this.name = "agent-server-" + properties.get("server.port");
    }

    /** Start on a daemon worker thread and return immediately. */
    public Thread startInBackground() {
        Thread worker = new Thread(() -> run(null), name);
        worker.setDaemon(true);
        thread = worker;
        worker.start();
        return worker;
    }

    /**
     * Serve on the calling thread until {@link #signalExit()} or the context
     * closes. {@code onStarted} runs once the server accepts connections.
     */
    public void runForeground(Runnable onStarted) {
        thread = Thread.currentThread();
        run(onStarted);
    }

    private void run(Runnable onStarted) {
        try {
            ConfigurableApplicationContext ctx = AgentServiceApplication.builder(runner)
                    .listeners(new ApplicationListener<ContextClosedEvent>() {
                        @Override
                        public void onApplicationEvent(ContextClosedEvent event) {
                            signalExit();
                        }
                    })
                    .run(AgentServiceApplication.toArguments(properties));
            context = ctx;
            started = true;
            log.info("{} started", name);
            if (onStarted != null) {
                onStarted.run();
            }
            exitSignal.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", name);
        } catch (RuntimeException e) {
            failure = e;
            log.error("{} failed: {}", name, e.getMessage());
        } finally {
            started = false;
            closeContext();
            terminated.countDown();
        }
    }

    private void closeContext() {
        ConfigurableApplicationContext ctx = context;
        context = null;
        if (ctx != null && ctx.isActive()) {
            ctx.close();
        }
        log.info("{} stopped", name);
    }

    /** Ask the server to shut down; returns immediately. */
    public void signalExit() {
        exitSignal.countDown();
    }

    /** Wait for the server to finish shutting down. */
    public boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return terminated.getCount() == 0;
        }
    }

    public boolean isStarted() { return started; }

    /** True until the server has terminated. */
    public boolean isAlive() {
        return terminated.getCount() > 0 && failure == null;
    }

    public Throwable getFailure() { return failure; }

    public Thread getThread() { return thread; }

    public String getName() { return name; }
}
