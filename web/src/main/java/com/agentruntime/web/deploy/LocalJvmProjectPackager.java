/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.common.exception.DeploymentException;
import com.agentruntime.common.exception.ValidationException;
import com.agentruntime.server.deploy.DeploymentConfig;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.web.AgentServiceApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Packages a runner for a child JVM on this machine.
 *
 * <p>The child runs with this JVM's {@code java} binary and classpath, plus
 * the configured extra packages. The handler is rebuilt by class name, so it
 * must be a public top-level or static nested class with a public no-arg
 * constructor. Lambdas and anonymous classes cannot be packaged. Lifecycle
 * hooks stay in the parent.</p>
 *
 * <pre>
 *   &lt;base-dir&gt;/agent-&lt;uuid&gt;/agent-project.json
 *   java -cp &lt;classpath&gt; com.agentruntime.web.AgentServiceApplication --agent.project-dir=&lt;dir&gt;
 * </pre>
 */
public class LocalJvmProjectPackager implements ProjectPackager {

    private static final Logger log = LoggerFactory.getLogger(LocalJvmProjectPackager.class);

    private final Path baseDir;

    public LocalJvmProjectPackager(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public PackagedProject packageProject(Runner runner, DeploymentConfig config) {
        Class<?> handlerType = runner.getHandlerType();
        checkRebuildable(handlerType);

        Path projectDir = baseDir.resolve("agent-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            Files.createDirectories(projectDir);
        } catch (IOException e) {
            throw new DeploymentException("Cannot create project directory " + projectDir + ": " + e.getMessage(), e);
        }

        AgentProject project = new AgentProject();
        project.setHandlerClass(handlerType.getName());
        project.setHost(config.getHost());
        project.setPort(config.getPort());
        project.setEndpointPath(config.getEndpointPath());
        project.setResponseType(config.getResponseType());
        project.setStream(config.isStream());
        project.setRequirements(new ArrayList<>(config.getRequirements()));
        project.setExtraPackages(new ArrayList<>(config.getExtraPackages()));
        project.setEnvironment(new LinkedHashMap<>(config.getEnvironment()));
        project.setCreatedAt(Instant.now());
        Path file = project.save(projectDir);
        log.info("Packaged {} into {}", handlerType.getName(), file);

        if (!config.getRequirements().isEmpty()) {
            log.info("Requirements recorded for {}: {}", handlerType.getSimpleName(), config.getRequirements());
        }
        return new PackagedProject(projectDir, command(projectDir, config.getExtraPackages()));
    }

    List<String> command(Path projectDir, List<String> extraPackages) {
        String javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        List<String> classpath = new ArrayList<>();
        classpath.add(System.getProperty("java.class.path"));
        classpath.addAll(extraPackages);

        List<String> command = new ArrayList<>();
        command.add(javaBin);
        command.add("-cp");
        command.add(String.join(File.pathSeparator, classpath));
        command.add(AgentServiceApplication.class.getName());
        command.add(AgentServiceApplication.PROJECT_DIR_ARG + projectDir.toAbsolutePath());
        return command;
    }

    /**
     * @throws ValidationException if a child JVM could not instantiate the type by name
     */
    static void checkRebuildable(Class<?> type) {
        String name = type.getName();
        if (type.isSynthetic() || type.isAnonymousClass() || type.isLocalClass() || type.getCanonicalName() == null) {
            throw new ValidationException("Handler " + name +
                    " is a lambda, anonymous or local class and cannot run in a detached process");
        }
        if (!Modifier.isPublic(type.getModifiers()) || Modifier.isAbstract(type.getModifiers())) {
            throw new ValidationException("Handler class " + name + " must be public and concrete");
        }
        if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
            throw new ValidationException("Nested handler class " + name + " must be static");
        }
        try {
            Constructor<?> constructor = type.getConstructor();
            if (!Modifier.isPublic(constructor.getModifiers())) {
                throw new ValidationException("No-arg constructor of " + name + " must be public");
            }
        } catch (NoSuchMethodException e) {
            throw new ValidationException("Handler class " + name + " needs a public no-arg constructor", e);
        }
    }
}
