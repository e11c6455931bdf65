/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web;

import com.agentruntime.server.deploy.DeploymentMode;
import com.agentruntime.server.engine.Runner;
import com.agentruntime.web.deploy.AgentProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot application hosting one agent {@link Runner} behind HTTP.
 *
 * <p>In-process deployments build it through {@link #builder(Runner)}.
 * {@link #main} is the entry point of detached child processes:</p>
 * <pre>
 *   java -cp ... com.agentruntime.web.AgentServiceApplication --agent.project-dir=/tmp/agent-runtime/agent-...
 * </pre>
 */
@SpringBootApplication
public class AgentServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AgentServiceApplication.class);

    public static final String RUNNER_BEAN = "agentRunner";
    public static final String PROJECT_DIR_ARG = "--agent.project-dir=";

    public static void main(String[] args) {
        Path projectDir = projectDir(args);
        if (projectDir == null) {
            log.error("Missing {}<dir> argument, nothing to serve", PROJECT_DIR_ARG);
            System.exit(2);
            return;
        }
        AgentProject project = AgentProject.load(projectDir);
        Runner runner = project.createRunner();

        List<String> arguments = new ArrayList<>(List.of(args));
        arguments.addAll(project.toArguments());
        arguments.add("--agent.runner.managed=true");

        log.info("Starting detached agent service for {} on {}:{}",
                project.getHandlerClass(), project.getHost(), project.getPort());
        builder(runner).run(arguments.toArray(new String[0]));
    }

    /**
     * Application builder with the runner registered as a singleton bean.
     * The caller keeps ownership of the runner unless
     * {@code agent.runner.managed=true} is passed.
     */
    public static SpringApplicationBuilder builder(Runner runner) {
        return new SpringApplicationBuilder(AgentServiceApplication.class)
                .initializers(context -> context.getBeanFactory().registerSingleton(RUNNER_BEAN, runner));
    }

    /** Properties describing one hosted service, as read by the controllers. */
    public static Map<String, Object> serviceProperties(DeploymentMode mode, String host, int port,
                                                        String endpointPath, String responseType, boolean stream) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("server.address", host);
        properties.put("server.port", port);
        properties.put("agent.service.mode", mode.getValue());
        properties.put("agent.service.endpoint-path", endpointPath);
        properties.put("agent.service.response-type", responseType);
        properties.put("agent.service.stream", stream);
        properties.put("spring.main.banner-mode", "off");
        return properties;
    }

    /** Turn properties into command-line arguments, which take precedence over application.properties. */
    public static String[] toArguments(Map<String, ?> properties) {
        return properties.entrySet().stream()
                .map(e -> "--" + e.getKey() + "=" + e.getValue())
                .toArray(String[]::new);
    }

    static Path projectDir(String[] args) {
        for (String arg : args) {
            if (arg.startsWith(PROJECT_DIR_ARG)) {
                return Path.of(arg.substring(PROJECT_DIR_ARG.length()));
            }
        }
        String property = System.getProperty("agent.project-dir");
        return property != null ? Path.of(property) : null;
    }
}
