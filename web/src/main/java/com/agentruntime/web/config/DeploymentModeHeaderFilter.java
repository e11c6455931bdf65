/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.config;

import com.agentruntime.server.deploy.DeploymentMode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Tags every response with how the service was deployed:
 * {@code X-Process-Mode: detached} or {@code X-Deployment-Mode: standalone}.
 */
@Component
public class DeploymentModeHeaderFilter extends OncePerRequestFilter {

    public static final String PROCESS_MODE_HEADER = "X-Process-Mode";
    public static final String DEPLOYMENT_MODE_HEADER = "X-Deployment-Mode";

    private final DeploymentMode mode;

    public DeploymentModeHeaderFilter(@Value("${agent.service.mode:daemon_thread}") String mode) {
        this.mode = DeploymentMode.fromValue(mode);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        if (mode == DeploymentMode.DETACHED_PROCESS) {
            response.setHeader(PROCESS_MODE_HEADER, "detached");
        } else if (mode == DeploymentMode.STANDALONE) {
            response.setHeader(DEPLOYMENT_MODE_HEADER, "standalone");
        }
        chain.doFilter(request, response);
    }
}
