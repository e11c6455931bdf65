/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import com.agentruntime.server.deploy.DeploymentConfig;
import com.agentruntime.server.engine.Runner;

/**
 * Turns a runner into something a separate process can launch.
 */
@FunctionalInterface
public interface ProjectPackager {

    /**
     * Write the project for {@code runner} and return how to start it.
     * {@code config} carries the resolved host and port.
     *
     * @throws com.agentruntime.common.exception.ValidationException if the handler cannot be packaged
     * @throws com.agentruntime.common.exception.DeploymentException if the project cannot be written
     */
    PackagedProject packageProject(Runner runner, DeploymentConfig config);
}
