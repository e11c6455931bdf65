/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.deploy;

import java.nio.file.Path;
import java.util.List;

/**
 * A packaged project directory and the command that serves it.
 */
public final class PackagedProject {

    private final Path projectDir;
    private final List<String> command;

    public PackagedProject(Path projectDir, List<String> command) {
        this.projectDir = projectDir;
        this.command = List.copyOf(command);
    }

    public Path getProjectDir() { return projectDir; }
    public List<String> getCommand() { return command; }

    @Override
    public String toString() {
        return "PackagedProject{dir=" + projectDir + ", command=" + String.join(" ", command) + "}";
    }
}
