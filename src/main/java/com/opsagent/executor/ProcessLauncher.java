package com.opsagent.executor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Starts a process with exactly the given environment; nothing is inherited.
     */
    Process launch(List<String> command, Path workingDir, Map<String, String> environment) throws IOException;

    static ProcessLauncher system() {
        return (command, workingDir, environment) -> {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDir.toFile());
            builder.environment().clear();
            builder.environment().putAll(environment);
            return builder.start();
        };
    }
}
