package com.opsagent.executor;

import com.opsagent.config.DispatchProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Per-incident working directories under {@code dispatch.executor.workspace-root}.
 */
@Component
public class IncidentWorkspace {

    private final Path workspaceRoot;

    public IncidentWorkspace(DispatchProperties properties) {
        String configuredRoot = properties.getExecutor().getWorkspaceRoot();
        String rootValue = StringUtils.hasText(configuredRoot)
                ? configuredRoot
                : Paths.get(System.getProperty("user.dir"), "workspaces").toString();
        this.workspaceRoot = Paths.get(rootValue).toAbsolutePath().normalize();
    }

    /**
     * Returns the incident's directory, creating it when missing.
     *
     * @throws AgentExecutionException when the id escapes the root or the directory cannot be created
     */
    public Path prepare(String incidentId) {
        Path directory = workspaceRoot.resolve(incidentId).normalize();
        if (!directory.startsWith(workspaceRoot) || directory.equals(workspaceRoot)) {
            throw new AgentExecutionException("invalid incident id for workspace: " + incidentId, null);
        }
        try {
            return Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new AgentExecutionException("failed to create workspace " + directory, ex);
        }
    }
}
