package com.opsagent.executor;

import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Everything needed to run the agent binary once.
 *
 * @param incidentId  correlation key, also used to cancel the run
 * @param task        task text for a fresh session, or the follow-up message when resuming
 * @param sessionId   session token to resume, {@code null} or blank for a fresh session
 * @param workingDir  directory the agent runs in
 * @param llmConfig   provider settings, may be null
 * @param proxyConfig proxy settings, may be null
 */
public record ExecutionRequest(
        String incidentId,
        String task,
        @Nullable String sessionId,
        Path workingDir,
        @Nullable AgentLlmConfig llmConfig,
        @Nullable ProxyConfig proxyConfig
) {

    public boolean isResume() {
        return StringUtils.hasText(sessionId);
    }
}
