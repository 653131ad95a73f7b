package com.opsagent.worker;

import com.opsagent.dispatch.WorkerMessage;
import com.opsagent.dispatch.WorkerMessageType;
import com.opsagent.executor.AgentExecutionException;
import com.opsagent.executor.AgentProcessExecutor;
import com.opsagent.executor.ExecutionRequest;
import com.opsagent.executor.ExecutionResult;
import com.opsagent.executor.IncidentWorkspace;
import com.opsagent.executor.ResultFormatter;
import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes orchestrator requests on the worker: runs the agent per incident and reports progress,
 * completion or failure back over the channel. At most one terminal message is sent per run.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "dispatch.worker", name = "enabled", havingValue = "true")
public class WorkerTaskRunner {

    static final String NO_SESSION = "No session found for incident";

    private final AgentProcessExecutor executor;
    private final IncidentWorkspace workspace;
    private final WorkerSessionStore sessionStore;
    private final ExecutorService incidentExecutor;
    private final AtomicReference<ProxyConfig> proxyConfig = new AtomicReference<>();

    public WorkerTaskRunner(AgentProcessExecutor executor,
                            IncidentWorkspace workspace,
                            WorkerSessionStore sessionStore,
                            @Qualifier("incidentExecutor") ExecutorService incidentExecutor) {
        this.executor = executor;
        this.workspace = workspace;
        this.sessionStore = sessionStore;
        this.incidentExecutor = incidentExecutor;
    }

    public void handle(WorkerMessage message, WorkerChannel channel) {
        WorkerMessageType type = message.messageType().orElse(null);
        if (type == null) {
            log.warn("Ignoring unknown message type from orchestrator: {}", message.type());
            return;
        }
        switch (type) {
            case NEW_INCIDENT -> startNew(message, channel);
            case CONTINUE_INCIDENT -> continueExisting(message, channel);
            case CANCEL_INCIDENT -> cancel(message.incidentId());
            case PROXY_CONFIG_UPDATE -> {
                proxyConfig.set(message.proxyConfig());
                log.info("Proxy configuration updated");
            }
            default -> log.warn("Ignoring message of type {} from orchestrator", message.type());
        }
    }

    @Nullable
    ProxyConfig currentProxyConfig() {
        return proxyConfig.get();
    }

    private void startNew(WorkerMessage message, WorkerChannel channel) {
        String incidentId = message.incidentId();
        log.info("Starting new incident {}", incidentId);
        sessionStore.create(incidentId);
        submit(incidentId, message.task(), null, message, channel);
    }

    private void continueExisting(WorkerMessage message, WorkerChannel channel) {
        String incidentId = message.incidentId();
        String sessionId = message.sessionId();
        if (!StringUtils.hasText(sessionId)) {
            sessionId = sessionStore.get(incidentId).map(WorkerSession::sessionId).orElse(null);
        }
        if (!StringUtils.hasText(sessionId)) {
            log.warn("Cannot continue incident {}: no session", incidentId);
            channel.send(WorkerMessage.error(incidentId, NO_SESSION));
            return;
        }
        log.info("Continuing incident {} with session {}", incidentId, sessionId);
        submit(incidentId, message.message(), sessionId, message, channel);
    }

    private void cancel(String incidentId) {
        if (executor.cancel(incidentId)) {
            sessionStore.setFailed(incidentId, "Cancelled by user");
        } else {
            log.info("No active run to cancel for incident {}", incidentId);
        }
    }

    private void submit(String incidentId, String task, @Nullable String sessionId, WorkerMessage message,
                        WorkerChannel channel) {
        if (message.proxyConfig() != null) {
            proxyConfig.set(message.proxyConfig());
        }
        AgentLlmConfig llmConfig = message.llmConfig().orElse(null);
        ProxyConfig proxy = proxyConfig.get();
        try {
            incidentExecutor.execute(() -> run(incidentId, task, sessionId, llmConfig, proxy, channel));
        } catch (RejectedExecutionException ex) {
            log.error("Cannot schedule incident {}: {}", incidentId, ex.getMessage());
            sessionStore.setFailed(incidentId, "worker is shutting down");
            channel.send(WorkerMessage.error(incidentId, "worker is shutting down"));
        }
    }

    void run(String incidentId, String task, @Nullable String sessionId, @Nullable AgentLlmConfig llmConfig,
             @Nullable ProxyConfig proxy, WorkerChannel channel) {
        ExecutionResult result;
        try {
            Path workingDir = workspace.prepare(incidentId);
            ExecutionRequest request = new ExecutionRequest(incidentId, task, sessionId, workingDir, llmConfig, proxy);
            result = executor.execute(request, progress -> channel.send(WorkerMessage.output(incidentId, progress)));
        } catch (AgentExecutionException ex) {
            log.warn("Incident {} could not start: {}", incidentId, ex.getMessage());
            reportFailure(incidentId, ex.getMessage(), channel);
            return;
        } catch (RuntimeException ex) {
            log.error("Incident {} failed unexpectedly", incidentId, ex);
            reportFailure(incidentId, "execution failed: " + ex.getMessage(), channel);
            return;
        }

        if (StringUtils.hasText(result.sessionId())) {
            sessionStore.setRunning(incidentId, result.sessionId());
        }
        if (!result.succeeded()) {
            sessionStore.setFailed(incidentId, result.error());
            channel.send(WorkerMessage.error(incidentId,
                    ResultFormatter.formatFailure(result.error(), result.errorMessages())));
            return;
        }
        sessionStore.setCompleted(incidentId, result.sessionId(), result.output(), result.fullLog());
        channel.send(WorkerMessage.completed(incidentId, result.sessionId(), result.output(),
                result.tokensUsed(), result.executionTimeMs()));
        log.info("Incident {} completed (tokens: {}, time: {}ms)", incidentId, result.tokensUsed(),
                result.executionTimeMs());
    }

    private void reportFailure(String incidentId, String error, WorkerChannel channel) {
        sessionStore.setFailed(incidentId, error);
        channel.send(WorkerMessage.error(incidentId, error));
    }
}
