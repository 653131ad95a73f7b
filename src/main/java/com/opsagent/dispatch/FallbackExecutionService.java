package com.opsagent.dispatch;

import com.opsagent.config.DispatchProperties;
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
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs incidents in-process when no worker is connected, behind the same callback contract as the
 * worker path. Unlike the worker path each run is bounded by {@code dispatch.fallback.timeout}.
 */
@Slf4j
@Service
public class FallbackExecutionService {

    private final AgentProcessExecutor executor;
    private final IncidentWorkspace workspace;
    private final ExecutorService incidentExecutor;
    private final DispatchProperties properties;

    public FallbackExecutionService(AgentProcessExecutor executor,
                                    IncidentWorkspace workspace,
                                    @Qualifier("incidentExecutor") ExecutorService incidentExecutor,
                                    DispatchProperties properties) {
        this.executor = executor;
        this.workspace = workspace;
        this.incidentExecutor = incidentExecutor;
        this.properties = properties;
    }

    /**
     * @return a future that completes after the terminal callback has fired
     */
    public CompletableFuture<Void> start(String incidentId, String task, @Nullable AgentLlmConfig llmConfig,
                                         @Nullable ProxyConfig proxyConfig, IncidentCallback callback) {
        return run(incidentId, task, null, llmConfig, proxyConfig, callback);
    }

    public CompletableFuture<Void> continueIncident(String incidentId, String sessionId, String message,
                                                    @Nullable AgentLlmConfig llmConfig,
                                                    @Nullable ProxyConfig proxyConfig, IncidentCallback callback) {
        return run(incidentId, message, sessionId, llmConfig, proxyConfig, callback);
    }

    /**
     * Destroys the local agent process; the run then reports the cancellation through its error
     * callback.
     */
    public boolean cancel(String incidentId) {
        return executor.cancel(incidentId);
    }

    private CompletableFuture<Void> run(String incidentId, String task, @Nullable String sessionId,
                                        @Nullable AgentLlmConfig llmConfig, @Nullable ProxyConfig proxyConfig,
                                        IncidentCallback callback) {
        GuardedCallback guard = new GuardedCallback(incidentId, callback);
        Duration timeout = properties.getFallback().getTimeout();
        log.info("Running incident {} locally (resume={}, timeout {})", incidentId, sessionId != null,
                ResultFormatter.formatDuration(timeout));

        CompletableFuture<ExecutionResult> execution = CompletableFuture.supplyAsync(() -> {
            Path workingDir = workspace.prepare(incidentId);
            ExecutionRequest request = new ExecutionRequest(incidentId, task, sessionId, workingDir,
                    llmConfig, proxyConfig);
            return executor.execute(request, guard::output);
        }, incidentExecutor);

        return execution
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, failure) -> {
                    if (failure != null) {
                        handleFailure(incidentId, unwrap(failure), timeout, guard);
                    } else {
                        deliver(incidentId, result, guard);
                    }
                    return null;
                });
    }

    private void deliver(String incidentId, ExecutionResult result, GuardedCallback guard) {
        if (result.succeeded()) {
            log.info("Local run of incident {} completed: {} chars, {} tokens", incidentId,
                    result.output().length(), result.tokensUsed());
            guard.completed(result.sessionId(), ResultFormatter.formatSuccess(result));
        } else {
            guard.error(ResultFormatter.formatFailure(result.error(), result.errorMessages()));
        }
    }

    private void handleFailure(String incidentId, Throwable failure, Duration timeout, GuardedCallback guard) {
        if (failure instanceof TimeoutException) {
            String reason = "execution timed out after " + ResultFormatter.formatDuration(timeout);
            log.warn("Local run of incident {} timed out, cancelling", incidentId);
            executor.cancel(incidentId, reason);
            guard.error(reason);
        } else if (failure instanceof AgentExecutionException) {
            log.warn("Local run of incident {} could not start: {}", incidentId, failure.getMessage());
            guard.error(failure.getMessage());
        } else {
            log.error("Local run of incident {} failed", incidentId, failure);
            guard.error("local execution failed: " + failure.getMessage());
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
