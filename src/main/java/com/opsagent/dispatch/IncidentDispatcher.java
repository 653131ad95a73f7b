package com.opsagent.dispatch;

import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Entry point for callers: sends incidents to the connected worker, or runs them locally when no
 * worker is connected. Every call yields exactly one terminal callback and a future completed
 * with the same outcome, including when dispatch itself fails.
 */
@Slf4j
@Service
public class IncidentDispatcher {

    private final WorkerConnectionManager connectionManager;
    private final FallbackExecutionService fallback;
    private final AgentSettingsLookup settingsLookup;

    public IncidentDispatcher(WorkerConnectionManager connectionManager,
                              FallbackExecutionService fallback,
                              AgentSettingsLookup settingsLookup) {
        this.connectionManager = connectionManager;
        this.fallback = fallback;
        this.settingsLookup = settingsLookup;
    }

    public CompletableFuture<IncidentOutcome> start(String incidentId, String task, IncidentCallback callback) {
        AgentLlmConfig llmConfig = settingsLookup.llmConfig().orElse(null);
        if (connectionManager.isConnected()) {
            OneShot oneShot = new OneShot(incidentId, callback, false);
            try {
                connectionManager.startIncident(incidentId, task, llmConfig, settingsLookup.enabledSkills(),
                        oneShot.callback());
            } catch (DispatchException ex) {
                log.warn("Failed to dispatch incident {} to worker: {}", incidentId, ex.getMessage());
                oneShot.fail("Failed to start incident: " + ex.getMessage());
            }
            return oneShot.future();
        }
        log.info("No agent worker connected, running incident {} locally", incidentId);
        OneShot oneShot = new OneShot(incidentId, callback, true);
        ProxyConfig proxyConfig = settingsLookup.proxyConfig().orElse(null);
        fallback.start(incidentId, task, llmConfig, proxyConfig, oneShot.callback());
        return oneShot.future();
    }

    public CompletableFuture<IncidentOutcome> continueIncident(String incidentId, String sessionId, String message,
                                                               IncidentCallback callback) {
        AgentLlmConfig llmConfig = settingsLookup.llmConfig().orElse(null);
        if (connectionManager.isConnected()) {
            OneShot oneShot = new OneShot(incidentId, callback, false);
            try {
                connectionManager.continueIncident(incidentId, sessionId, message, llmConfig, oneShot.callback());
            } catch (DispatchException ex) {
                log.warn("Failed to dispatch continuation of incident {}: {}", incidentId, ex.getMessage());
                oneShot.fail("Failed to continue incident: " + ex.getMessage());
            }
            return oneShot.future();
        }
        log.info("No agent worker connected, continuing incident {} locally", incidentId);
        OneShot oneShot = new OneShot(incidentId, callback, true);
        ProxyConfig proxyConfig = settingsLookup.proxyConfig().orElse(null);
        fallback.continueIncident(incidentId, sessionId, message, llmConfig, proxyConfig, oneShot.callback());
        return oneShot.future();
    }

    /**
     * Requests cancellation. Advisory on the worker path; on the local path the agent process is
     * destroyed.
     *
     * @return true when a cancellation was sent or a local run was stopped
     */
    public boolean cancel(String incidentId) {
        if (fallback.cancel(incidentId)) {
            return true;
        }
        if (!connectionManager.isConnected()) {
            return false;
        }
        try {
            connectionManager.cancelIncident(incidentId);
            return true;
        } catch (DispatchException ex) {
            log.warn("Failed to send cancellation for incident {}: {}", incidentId, ex.getMessage());
            return false;
        }
    }

    public boolean isWorkerConnected() {
        return connectionManager.isConnected();
    }

    public ConnectionState workerState() {
        return connectionManager.connectionState();
    }

    private static final class OneShot {
        private final CompletableFuture<IncidentOutcome> future = new CompletableFuture<>();
        private final GuardedCallback guard;

        OneShot(String incidentId, IncidentCallback callback, boolean fallback) {
            Consumer<String> onError = error -> {
                try {
                    callback.error(error);
                } finally {
                    future.complete(IncidentOutcome.failed(incidentId, error, fallback));
                }
            };
            BiConsumer<String, String> onCompleted = (sessionId, response) -> {
                try {
                    callback.completed(sessionId, response);
                } finally {
                    future.complete(IncidentOutcome.completed(incidentId, sessionId, response, fallback));
                }
            };
            this.guard = new GuardedCallback(incidentId, new IncidentCallback(callback.onOutput(), onCompleted, onError));
        }

        IncidentCallback callback() {
            return guard.asCallback();
        }

        void fail(String error) {
            guard.error(error);
        }

        CompletableFuture<IncidentOutcome> future() {
            return future;
        }
    }
}
