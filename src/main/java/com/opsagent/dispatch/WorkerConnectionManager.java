package com.opsagent.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.executor.ResultFormatter;
import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the single worker connection and correlates requests sent over it with the responses routed
 * back through the {@link CallbackRegistry}.
 *
 * <p>The connection handle is guarded by its own lock, never held together with the registry lock.
 * Outbound frames are serialized by a separate write lock. A new worker replaces and closes the
 * previous one.
 */
@Slf4j
@Component
public class WorkerConnectionManager {

    private final CallbackRegistry registry;
    private final AgentSettingsLookup settingsLookup;
    private final ObjectMapper objectMapper;
    private final ReentrantReadWriteLock connectionLock = new ReentrantReadWriteLock();
    private final ReentrantLock writeLock = new ReentrantLock();

    private WebSocketSession session;
    private ConnectionState state = ConnectionState.CLOSED;

    public WorkerConnectionManager(CallbackRegistry registry,
                                   AgentSettingsLookup settingsLookup,
                                   ObjectMapper objectMapper) {
        this.registry = registry;
        this.settingsLookup = settingsLookup;
        this.objectMapper = objectMapper;
    }

    public void attach(WebSocketSession newSession) {
        connectionLock.writeLock().lock();
        try {
            WebSocketSession previous = session;
            if (previous != null && previous != newSession) {
                log.info("Replacing worker connection {} with {}", previous.getId(), newSession.getId());
                closeQuietly(previous);
            }
            state = ConnectionState.CONNECTING;
            session = newSession;
            state = ConnectionState.READY;
        } finally {
            connectionLock.writeLock().unlock();
        }
        log.info("Agent worker connected: {} from {}", newSession.getId(), newSession.getRemoteAddress());
    }

    /**
     * Clears the connection if {@code closed} is the current one; a late close of a replaced
     * session is ignored.
     */
    public boolean detach(WebSocketSession closed) {
        connectionLock.writeLock().lock();
        try {
            if (session != closed) {
                return false;
            }
            session = null;
            state = ConnectionState.CLOSED;
        } finally {
            connectionLock.writeLock().unlock();
        }
        log.info("Agent worker disconnected: {}", closed.getId());
        return true;
    }

    public boolean isConnected() {
        connectionLock.readLock().lock();
        try {
            return session != null && state == ConnectionState.READY;
        } finally {
            connectionLock.readLock().unlock();
        }
    }

    public ConnectionState connectionState() {
        connectionLock.readLock().lock();
        try {
            return state;
        } finally {
            connectionLock.readLock().unlock();
        }
    }

    /**
     * Registers the callback and sends {@code new_incident}. On failure the registration is
     * removed before the exception propagates.
     *
     * @throws DispatchException when the message could not be written
     */
    public void startIncident(String incidentId, String task, @Nullable AgentLlmConfig llmConfig,
                              @Nullable List<String> enabledSkills, IncidentCallback callback) {
        WorkerMessage message = WorkerMessage.newIncident(incidentId, task, llmConfig,
                settingsLookup.proxyConfig().orElse(null), enabledSkills);
        registerAndSend(incidentId, callback, message);
        log.info("Dispatched incident {} to worker", incidentId);
    }

    public void continueIncident(String incidentId, String sessionId, String message,
                                 @Nullable AgentLlmConfig llmConfig, IncidentCallback callback) {
        WorkerMessage envelope = WorkerMessage.continueIncident(incidentId, sessionId, message, llmConfig,
                settingsLookup.proxyConfig().orElse(null), settingsLookup.enabledSkills());
        registerAndSend(incidentId, callback, envelope);
        log.info("Dispatched continuation of incident {} (session {}) to worker", incidentId, sessionId);
    }

    /**
     * Forwards a cancellation. The worker decides how to stop the run; the terminal callback, if
     * any, still arrives through the normal path.
     */
    public void cancelIncident(String incidentId) {
        send(WorkerMessage.cancelIncident(incidentId));
        log.info("Sent cancellation for incident {}", incidentId);
    }

    public void broadcastProxyConfig(ProxyConfig proxyConfig) {
        send(WorkerMessage.proxyConfigUpdate(proxyConfig));
        log.info("Sent proxy configuration update to worker");
    }

    /**
     * Routes one inbound frame. Malformed frames and unknown types are logged and ignored.
     */
    public void handleMessage(String payload) {
        WorkerMessage message;
        try {
            message = objectMapper.readValue(payload, WorkerMessage.class);
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unparseable worker message: {}", ex.getOriginalMessage());
            return;
        }
        WorkerMessageType type = message.messageType().orElse(null);
        if (type == null) {
            log.warn("Ignoring unknown worker message type: {}", message.type());
            return;
        }
        log.debug("Worker message type={} incident={}", message.type(), message.incidentId());
        if (type.isIncidentReport() && !StringUtils.hasText(message.incidentId())) {
            log.warn("Ignoring {} message without incident id", message.type());
            return;
        }
        switch (type) {
            case HEARTBEAT -> {
                // liveness only
            }
            case STATUS -> log.info("Worker status: {}",
                    message.data() != null ? message.data().get("status") : null);
            case AGENT_OUTPUT -> registry.dispatchOutput(message.incidentId(),
                    message.output() != null ? message.output() : "");
            case AGENT_COMPLETED -> handleCompleted(message);
            case AGENT_ERROR -> handleError(message);
            default -> log.warn("Ignoring worker message of outbound type {}", message.type());
        }
    }

    private void handleCompleted(WorkerMessage message) {
        log.info("Incident {} completed with session {}, tokens: {}, time: {}ms", message.incidentId(),
                message.sessionId(), message.tokensUsedOrZero(), message.executionTimeMsOrZero());
        String response = ResultFormatter.appendMetrics(message.output(),
                Duration.ofMillis(message.executionTimeMsOrZero()), message.tokensUsedOrZero());
        registry.dispatchCompleted(message.incidentId(),
                message.sessionId() != null ? message.sessionId() : "", response);
    }

    private void handleError(WorkerMessage message) {
        String error = message.error() != null ? message.error() : "unknown worker error";
        log.warn("Incident {} failed on worker: {}", message.incidentId(), error);
        registry.dispatchError(message.incidentId(), error);
    }

    private void registerAndSend(String incidentId, IncidentCallback callback, WorkerMessage message) {
        registry.register(incidentId, callback);
        try {
            send(message);
        } catch (DispatchException ex) {
            registry.unregister(incidentId);
            throw ex;
        }
    }

    private void send(WorkerMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new DispatchException("failed to encode " + message.type() + " message", ex);
        }
        WebSocketSession target = currentSession();
        if (target == null) {
            throw new WorkerNotConnectedException();
        }
        writeLock.lock();
        try {
            target.sendMessage(new TextMessage(payload));
        } catch (IOException | IllegalStateException ex) {
            throw new DispatchException("failed to send " + message.type() + " to worker: " + ex.getMessage(), ex);
        } finally {
            writeLock.unlock();
        }
    }

    private WebSocketSession currentSession() {
        connectionLock.readLock().lock();
        try {
            return state == ConnectionState.READY ? session : null;
        } finally {
            connectionLock.readLock().unlock();
        }
    }

    private void closeQuietly(WebSocketSession previous) {
        state = ConnectionState.CLOSING;
        try {
            previous.close(CloseStatus.SERVICE_RESTARTED);
        } catch (IOException ex) {
            log.debug("Failed to close replaced worker connection: {}", ex.getMessage());
        }
    }
}
