package com.opsagent.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.config.DispatchProperties;
import com.opsagent.dispatch.WorkerMessage;
import jakarta.annotation.PreDestroy;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Worker side of the dispatch connection: dials the orchestrator, keeps the link alive with
 * heartbeats and reconnects after the configured delay whenever it drops.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "dispatch.worker", name = "enabled", havingValue = "true")
public class AgentWorkerClient extends TextWebSocketHandler implements WorkerChannel {

    private final DispatchProperties properties;
    private final WorkerTaskRunner runner;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final WebSocketClient client;

    private volatile WebSocketSession session;
    private volatile boolean stopping;
    private ScheduledFuture<?> heartbeat;

    public AgentWorkerClient(DispatchProperties properties,
                             WorkerTaskRunner runner,
                             ObjectMapper objectMapper,
                             @Qualifier("workerScheduler") ScheduledExecutorService scheduler) {
        this(properties, runner, objectMapper, scheduler, createClient(properties));
    }

    AgentWorkerClient(DispatchProperties properties,
                      WorkerTaskRunner runner,
                      ObjectMapper objectMapper,
                      ScheduledExecutorService scheduler,
                      WebSocketClient client) {
        this.properties = properties;
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.client = client;
    }

    private static WebSocketClient createClient(DispatchProperties properties) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        int maxBytes = (int) Math.min(Integer.MAX_VALUE, properties.getMaxMessageSize().toBytes());
        container.setDefaultMaxTextMessageBufferSize(maxBytes);
        return new StandardWebSocketClient(container);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        connect();
    }

    void connect() {
        if (stopping) {
            return;
        }
        String url = properties.getWorker().getOrchestratorUrl();
        log.info("Connecting to orchestrator at {}", url);
        client.execute(this, url).whenComplete((connected, ex) -> {
            if (ex != null) {
                log.warn("Failed to connect to orchestrator: {}", ex.getMessage());
                scheduleReconnect();
            }
        });
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession newSession) {
        this.session = newSession;
        log.info("Connected to orchestrator (session {})", newSession.getId());
        send(WorkerMessage.status("ready"));
        startHeartbeat();
    }

    @Override
    protected void handleTextMessage(WebSocketSession from, TextMessage message) {
        WorkerMessage parsed;
        try {
            parsed = objectMapper.readValue(message.getPayload(), WorkerMessage.class);
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unparseable message from orchestrator: {}", ex.getOriginalMessage());
            return;
        }
        runner.handle(parsed, this);
    }

    @Override
    public void handleTransportError(WebSocketSession from, Throwable exception) {
        log.warn("Transport error on orchestrator connection: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
        log.info("Disconnected from orchestrator: {}", status);
        if (session == closed) {
            session = null;
        }
        stopHeartbeat();
        scheduleReconnect();
    }

    @Override
    public boolean send(WorkerMessage message) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            log.warn("Dropping {} message for incident {}: not connected", message.type(), message.incidentId());
            return false;
        }
        try {
            String payload = objectMapper.writeValueAsString(message);
            synchronized (current) {
                current.sendMessage(new TextMessage(payload));
            }
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.warn("Failed to send {} message to orchestrator: {}", message.type(), ex.getMessage());
            return false;
        }
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @PreDestroy
    public void stop() {
        stopping = true;
        stopHeartbeat();
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.GOING_AWAY);
            } catch (IOException ex) {
                log.debug("Error closing orchestrator connection: {}", ex.getMessage());
            }
        }
    }

    private synchronized void startHeartbeat() {
        stopHeartbeat();
        long intervalMs = properties.getWorker().getHeartbeatInterval().toMillis();
        heartbeat = scheduler.scheduleAtFixedRate(() -> send(WorkerMessage.heartbeat()),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private synchronized void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
    }

    private void scheduleReconnect() {
        if (stopping) {
            return;
        }
        long delayMs = properties.getWorker().getReconnectDelay().toMillis();
        log.info("Reconnecting to orchestrator in {}ms", delayMs);
        scheduler.schedule(this::connect, delayMs, TimeUnit.MILLISECONDS);
    }
}
