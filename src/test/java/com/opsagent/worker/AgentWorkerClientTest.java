package com.opsagent.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.config.DispatchProperties;
import com.opsagent.dispatch.WorkerMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AgentWorkerClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DispatchProperties properties;
    private WorkerTaskRunner runner;
    private ScheduledExecutorService scheduler;
    private WebSocketClient webSocketClient;
    private WebSocketSession session;
    private AgentWorkerClient client;

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
        properties.getWorker().setOrchestratorUrl("ws://orchestrator:8080/ws/agent");
        properties.getWorker().setHeartbeatInterval(Duration.ofSeconds(30));
        properties.getWorker().setReconnectDelay(Duration.ofSeconds(5));
        runner = mock(WorkerTaskRunner.class);
        scheduler = mock(ScheduledExecutorService.class);
        webSocketClient = mock(WebSocketClient.class);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        client = new AgentWorkerClient(properties, runner, objectMapper, scheduler, webSocketClient);
    }

    @Test
    void testConnectAnnouncesReadyAndStartsHeartbeat() throws Exception {
        client.afterConnectionEstablished(session);

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        assertEquals("ready", objectMapper.readTree(captor.getValue().getPayload()).get("data").get("status").asText());
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(30_000L), eq(30_000L), eq(TimeUnit.MILLISECONDS));
        assertTrue(client.isConnected());
    }

    @Test
    void testInboundMessagesGoToRunner() throws Exception {
        client.afterConnectionEstablished(session);

        client.handleTextMessage(session, new TextMessage("{\"type\":\"new_incident\",\"incident_id\":\"inc-1\",\"task\":\"t\"}"));
        client.handleTextMessage(session, new TextMessage("garbage"));

        ArgumentCaptor<WorkerMessage> captor = ArgumentCaptor.forClass(WorkerMessage.class);
        verify(runner).handle(captor.capture(), eq(client));
        assertEquals("inc-1", captor.getValue().incidentId());
    }

    @Test
    void testConnectFailureSchedulesReconnect() {
        when(webSocketClient.execute(any(), eq("ws://orchestrator:8080/ws/agent")))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection refused")));

        client.start();

        verify(scheduler).schedule(any(Runnable.class), eq(5_000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void testCloseSchedulesReconnectUnlessStopping() {
        client.afterConnectionEstablished(session);
        client.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(scheduler).schedule(any(Runnable.class), eq(5_000L), eq(TimeUnit.MILLISECONDS));
        assertFalse(client.isConnected());
        assertFalse(client.send(WorkerMessage.heartbeat()));

        client.stop();
        client.afterConnectionClosed(session, CloseStatus.GOING_AWAY);
        verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void testSendFailureReturnsFalse() throws Exception {
        client.afterConnectionEstablished(session);
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());

        assertFalse(client.send(WorkerMessage.output("inc-1", "log")));
    }
}
