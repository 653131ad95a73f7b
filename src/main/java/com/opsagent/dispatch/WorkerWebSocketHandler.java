package com.opsagent.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Server endpoint the agent worker dials. Messages of one session are delivered sequentially, so
 * this is the connection's read loop.
 */
@Slf4j
@Component
public class WorkerWebSocketHandler extends TextWebSocketHandler {

    private final WorkerConnectionManager connectionManager;

    public WorkerWebSocketHandler(WorkerConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connectionManager.attach(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        connectionManager.handleMessage(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Worker connection {} transport error: {}", session.getId(), exception.getMessage());
        connectionManager.detach(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Worker connection {} closed: {}", session.getId(), status);
        connectionManager.detach(session);
    }
}
