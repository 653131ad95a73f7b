package com.opsagent.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;

/**
 * Dashboard endpoint: {@code /ws/incidents?incidentId=<id>&since=<eventId>}. Push only.
 */
@Slf4j
@Component
public class IncidentStreamWebSocketHandler extends TextWebSocketHandler {

    static final CloseStatus MISSING_INCIDENT = CloseStatus.BAD_DATA.withReason("incidentId is required");
    static final CloseStatus UNKNOWN_INCIDENT = CloseStatus.NOT_ACCEPTABLE.withReason("no progress for incident");

    private final IncidentStreamHub hub;

    public IncidentStreamWebSocketHandler(IncidentStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        MultiValueMap<String, String> query = session.getUri() != null
                ? UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams()
                : new LinkedMultiValueMap<>();
        String incidentId = query.getFirst("incidentId");
        if (!StringUtils.hasText(incidentId)) {
            session.close(MISSING_INCIDENT);
            return;
        }
        if (!hub.subscribe(incidentId, session, lastSeenEventId(query.getFirst("since")))) {
            session.close(UNKNOWN_INCIDENT);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Dashboard socket {} failed: {}", session.getId(), exception.getMessage());
        hub.unsubscribe(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.unsubscribe(session);
    }

    static long lastSeenEventId(String raw) {
        if (!StringUtils.hasText(raw)) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(raw.trim()));
        } catch (NumberFormatException ex) {
            log.debug("Ignoring invalid since value {}", raw);
            return 0L;
        }
    }
}
