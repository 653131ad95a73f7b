package com.opsagent.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.entity.IncidentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Pushes incident progress to dashboard sockets. A subscriber that joins mid-run receives the
 * current status, the newest log snapshot and, once the run is over, its outcome.
 */
@Slf4j
@Component
public class IncidentStreamHub {

    static final Duration RETENTION = Duration.ofMinutes(30);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 4 * 1024 * 1024;

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, IncidentProgress> progressByIncident = new ConcurrentHashMap<>();
    private final Map<String, String> incidentBySubscriber = new ConcurrentHashMap<>();

    public IncidentStreamHub(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Marks the incident as running, starting a new run for a continuation.
     */
    public void running(String incidentId) {
        Instant now = clock.instant();
        progressByIncident.values().removeIf(progress -> progress.expired(now.minus(RETENTION)));
        IncidentProgress progress = progressByIncident.computeIfAbsent(incidentId, IncidentProgress::new);
        publish(progress, p -> p.restart(now));
    }

    public void progress(String incidentId, String log) {
        IncidentProgress progress = progressByIncident.get(incidentId);
        if (progress != null) {
            publish(progress, p -> p.output(log, clock.instant()));
        }
    }

    public void finished(String incidentId, IncidentStatus status, String response) {
        IncidentProgress progress = progressByIncident.get(incidentId);
        if (progress != null) {
            publish(progress, p -> p.finish(status, response, clock.instant()));
        }
    }

    /**
     * Replays what the subscriber has not seen yet and adds it for live updates.
     *
     * @return false when nothing is known about the incident
     */
    public boolean subscribe(String incidentId, WebSocketSession session, long sinceId) {
        IncidentProgress progress = progressByIncident.get(incidentId);
        if (progress == null) {
            return false;
        }
        WebSocketSession subscriber =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        synchronized (progress) {
            progress.subscribers().put(session.getId(), subscriber);
            incidentBySubscriber.put(session.getId(), incidentId);
            progress.replaySince(sinceId).forEach(event -> deliver(progress, subscriber, event));
        }
        return true;
    }

    public void unsubscribe(WebSocketSession session) {
        String incidentId = incidentBySubscriber.remove(session.getId());
        if (incidentId == null) {
            return;
        }
        IncidentProgress progress = progressByIncident.get(incidentId);
        if (progress != null) {
            progress.subscribers().remove(session.getId());
        }
    }

    public boolean isRunning(String incidentId) {
        IncidentProgress progress = progressByIncident.get(incidentId);
        return progress != null && progress.running();
    }

    private void publish(IncidentProgress progress, Function<IncidentProgress, IncidentStreamEvent> change) {
        synchronized (progress) {
            IncidentStreamEvent event = change.apply(progress);
            progress.subscribers().values().forEach(subscriber -> deliver(progress, subscriber, event));
        }
    }

    private void deliver(IncidentProgress progress, WebSocketSession subscriber, IncidentStreamEvent event) {
        if (!subscriber.isOpen()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("Cannot serialize {} event of incident {}: {}", event.type(), progress.incidentId(),
                    ex.getOriginalMessage());
            return;
        }
        try {
            subscriber.sendMessage(new TextMessage(payload));
        } catch (IOException | SessionLimitExceededException ex) {
            log.debug("Dropping dashboard subscriber {} of incident {}: {}", subscriber.getId(),
                    progress.incidentId(), ex.getMessage());
            progress.subscribers().remove(subscriber.getId());
            incidentBySubscriber.remove(subscriber.getId());
        }
    }
}
