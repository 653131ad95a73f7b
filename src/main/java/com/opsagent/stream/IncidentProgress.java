package com.opsagent.stream;

import com.opsagent.entity.IncidentStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Replay state of one incident. Every output carries the whole progress log, so only the newest
 * snapshot is kept next to the current status and the outcome of the run.
 */
final class IncidentProgress {

    private final String incidentId;
    private final Map<String, WebSocketSession> subscribers = new ConcurrentHashMap<>();
    private long lastEventId;
    private IncidentStreamEvent status;
    private IncidentStreamEvent latestOutput;
    private IncidentStreamEvent outcome;
    private Instant finishedAt;

    IncidentProgress(String incidentId) {
        this.incidentId = incidentId;
    }

    String incidentId() {
        return incidentId;
    }

    Map<String, WebSocketSession> subscribers() {
        return subscribers;
    }

    /**
     * Starts a run. The previous run's snapshot and outcome are dropped, event ids keep counting.
     */
    synchronized IncidentStreamEvent restart(Instant now) {
        latestOutput = null;
        outcome = null;
        finishedAt = null;
        status = next(now, IncidentStreamEvent.Kind.STATUS, IncidentStatus.RUNNING, null, null);
        return status;
    }

    synchronized IncidentStreamEvent output(String log, Instant now) {
        latestOutput = next(now, IncidentStreamEvent.Kind.OUTPUT, null, log, null);
        return latestOutput;
    }

    synchronized IncidentStreamEvent finish(IncidentStatus result, String response, Instant now) {
        IncidentStreamEvent.Kind kind = result == IncidentStatus.COMPLETED
                ? IncidentStreamEvent.Kind.COMPLETE
                : IncidentStreamEvent.Kind.ERROR;
        outcome = next(now, kind, result, null, response);
        finishedAt = now;
        return outcome;
    }

    synchronized List<IncidentStreamEvent> replaySince(long sinceId) {
        return Stream.of(status, latestOutput, outcome)
                .filter(Objects::nonNull)
                .filter(event -> event.id() > sinceId)
                .sorted(Comparator.comparingLong(IncidentStreamEvent::id))
                .toList();
    }

    synchronized boolean running() {
        return status != null && finishedAt == null;
    }

    synchronized boolean expired(Instant cutoff) {
        return finishedAt != null && finishedAt.isBefore(cutoff) && subscribers.isEmpty();
    }

    private IncidentStreamEvent next(Instant now, IncidentStreamEvent.Kind kind, IncidentStatus result,
                                     String log, String response) {
        return new IncidentStreamEvent(++lastEventId, now, kind, result, log, response);
    }
}
