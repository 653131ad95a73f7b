package com.opsagent.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Worker-side record of an incident's agent session, kept so that continuations can find the
 * session token after a restart.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record WorkerSession(
        @JsonProperty("incident_id") String incidentId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("status") String status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("response") String response,
        @JsonProperty("full_log") String fullLog
) {

    public static final String PENDING = "pending";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    static WorkerSession pending(String incidentId, Instant now) {
        return new WorkerSession(incidentId, null, PENDING, now, now, null, null);
    }

    WorkerSession running(String sessionId, Instant now) {
        return new WorkerSession(incidentId, sessionId != null ? sessionId : this.sessionId, RUNNING,
                startedAt, now, response, fullLog);
    }

    WorkerSession completed(String sessionId, String response, String fullLog, Instant now) {
        String resolved = sessionId != null && !sessionId.isEmpty() ? sessionId : this.sessionId;
        return new WorkerSession(incidentId, resolved, COMPLETED, startedAt, now, response, fullLog);
    }

    WorkerSession failed(String error, Instant now) {
        return new WorkerSession(incidentId, sessionId, FAILED, startedAt, now, error, fullLog);
    }
}
