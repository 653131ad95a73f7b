package com.opsagent.dispatch;

import com.opsagent.entity.IncidentStatus;
import org.springframework.lang.Nullable;

/**
 * Durable incident log used when worker traffic arrives for an incident nobody is waiting on.
 * Implementations must not throw.
 */
public interface IncidentLogSink {

    void updateLog(String incidentId, String fullLog);

    void recordOutcome(String incidentId, IncidentStatus status, @Nullable String sessionId, String response);
}
