package com.opsagent.dispatch;

import org.springframework.lang.Nullable;

/**
 * Terminal result of one dispatched incident attempt.
 *
 * @param sessionId session token to resume with, empty on failure
 * @param response  formatted response on success, error text on failure
 */
public record IncidentOutcome(
        String incidentId,
        boolean succeeded,
        String sessionId,
        String response,
        boolean fallback
) {

    static IncidentOutcome completed(String incidentId, @Nullable String sessionId, String response, boolean fallback) {
        return new IncidentOutcome(incidentId, true, sessionId != null ? sessionId : "", response, fallback);
    }

    static IncidentOutcome failed(String incidentId, String error, boolean fallback) {
        return new IncidentOutcome(incidentId, false, "", error, fallback);
    }
}
