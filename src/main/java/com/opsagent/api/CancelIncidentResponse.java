package com.opsagent.api;

public record CancelIncidentResponse(
        String status,
        String message
) {
    public static CancelIncidentResponse success() {
        return new CancelIncidentResponse("success", "Incident cancellation requested.");
    }

    public static CancelIncidentResponse notRunning() {
        return new CancelIncidentResponse("not-running", "Incident is not running.");
    }
}
