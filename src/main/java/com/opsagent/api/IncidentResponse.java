package com.opsagent.api;

import com.opsagent.entity.Incident;
import com.opsagent.entity.IncidentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IncidentResponse(
        UUID id,
        String source,
        String title,
        String task,
        IncidentStatus status,
        String sessionId,
        String fullLog,
        String response,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime completedAt
) {
    public static IncidentResponse from(Incident incident) {
        return new IncidentResponse(
                incident.getId(),
                incident.getSource(),
                incident.getTitle(),
                incident.getTask(),
                incident.getStatus(),
                incident.getSessionId(),
                incident.getFullLog(),
                incident.getResponse(),
                incident.getCreatedAt(),
                incident.getUpdatedAt(),
                incident.getCompletedAt()
        );
    }
}
