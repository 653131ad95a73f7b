package com.opsagent.incident;

import com.opsagent.dispatch.IncidentLogSink;
import com.opsagent.entity.Incident;
import com.opsagent.entity.IncidentStatus;
import com.opsagent.repository.IncidentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Writes incident progress and outcomes to the database. Failures are logged and absorbed so that
 * persistence problems never interrupt callback delivery.
 */
@Slf4j
@Service
public class IncidentLogService implements IncidentLogSink {

    private final IncidentRepository incidentRepository;

    public IncidentLogService(IncidentRepository incidentRepository) {
        this.incidentRepository = incidentRepository;
    }

    @Override
    public void updateLog(String incidentId, String fullLog) {
        modify(incidentId, "update log", incident -> incident.setFullLog(fullLog));
    }

    @Override
    public void recordOutcome(String incidentId, IncidentStatus status, @Nullable String sessionId, String response) {
        modify(incidentId, "record outcome", incident -> applyOutcome(incident, status, sessionId, response));
    }

    public void markRunning(String incidentId, String fullLog) {
        modify(incidentId, "mark running", incident -> {
            incident.setStatus(IncidentStatus.RUNNING);
            incident.setFullLog(fullLog);
            incident.setCompletedAt(null);
        });
    }

    public void complete(String incidentId, IncidentStatus status, @Nullable String sessionId,
                         String fullLog, String response) {
        modify(incidentId, "complete", incident -> {
            applyOutcome(incident, status, sessionId, response);
            incident.setFullLog(fullLog);
        });
    }

    private void applyOutcome(Incident incident, IncidentStatus status, @Nullable String sessionId, String response) {
        incident.setStatus(status);
        incident.setResponse(response);
        if (StringUtils.hasText(sessionId)) {
            incident.setSessionId(sessionId);
        }
        if (status.isTerminal()) {
            incident.setCompletedAt(OffsetDateTime.now());
        }
    }

    private void modify(String incidentId, String action, Consumer<Incident> change) {
        try {
            Optional<Incident> incident = incidentRepository.findById(UUID.fromString(incidentId));
            if (incident.isEmpty()) {
                log.warn("Cannot {} for unknown incident {}", action, incidentId);
                return;
            }
            change.accept(incident.get());
            incidentRepository.save(incident.get());
        } catch (RuntimeException ex) {
            log.warn("Failed to {} for incident {}: {}", action, incidentId, ex.getMessage());
        }
    }
}
