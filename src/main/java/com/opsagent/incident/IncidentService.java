package com.opsagent.incident;

import com.opsagent.dispatch.IncidentCallback;
import com.opsagent.dispatch.IncidentDispatcher;
import com.opsagent.dispatch.IncidentOutcome;
import com.opsagent.entity.Incident;
import com.opsagent.entity.IncidentStatus;
import com.opsagent.executor.AgentExecutionException;
import com.opsagent.executor.IncidentWorkspace;
import com.opsagent.repository.IncidentRepository;
import com.opsagent.stream.IncidentStreamHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Creates, continues and cancels incidents, keeping the stored log, status and response in step
 * with the dispatched run.
 */
@Slf4j
@Service
public class IncidentService {

    static final String FINAL_RESPONSE_SEPARATOR = "\n\n--- Final Response ---\n\n";
    private static final int TITLE_LENGTH = 120;

    private final IncidentRepository incidentRepository;
    private final IncidentLogService logService;
    private final IncidentDispatcher dispatcher;
    private final IncidentWorkspace workspace;
    private final IncidentStreamHub streamHub;
    private final Clock clock;

    public IncidentService(IncidentRepository incidentRepository,
                           IncidentLogService logService,
                           IncidentDispatcher dispatcher,
                           IncidentWorkspace workspace,
                           IncidentStreamHub streamHub,
                           Clock clock) {
        this.incidentRepository = incidentRepository;
        this.logService = logService;
        this.dispatcher = dispatcher;
        this.workspace = workspace;
        this.streamHub = streamHub;
        this.clock = clock;
    }

    public IncidentRun create(String task, @Nullable String source) {
        Incident incident = incidentRepository.save(Incident.builder()
                .task(task)
                .title(titleOf(task))
                .source(StringUtils.hasText(source) ? source : "api")
                .status(IncidentStatus.PENDING)
                .build());
        String incidentId = incident.getId().toString();
        try {
            incident.setWorkingDir(workspace.prepare(incidentId).toString());
        } catch (AgentExecutionException ex) {
            incident.setStatus(IncidentStatus.FAILED);
            incident.setResponse("❌ " + ex.getMessage());
            incidentRepository.save(incident);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to prepare workspace.");
        }
        incident = incidentRepository.save(incident);
        log.info("Created incident {} from {}", incidentId, incident.getSource());

        String header = "📝 Incident Task:\n" + task + "\n\n--- Execution Log ---\n\n";
        begin(incidentId, header);
        CompletableFuture<IncidentOutcome> outcome = dispatcher.start(incidentId,
                TaskGuidance.prepend(task, clock), trackingCallback(incidentId, header));
        return new IncidentRun(incident, outcome);
    }

    public IncidentRun continueIncident(UUID id, String message) {
        Incident incident = get(id);
        if (incident.getStatus() == IncidentStatus.RUNNING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Incident is still running.");
        }
        if (!StringUtils.hasText(incident.getSessionId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Incident has no session to continue.");
        }
        String incidentId = id.toString();
        String previousLog = incident.getFullLog() != null ? incident.getFullLog() : "";
        String header = previousLog + "\n\n--- Follow-up ---\n\n💬 " + message + "\n\n";
        begin(incidentId, header);
        CompletableFuture<IncidentOutcome> outcome = dispatcher.continueIncident(incidentId,
                incident.getSessionId(), message, trackingCallback(incidentId, header));
        return new IncidentRun(incident, outcome);
    }

    public boolean cancel(UUID id) {
        Incident incident = get(id);
        if (incident.getStatus().isTerminal()) {
            return false;
        }
        return dispatcher.cancel(id.toString());
    }

    public Incident get(UUID id) {
        return incidentRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Incident not found."));
    }

    public List<Incident> recent() {
        return incidentRepository.findTop50ByOrderByCreatedAtDesc();
    }

    private void begin(String incidentId, String header) {
        logService.markRunning(incidentId, header + "Starting execution...");
        streamHub.running(incidentId);
    }

    private IncidentCallback trackingCallback(String incidentId, String header) {
        AtomicReference<String> streamedLog = new AtomicReference<>("");
        return new IncidentCallback(
                output -> {
                    streamedLog.set(output);
                    logService.updateLog(incidentId, header + output);
                    streamHub.progress(incidentId, output);
                },
                (sessionId, response) -> finish(incidentId, header + streamedLog.get(),
                        IncidentStatus.COMPLETED, sessionId, response),
                error -> finish(incidentId, header + streamedLog.get(),
                        IncidentStatus.FAILED, null, "❌ Error: " + error));
    }

    private void finish(String incidentId, String progressLog, IncidentStatus status, @Nullable String sessionId,
                        String response) {
        String fullLog = StringUtils.hasText(response) ? progressLog + FINAL_RESPONSE_SEPARATOR + response : progressLog;
        logService.complete(incidentId, status, sessionId, fullLog, response);
        streamHub.finished(incidentId, status, response);
        log.info("Incident {} finished with status {}", incidentId, status);
    }

    private static String titleOf(String task) {
        String singleLine = task.replace('\n', ' ').trim();
        return singleLine.length() <= TITLE_LENGTH ? singleLine : singleLine.substring(0, TITLE_LENGTH - 3) + "...";
    }
}
