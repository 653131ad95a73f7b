package com.opsagent.api;

import com.opsagent.incident.IncidentRun;
import com.opsagent.incident.IncidentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/incidents")
public class IncidentController {

    private final IncidentService incidentService;

    public IncidentController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public IncidentResponse create(@Valid @RequestBody CreateIncidentRequest request) {
        IncidentRun run = incidentService.create(request.task(), request.source());
        return IncidentResponse.from(run.incident());
    }

    @PostMapping("/{id}/continue")
    public IncidentResponse continueIncident(@PathVariable UUID id,
                                             @Valid @RequestBody ContinueIncidentRequest request) {
        IncidentRun run = incidentService.continueIncident(id, request.message());
        return IncidentResponse.from(run.incident());
    }

    @PostMapping("/{id}/cancel")
    public CancelIncidentResponse cancel(@PathVariable UUID id) {
        return incidentService.cancel(id) ? CancelIncidentResponse.success() : CancelIncidentResponse.notRunning();
    }

    @GetMapping("/{id}")
    public IncidentResponse get(@PathVariable UUID id) {
        return IncidentResponse.from(incidentService.get(id));
    }

    @GetMapping
    public List<IncidentResponse> list() {
        return incidentService.recent().stream()
                .map(IncidentResponse::from)
                .toList();
    }
}
