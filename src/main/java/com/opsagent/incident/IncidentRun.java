package com.opsagent.incident;

import com.opsagent.dispatch.IncidentOutcome;
import com.opsagent.entity.Incident;

import java.util.concurrent.CompletableFuture;

/**
 * A dispatched incident and the future of its terminal outcome.
 */
public record IncidentRun(Incident incident, CompletableFuture<IncidentOutcome> outcome) {
}
