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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class IncidentServiceTest {

    private static final UUID ID = UUID.fromString("7f1d9a52-3c4e-4d7a-9c1b-0a2b3c4d5e6f");

    private IncidentRepository incidentRepository;
    private IncidentLogService logService;
    private IncidentDispatcher dispatcher;
    private IncidentWorkspace workspace;
    private IncidentStreamHub streamHub;
    private IncidentService service;

    @BeforeEach
    void setUp() {
        incidentRepository = mock(IncidentRepository.class);
        logService = mock(IncidentLogService.class);
        dispatcher = mock(IncidentDispatcher.class);
        workspace = mock(IncidentWorkspace.class);
        streamHub = mock(IncidentStreamHub.class);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
        service = new IncidentService(incidentRepository, logService, dispatcher, workspace, streamHub, clock);

        when(incidentRepository.save(any(Incident.class))).thenAnswer(invocation -> {
            Incident incident = invocation.getArgument(0);
            if (incident.getId() == null) {
                incident.setId(ID);
            }
            return incident;
        });
        when(workspace.prepare(anyString())).thenReturn(Path.of("/tmp/workspaces", ID.toString()));
    }

    private IncidentCallback capturedStartCallback() {
        ArgumentCaptor<IncidentCallback> callback = ArgumentCaptor.forClass(IncidentCallback.class);
        verify(dispatcher).start(eq(ID.toString()), anyString(), callback.capture());
        return callback.getValue();
    }

    @Test
    void testCreateDispatchesGuidedTask() {
        when(dispatcher.start(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        IncidentRun run = service.create("High CPU on web01", "zabbix");

        assertEquals(ID, run.incident().getId());
        assertEquals("zabbix", run.incident().getSource());
        assertEquals("High CPU on web01", run.incident().getTitle());
        assertEquals("/tmp/workspaces/" + ID, run.incident().getWorkingDir());
        verify(dispatcher).start(eq(ID.toString()), eq("Current time: 2026-03-01 10:15:30 UTC\n"
                + "Please help with the following incident or request:\n\nHigh CPU on web01"), any());
        verify(logService).markRunning(eq(ID.toString()), startsWith("📝 Incident Task:\nHigh CPU on web01"));
        verify(streamHub).running(ID.toString());
    }

    @Test
    void testCallbackPersistsProgressAndOutcome() {
        when(dispatcher.start(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        service.create("disk full", null);
        IncidentCallback callback = capturedStartCallback();
        String header = "📝 Incident Task:\ndisk full\n\n--- Execution Log ---\n\n";

        callback.onOutput().accept("🤔 checking");
        callback.onCompleted().accept("sess-1", "Cleaned /var/log");

        verify(logService).updateLog(ID.toString(), header + "🤔 checking");
        verify(streamHub).progress(ID.toString(), "🤔 checking");
        verify(logService).complete(ID.toString(), IncidentStatus.COMPLETED, "sess-1",
                header + "🤔 checking" + IncidentService.FINAL_RESPONSE_SEPARATOR + "Cleaned /var/log",
                "Cleaned /var/log");
        verify(streamHub).finished(ID.toString(), IncidentStatus.COMPLETED, "Cleaned /var/log");
    }

    @Test
    void testErrorMarksIncidentFailed() {
        when(dispatcher.start(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        service.create("disk full", null);

        capturedStartCallback().onError().accept("agent worker not connected");

        verify(logService).complete(eq(ID.toString()), eq(IncidentStatus.FAILED), isNull(), anyString(),
                eq("❌ Error: agent worker not connected"));
        verify(streamHub).finished(ID.toString(), IncidentStatus.FAILED, "❌ Error: agent worker not connected");
    }

    @Test
    void testCreateFailsWhenWorkspaceCannotBePrepared() {
        when(workspace.prepare(anyString())).thenThrow(new AgentExecutionException("disk read-only", null));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.create("task", null));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ex.getStatusCode());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testContinueUsesStoredSession() {
        Incident incident = Incident.builder().id(ID).task("disk full").status(IncidentStatus.COMPLETED)
                .sessionId("sess-1").fullLog("previous log").build();
        when(incidentRepository.findById(ID)).thenReturn(Optional.of(incident));
        CompletableFuture<IncidentOutcome> outcome = new CompletableFuture<>();
        when(dispatcher.continueIncident(anyString(), anyString(), anyString(), any())).thenReturn(outcome);

        IncidentRun run = service.continueIncident(ID, "what about /tmp?");

        assertSame(outcome, run.outcome());
        verify(dispatcher).continueIncident(eq(ID.toString()), eq("sess-1"), eq("what about /tmp?"), any());
        verify(logService).markRunning(eq(ID.toString()),
                startsWith("previous log\n\n--- Follow-up ---\n\n💬 what about /tmp?"));
    }

    @Test
    void testContinueRejectsRunningIncident() {
        Incident incident = Incident.builder().id(ID).task("t").status(IncidentStatus.RUNNING).sessionId("s").build();
        when(incidentRepository.findById(ID)).thenReturn(Optional.of(incident));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.continueIncident(ID, "more"));
        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    @Test
    void testContinueRequiresSession() {
        Incident incident = Incident.builder().id(ID).task("t").status(IncidentStatus.FAILED).build();
        when(incidentRepository.findById(ID)).thenReturn(Optional.of(incident));

        assertThrows(ResponseStatusException.class, () -> service.continueIncident(ID, "more"));
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testCancel() {
        when(incidentRepository.findById(ID)).thenReturn(Optional.of(
                Incident.builder().id(ID).task("t").status(IncidentStatus.RUNNING).build()));
        when(dispatcher.cancel(ID.toString())).thenReturn(true);

        assertTrue(service.cancel(ID));
    }

    @Test
    void testCancelFinishedIncident() {
        when(incidentRepository.findById(ID)).thenReturn(Optional.of(
                Incident.builder().id(ID).task("t").status(IncidentStatus.COMPLETED).build()));

        assertFalse(service.cancel(ID));
        verify(dispatcher, never()).cancel(anyString());
    }

    @Test
    void testGetUnknownIncident() {
        when(incidentRepository.findById(ID)).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.get(ID));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
