package com.opsagent.dispatch;

import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IncidentDispatcherTest {

    private WorkerConnectionManager connectionManager;
    private FallbackExecutionService fallback;
    private AgentSettingsLookup settingsLookup;
    private IncidentDispatcher dispatcher;

    private final List<String> errors = new ArrayList<>();
    private final List<String> completions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        connectionManager = mock(WorkerConnectionManager.class);
        fallback = mock(FallbackExecutionService.class);
        settingsLookup = mock(AgentSettingsLookup.class);
        when(settingsLookup.llmConfig()).thenReturn(Optional.of(new AgentLlmConfig("openai", "sk", null, null, null)));
        when(settingsLookup.proxyConfig()).thenReturn(Optional.empty());
        when(settingsLookup.enabledSkills()).thenReturn(List.of());
        dispatcher = new IncidentDispatcher(connectionManager, fallback, settingsLookup);
    }

    private IncidentCallback callback() {
        return new IncidentCallback(null, (s, r) -> completions.add(s + "|" + r), errors::add);
    }

    @Test
    void testDispatchFailureIsReportedThroughCallback() {
        when(connectionManager.isConnected()).thenReturn(true);
        doThrow(new DispatchException("failed to send new_incident to worker: closed"))
                .when(connectionManager).startIncident(eq("inc-1"), anyString(), any(), anyList(), any());

        CompletableFuture<IncidentOutcome> outcome = dispatcher.start("inc-1", "task", callback());

        assertEquals(List.of("Failed to start incident: failed to send new_incident to worker: closed"), errors);
        assertTrue(outcome.isDone());
        IncidentOutcome result = outcome.join();
        assertFalse(result.succeeded());
        assertFalse(result.fallback());
        verifyNoInteractions(fallback);
    }

    @Test
    void testWorkerPathCompletesFutureWhenWorkerReports() {
        when(connectionManager.isConnected()).thenReturn(true);
        List<IncidentCallback> registered = new ArrayList<>();
        doAnswer(invocation -> registered.add(invocation.getArgument(4)))
                .when(connectionManager).startIncident(eq("inc-1"), anyString(), any(), anyList(), any());

        CompletableFuture<IncidentOutcome> outcome = dispatcher.start("inc-1", "task", callback());
        assertFalse(outcome.isDone());

        registered.get(0).onCompleted().accept("sess-1", "done");
        registered.get(0).onError().accept("late error");

        IncidentOutcome result = outcome.join();
        assertTrue(result.succeeded());
        assertEquals("sess-1", result.sessionId());
        assertEquals(List.of("sess-1|done"), completions);
        assertTrue(errors.isEmpty());
    }

    @Test
    void testFallbackUsedWhenNoWorker() {
        when(connectionManager.isConnected()).thenReturn(false);
        ProxyConfig proxy = new ProxyConfig("http://proxy:3128", null, true, false, false);
        when(settingsLookup.proxyConfig()).thenReturn(Optional.of(proxy));
        doAnswer(invocation -> {
            IncidentCallback cb = invocation.getArgument(4);
            cb.onCompleted().accept("sess-local", "local answer");
            return CompletableFuture.completedFuture(null);
        }).when(fallback).start(eq("inc-1"), eq("task"), any(), eq(proxy), any());

        IncidentOutcome result = dispatcher.start("inc-1", "task", callback()).join();

        assertTrue(result.succeeded());
        assertTrue(result.fallback());
        assertEquals("local answer", result.response());
        verify(connectionManager, never()).startIncident(any(), any(), any(), any(), any());
    }

    @Test
    void testContinueDispatchFailure() {
        when(connectionManager.isConnected()).thenReturn(true);
        doThrow(new WorkerNotConnectedException())
                .when(connectionManager).continueIncident(eq("inc-1"), eq("sess-1"), eq("more"), any(), any());

        IncidentOutcome result = dispatcher.continueIncident("inc-1", "sess-1", "more", callback()).join();

        assertFalse(result.succeeded());
        assertEquals(List.of("Failed to continue incident: agent worker not connected"), errors);
    }

    @Test
    void testFailingUserHandlerStillCompletesFuture() {
        when(connectionManager.isConnected()).thenReturn(true);
        doThrow(new DispatchException("closed"))
                .when(connectionManager).startIncident(eq("inc-1"), anyString(), any(), anyList(), any());
        IncidentCallback throwing = new IncidentCallback(null, null, error -> {
            throw new IllegalStateException("handler failed");
        });

        CompletableFuture<IncidentOutcome> outcome = dispatcher.start("inc-1", "task", throwing);

        assertTrue(outcome.isDone());
        assertFalse(outcome.join().succeeded());
    }

    @Test
    void testCancelPrefersLocalRun() {
        when(fallback.cancel("inc-1")).thenReturn(true);

        assertTrue(dispatcher.cancel("inc-1"));
        verify(connectionManager, never()).cancelIncident(any());
    }

    @Test
    void testCancelForwardsToWorker() {
        when(fallback.cancel("inc-1")).thenReturn(false);
        when(connectionManager.isConnected()).thenReturn(true);

        assertTrue(dispatcher.cancel("inc-1"));
        verify(connectionManager).cancelIncident("inc-1");
    }

    @Test
    void testCancelWithoutWorkerOrRun() {
        when(fallback.cancel("inc-1")).thenReturn(false);
        when(connectionManager.isConnected()).thenReturn(false);

        assertFalse(dispatcher.cancel("inc-1"));
    }
}
