package com.opsagent.dispatch;

import com.opsagent.config.DispatchProperties;
import com.opsagent.executor.AgentExecutionException;
import com.opsagent.executor.AgentProcessExecutor;
import com.opsagent.executor.ExecutionRequest;
import com.opsagent.executor.ExecutionResult;
import com.opsagent.executor.IncidentWorkspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class FallbackExecutionServiceTest {

    @TempDir
    Path tempDir;

    private AgentProcessExecutor executor;
    private ExecutorService incidentExecutor;
    private DispatchProperties properties;
    private FallbackExecutionService service;

    private final List<String> outputs = new CopyOnWriteArrayList<>();
    private final List<String> completions = new CopyOnWriteArrayList<>();
    private final List<String> errors = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = mock(AgentProcessExecutor.class);
        incidentExecutor = Executors.newCachedThreadPool();
        properties = new DispatchProperties();
        properties.getExecutor().setWorkspaceRoot(tempDir.toString());
        service = new FallbackExecutionService(executor, new IncidentWorkspace(properties), incidentExecutor, properties);
    }

    @AfterEach
    void tearDown() {
        incidentExecutor.shutdownNow();
    }

    private IncidentCallback callback() {
        return new IncidentCallback(outputs::add, (sessionId, response) -> completions.add(sessionId + "|" + response),
                errors::add);
    }

    private static ExecutionResult success(String output, int tokens) {
        return new ExecutionResult(output, "sess-1", Duration.ofMillis(1500), tokens, "log", List.of(), 0, null);
    }

    @Test
    void testLocalRunStreamsAndCompletes() throws Exception {
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            Consumer<String> progress = invocation.getArgument(1);
            progress.accept("🤔 checking");
            return success("Disk cleaned", 42);
        });

        service.start("inc-1", "clean disk", null, null, callback()).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("🤔 checking"), outputs);
        assertEquals(List.of("sess-1|Disk cleaned\n\n---\n⏱️ Time: 1.5s | 🎯 Tokens: 42"), completions);
        assertTrue(errors.isEmpty());

        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executor).execute(request.capture(), any());
        assertEquals(tempDir.resolve("inc-1"), request.getValue().workingDir());
        assertFalse(request.getValue().isResume());
    }

    @Test
    void testContinuationResumesSession() throws Exception {
        when(executor.execute(any(), any())).thenReturn(success("follow-up answer", 0));

        service.continueIncident("inc-1", "sess-1", "and now?", null, null, callback()).get(5, TimeUnit.SECONDS);

        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executor).execute(request.capture(), any());
        assertEquals("sess-1", request.getValue().sessionId());
        assertEquals("and now?", request.getValue().task());
        assertEquals(1, completions.size());
    }

    @Test
    void testFailedRunReportsError() throws Exception {
        when(executor.execute(any(), any())).thenReturn(new ExecutionResult("partial", "", Duration.ofSeconds(1), 0,
                "", List.of("invalid key"), 1, "agent execution failed: invalid key"));

        service.start("inc-1", "task", null, null, callback()).get(5, TimeUnit.SECONDS);

        assertTrue(completions.isEmpty());
        assertEquals(List.of("agent execution failed: invalid key\n\nErrors:\n1. invalid key\n"), errors);
    }

    @Test
    void testStartFailureReportsError() throws Exception {
        when(executor.execute(any(), any())).thenThrow(new AgentExecutionException("failed to start agent: no binary", null));

        service.start("inc-1", "task", null, null, callback()).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("failed to start agent: no binary"), errors);
    }

    @Test
    void testTimeoutCancelsRunAndReportsOnce() throws Exception {
        properties.getFallback().setTimeout(Duration.ofMillis(200));
        CountDownLatch released = new CountDownLatch(1);
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            released.await(5, TimeUnit.SECONDS);
            return new ExecutionResult("", "", Duration.ofMillis(250), 0, "", List.of(), 137, "cancelled");
        });
        when(executor.cancel(eq("inc-1"), anyString())).thenAnswer(invocation -> {
            released.countDown();
            return true;
        });

        service.start("inc-1", "task", null, null, callback()).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("execution timed out after 200ms"), errors);
        verify(executor).cancel("inc-1", "execution timed out after 200ms");
        Thread.sleep(100);
        assertEquals(1, errors.size());
        assertTrue(completions.isEmpty());
    }

    @Test
    void testCancelDelegatesToExecutor() {
        when(executor.cancel("inc-1")).thenReturn(true);

        assertTrue(service.cancel("inc-1"));
        assertFalse(service.cancel("inc-2"));
    }
}
