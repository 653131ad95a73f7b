package com.opsagent.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.config.DispatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the agent binary for one task and supervises it until exit.
 *
 * <p>stdout carries the JSON event stream and stderr carries diagnostics plus the session id
 * banner. Both are drained on {@code agentStreamExecutor} and must reach end-of-stream before the
 * process is joined, otherwise a full pipe can block the child forever.
 */
@Slf4j
@Component
public class AgentProcessExecutor {

    static final String CANCELLED = "execution cancelled";
    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("Session ID: ([a-zA-Z0-9-]+)");
    private static final int STDERR_TAIL_LINES = 20;

    private final DispatchProperties properties;
    private final AgentEventDecoder decoder;
    private final ProcessLauncher processLauncher;
    private final ExecutorService streamExecutor;
    private final Map<String, String> ambientEnvironment;
    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    @Autowired
    public AgentProcessExecutor(DispatchProperties properties,
                                ObjectMapper objectMapper,
                                ProcessLauncher processLauncher,
                                @Qualifier("agentStreamExecutor") ExecutorService streamExecutor) {
        this(properties, objectMapper, processLauncher, streamExecutor, System.getenv());
    }

    AgentProcessExecutor(DispatchProperties properties,
                         ObjectMapper objectMapper,
                         ProcessLauncher processLauncher,
                         ExecutorService streamExecutor,
                         Map<String, String> ambientEnvironment) {
        this.properties = properties;
        this.decoder = new AgentEventDecoder(objectMapper);
        this.processLauncher = processLauncher;
        this.streamExecutor = streamExecutor;
        this.ambientEnvironment = Map.copyOf(ambientEnvironment);
    }

    /**
     * Runs the agent and blocks until it exits.
     *
     * @param onProgress receives the full progress log after every completed item, may be null
     * @return the result, with {@link ExecutionResult#error()} set when the run failed after start
     * @throws AgentExecutionException when the process cannot be started
     */
    public ExecutionResult execute(ExecutionRequest request, @Nullable Consumer<String> onProgress) {
        Instant startedAt = Instant.now();
        List<String> command = buildCommand(request);
        DispatchProperties.ExecutorConfig config = properties.getExecutor();
        Map<String, String> environment = SafeEnvironment.forRequest(
                request, ambientEnvironment, config.getEnvPrefix(), config.getMcpGatewayUrl());

        log.info("Starting agent for incident {} in {} (resume={})",
                request.incidentId(), request.workingDir(), request.isResume());
        Process process;
        try {
            process = processLauncher.launch(command, request.workingDir(), environment);
        } catch (IOException ex) {
            throw new AgentExecutionException("failed to start agent: " + ex.getMessage(), ex);
        }

        ActiveRun run = new ActiveRun(process);
        activeRuns.put(request.incidentId(), run);
        try {
            closeStdin(process);
            AgentEventAccumulator accumulator = new AgentEventAccumulator();
            StderrCapture stderr = new StderrCapture();

            CompletableFuture<Void> stdoutDrain = CompletableFuture.runAsync(
                    () -> drainStdout(process.getInputStream(), accumulator, request.incidentId(), onProgress),
                    streamExecutor);
            CompletableFuture<Void> stderrDrain = CompletableFuture.runAsync(
                    () -> drainStderr(process.getErrorStream(), stderr),
                    streamExecutor);
            CompletableFuture.allOf(stdoutDrain, stderrDrain).join();

            int exitCode = awaitExit(process, run);
            Duration elapsed = Duration.between(startedAt, Instant.now());
            ExecutionResult result = buildResult(request, accumulator, stderr, exitCode, elapsed, run.cancelReason());
            if (result.succeeded()) {
                log.info("Agent finished incident {}: {} chars, session {}, {} tokens, {}ms",
                        request.incidentId(), result.output().length(), result.sessionId(),
                        result.tokensUsed(), result.executionTimeMs());
            } else {
                log.warn("Agent failed incident {}: {}", request.incidentId(), result.error());
            }
            return result;
        } finally {
            activeRuns.remove(request.incidentId(), run);
        }
    }

    public boolean cancel(String incidentId) {
        return cancel(incidentId, CANCELLED);
    }

    /**
     * Destroys the process tree of a running incident. The pending {@link #execute} call still
     * returns, with {@code reason} as its error.
     */
    public boolean cancel(String incidentId, String reason) {
        ActiveRun run = activeRuns.get(incidentId);
        if (run == null) {
            return false;
        }
        log.info("Cancelling agent run for incident {}: {}", incidentId, reason);
        run.cancel(reason);
        return true;
    }

    public boolean isRunning(String incidentId) {
        return activeRuns.containsKey(incidentId);
    }

    List<String> buildCommand(ExecutionRequest request) {
        List<String> command = new ArrayList<>();
        command.add(properties.getExecutor().getBinary());
        command.add("exec");
        if (request.isResume()) {
            command.add("resume");
            command.add(request.sessionId());
        }
        command.add("--skip-git-repo-check");
        command.add("--dangerously-bypass-approvals-and-sandbox");
        command.add("--json");
        command.add(request.task());
        return command;
    }

    private void drainStdout(InputStream stdout, AgentEventAccumulator accumulator, String incidentId,
                             @Nullable Consumer<String> onProgress) {
        int decoded = decoder.decode(stdout, event -> {
            if (accumulator.fold(event) && onProgress != null) {
                notifyProgress(onProgress, accumulator.progressLog(), incidentId);
            }
        });
        log.debug("stdout closed for incident {} after {} events", incidentId, decoded);
    }

    private void notifyProgress(Consumer<String> onProgress, String progressLog, String incidentId) {
        try {
            onProgress.accept(progressLog);
        } catch (RuntimeException ex) {
            log.warn("Progress callback failed for incident {}: {}", incidentId, ex.getMessage());
        }
    }

    private void drainStderr(InputStream stderr, StderrCapture capture) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                capture.accept(line);
            }
        } catch (IOException ex) {
            log.debug("stderr read ended with error: {}", ex.getMessage());
        }
    }

    private int awaitExit(Process process, ActiveRun run) {
        try {
            return process.waitFor();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            run.cancel("execution interrupted");
            return -1;
        }
    }

    private ExecutionResult buildResult(ExecutionRequest request, AgentEventAccumulator accumulator,
                                        StderrCapture stderr, int exitCode, Duration elapsed,
                                        @Nullable String cancelReason) {
        String output = accumulator.finalOutput();
        List<String> errors = accumulator.errorMessages();
        String sessionId = firstNonBlank(stderr.sessionId(), accumulator.threadId(), request.sessionId());

        String error = null;
        if (cancelReason != null) {
            error = cancelReason;
        } else if (exitCode != 0) {
            error = "agent execution failed: " + describeFailure(exitCode, errors, stderr.tail());
        } else if (output.isEmpty() && accumulator.tokensUsed() == 0) {
            if (!errors.isEmpty()) {
                error = "agent error: " + errors.get(errors.size() - 1);
            } else if (StringUtils.hasText(stderr.tail())) {
                error = "agent returned empty response: " + stderr.tail();
            }
        }
        return new ExecutionResult(output, sessionId, elapsed, accumulator.tokensUsed(),
                accumulator.progressLog(), errors, exitCode, error);
    }

    private String describeFailure(int exitCode, List<String> errors, String stderrTail) {
        if (!errors.isEmpty()) {
            return errors.get(errors.size() - 1);
        }
        String description = "exit code " + exitCode;
        return StringUtils.hasText(stderrTail) ? description + ": " + stderrTail : description;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate;
            }
        }
        return "";
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException ex) {
            log.debug("Failed to close agent stdin: {}", ex.getMessage());
        }
    }

    private static final class StderrCapture {
        private final Deque<String> tail = new ArrayDeque<>();
        private volatile String sessionId;

        synchronized void accept(String line) {
            Matcher matcher = SESSION_ID_PATTERN.matcher(line);
            if (matcher.find()) {
                sessionId = matcher.group(1);
                log.debug("Agent session id {}", sessionId);
            }
            if (line.isBlank()) {
                return;
            }
            log.debug("agent stderr: {}", line);
            tail.addLast(line);
            if (tail.size() > STDERR_TAIL_LINES) {
                tail.removeFirst();
            }
        }

        String sessionId() {
            return sessionId;
        }

        synchronized String tail() {
            return String.join("\n", tail).trim();
        }
    }

    private static final class ActiveRun {
        private final Process process;
        private final AtomicReference<String> cancelReason = new AtomicReference<>();

        ActiveRun(Process process) {
            this.process = process;
        }

        void cancel(String reason) {
            cancelReason.compareAndSet(null, reason);
            try {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
            } catch (UnsupportedOperationException ex) {
                log.debug("Process tree not available, destroying the agent process only");
            }
            process.destroyForcibly();
        }

        String cancelReason() {
            return cancelReason.get();
        }
    }
}
