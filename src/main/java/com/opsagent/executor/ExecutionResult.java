package com.opsagent.executor;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one agent run. A run that started always produces one of these, even when it
 * failed; {@code error} is null only on success.
 *
 * @param output        final agent message (or last reasoning when no message was produced)
 * @param sessionId     resumable session token, empty when none was issued
 * @param executionTime wall-clock duration of the run
 * @param tokensUsed    input + output tokens from the last usage report
 * @param fullLog       human-readable reasoning and command transcript
 * @param errorMessages error messages reported by the agent's event stream
 * @param exitCode      process exit code, -1 when the process never exited normally
 * @param error         terminal error, null on success
 */
public record ExecutionResult(
        String output,
        String sessionId,
        Duration executionTime,
        int tokensUsed,
        String fullLog,
        List<String> errorMessages,
        int exitCode,
        @Nullable String error
) {

    public ExecutionResult {
        errorMessages = errorMessages != null ? List.copyOf(errorMessages) : List.of();
    }

    public boolean succeeded() {
        return error == null;
    }

    public long executionTimeMs() {
        return executionTime.toMillis();
    }
}
