package com.opsagent.executor;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable rendering of agent results for incident responses.
 */
public final class ResultFormatter {

    static final String NO_OUTPUT = "✅ Task completed (no output)";

    private ResultFormatter() {
    }

    /**
     * Formats a duration as {@code 45ms}, {@code 1.5s}, {@code 2m 30s} or {@code 1h 15m}.
     */
    public static String formatDuration(Duration duration) {
        long millis = Math.max(0, duration.toMillis());
        if (millis < 1000) {
            return millis + "ms";
        }
        if (millis < 60_000) {
            return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
        }
        long totalSeconds = millis / 1000;
        long minutes = totalSeconds / 60;
        long seconds = totalSeconds % 60;
        if (minutes < 60) {
            return seconds > 0 ? minutes + "m " + seconds + "s" : minutes + "m";
        }
        long hours = minutes / 60;
        minutes = minutes % 60;
        return minutes > 0 ? hours + "h " + minutes + "m" : hours + "h";
    }

    public static String formatNumber(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    /**
     * Appends the time and token footer. Tokens are omitted when none were reported.
     */
    public static String appendMetrics(String response, Duration executionTime, int tokensUsed) {
        StringBuilder builder = new StringBuilder(response != null ? response : "");
        builder.append("\n\n---\n⏱️ Time: ").append(formatDuration(executionTime));
        if (tokensUsed > 0) {
            builder.append(" | 🎯 Tokens: ").append(formatNumber(tokensUsed));
        }
        return builder.toString();
    }

    public static String formatSuccess(ExecutionResult result) {
        String response = result.output();
        if (response.isEmpty()) {
            response = result.errorMessages().isEmpty()
                    ? NO_OUTPUT
                    : "❌ Task failed with errors:\n\n" + numbered(result.errorMessages());
        }
        return appendMetrics(response, result.executionTime(), result.tokensUsed());
    }

    public static String formatFailure(String error, List<String> errorMessages) {
        if (errorMessages == null || errorMessages.isEmpty()) {
            return error;
        }
        return error + "\n\nErrors:\n" + numbered(errorMessages);
    }

    private static String numbered(List<String> messages) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            builder.append(i + 1).append(". ").append(messages.get(i)).append('\n');
        }
        return builder.toString();
    }
}
