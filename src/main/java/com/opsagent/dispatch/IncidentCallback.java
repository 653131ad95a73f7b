package com.opsagent.dispatch;

import org.springframework.lang.Nullable;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Handlers for one dispatched incident. {@code onOutput} may fire many times, then exactly one of
 * {@code onCompleted} or {@code onError} fires. Any handler may be null.
 *
 * @param onOutput    receives the full progress log so far
 * @param onCompleted receives the session id and the formatted response
 * @param onError     receives the error text
 */
public record IncidentCallback(
        @Nullable Consumer<String> onOutput,
        @Nullable BiConsumer<String, String> onCompleted,
        @Nullable Consumer<String> onError
) {

    void output(String text) {
        if (onOutput != null) {
            onOutput.accept(text);
        }
    }

    void completed(String sessionId, String response) {
        if (onCompleted != null) {
            onCompleted.accept(sessionId, response);
        }
    }

    void error(String error) {
        if (onError != null) {
            onError.accept(error);
        }
    }
}
