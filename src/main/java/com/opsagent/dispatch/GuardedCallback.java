package com.opsagent.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets exactly one terminal call through to the wrapped handlers and drops output that arrives
 * after it. Handler failures are logged, never propagated to the dispatching thread.
 */
@Slf4j
final class GuardedCallback {

    private final String incidentId;
    private final IncidentCallback delegate;
    private final AtomicBoolean terminated = new AtomicBoolean();

    GuardedCallback(String incidentId, IncidentCallback delegate) {
        this.incidentId = incidentId;
        this.delegate = delegate;
    }

    void output(String text) {
        if (terminated.get()) {
            log.debug("Dropping output for finished incident {}", incidentId);
            return;
        }
        run("output", () -> delegate.output(text));
    }

    boolean completed(String sessionId, String response) {
        if (!terminated.compareAndSet(false, true)) {
            log.debug("Ignoring second terminal call (completed) for incident {}", incidentId);
            return false;
        }
        run("completion", () -> delegate.completed(sessionId, response));
        return true;
    }

    boolean error(String error) {
        if (!terminated.compareAndSet(false, true)) {
            log.debug("Ignoring second terminal call (error) for incident {}: {}", incidentId, error);
            return false;
        }
        run("error", () -> delegate.error(error));
        return true;
    }

    boolean isTerminated() {
        return terminated.get();
    }

    IncidentCallback asCallback() {
        return new IncidentCallback(this::output, this::completed, this::error);
    }

    private void run(String kind, Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException ex) {
            log.warn("The {} handler for incident {} failed: {}", kind, incidentId, ex.getMessage(), ex);
        }
    }
}
