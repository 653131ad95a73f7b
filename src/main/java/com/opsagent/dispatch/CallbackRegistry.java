package com.opsagent.dispatch;

import com.opsagent.entity.IncidentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Correlates worker responses with the caller that dispatched the incident.
 *
 * <p>A registration lives from dispatch until its own terminal event and is removed right after
 * that event whether or not a handler was present. A newer registration for the same incident is
 * left in place. Handlers always run outside the lock. Traffic
 * for an incident with no registration is written to the {@link IncidentLogSink} instead of being
 * dropped.
 */
@Slf4j
@Component
public class CallbackRegistry {

    private final IncidentLogSink logSink;
    private final Map<String, IncidentCallback> callbacks = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CallbackRegistry(IncidentLogSink logSink) {
        this.logSink = logSink;
    }

    /**
     * Stores the handlers, replacing any earlier registration for the same incident.
     */
    public void register(String incidentId, IncidentCallback callback) {
        IncidentCallback previous;
        lock.writeLock().lock();
        try {
            previous = callbacks.put(incidentId, callback);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            log.debug("Replaced callback for incident {}", incidentId);
        }
    }

    public boolean unregister(String incidentId) {
        lock.writeLock().lock();
        try {
            return callbacks.remove(incidentId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the entry only while it is still the one the terminal event was routed to, so a
     * registration made from inside a terminal handler survives.
     */
    private void release(String incidentId, IncidentCallback callback) {
        if (callback == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (callbacks.get(incidentId) == callback) {
                callbacks.remove(incidentId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void dispatchOutput(String incidentId, String output) {
        IncidentCallback callback = lookup(incidentId);
        if (callback != null && callback.onOutput() != null) {
            invoke(incidentId, "output", () -> callback.output(output));
            return;
        }
        log.debug("No output handler for incident {}, writing to incident log", incidentId);
        logSink.updateLog(incidentId, output);
    }

    public void dispatchCompleted(String incidentId, String sessionId, String response) {
        IncidentCallback callback = lookup(incidentId);
        try {
            if (callback != null && callback.onCompleted() != null) {
                invoke(incidentId, "completion", () -> callback.completed(sessionId, response));
            } else {
                log.info("No completion handler for incident {}, recording outcome directly", incidentId);
                logSink.recordOutcome(incidentId, IncidentStatus.COMPLETED, sessionId, response);
            }
        } finally {
            release(incidentId, callback);
        }
    }

    public void dispatchError(String incidentId, String error) {
        IncidentCallback callback = lookup(incidentId);
        try {
            if (callback != null && callback.onError() != null) {
                invoke(incidentId, "error", () -> callback.error(error));
            } else {
                log.info("No error handler for incident {}, recording failure directly", incidentId);
                logSink.recordOutcome(incidentId, IncidentStatus.FAILED, null, error);
            }
        } finally {
            release(incidentId, callback);
        }
    }

    public boolean isRegistered(String incidentId) {
        return lookup(incidentId) != null;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return callbacks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void invoke(String incidentId, String kind, Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException ex) {
            log.warn("The {} handler for incident {} failed: {}", kind, incidentId, ex.getMessage(), ex);
        }
    }

    private IncidentCallback lookup(String incidentId) {
        lock.readLock().lock();
        try {
            return callbacks.get(incidentId);
        } finally {
            lock.readLock().unlock();
        }
    }
}
