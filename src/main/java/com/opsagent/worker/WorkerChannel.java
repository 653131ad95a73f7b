package com.opsagent.worker;

import com.opsagent.dispatch.WorkerMessage;

/**
 * Outbound side of the worker's connection to the orchestrator.
 */
public interface WorkerChannel {

    /**
     * Best-effort send.
     *
     * @return false when the message could not be written
     */
    boolean send(WorkerMessage message);
}
