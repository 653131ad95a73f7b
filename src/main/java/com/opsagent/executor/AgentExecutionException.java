package com.opsagent.executor;

/**
 * Raised when the agent process cannot be started. Failures after start are reported through
 * {@link ExecutionResult#error()} together with the partial output.
 */
public class AgentExecutionException extends RuntimeException {

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
