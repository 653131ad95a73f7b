package com.opsagent.dispatch;

/**
 * A request could not be handed to the worker. Thrown synchronously at dispatch time; any callback
 * registered for the request has already been removed.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
