package com.opsagent.dispatch;

/**
 * Lifecycle of the single worker connection.
 */
public enum ConnectionState {
    CONNECTING,
    READY,
    CLOSING,
    CLOSED
}
