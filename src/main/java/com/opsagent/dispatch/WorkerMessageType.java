package com.opsagent.dispatch;

import java.util.Arrays;
import java.util.Optional;

/**
 * Message types exchanged with the worker, by wire name.
 */
public enum WorkerMessageType {

    NEW_INCIDENT("new_incident"),
    CONTINUE_INCIDENT("continue_incident"),
    CANCEL_INCIDENT("cancel_incident"),
    PROXY_CONFIG_UPDATE("proxy_config_update"),

    AGENT_OUTPUT("codex_output"),
    AGENT_COMPLETED("codex_completed"),
    AGENT_ERROR("codex_error"),
    HEARTBEAT("heartbeat"),
    STATUS("status");

    private final String wireName;

    WorkerMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isIncidentReport() {
        return this == AGENT_OUTPUT || this == AGENT_COMPLETED || this == AGENT_ERROR;
    }

    public static Optional<WorkerMessageType> fromWire(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
