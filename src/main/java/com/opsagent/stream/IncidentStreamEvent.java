package com.opsagent.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.opsagent.entity.IncidentStatus;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Locale;

/**
 * One dashboard update. Ids increase per incident across continuations, so a client can resume
 * with {@code since=<last id seen>}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentStreamEvent(
        long id,
        Instant timestamp,
        Kind type,
        @Nullable IncidentStatus status,
        @Nullable String log,
        @Nullable String response
) {

    public enum Kind {
        STATUS,
        OUTPUT,
        COMPLETE,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
