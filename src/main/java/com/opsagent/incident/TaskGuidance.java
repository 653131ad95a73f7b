package com.opsagent.incident;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Frames a task for the agent with the current UTC time.
 */
public final class TaskGuidance {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    private TaskGuidance() {
    }

    public static String prepend(String task, Clock clock) {
        String now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).format(TIMESTAMP);
        return "Current time: " + now + "\nPlease help with the following incident or request:\n\n" + task;
    }
}
