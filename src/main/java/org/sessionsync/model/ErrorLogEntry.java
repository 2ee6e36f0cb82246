package org.sessionsync.model;

import org.sessionsync.util.StateValues;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/** Internal record of a degraded-but-recoverable failure (conflict, retry, recovery). */
public final class ErrorLogEntry {

    private final String type;
    private final Instant timestamp;
    private final Map<String, Object> details;

    public ErrorLogEntry(String type, Instant timestamp, Map<String, ?> details) {
        this.type = type;
        this.timestamp = timestamp;
        this.details = Collections.unmodifiableMap(StateValues.deepCopyMap(details));
    }

    public String type() { return type; }
    public Instant timestamp() { return timestamp; }
    public Map<String, Object> details() { return details; }

    @Override
    public String toString() {
        return "ErrorLogEntry{type='" + type + "', timestamp=" + timestamp + ", details=" + details + '}';
    }
}
