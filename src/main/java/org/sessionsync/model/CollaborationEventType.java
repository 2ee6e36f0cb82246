package org.sessionsync.model;

/**
 * Kinds of collaboration events. The wire name is what the transport layer forwards to clients
 * and what the operation dispatcher uses as the operation {@code type}.
 */
public enum CollaborationEventType {
    CREATE("create", false),
    USER_JOINED("user_joined", true),
    USER_LEFT("user_left", true),
    ROLE_CHANGED("role_changed", true),
    STATE_UPDATE("state_update", true),
    CONFLICT_DETECTED("conflict_detected", false),
    RETRY_OPERATION("retry_operation", false),
    SESSION_TIMEOUT("session_timeout", false),
    METRICS_UPDATE("metrics_update", false),
    PROGRESS_UPDATE("progress_update", true),
    PERFORMANCE_UPDATE("performance_update", true),
    CONTENT_UPDATE("content_update", true),
    FEEDBACK("feedback", false);

    private final String wireName;
    private final boolean replayable;

    CollaborationEventType(String wireName, boolean replayable) {
        this.wireName = wireName;
        this.replayable = replayable;
    }

    public String wireName() {
        return wireName;
    }

    /** @return true if recovery re-applies events of this type after restoring a snapshot */
    public boolean isReplayable() {
        return replayable;
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static CollaborationEventType fromWireName(String name) {
        for (CollaborationEventType t : values()) {
            if (t.wireName.equals(name)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown event type: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
