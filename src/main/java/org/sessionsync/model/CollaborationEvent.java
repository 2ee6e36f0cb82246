package org.sessionsync.model;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.sessionsync.util.StateValues;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the event log. Immutable once created.
 * <p>
 * {@code sequence} is process-wide and strictly increasing, so it orders events
 * across sessions and anchors snapshot replay. {@code sessionId} is null only
 * for events not tied to a session.
 * </p>
 */
public final class CollaborationEvent {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final long sequence;
    private final CollaborationEventType type;
    private final String sessionId;
    private final String userId;
    private final Map<String, Object> payload;
    private final Instant timestamp;

    public CollaborationEvent(long sequence,
                              CollaborationEventType type,
                              String sessionId,
                              String userId,
                              Map<String, ?> payload,
                              Instant timestamp) {
        this.sequence = sequence;
        this.type = Objects.requireNonNull(type, "type");
        this.sessionId = sessionId;
        this.userId = Objects.requireNonNull(userId, "userId");
        this.payload = Collections.unmodifiableMap(StateValues.deepCopyMap(payload));
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public long sequence() { return sequence; }
    public CollaborationEventType type() { return type; }
    public String sessionId() { return sessionId; }
    public String userId() { return userId; }
    public Instant timestamp() { return timestamp; }

    /** @return a deep copy of the payload */
    public Map<String, Object> payload() {
        return StateValues.deepCopyMap(payload);
    }

    /**
     * JSON form forwarded by the transport layer:
     * {@code {"sequence","type","session_id","user_id","timestamp","data"}}.
     */
    public String toJson() {
        JsonObject o = new JsonObject();
        o.addProperty("sequence", sequence);
        o.addProperty("type", type.wireName());
        o.addProperty("session_id", sessionId);
        o.addProperty("user_id", userId);
        o.addProperty("timestamp", timestamp.toEpochMilli());
        o.add("data", GSON.toJsonTree(payload));
        return GSON.toJson(o);
    }

    @Override
    public String toString() {
        return "CollaborationEvent{" +
                "seq=" + sequence +
                ", type=" + type +
                ", sessionId='" + sessionId + '\'' +
                ", userId='" + userId + '\'' +
                ", payload=" + payload +
                ", timestamp=" + timestamp +
                '}';
    }
}
