package org.sessionsync.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import org.sessionsync.model.CollaboratorInfo;
import org.sessionsync.model.Role;
import org.sessionsync.model.StateEntry;
import org.sessionsync.model.StateSnapshot;
import org.sessionsync.model.VectorClock;

import java.lang.reflect.Type;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON codec for {@link StateSnapshot}, built on Gson's tree model.
 * <p>
 * Instants are stored as epoch millis. Whole numbers inside state values come
 * back as {@code Long}, others as {@code Double}.
 * </p>
 */
final class SnapshotJson {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private static final Type CLOCK_TYPE = new TypeToken<Map<String, Long>>() {}.getType();
    private static final Type METRICS_TYPE = new TypeToken<Map<String, Double>>() {}.getType();

    private SnapshotJson() {}

    static String write(StateSnapshot s) {
        JsonObject root = new JsonObject();
        root.addProperty("session_id", s.sessionId());
        root.addProperty("captured_at", s.capturedAt().toEpochMilli());
        root.addProperty("last_event_sequence", s.lastEventSequence());
        JsonObject collaborators = new JsonObject();
        s.collaborators().forEach((id, c) -> collaborators.add(id, writeCollaborator(c)));
        root.add("collaborators", collaborators);
        return GSON.toJson(root);
    }

    private static JsonObject writeCollaborator(CollaboratorInfo c) {
        JsonObject o = new JsonObject();
        o.addProperty("user_id", c.getUserId());
        o.addProperty("display_name", c.getDisplayName());
        o.addProperty("role", c.getRole().name());
        o.addProperty("joined_at", c.getJoinedAt().toEpochMilli());
        o.addProperty("active", c.isActive());
        o.addProperty("current_line", c.getCurrentLine());
        o.add("performance_metrics", GSON.toJsonTree(c.getPerformanceMetrics()));
        o.addProperty("content", c.getContent());
        JsonObject state = new JsonObject();
        c.getLastKnownState().forEach((k, e) -> {
            JsonObject entry = new JsonObject();
            entry.add("value", GSON.toJsonTree(e.value()));
            entry.addProperty("timestamp", e.timestamp());
            entry.addProperty("applied_at", e.appliedAt());
            state.add(k, entry);
        });
        o.add("last_known_state", state);
        o.addProperty("last_sync", c.getLastSync().toEpochMilli());
        o.addProperty("retry_count", c.getRetryCount());
        o.add("vector_clock", GSON.toJsonTree(c.getVectorClock().timestamps()));
        return o;
    }

    /**
     * @throws com.google.gson.JsonParseException or IllegalStateException on malformed input
     */
    static StateSnapshot read(String json) {
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();
        Map<String, CollaboratorInfo> collaborators = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : root.getAsJsonObject("collaborators").entrySet()) {
            collaborators.put(e.getKey(), readCollaborator(e.getValue().getAsJsonObject()));
        }
        return new StateSnapshot(
                root.get("session_id").getAsString(),
                collaborators,
                Instant.ofEpochMilli(root.get("captured_at").getAsLong()),
                root.get("last_event_sequence").getAsLong());
    }

    private static CollaboratorInfo readCollaborator(JsonObject o) {
        Map<String, Long> clock = GSON.fromJson(o.get("vector_clock"), CLOCK_TYPE);
        CollaboratorInfo base = new CollaboratorInfo(
                o.get("user_id").getAsString(),
                o.get("display_name").getAsString(),
                Role.of(o.get("role").getAsString()),
                Instant.ofEpochMilli(o.get("joined_at").getAsLong()),
                VectorClock.from(clock));
        Map<String, StateEntry> state = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : o.getAsJsonObject("last_known_state").entrySet()) {
            JsonObject entry = e.getValue().getAsJsonObject();
            Object value = GSON.fromJson(entry.get("value"), Object.class);
            JsonElement appliedAt = entry.get("applied_at");
            state.put(e.getKey(), new StateEntry(value, entry.get("timestamp").getAsDouble(),
                    appliedAt == null ? 0L : appliedAt.getAsLong()));
        }
        JsonElement line = o.get("current_line");
        Map<String, Double> metrics = GSON.fromJson(o.get("performance_metrics"), METRICS_TYPE);
        return CollaboratorInfo.restore(base,
                o.get("active").getAsBoolean(),
                line == null || line.isJsonNull() ? null : line.getAsInt(),
                metrics == null ? Map.of() : metrics,
                o.get("content").getAsString(),
                state,
                Instant.ofEpochMilli(o.get("last_sync").getAsLong()),
                o.get("retry_count").getAsInt());
    }
}
