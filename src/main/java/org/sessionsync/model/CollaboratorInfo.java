package org.sessionsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State of one participant in one session.
 * <p>
 * Mutable: instances held by the service are only touched under the owning
 * session's lock. Everything handed out to callers is a {@link #copy()}.
 * </p>
 */
public final class CollaboratorInfo {

    private final String userId;
    private String displayName;
    private Role role;
    private final Instant joinedAt;
    private boolean active = true;
    private Integer currentLine;
    private final Map<String, Double> performanceMetrics = new LinkedHashMap<>();
    private String content = "";
    private final Map<String, StateEntry> lastKnownState = new LinkedHashMap<>();
    private Instant lastSync;
    private int retryCount;
    private final VectorClock vectorClock;

    public CollaboratorInfo(String userId, String displayName, Role role, Instant joinedAt) {
        this(userId, displayName, role, joinedAt, new VectorClock());
    }

    public CollaboratorInfo(String userId, String displayName, Role role, Instant joinedAt, VectorClock vectorClock) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.displayName = displayName == null ? userId : displayName;
        this.role = Objects.requireNonNull(role, "role");
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
        this.lastSync = joinedAt;
        this.vectorClock = Objects.requireNonNull(vectorClock, "vectorClock");
    }

    /** Deep copy, including the vector clock and every state entry. */
    public CollaboratorInfo copy() {
        CollaboratorInfo c = new CollaboratorInfo(userId, displayName, role, joinedAt, vectorClock.copy());
        c.active = active;
        c.currentLine = currentLine;
        c.performanceMetrics.putAll(performanceMetrics);
        c.content = content;
        c.lastKnownState.putAll(lastKnownState); // entries are immutable
        c.lastSync = lastSync;
        c.retryCount = retryCount;
        return c;
    }

    public String getUserId() { return userId; }
    public String getDisplayName() { return displayName; }
    public Role getRole() { return role; }
    public Instant getJoinedAt() { return joinedAt; }
    public boolean isActive() { return active; }
    public Integer getCurrentLine() { return currentLine; }
    public String getContent() { return content; }
    public Instant getLastSync() { return lastSync; }
    public int getRetryCount() { return retryCount; }
    public VectorClock getVectorClock() { return vectorClock; }

    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public void setRole(Role role) { this.role = Objects.requireNonNull(role, "role"); }
    public void setActive(boolean active) { this.active = active; }
    public void setCurrentLine(Integer currentLine) { this.currentLine = currentLine; }
    public void setContent(String content) { this.content = content == null ? "" : content; }
    public void setLastSync(Instant lastSync) { this.lastSync = lastSync; }

    public void incrementRetryCount() { retryCount++; }
    public void resetRetryCount() { retryCount = 0; }

    public Map<String, Double> getPerformanceMetrics() {
        return Collections.unmodifiableMap(performanceMetrics);
    }

    /** Merges {@code metrics} into the metric map; null values are skipped. */
    public void mergePerformanceMetrics(Map<String, ? extends Number> metrics) {
        metrics.forEach((k, v) -> {
            if (k != null && v != null) {
                performanceMetrics.put(k, v.doubleValue());
            }
        });
    }

    /** Raw entries, keyed by state key. */
    public Map<String, StateEntry> getLastKnownState() {
        return Collections.unmodifiableMap(lastKnownState);
    }

    /** @return copies of the stored values, without timestamps */
    public Map<String, Object> stateValues() {
        Map<String, Object> out = new LinkedHashMap<>();
        lastKnownState.forEach((k, e) -> out.put(k, e.value()));
        return out;
    }

    /** Merges entries into the last-known state (merge, not replace). */
    public void applyState(Map<String, StateEntry> entries) {
        lastKnownState.putAll(entries);
    }

    /** Restores persisted fields not covered by the constructor. */
    public static CollaboratorInfo restore(CollaboratorInfo base,
                                           boolean active,
                                           Integer currentLine,
                                           Map<String, ? extends Number> metrics,
                                           String content,
                                           Map<String, StateEntry> state,
                                           Instant lastSync,
                                           int retryCount) {
        base.active = active;
        base.currentLine = currentLine;
        base.mergePerformanceMetrics(metrics);
        base.setContent(content);
        base.lastKnownState.putAll(state);
        base.lastSync = lastSync;
        base.retryCount = retryCount;
        return base;
    }

    @Override
    public String toString() {
        return "CollaboratorInfo{" +
                "userId='" + userId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", role=" + role +
                ", active=" + active +
                ", currentLine=" + currentLine +
                ", state=" + lastKnownState.keySet() +
                ", retryCount=" + retryCount +
                ", clock=" + vectorClock +
                '}';
    }
}
