package org.sessionsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time capture of a session's participants.
 * <p>
 * Participants are deep-copied on the way in and on the way out, so neither
 * the live session nor a caller can alter a snapshot after it was taken.
 * {@code lastEventSequence} is the highest event sequence recorded when the
 * snapshot was captured; replay starts right after it.
 * </p>
 */
public final class StateSnapshot {

    private final String sessionId;
    private final Map<String, CollaboratorInfo> collaborators;
    private final Instant capturedAt;
    private final long lastEventSequence;

    public StateSnapshot(String sessionId,
                         Map<String, CollaboratorInfo> collaborators,
                         Instant capturedAt,
                         long lastEventSequence) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
        this.lastEventSequence = lastEventSequence;
        Map<String, CollaboratorInfo> copy = new LinkedHashMap<>();
        collaborators.forEach((id, c) -> copy.put(id, c.copy()));
        this.collaborators = Collections.unmodifiableMap(copy);
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    public long lastEventSequence() {
        return lastEventSequence;
    }

    /** @return fresh deep copies of the captured participants, in join order */
    public Map<String, CollaboratorInfo> collaborators() {
        Map<String, CollaboratorInfo> out = new LinkedHashMap<>();
        collaborators.forEach((id, c) -> out.put(id, c.copy()));
        return out;
    }

    public int size() {
        return collaborators.size();
    }

    @Override
    public String toString() {
        return "StateSnapshot{sessionId='" + sessionId + "', capturedAt=" + capturedAt +
                ", lastEventSequence=" + lastEventSequence + ", collaborators=" + collaborators.keySet() + '}';
    }
}
