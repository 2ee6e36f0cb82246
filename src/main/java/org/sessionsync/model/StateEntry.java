package org.sessionsync.model;

import org.sessionsync.util.StateValues;

import java.util.Objects;

/**
 * One value in a participant's last-known state.
 *
 * <p>{@link #timestamp()} is the value's own embedded {@code timestamp} (0 when it has none) and is the
 * only thing last-write-wins compares. {@link #appliedAt()} records when the service stored the value.
 */
public final class StateEntry {

    private final Object value;      // JSON-like, deep-copied on the way in and out
    private final double timestamp;  // embedded value timestamp, 0 if absent
    private final long appliedAt;    // epoch millis, 0 if unknown

    public StateEntry(Object value, double timestamp) {
        this(value, timestamp, 0L);
    }

    public StateEntry(Object value, double timestamp, long appliedAt) {
        this.value = StateValues.deepCopy(value);
        this.timestamp = timestamp;
        this.appliedAt = appliedAt;
    }

    /** Entry for a freshly written value, timestamped from the value itself. */
    public static StateEntry of(Object value, long appliedAtMillis) {
        return new StateEntry(value, StateValues.embeddedTimestamp(value, 0), appliedAtMillis);
    }

    public Object value() {
        return StateValues.deepCopy(value);
    }

    public double timestamp() {
        return timestamp;
    }

    public long appliedAt() {
        return appliedAt;
    }

    /** @return true if this entry's embedded timestamp is strictly after {@code other}'s */
    public boolean isNewerThan(StateEntry other) {
        return other == null || Double.compare(timestamp, other.timestamp) > 0;
    }

    /** Like {@link #isNewerThan} but falls back to apply time when the embedded timestamps tie. */
    public boolean isFresherThan(StateEntry other) {
        if (other == null) {
            return true;
        }
        int byTimestamp = Double.compare(timestamp, other.timestamp);
        return byTimestamp != 0 ? byTimestamp > 0 : appliedAt > other.appliedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateEntry)) {
            return false;
        }
        StateEntry that = (StateEntry) o;
        return Double.compare(timestamp, that.timestamp) == 0
                && appliedAt == that.appliedAt
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, timestamp, appliedAt);
    }

    @Override
    public String toString() {
        return "StateEntry{value=" + value + ", timestamp=" + timestamp + ", appliedAt=" + appliedAt + '}';
    }
}
