package org.sessionsync.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-participant vector clock: participant id to a non-negative counter,
 * 0 for ids never seen.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Counters only grow: {@link #increment(String)} adds one, {@link #merge(VectorClock)}
 *       takes the pointwise maximum.</li>
 *   <li>Backed by a {@link ConcurrentHashMap} so single-counter updates are atomic; comparisons
 *       between two clocks are only consistent when the owning session's lock is held.</li>
 *   <li>{@link #happensBefore(VectorClock)} is the non-strict causal order (equal clocks are
 *       ordered both ways, hence never concurrent).</li>
 * </ul>
 */
public final class VectorClock {

    // Backing counters; absent key means 0
    private final ConcurrentHashMap<String, Long> counters = new ConcurrentHashMap<>();

    public VectorClock() {
    }

    /**
     * Builds a clock from a counter map (e.g. a snapshot or an event payload).
     * Negative and null counters are ignored.
     */
    public static VectorClock from(Map<String, ? extends Number> timestamps) {
        VectorClock c = new VectorClock();
        if (timestamps != null) {
            timestamps.forEach((node, ts) -> {
                if (node != null && ts != null && ts.longValue() > 0) {
                    c.counters.put(node, ts.longValue());
                }
            });
        }
        return c;
    }

    /**
     * Increments the counter of {@code node} for a local event.
     *
     * @return the incremented counter value
     */
    public long increment(String node) {
        Objects.requireNonNull(node, "node");
        return counters.merge(node, 1L, Long::sum);
    }

    /**
     * Merges another clock into this one: every counter becomes the max of both.
     * Mutates the receiver only.
     */
    public void merge(VectorClock other) {
        Objects.requireNonNull(other, "other");
        other.counters.forEach((node, ts) -> counters.merge(node, ts, Math::max));
    }

    /**
     * @return true iff every counter of this clock is &lt;= the other's (absent = 0)
     */
    public boolean happensBefore(VectorClock other) {
        Objects.requireNonNull(other, "other");
        Set<String> nodes = new HashSet<>(counters.keySet());
        nodes.addAll(other.counters.keySet());
        for (String node : nodes) {
            if (get(node) > other.get(node)) {
                return false;
            }
        }
        return true;
    }

    /** @return true iff neither clock happens-before the other. */
    public boolean isConcurrentWith(VectorClock other) {
        return !happensBefore(other) && !other.happensBefore(this);
    }

    /** @return the counter of {@code node}, 0 if never incremented */
    public long get(String node) {
        Long v = counters.get(node);
        return v == null ? 0L : v;
    }

    /** @return an ordered copy of the counters, suitable for payloads and snapshots */
    public Map<String, Long> timestamps() {
        Map<String, Long> out = new LinkedHashMap<>();
        counters.keySet().stream().sorted().forEach(k -> out.put(k, counters.get(k)));
        return out;
    }

    public VectorClock copy() {
        return from(counters);
    }

    /** Equality over counters, treating absent and 0 alike. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VectorClock)) {
            return false;
        }
        VectorClock that = (VectorClock) o;
        return happensBefore(that) && that.happensBefore(this);
    }

    @Override
    public int hashCode() {
        return timestamps().hashCode();
    }

    @Override
    public String toString() {
        return "VectorClock" + timestamps();
    }
}
