package org.sessionsync.util;

import org.sessionsync.interfaces.ExpiryPolicy;

import java.time.Duration;

/**
 * FixedTtlPolicy implements a constant time-to-live (TTL) expiration strategy.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>This class is immutable and thread-safe since {@code ttlMs} is final.</li>
 *   <li>Used for session inactivity cleanup and for snapshot retention.</li>
 *   <li>A zero TTL expires everything, including data touched in the same millisecond.</li>
 * </ul>
 */
public final class FixedTtlPolicy implements ExpiryPolicy {

    /** Time-to-live duration in milliseconds. */
    private final long ttlMs;

    /**
     * Constructs a fixed TTL policy.
     *
     * @param ttlMs duration in milliseconds before data is considered expired
     */
    public FixedTtlPolicy(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0: " + ttlMs);
        }
        this.ttlMs = ttlMs;
    }

    public static FixedTtlPolicy of(Duration ttl) {
        return new FixedTtlPolicy(ttl.toMillis());
    }

    /**
     * Returns the TTL duration in milliseconds.
     *
     * @return TTL in ms
     */
    @Override
    public long ttlMs() {
        return ttlMs;
    }

    /**
     * Determines whether data is expired based on the last applied timestamp: the elapsed
     * time {@code (now - lastAppliedAt)} reached the TTL. Epoch millisecond 0 is an ordinary
     * instant.
     *
     * @param lastAppliedAt timestamp of the last activity (ms)
     * @param now current time in milliseconds
     * @return true if expired, false otherwise
     */
    @Override
    public boolean isExpired(long lastAppliedAt, long now) {
        return (now - lastAppliedAt) >= ttlMs;
    }

    @Override
    public String toString() {
        return "FixedTtlPolicy{ttlMs=" + ttlMs + '}';
    }
}
