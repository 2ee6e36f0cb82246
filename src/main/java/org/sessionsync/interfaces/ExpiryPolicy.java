package org.sessionsync.interfaces;

/**
 * Age-based expiry contract shared by inactivity cleanup and snapshot retention.
 */
public interface ExpiryPolicy {

    long ttlMs();

    /**
     * @param lastAppliedAt epoch millis of the last activity
     * @param now current epoch millis
     * @return true once the age reaches the TTL
     */
    default boolean isExpired(long lastAppliedAt, long now) {
        return (now - lastAppliedAt) >= ttlMs();
    }
}
