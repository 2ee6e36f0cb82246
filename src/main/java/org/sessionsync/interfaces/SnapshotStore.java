package org.sessionsync.interfaces;

import org.sessionsync.model.StateSnapshot;

import java.util.List;

/**
 * Storage for per-session state snapshots.
 * <p>
 * Callers hold the owning session's lock while invoking these methods, so
 * implementations only need to be safe across different sessions.
 * </p>
 */
public interface SnapshotStore {

    /** Append a snapshot to the session's history. Must be safe to call repeatedly. */
    void append(StateSnapshot snapshot);

    /** All retained snapshots of the session in capture order; empty if none. */
    List<StateSnapshot> list(String sessionId);

    /**
     * Drop snapshots whose age reached the policy's TTL.
     * @return number of snapshots removed
     */
    int prune(String sessionId, ExpiryPolicy policy, long nowMillis);

    /** Forget every snapshot of the session. */
    void remove(String sessionId);
}
