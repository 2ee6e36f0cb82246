package org.sessionsync.persistence;

import org.sessionsync.interfaces.ExpiryPolicy;
import org.sessionsync.interfaces.SnapshotStore;
import org.sessionsync.model.StateSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Default snapshot store: per-session lists kept for the process lifetime. */
public final class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<StateSnapshot>> snapshots = new ConcurrentHashMap<>();

    @Override
    public void append(StateSnapshot snapshot) {
        snapshots.computeIfAbsent(snapshot.sessionId(), k -> new CopyOnWriteArrayList<>()).add(snapshot);
    }

    @Override
    public List<StateSnapshot> list(String sessionId) {
        List<StateSnapshot> l = snapshots.get(sessionId);
        return l == null ? new ArrayList<>() : new ArrayList<>(l);
    }

    @Override
    public int prune(String sessionId, ExpiryPolicy policy, long nowMillis) {
        List<StateSnapshot> l = snapshots.get(sessionId);
        if (l == null) {
            return 0;
        }
        int before = l.size();
        l.removeIf(s -> policy.isExpired(s.capturedAt().toEpochMilli(), nowMillis));
        return before - l.size();
    }

    @Override
    public void remove(String sessionId) {
        snapshots.remove(sessionId);
    }
}
