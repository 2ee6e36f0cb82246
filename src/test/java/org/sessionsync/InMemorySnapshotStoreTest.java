package org.sessionsync;

import org.junit.jupiter.api.Test;
import org.sessionsync.interfaces.SnapshotStore;
import org.sessionsync.model.CollaboratorInfo;
import org.sessionsync.model.Role;
import org.sessionsync.model.StateSnapshot;
import org.sessionsync.persistence.InMemorySnapshotStore;
import org.sessionsync.util.FixedTtlPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySnapshotStoreTest {

    private static StateSnapshot snapshot(String sessionId, Instant at, long seq) {
        Map<String, CollaboratorInfo> m = new LinkedHashMap<>();
        m.put("a", new CollaboratorInfo("a", "Alice", Role.EDITOR, at));
        return new StateSnapshot(sessionId, m, at, seq);
    }

    @Test
    void appendListPruneRemove() {
        SnapshotStore store = new InMemorySnapshotStore();
        Instant t0 = MutableClock.START;
        store.append(snapshot("s1", t0, 1));
        store.append(snapshot("s1", t0.plusSeconds(60), 2));
        store.append(snapshot("s2", t0, 3));

        assertEquals(2, store.list("s1").size());
        assertTrue(store.list("unknown").isEmpty());

        int pruned = store.prune("s1", FixedTtlPolicy.of(Duration.ofSeconds(90)), t0.plusSeconds(100).toEpochMilli());
        assertEquals(1, pruned);
        assertEquals(2L, store.list("s1").get(0).lastEventSequence());

        store.remove("s1");
        assertTrue(store.list("s1").isEmpty());
        assertEquals(1, store.list("s2").size());
    }

    @Test
    void snapshotIsIsolatedFromLiveState() {
        Map<String, CollaboratorInfo> live = new LinkedHashMap<>();
        CollaboratorInfo a = new CollaboratorInfo("a", "Alice", Role.EDITOR, MutableClock.START);
        live.put("a", a);
        StateSnapshot s = new StateSnapshot("s", live, MutableClock.START, 0);

        a.getVectorClock().increment("a");
        a.setCurrentLine(12);
        live.remove("a");

        CollaboratorInfo captured = s.collaborators().get("a");
        assertEquals(0L, captured.getVectorClock().get("a"));
        assertNull(captured.getCurrentLine());

        // handed-out copies do not leak back either
        captured.setRole(Role.VIEWER);
        assertEquals(Role.EDITOR, s.collaborators().get("a").getRole());
    }
}
