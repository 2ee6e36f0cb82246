package org.sessionsync.service;

import org.junit.jupiter.api.Test;
import org.sessionsync.model.CollaboratorInfo;
import org.sessionsync.model.Conflict;
import org.sessionsync.model.Role;
import org.sessionsync.model.StateEntry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final ConflictResolver resolver = new ConflictResolver();

    private static CollaboratorInfo participant(String id, Role role, Map<String, StateEntry> state) {
        CollaboratorInfo c = new CollaboratorInfo(id, id, role, T0);
        c.getVectorClock().increment(id);
        c.applyState(state);
        return c;
    }

    private static Map<String, CollaboratorInfo> index(CollaboratorInfo... cs) {
        Map<String, CollaboratorInfo> m = new LinkedHashMap<>();
        for (CollaboratorInfo c : cs) m.put(c.getUserId(), c);
        return m;
    }

    @Test
    void detectsConcurrentOverlappingPeersOnly() {
        CollaboratorInfo updater = participant("a", Role.VIEWER, Map.of());
        CollaboratorInfo overlapping = participant("b", Role.VIEWER, Map.of("line", new StateEntry(1, 1)));
        CollaboratorInfo disjoint = participant("c", Role.VIEWER, Map.of("cursor", new StateEntry(1, 1)));
        CollaboratorInfo inactive = participant("d", Role.VIEWER, Map.of("line", new StateEntry(1, 1)));
        inactive.setActive(false);
        CollaboratorInfo causal = new CollaboratorInfo("e", "e", Role.VIEWER, T0);   // empty clock precedes a's
        causal.applyState(Map.of("line", new StateEntry(1, 1)));

        List<Conflict> conflicts = resolver.detect(updater,
                index(updater, overlapping, disjoint, inactive, causal).values(), Set.of("line"));

        assertEquals(1, conflicts.size());
        assertEquals("b", conflicts.get(0).peerId());
        assertEquals(Set.of("line"), conflicts.get(0).keys());
        assertEquals(Map.of("b", 1L), conflicts.get(0).peerClock());
    }

    @Test
    void editorUpdaterBeatsNonEditorPeer() {
        CollaboratorInfo editor = participant("a", Role.EDITOR, Map.of());
        CollaboratorInfo viewer = participant("b", Role.VIEWER, Map.of("line", new StateEntry(7, 2000)));
        Map<String, StateEntry> updates = Map.of("line", new StateEntry(5, 1000));

        Map<String, StateEntry> out = resolve(editor, viewer, updates);

        assertEquals(updates, out);
    }

    @Test
    void nonEditorUpdaterLosesToEditorPeer() {
        CollaboratorInfo viewer = participant("b", Role.VIEWER, Map.of());
        CollaboratorInfo editor = participant("a", Role.EDITOR, Map.of("line", new StateEntry(5, 1000)));
        Map<String, StateEntry> updates = new LinkedHashMap<>();
        updates.put("line", new StateEntry(7, 2000));
        updates.put("note", new StateEntry("x", 2000));

        Map<String, StateEntry> out = resolve(viewer, editor, updates);

        assertEquals(Set.of("note"), out.keySet());
    }

    @Test
    void samePriorityFallsBackToLastWriteWins() {
        CollaboratorInfo a = participant("a", Role.VIEWER, Map.of());
        CollaboratorInfo newer = participant("b", Role.VIEWER, Map.of("line", new StateEntry(7, 2000)));
        assertTrue(resolve(a, newer, Map.of("line", new StateEntry(5, 1000))).isEmpty());

        CollaboratorInfo older = participant("c", Role.VIEWER, Map.of("line", new StateEntry(7, 500)));
        assertEquals(1, resolve(a, older, Map.of("line", new StateEntry(5, 1000))).size());

        // ties keep the incoming value
        CollaboratorInfo tied = participant("d", Role.VIEWER, Map.of("line", new StateEntry(7, 1000)));
        assertEquals(1, resolve(a, tied, Map.of("line", new StateEntry(5, 1000))).size());
    }

    @Test
    void embeddedTimestampDrivesLastWriteWins() {
        CollaboratorInfo a = participant("a", Role.EDITOR, Map.of());
        CollaboratorInfo b = participant("b", Role.EDITOR,
                Map.of("cue", StateEntry.of(Map.of("text", "exit", "timestamp", 50.0), 9_999L)));

        Map<String, StateEntry> out = resolve(a, b, Map.of("cue", StateEntry.of(Map.of("text", "enter", "timestamp", 40.0), 10_000L)));

        assertTrue(out.isEmpty());
    }

    @Test
    void plainValueCountsAsTimestampZero() {
        long appliedAt = T0.toEpochMilli();
        double seconds = T0.getEpochSecond() + 60;

        // peer wrote a plain value, the updater's carries its own timestamp
        CollaboratorInfo a = participant("a", Role.VIEWER, Map.of());
        CollaboratorInfo plainPeer = participant("b", Role.VIEWER, Map.of("line", StateEntry.of(7, appliedAt)));
        Map<String, StateEntry> stamped = Map.of("line", StateEntry.of(Map.of("v", 5, "timestamp", seconds), appliedAt + 1));
        assertEquals(stamped, resolve(a, plainPeer, stamped));

        // and the other way round the stamped peer keeps the key
        CollaboratorInfo stampedPeer = participant("c", Role.VIEWER,
                Map.of("line", StateEntry.of(Map.of("v", 5, "timestamp", seconds), appliedAt)));
        assertTrue(resolve(a, stampedPeer, Map.of("line", StateEntry.of(7, appliedAt + 1))).isEmpty());
    }

    @Test
    void viewBreaksTimestampTiesByLatestWrite() {
        CollaboratorInfo first = participant("f", Role.VIEWER, Map.of("line", new StateEntry(1, 0, 1_000L)));
        CollaboratorInfo second = participant("s", Role.VIEWER, Map.of("line", new StateEntry(2, 0, 2_000L)));

        assertEquals(2, resolver.view(index(first, second).values()).get("line"));
    }

    @Test
    void viewPrefersEditorThenNewest() {
        CollaboratorInfo viewer = participant("v", Role.VIEWER, Map.of(
                "line", new StateEntry(7, 2000),
                "note", new StateEntry("v", 10)));
        CollaboratorInfo editor = participant("e", Role.EDITOR, Map.of("line", new StateEntry(5, 1000)));
        CollaboratorInfo other = participant("o", Role.VIEWER, Map.of("note", new StateEntry("o", 20)));

        Map<String, Object> view = resolver.view(index(viewer, editor, other).values());

        assertEquals(5, view.get("line"));
        assertEquals("o", view.get("note"));
    }

    private Map<String, StateEntry> resolve(CollaboratorInfo updater, CollaboratorInfo peer, Map<String, StateEntry> updates) {
        Map<String, CollaboratorInfo> all = index(updater, peer);
        List<Conflict> conflicts = resolver.detect(updater, all.values(), updates.keySet());
        assertEquals(1, conflicts.size());
        return resolver.resolve(updater, all, updates, conflicts);
    }
}
