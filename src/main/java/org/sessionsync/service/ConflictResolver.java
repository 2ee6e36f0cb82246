package org.sessionsync.service;

import org.sessionsync.model.CollaboratorInfo;
import org.sessionsync.model.Conflict;
import org.sessionsync.model.StateEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conflict detection and role-priority / last-write-wins resolution.
 * <p>
 * Stateless. Callers hold the session lock so every participant's clock and
 * state is observed consistently.
 * </p>
 */
final class ConflictResolver {

    /**
     * A conflict is an active peer whose clock is concurrent with the updater's and whose
     * last-known state shares keys with the update.
     */
    List<Conflict> detect(CollaboratorInfo updater, Collection<CollaboratorInfo> participants, Set<String> keys) {
        List<Conflict> conflicts = new ArrayList<>();
        for (CollaboratorInfo peer : participants) {
            if (peer.getUserId().equals(updater.getUserId()) || !peer.isActive()) {
                continue;
            }
            if (!updater.getVectorClock().isConcurrentWith(peer.getVectorClock())) {
                continue;
            }
            Set<String> overlap = new LinkedHashSet<>(keys);
            overlap.retainAll(peer.getLastKnownState().keySet());
            if (!overlap.isEmpty()) {
                conflicts.add(new Conflict(peer.getUserId(), overlap, peer.getVectorClock().timestamps()));
            }
        }
        return conflicts;
    }

    /**
     * Applies the policy per conflicting peer:
     * <ol>
     *   <li>editor updater vs non-editor peer: updater keeps its keys;</li>
     *   <li>non-editor updater vs editor peer: updater's conflicting keys are dropped;</li>
     *   <li>same priority: a key is dropped when the peer's stored entry is strictly newer.</li>
     * </ol>
     *
     * @return the surviving subset of {@code updates}
     */
    Map<String, StateEntry> resolve(CollaboratorInfo updater,
                                    Map<String, CollaboratorInfo> participants,
                                    Map<String, StateEntry> updates,
                                    List<Conflict> conflicts) {
        Map<String, StateEntry> resolved = new LinkedHashMap<>(updates);
        boolean updaterEditor = updater.getRole().isEditor();
        for (Conflict conflict : conflicts) {
            CollaboratorInfo peer = participants.get(conflict.peerId());
            if (peer == null) {
                continue;
            }
            boolean peerEditor = peer.getRole().isEditor();
            if (updaterEditor && !peerEditor) {
                continue;
            }
            if (!updaterEditor && peerEditor) {
                conflict.keys().forEach(resolved::remove);
                continue;
            }
            for (String key : conflict.keys()) {
                StateEntry mine = updates.get(key);
                StateEntry theirs = peer.getLastKnownState().get(key);
                if (theirs != null && theirs.isNewerThan(mine)) {
                    resolved.remove(key);
                }
            }
        }
        return resolved;
    }

    /**
     * Resolved view of every key held by active participants: an editor's value beats a
     * non-editor's, then the newest embedded timestamp, then the latest write, then the earliest joiner.
     */
    Map<String, Object> view(Collection<CollaboratorInfo> participants) {
        Map<String, StateEntry> winners = new LinkedHashMap<>();
        Map<String, Boolean> winnerIsEditor = new LinkedHashMap<>();
        for (CollaboratorInfo c : participants) {
            if (!c.isActive()) {
                continue;
            }
            boolean editor = c.getRole().isEditor();
            c.getLastKnownState().forEach((key, entry) -> {
                StateEntry current = winners.get(key);
                boolean currentEditor = Boolean.TRUE.equals(winnerIsEditor.get(key));
                boolean wins = current == null
                        || (editor && !currentEditor)
                        || (editor == currentEditor && entry.isFresherThan(current));
                if (wins) {
                    winners.put(key, entry);
                    winnerIsEditor.put(key, editor);
                }
            });
        }
        Map<String, Object> out = new LinkedHashMap<>();
        winners.forEach((k, e) -> out.put(k, e.value()));
        return out;
    }
}
