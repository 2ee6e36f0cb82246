package org.sessionsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A concurrent peer whose last-known state overlaps the keys of an incoming update. */
public final class Conflict {

    private final String peerId;
    private final Set<String> keys;
    private final Map<String, Long> peerClock;

    public Conflict(String peerId, Set<String> keys, Map<String, Long> peerClock) {
        this.peerId = peerId;
        this.keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
        this.peerClock = Collections.unmodifiableMap(new LinkedHashMap<>(peerClock));
    }

    public String peerId() { return peerId; }
    public Set<String> keys() { return keys; }
    public Map<String, Long> peerClock() { return peerClock; }

    /** Event payload form: {@code {"user_id","keys","vector_clock"}}. */
    public Map<String, Object> toPayload() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("user_id", peerId);
        m.put("keys", List.copyOf(keys));
        m.put("vector_clock", new LinkedHashMap<>(peerClock));
        return m;
    }

    @Override
    public String toString() {
        return "Conflict{peer='" + peerId + "', keys=" + keys + ", clock=" + peerClock + '}';
    }
}
