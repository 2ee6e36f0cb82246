package org.sessionsync.service;

import org.sessionsync.model.CollaboratorInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Participants of one session, in join order. Guarded by the session's lock. */
final class Session {

    final String id;
    final int capacity;
    Map<String, CollaboratorInfo> participants = new LinkedHashMap<>();
    Instant lastActivity;
    boolean replaying;

    Session(String id, int capacity, Instant createdAt) {
        this.id = id;
        this.capacity = capacity;
        this.lastActivity = createdAt;
    }

    boolean isFull() {
        return participants.size() >= capacity;
    }

    void touch(Instant now) {
        lastActivity = now;
    }
}
