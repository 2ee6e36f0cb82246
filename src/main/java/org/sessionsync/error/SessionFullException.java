package org.sessionsync.error;

/** Join refused because the session reached its capacity. */
public class SessionFullException extends CollaborationException {

    public SessionFullException(String sessionId, int capacity) {
        super(CollaborationError.SESSION_FULL, sessionId, "Session is full: " + sessionId + " (capacity " + capacity + ")");
    }
}
