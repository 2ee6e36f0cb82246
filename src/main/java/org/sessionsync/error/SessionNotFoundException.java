package org.sessionsync.error;

/** The requested session does not exist. */
public class SessionNotFoundException extends CollaborationException {

    public SessionNotFoundException(String sessionId) {
        super(CollaborationError.SESSION_NOT_FOUND, sessionId, "Session not found: " + sessionId);
    }
}
