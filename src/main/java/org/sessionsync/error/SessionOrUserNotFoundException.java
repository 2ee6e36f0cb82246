package org.sessionsync.error;

/** The session, or the participant inside it, does not exist. */
public class SessionOrUserNotFoundException extends CollaborationException {

    private final String userId;

    public SessionOrUserNotFoundException(String sessionId, String userId) {
        super(CollaborationError.SESSION_OR_USER_NOT_FOUND, sessionId,
                "Session or user not found: session=" + sessionId + ", user=" + userId);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
