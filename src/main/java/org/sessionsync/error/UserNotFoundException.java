package org.sessionsync.error;

/** The participant is not part of the session. */
public class UserNotFoundException extends CollaborationException {

    private final String userId;

    public UserNotFoundException(String sessionId, String userId) {
        super(CollaborationError.USER_NOT_FOUND, sessionId,
                "User not found in session: session=" + sessionId + ", user=" + userId);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
