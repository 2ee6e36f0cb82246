package org.sessionsync.error;

/**
 * The participant's retry budget is spent. Terminal: the counter is not reset
 * until an attempt succeeds, so further calls keep failing this way.
 */
public class MaxRetriesExceededException extends CollaborationException {

    private final String userId;
    private final int attempts;

    public MaxRetriesExceededException(String sessionId, String userId, int attempts) {
        super(CollaborationError.MAX_RETRIES_EXCEEDED, sessionId,
                "Operation failed after max retries (" + attempts + ") for user " + userId);
        this.userId = userId;
        this.attempts = attempts;
    }

    public String userId() {
        return userId;
    }

    public int attempts() {
        return attempts;
    }
}
