package org.sessionsync.error;

/**
 * Base of every recoverable failure the collaboration service reports.
 * <p>
 * Each operation declares the subclasses it can throw; the caller translates
 * them into client responses.
 * </p>
 */
public abstract class CollaborationException extends Exception {

    private final CollaborationError error;
    private final String sessionId;

    protected CollaborationException(CollaborationError error, String sessionId, String message) {
        super(message);
        this.error = error;
        this.sessionId = sessionId;
    }

    protected CollaborationException(CollaborationError error, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.sessionId = sessionId;
    }

    public CollaborationError error() {
        return error;
    }

    /** @return the session the failure relates to, or null */
    public String sessionId() {
        return sessionId;
    }
}
