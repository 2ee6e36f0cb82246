package org.sessionsync.error;

/** Recovery was requested on a session without snapshot history. */
public class NoValidSnapshotException extends CollaborationException {

    public NoValidSnapshotException(String sessionId) {
        super(CollaborationError.NO_VALID_SNAPSHOT, sessionId, "No valid snapshot found for session " + sessionId);
    }
}
