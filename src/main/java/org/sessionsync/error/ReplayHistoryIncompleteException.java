package org.sessionsync.error;

/** Events of the session that follow the chosen snapshot are no longer in the event history. */
public class ReplayHistoryIncompleteException extends CollaborationException {

    private final long snapshotSequence;
    private final long lastEvictedSequence;

    public ReplayHistoryIncompleteException(String sessionId, long snapshotSequence, long lastEvictedSequence) {
        super(CollaborationError.REPLAY_HISTORY_INCOMPLETE, sessionId,
                "Cannot replay session " + sessionId + " from snapshot at seq " + snapshotSequence
                        + ": events up to seq " + lastEvictedSequence + " were evicted from history");
        this.snapshotSequence = snapshotSequence;
        this.lastEvictedSequence = lastEvictedSequence;
    }

    public long snapshotSequence() {
        return snapshotSequence;
    }

    public long lastEvictedSequence() {
        return lastEvictedSequence;
    }
}
