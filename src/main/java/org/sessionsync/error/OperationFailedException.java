package org.sessionsync.error;

/** An operation handler failed with something outside the collaboration taxonomy. */
public class OperationFailedException extends CollaborationException {

    private final String operationType;

    public OperationFailedException(String sessionId, String operationType, Throwable cause) {
        super(CollaborationError.OPERATION_FAILED, sessionId,
                "Operation '" + operationType + "' failed: " + cause.getMessage(), cause);
        this.operationType = operationType;
    }

    public String operationType() {
        return operationType;
    }
}
