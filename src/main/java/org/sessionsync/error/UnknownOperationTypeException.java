package org.sessionsync.error;

/** No handler is registered for the operation's {@code type}. */
public class UnknownOperationTypeException extends CollaborationException {

    private final String operationType;

    public UnknownOperationTypeException(String sessionId, String operationType) {
        super(CollaborationError.UNKNOWN_OPERATION_TYPE, sessionId,
                operationType == null
                        ? "Operation type not specified"
                        : "Unknown operation type: " + operationType);
        this.operationType = operationType;
    }

    /** @return the unmatched type, or null when the operation had none */
    public String operationType() {
        return operationType;
    }
}
