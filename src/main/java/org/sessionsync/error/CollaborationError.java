package org.sessionsync.error;

/** Error taxonomy returned to the transport layer. */
public enum CollaborationError {
    SESSION_NOT_FOUND,
    SESSION_OR_USER_NOT_FOUND,
    USER_NOT_FOUND,
    SESSION_FULL,
    NO_VALID_SNAPSHOT,
    REPLAY_HISTORY_INCOMPLETE,
    UNKNOWN_OPERATION_TYPE,
    MAX_RETRIES_EXCEEDED,
    OPERATION_FAILED
}
