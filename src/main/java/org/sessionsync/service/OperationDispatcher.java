package org.sessionsync.service;

import org.sessionsync.error.CollaborationException;
import org.sessionsync.error.OperationFailedException;
import org.sessionsync.error.UnknownOperationTypeException;
import org.sessionsync.interfaces.OperationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Generic operation dispatch: the operation's {@code type} selects a registered handler.
 * Used by retries and by snapshot replay.
 */
final class OperationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OperationDispatcher.class);

    static final String TYPE = "type";

    private final ConcurrentHashMap<String, OperationHandler> handlers = new ConcurrentHashMap<>();

    void register(String type, OperationHandler handler) {
        handlers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(handler, "handler"));
    }

    /**
     * @throws UnknownOperationTypeException when the type is missing or unregistered
     * @throws CollaborationException as thrown by the handler
     * @throws OperationFailedException wrapping any other handler failure
     */
    void dispatch(String sessionId, String userId, Map<String, Object> operation) throws CollaborationException {
        Object rawType = operation == null ? null : operation.get(TYPE);
        String type = rawType == null ? null : String.valueOf(rawType);
        OperationHandler handler = type == null ? null : handlers.get(type);
        if (handler == null) {
            log.error("Operation processing failed: session={}, user={}, unknown type {}", sessionId, userId, type);
            throw new UnknownOperationTypeException(sessionId, type);
        }
        try {
            handler.handle(sessionId, userId, operation);
        } catch (CollaborationException e) {
            log.error("Operation processing failed: session={}, user={}, type={}: {}", sessionId, userId, type, e.getMessage());
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Operation processing failed: session={}, user={}, type={}: {}", sessionId, userId, type, e.getMessage());
            throw new OperationFailedException(sessionId, type, e);
        }
    }
}
