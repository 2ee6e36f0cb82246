package org.sessionsync.interfaces;

import java.util.Map;

/**
 * Handler for one operation type in the generic dispatch table.
 * Used when retrying failed operations and when replaying recorded events.
 */
@FunctionalInterface
public interface OperationHandler {

    /**
     * @param sessionId session the operation targets
     * @param userId participant on whose behalf it runs
     * @param operation payload; always carries a {@code type} entry
     * @throws Exception any failure, logged and propagated by the dispatcher
     */
    void handle(String sessionId, String userId, Map<String, Object> operation) throws Exception;
}
