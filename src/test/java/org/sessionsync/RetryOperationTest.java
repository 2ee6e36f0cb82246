package org.sessionsync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sessionsync.config.CollaborationConfig;
import org.sessionsync.error.CollaborationError;
import org.sessionsync.error.MaxRetriesExceededException;
import org.sessionsync.error.OperationFailedException;
import org.sessionsync.error.SessionOrUserNotFoundException;
import org.sessionsync.error.UnknownOperationTypeException;
import org.sessionsync.model.CollaborationEvent;
import org.sessionsync.model.CollaborationEventType;
import org.sessionsync.persistence.InMemorySnapshotStore;
import org.sessionsync.service.CollaborationService;
import org.sessionsync.util.BackoffSchedule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryOperationTest {

    private static final BackoffSchedule FAST =
            BackoffSchedule.of(List.of(Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(4)));

    private final List<Duration> sleeps = new ArrayList<>();
    private CollaborationService service;
    private String sid;

    @BeforeEach
    void setUp() {
        CollaborationConfig config = CollaborationConfig.builder().retrySchedule(FAST).build();
        service = new CollaborationService(config, new InMemorySnapshotStore(), new MutableClock(), sleeps::add);
        sid = service.createSession("A", "A");
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private int retryCount() {
        return service.getCollaboratorInfo(sid, "A").orElseThrow().getRetryCount();
    }

    @Test
    void failsKTimesThenSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        service.registerOperationHandler("flaky", (s, u, op) -> {
            if (calls.incrementAndGet() <= 2) throw new IllegalStateException("transient");
        });
        Map<String, Object> op = Map.of("type", "flaky");

        assertThrows(OperationFailedException.class, () -> service.retryOperation(sid, "A", op));
        assertEquals(1, retryCount());
        assertThrows(OperationFailedException.class, () -> service.retryOperation(sid, "A", op));
        assertEquals(2, retryCount());

        service.retryOperation(sid, "A", op);

        assertEquals(0, retryCount());
        assertEquals(3, calls.get());
        assertEquals(FAST.delays(), sleeps);
        assertEquals(3L, service.getMetrics().retries().total());
        assertEquals(1L, service.getMetrics().retries().successful());
        assertEquals(2, service.getErrorLog("retry_error", 10).size());
    }

    @Test
    void alwaysFailingExhaustsScheduleThenStops() {
        AtomicInteger calls = new AtomicInteger();
        service.registerOperationHandler("broken", (s, u, op) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        });
        Map<String, Object> op = Map.of("type", "broken");

        for (int i = 0; i < FAST.maxAttempts(); i++) {
            assertThrows(OperationFailedException.class, () -> service.retryOperation(sid, "A", op));
        }
        MaxRetriesExceededException e = assertThrows(MaxRetriesExceededException.class,
                () -> service.retryOperation(sid, "A", op));

        assertEquals(CollaborationError.MAX_RETRIES_EXCEEDED, e.error());
        assertEquals(3, e.attempts());
        assertEquals(3, calls.get());
        assertEquals(3, retryCount());

        // terminal until something resets the counter
        assertThrows(MaxRetriesExceededException.class, () -> service.retryOperation(sid, "A", op));
        assertEquals(3, calls.get());
        // rejected calls count as failed retries
        assertEquals(5L, service.getMetrics().retries().total());
        assertEquals(0L, service.getMetrics().retries().successful());
        assertEquals(5, service.getEventHistory(CollaborationEventType.METRICS_UPDATE).size());
        assertEquals(2, service.getErrorLog("max_retries_exceeded", 10).size());
    }

    @Test
    void retryEventsCarryAttemptAndDelay() throws Exception {
        service.registerOperationHandler("noop", (s, u, op) -> { });
        service.retryOperation(sid, "A", Map.of("type", "noop", "payload", 1));

        List<CollaborationEvent> retries = service.getEventHistory(CollaborationEventType.RETRY_OPERATION);
        assertEquals(1, retries.size());
        assertEquals(1, retries.get(0).payload().get("attempt"));
        assertEquals(1L, retries.get(0).payload().get("delay_ms"));

        List<CollaborationEvent> metrics = service.getEventHistory(CollaborationEventType.METRICS_UPDATE);
        assertEquals(1, metrics.size());
        assertEquals(CollaborationService.SYSTEM_USER, metrics.get(0).userId());
        assertEquals("retry_mechanism", metrics.get(0).payload().get("type"));
    }

    @Test
    void builtInHandlerRetriesStateUpdate() throws Exception {
        service.retryOperation(sid, "A", Map.of("type", "state_update", "updates", Map.of("line", 9)));

        assertEquals(9, service.getSessionState(sid).get("line"));
        assertEquals(0, retryCount());
    }

    @Test
    void unknownAndMissingTypeRejected() {
        UnknownOperationTypeException unknown = assertThrows(UnknownOperationTypeException.class,
                () -> service.retryOperation(sid, "A", Map.of("type", "teleport")));
        assertEquals(CollaborationError.UNKNOWN_OPERATION_TYPE, unknown.error());
        assertThrows(UnknownOperationTypeException.class,
                () -> service.retryOperation(sid, "A", Map.of("updates", Map.of())));
        assertEquals(2, retryCount());
    }

    @Test
    void unknownParticipantRejectedBeforeSleeping() {
        assertThrows(SessionOrUserNotFoundException.class,
                () -> service.retryOperation(sid, "ghost", Map.of("type", "state_update")));
        assertThrows(SessionOrUserNotFoundException.class,
                () -> service.retryOperation("nope", "A", Map.of("type", "state_update")));
        assertTrue(sleeps.isEmpty());
        assertEquals(0L, service.getMetrics().retries().total());
    }

    @Test
    void cancelledBackoffLeavesCounterUntouched() {
        CollaborationService cancelling = new CollaborationService(
                CollaborationConfig.builder().retrySchedule(FAST).build(),
                new InMemorySnapshotStore(), new MutableClock(),
                d -> { throw new InterruptedException("caller gave up"); });
        try {
            String id = cancelling.createSession("A", "A");
            AtomicInteger calls = new AtomicInteger();
            cancelling.registerOperationHandler("noop", (s, u, op) -> calls.incrementAndGet());

            assertThrows(InterruptedException.class, () -> cancelling.retryOperation(id, "A", Map.of("type", "noop")));

            assertEquals(0, calls.get());
            assertEquals(0, cancelling.getCollaboratorInfo(id, "A").orElseThrow().getRetryCount());
            assertEquals(0L, cancelling.getMetrics().retries().successful());
        } finally {
            cancelling.close();
        }
    }
}
