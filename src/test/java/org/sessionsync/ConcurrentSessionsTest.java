package org.sessionsync;

import org.junit.jupiter.api.Test;
import org.sessionsync.config.CollaborationConfig;
import org.sessionsync.model.CollaborationEvent;
import org.sessionsync.model.CollaborationEventType;
import org.sessionsync.persistence.InMemorySnapshotStore;
import org.sessionsync.service.CollaborationService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentSessionsTest {

    private static final int UPDATES = 200;

    @Test
    void parallelUpdatesAreSerializedPerSession() throws Exception {
        try (CollaborationService service = new CollaborationService(
                CollaborationConfig.defaults(), new InMemorySnapshotStore(), new MutableClock(), d -> { })) {
            String sid = service.createSession("u0", "u0");
            List<String> users = List.of("u0", "u1", "u2", "u3");
            for (String u : users.subList(1, users.size())) {
                service.addCollaborator(sid, u, u);
            }

            ExecutorService pool = Executors.newFixedThreadPool(users.size());
            try {
                List<Callable<Void>> tasks = new ArrayList<>();
                for (String u : users) {
                    tasks.add(() -> {
                        for (int i = 0; i < UPDATES; i++) {
                            service.updateState(sid, u, Map.of(u + ".line", i));
                        }
                        return null;
                    });
                }
                for (Future<Void> f : pool.invokeAll(tasks)) {
                    f.get();
                }
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            }

            for (String u : users) {
                assertEquals(UPDATES, service.getCollaboratorInfo(sid, u).orElseThrow().getVectorClock().get(u));
                assertEquals(UPDATES - 1, service.getSessionState(sid).get(u + ".line"));
            }
            List<CollaborationEvent> updates = service.getEventHistory(CollaborationEventType.STATE_UPDATE);
            assertEquals(users.size() * UPDATES, updates.size());
            for (int i = 1; i < updates.size(); i++) {
                assertTrue(updates.get(i - 1).sequence() < updates.get(i).sequence());
            }
        }
    }

    @Test
    void independentSessionsProgressInParallel() throws Exception {
        try (CollaborationService service = new CollaborationService(
                CollaborationConfig.defaults(), new InMemorySnapshotStore(), new MutableClock(), d -> { })) {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Callable<String>> tasks = new ArrayList<>();
                for (int n = 0; n < 16; n++) {
                    String owner = "owner-" + n;
                    tasks.add(() -> {
                        String sid = service.createSession(owner, owner);
                        service.addCollaborator(sid, "guest", "Guest");
                        service.updateState(sid, owner, Map.of("line", 1));
                        service.removeCollaborator(sid, "guest");
                        return sid;
                    });
                }
                for (Future<String> f : pool.invokeAll(tasks)) {
                    String sid = f.get();
                    assertEquals(1, service.getSessionCollaborators(sid).size());
                }
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            }
            assertEquals(16, service.getSessionIds().size());
            assertTrue(service.getUserSessions("guest").isEmpty());
        }
    }
}
