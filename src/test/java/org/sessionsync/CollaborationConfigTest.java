package org.sessionsync;

import org.junit.jupiter.api.Test;
import org.sessionsync.config.CollaborationConfig;
import org.sessionsync.model.Role;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CollaborationConfigTest {

    @Test
    void defaults() {
        CollaborationConfig c = CollaborationConfig.defaults();
        assertEquals(4, c.sessionCapacity());
        assertEquals(Duration.ofSeconds(5), c.syncInterval());
        assertEquals(Duration.ofHours(24), c.maxSnapshotAge());
        assertEquals(Duration.ofHours(1), c.inactivityTimeout());
        assertEquals(5, c.retrySchedule().maxAttempts());
        assertEquals(Duration.ofSeconds(16), c.retrySchedule().delayFor(4));
        assertEquals(Role.EDITOR, c.ownerRole());
        assertEquals(Role.VIEWER, c.joinerRole());
        assertEquals(0, c.eventHistoryLimit());   // unbounded
        assertEquals(1_000, c.errorLogLimit());
    }

    @Test
    void classpathResourceMatchesDefaults() {
        CollaborationConfig loaded = CollaborationConfig.load();
        CollaborationConfig defaults = CollaborationConfig.defaults();
        assertEquals(defaults.sessionCapacity(), loaded.sessionCapacity());
        assertEquals(defaults.retrySchedule().delays(), loaded.retrySchedule().delays());
        assertEquals(defaults.inactivityTimeout(), loaded.inactivityTimeout());
    }

    @Test
    void fromPropertiesOverridesOnlyGivenKeys() {
        Properties p = new Properties();
        p.setProperty(CollaborationConfig.SESSION_CAPACITY, "10");
        p.setProperty(CollaborationConfig.RETRY_DELAYS_MS, " 5, 10 ,20");
        p.setProperty(CollaborationConfig.JOINER_ROLE, "Participant");

        CollaborationConfig c = CollaborationConfig.fromProperties(p);

        assertEquals(10, c.sessionCapacity());
        assertEquals(List.of(Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(20)),
                c.retrySchedule().delays());
        assertEquals(Role.PARTICIPANT, c.joinerRole());
        assertEquals(Duration.ofSeconds(5), c.syncInterval());
    }

    @Test
    void invalidValuesRejected() {
        Properties capacity = new Properties();
        capacity.setProperty(CollaborationConfig.SESSION_CAPACITY, "0");
        assertThrows(IllegalArgumentException.class, () -> CollaborationConfig.fromProperties(capacity));

        Properties notANumber = new Properties();
        notANumber.setProperty(CollaborationConfig.SYNC_INTERVAL_MS, "soon");
        assertThrows(IllegalArgumentException.class, () -> CollaborationConfig.fromProperties(notANumber));

        Properties emptySchedule = new Properties();
        emptySchedule.setProperty(CollaborationConfig.RETRY_DELAYS_MS, " , ");
        assertThrows(IllegalArgumentException.class, () -> CollaborationConfig.fromProperties(emptySchedule));

        assertThrows(IllegalArgumentException.class,
                () -> CollaborationConfig.builder().inactivityTimeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void toBuilderKeepsValues() {
        CollaborationConfig c = CollaborationConfig.builder().sessionCapacity(7).build();
        CollaborationConfig copy = c.toBuilder().eventHistoryLimit(500).build();
        assertEquals(7, copy.sessionCapacity());
        assertEquals(500, copy.eventHistoryLimit());
    }
}
