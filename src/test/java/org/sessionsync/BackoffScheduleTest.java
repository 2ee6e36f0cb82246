package org.sessionsync;

import org.junit.jupiter.api.Test;
import org.sessionsync.util.BackoffSchedule;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackoffScheduleTest {

    @Test
    void exponentialDoublesEachStep() {
        BackoffSchedule s = BackoffSchedule.exponential(Duration.ofSeconds(1), 5);
        assertEquals(5, s.maxAttempts());
        assertEquals(List.of(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(8), Duration.ofSeconds(16)), s.delays());
    }

    @Test
    void explicitDelays() {
        BackoffSchedule s = BackoffSchedule.of(List.of(Duration.ofMillis(3), Duration.ZERO));
        assertEquals(Duration.ofMillis(3), s.delayFor(0));
        assertEquals(Duration.ZERO, s.delayFor(1));
        assertThrows(IndexOutOfBoundsException.class, () -> s.delayFor(2));
    }

    @Test
    void rejectsInvalidSchedules() {
        assertThrows(IllegalArgumentException.class, () -> BackoffSchedule.of(List.of()));
        assertThrows(IllegalArgumentException.class, () -> BackoffSchedule.of(List.of(Duration.ofMillis(-1))));
        assertThrows(IllegalArgumentException.class, () -> BackoffSchedule.exponential(Duration.ofMillis(1), 0));
    }
}
