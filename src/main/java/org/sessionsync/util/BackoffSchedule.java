package org.sessionsync.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed retry delay schedule; the schedule length is the retry budget.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Immutable; safe to share between sessions.</li>
 *   <li>{@link #exponential(Duration, int)} doubles the base delay for every step:
 *       1s → 2s → 4s → 8s → 16s for the default configuration.</li>
 *   <li>No jitter.</li>
 * </ul>
 */
public final class BackoffSchedule {

    private final List<Duration> delays;

    private BackoffSchedule(List<Duration> delays) {
        this.delays = delays;
    }

    /**
     * Builds a schedule from explicit delays.
     *
     * @param delays one entry per allowed attempt, in order
     * @throws IllegalArgumentException if empty or any delay is negative
     */
    public static BackoffSchedule of(List<Duration> delays) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("retry schedule must not be empty");
        }
        for (Duration d : delays) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException("retry delay must be >= 0: " + d);
            }
        }
        return new BackoffSchedule(Collections.unmodifiableList(new ArrayList<>(delays)));
    }

    /**
     * Exponential backoff: baseDelay * 2^(attempt), for {@code attempts} steps.
     */
    public static BackoffSchedule exponential(Duration baseDelay, int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1: " + attempts);
        }
        List<Duration> out = new ArrayList<>(attempts);
        long base = Math.max(0L, baseDelay.toMillis());
        for (int i = 0; i < attempts; i++) {
            out.add(Duration.ofMillis(base << i));
        }
        return of(out);
    }

    /** @return delay to wait before the attempt with the given zero-based index */
    public Duration delayFor(int attempt) {
        if (attempt < 0 || attempt >= delays.size()) {
            throw new IndexOutOfBoundsException("no delay for attempt " + attempt + " of " + delays.size());
        }
        return delays.get(attempt);
    }

    /** @return number of attempts the schedule allows */
    public int maxAttempts() {
        return delays.size();
    }

    public List<Duration> delays() {
        return delays;
    }

    @Override
    public String toString() {
        return "BackoffSchedule" + delays;
    }
}
