package org.sessionsync.metrics;

import org.sessionsync.model.MetricsSnapshot;
import org.sessionsync.model.MetricsSnapshot.OperationStats;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide running totals for conflict resolution, retries and recovery.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Written from every session's lock scope, so all counters are lock-free atomics.</li>
 *   <li>Only the tracking hooks mutate it; there is no reset short of a new instance.</li>
 * </ul>
 */
public final class CollaborationMetrics {

    private final Tracker conflicts = new Tracker();
    private final Tracker retries = new Tracker();
    private final Tracker recoveries = new Tracker();

    public void recordConflictResolution(long elapsedNanos, boolean success) {
        conflicts.record(elapsedNanos, success);
    }

    public void recordRetry(long elapsedNanos, boolean success) {
        retries.record(elapsedNanos, success);
    }

    public void recordRecovery(long elapsedNanos, boolean success) {
        recoveries.record(elapsedNanos, success);
    }

    public OperationStats conflictStats() { return conflicts.stats(); }
    public OperationStats retryStats() { return retries.stats(); }
    public OperationStats recoveryStats() { return recoveries.stats(); }

    public MetricsSnapshot snapshot(int activeSessions, Duration uptime, int errorCount) {
        return new MetricsSnapshot(conflicts.stats(), retries.stats(), recoveries.stats(),
                activeSessions, uptime, errorCount);
    }

    /** Counters for one mechanism. */
    private static final class Tracker {
        private final LongAdder total = new LongAdder();
        private final LongAdder successful = new LongAdder();
        private final LongAdder elapsedNanos = new LongAdder();
        private final AtomicLong maxNanos = new AtomicLong();

        void record(long nanos, boolean success) {
            long n = Math.max(0L, nanos);
            total.increment();
            if (success) successful.increment();
            elapsedNanos.add(n);
            maxNanos.accumulateAndGet(n, Math::max);
        }

        OperationStats stats() {
            long t = total.sum();
            double avgMs = t == 0 ? 0.0 : elapsedNanos.sum() / (double) t / 1_000_000.0;
            return new OperationStats(t, successful.sum(), avgMs, maxNanos.get() / 1_000_000.0);
        }
    }
}
