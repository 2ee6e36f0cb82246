package org.sessionsync.model;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the service metrics at one instant, for dashboards.
 */
public final class MetricsSnapshot {

    /** Totals for one tracked mechanism (conflict resolution, retries, recovery). */
    public static final class OperationStats {
        private final long total;
        private final long successful;
        private final double averageMillis;
        private final double maxMillis;

        public OperationStats(long total, long successful, double averageMillis, double maxMillis) {
            this.total = total;
            this.successful = successful;
            this.averageMillis = averageMillis;
            this.maxMillis = maxMillis;
        }

        public long total() { return total; }
        public long successful() { return successful; }
        public double averageMillis() { return averageMillis; }
        public double maxMillis() { return maxMillis; }

        /** @return successful / total, 0.0 before the first sample */
        public double successRate() {
            return total == 0 ? 0.0 : (double) successful / total;
        }

        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("total", total);
            m.put("successful", successful);
            m.put("average_ms", averageMillis);
            m.put("max_ms", maxMillis);
            m.put("success_rate", successRate());
            return m;
        }

        @Override
        public String toString() {
            return "OperationStats" + toMap();
        }
    }

    private final OperationStats conflictResolution;
    private final OperationStats retries;
    private final OperationStats recoveries;
    private final int activeSessions;
    private final Duration uptime;
    private final int errorCount;

    public MetricsSnapshot(OperationStats conflictResolution,
                           OperationStats retries,
                           OperationStats recoveries,
                           int activeSessions,
                           Duration uptime,
                           int errorCount) {
        this.conflictResolution = conflictResolution;
        this.retries = retries;
        this.recoveries = recoveries;
        this.activeSessions = activeSessions;
        this.uptime = uptime;
        this.errorCount = errorCount;
    }

    public OperationStats conflictResolution() { return conflictResolution; }
    public OperationStats retries() { return retries; }
    public OperationStats recoveries() { return recoveries; }
    public int activeSessions() { return activeSessions; }
    public Duration uptime() { return uptime; }
    public int errorCount() { return errorCount; }

    /** Convenience accessor matching the dashboard name {@code total_conflicts}. */
    public long totalConflicts() {
        return conflictResolution.total();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("uptime_ms", uptime.toMillis());
        m.put("active_sessions", activeSessions);
        m.put("conflict_resolution", conflictResolution.toMap());
        m.put("retry_mechanism", retries.toMap());
        m.put("state_recovery", recoveries.toMap());
        m.put("error_count", errorCount);
        return m;
    }

    @Override
    public String toString() {
        return "MetricsSnapshot" + toMap();
    }
}
