package org.sessionsync.config;

import org.sessionsync.model.Role;
import org.sessionsync.util.BackoffSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings the surrounding process supplies to the collaboration service.
 * <p>
 * Immutable. Build with {@link #builder()} or load from properties
 * ({@link #load()} reads {@code collaboration.properties} from the classpath,
 * falling back to defaults for missing keys).
 * </p>
 */
public final class CollaborationConfig {

    private static final Logger log = LoggerFactory.getLogger(CollaborationConfig.class);

    public static final String RESOURCE = "collaboration.properties";

    public static final String SESSION_CAPACITY = "collab.session.capacity";
    public static final String SYNC_INTERVAL_MS = "collab.sync.interval.ms";
    public static final String SNAPSHOT_MAX_AGE_MS = "collab.snapshot.max-age.ms";
    public static final String INACTIVITY_TIMEOUT_MS = "collab.inactivity.timeout.ms";
    public static final String RETRY_DELAYS_MS = "collab.retry.delays.ms";
    public static final String OWNER_ROLE = "collab.owner.role";
    public static final String JOINER_ROLE = "collab.joiner.role";
    public static final String EVENT_HISTORY_LIMIT = "collab.event-history.limit";
    public static final String ERROR_LOG_LIMIT = "collab.error-log.limit";

    private final int sessionCapacity;
    private final Duration syncInterval;
    private final Duration maxSnapshotAge;
    private final Duration inactivityTimeout;
    private final BackoffSchedule retrySchedule;
    private final Role ownerRole;
    private final Role joinerRole;
    private final int eventHistoryLimit;
    private final int errorLogLimit;

    private CollaborationConfig(Builder b) {
        if (b.sessionCapacity < 1) {
            throw new IllegalArgumentException("session capacity must be >= 1: " + b.sessionCapacity);
        }
        if (b.eventHistoryLimit < 0) {
            throw new IllegalArgumentException("event history limit must be >= 0: " + b.eventHistoryLimit);
        }
        if (b.errorLogLimit < 1) {
            throw new IllegalArgumentException("error log limit must be >= 1: " + b.errorLogLimit);
        }
        this.sessionCapacity = b.sessionCapacity;
        this.syncInterval = nonNegative(b.syncInterval, "sync interval");
        this.maxSnapshotAge = nonNegative(b.maxSnapshotAge, "max snapshot age");
        this.inactivityTimeout = nonNegative(b.inactivityTimeout, "inactivity timeout");
        this.retrySchedule = b.retrySchedule;
        this.ownerRole = b.ownerRole;
        this.joinerRole = b.joinerRole;
        this.eventHistoryLimit = b.eventHistoryLimit;
        this.errorLogLimit = b.errorLogLimit;
    }

    private static Duration nonNegative(Duration d, String what) {
        if (d == null || d.isNegative()) {
            throw new IllegalArgumentException(what + " must be >= 0: " + d);
        }
        return d;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CollaborationConfig defaults() {
        return builder().build();
    }

    /** Loads {@value #RESOURCE} from the classpath; defaults when the resource is absent. */
    public static CollaborationConfig load() {
        try (InputStream in = CollaborationConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", RESOURCE);
                return defaults();
            }
            Properties p = new Properties();
            p.load(in);
            return fromProperties(p);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * @throws IllegalArgumentException for malformed or out-of-range values
     */
    public static CollaborationConfig fromProperties(Properties p) {
        Builder b = builder();
        String v;
        if ((v = p.getProperty(SESSION_CAPACITY)) != null) b.sessionCapacity(parseInt(SESSION_CAPACITY, v));
        if ((v = p.getProperty(SYNC_INTERVAL_MS)) != null) b.syncInterval(millis(SYNC_INTERVAL_MS, v));
        if ((v = p.getProperty(SNAPSHOT_MAX_AGE_MS)) != null) b.maxSnapshotAge(millis(SNAPSHOT_MAX_AGE_MS, v));
        if ((v = p.getProperty(INACTIVITY_TIMEOUT_MS)) != null) b.inactivityTimeout(millis(INACTIVITY_TIMEOUT_MS, v));
        if ((v = p.getProperty(RETRY_DELAYS_MS)) != null) b.retrySchedule(parseSchedule(v));
        if ((v = p.getProperty(OWNER_ROLE)) != null) b.ownerRole(Role.of(v));
        if ((v = p.getProperty(JOINER_ROLE)) != null) b.joinerRole(Role.of(v));
        if ((v = p.getProperty(EVENT_HISTORY_LIMIT)) != null) b.eventHistoryLimit(parseInt(EVENT_HISTORY_LIMIT, v));
        if ((v = p.getProperty(ERROR_LOG_LIMIT)) != null) b.errorLogLimit(parseInt(ERROR_LOG_LIMIT, v));
        return b.build();
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private static Duration millis(String key, String v) {
        try {
            return Duration.ofMillis(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + v, e);
        }
    }

    /** "1000, 2000,4000" → schedule of three delays. */
    static BackoffSchedule parseSchedule(String csv) {
        List<Duration> delays = new ArrayList<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                delays.add(millis(RETRY_DELAYS_MS, part));
            }
        }
        return BackoffSchedule.of(delays);
    }

    public int sessionCapacity() { return sessionCapacity; }
    public Duration syncInterval() { return syncInterval; }
    public Duration maxSnapshotAge() { return maxSnapshotAge; }
    public Duration inactivityTimeout() { return inactivityTimeout; }
    public BackoffSchedule retrySchedule() { return retrySchedule; }
    public Role ownerRole() { return ownerRole; }
    public Role joinerRole() { return joinerRole; }
    /** @return max retained events, 0 for unbounded */
    public int eventHistoryLimit() { return eventHistoryLimit; }
    public int errorLogLimit() { return errorLogLimit; }

    public Builder toBuilder() {
        return builder()
                .sessionCapacity(sessionCapacity)
                .syncInterval(syncInterval)
                .maxSnapshotAge(maxSnapshotAge)
                .inactivityTimeout(inactivityTimeout)
                .retrySchedule(retrySchedule)
                .ownerRole(ownerRole)
                .joinerRole(joinerRole)
                .eventHistoryLimit(eventHistoryLimit)
                .errorLogLimit(errorLogLimit);
    }

    @Override
    public String toString() {
        return "CollaborationConfig{" +
                "sessionCapacity=" + sessionCapacity +
                ", syncInterval=" + syncInterval +
                ", maxSnapshotAge=" + maxSnapshotAge +
                ", inactivityTimeout=" + inactivityTimeout +
                ", retrySchedule=" + retrySchedule +
                ", ownerRole=" + ownerRole +
                ", joinerRole=" + joinerRole +
                ", eventHistoryLimit=" + eventHistoryLimit +
                ", errorLogLimit=" + errorLogLimit +
                '}';
    }

    public static final class Builder {
        private int sessionCapacity = 4;
        private Duration syncInterval = Duration.ofSeconds(5);
        private Duration maxSnapshotAge = Duration.ofHours(24);
        private Duration inactivityTimeout = Duration.ofHours(1);
        private BackoffSchedule retrySchedule = BackoffSchedule.exponential(Duration.ofSeconds(1), 5);
        private Role ownerRole = Role.EDITOR;
        private Role joinerRole = Role.VIEWER;
        private int eventHistoryLimit = 0;
        private int errorLogLimit = 1_000;

        private Builder() {}

        public Builder sessionCapacity(int v) { this.sessionCapacity = v; return this; }
        public Builder syncInterval(Duration v) { this.syncInterval = v; return this; }
        public Builder maxSnapshotAge(Duration v) { this.maxSnapshotAge = v; return this; }
        public Builder inactivityTimeout(Duration v) { this.inactivityTimeout = v; return this; }
        public Builder retrySchedule(BackoffSchedule v) { this.retrySchedule = Objects.requireNonNull(v); return this; }
        public Builder ownerRole(Role v) { this.ownerRole = Objects.requireNonNull(v); return this; }
        public Builder joinerRole(Role v) { this.joinerRole = Objects.requireNonNull(v); return this; }
        public Builder eventHistoryLimit(int v) { this.eventHistoryLimit = v; return this; }
        public Builder errorLogLimit(int v) { this.errorLogLimit = v; return this; }

        public CollaborationConfig build() {
            return new CollaborationConfig(this);
        }
    }
}
