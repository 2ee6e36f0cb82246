package org.sessionsync.service;

import org.sessionsync.config.CollaborationConfig;
import org.sessionsync.error.CollaborationException;
import org.sessionsync.error.MaxRetriesExceededException;
import org.sessionsync.error.NoValidSnapshotException;
import org.sessionsync.error.ReplayHistoryIncompleteException;
import org.sessionsync.error.SessionFullException;
import org.sessionsync.error.SessionNotFoundException;
import org.sessionsync.error.SessionOrUserNotFoundException;
import org.sessionsync.error.UserNotFoundException;
import org.sessionsync.event.EventBus;
import org.sessionsync.interfaces.CollaborationListener;
import org.sessionsync.interfaces.ExpiryPolicy;
import org.sessionsync.interfaces.OperationHandler;
import org.sessionsync.interfaces.Sleeper;
import org.sessionsync.interfaces.SnapshotStore;
import org.sessionsync.metrics.CollaborationMetrics;
import org.sessionsync.metrics.ErrorLog;
import org.sessionsync.model.CollaborationEvent;
import org.sessionsync.model.CollaborationEventType;
import org.sessionsync.model.CollaboratorInfo;
import org.sessionsync.model.Conflict;
import org.sessionsync.model.ErrorLogEntry;
import org.sessionsync.model.MetricsSnapshot;
import org.sessionsync.model.MetricsSnapshot.OperationStats;
import org.sessionsync.model.Role;
import org.sessionsync.model.StateEntry;
import org.sessionsync.model.StateSnapshot;
import org.sessionsync.persistence.InMemorySnapshotStore;
import org.sessionsync.util.BackoffSchedule;
import org.sessionsync.util.FixedTtlPolicy;
import org.sessionsync.util.StateValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collaborative session state engine.
 * <p>
 * Holds every live session, serializes all mutations of one session behind that session's
 * lock, detects concurrent conflicting writes with vector clocks and resolves them by role
 * priority with a last-write-wins fallback. Every state change is emitted as a
 * {@link CollaborationEvent}; snapshots plus the event history allow a session to be rebuilt
 * with {@link #recoverState(String, Instant)}.
 * </p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Operations on different sessions run fully in parallel.</li>
 *   <li>The retry backoff sleeps without holding the session lock.</li>
 *   <li>Event history, metrics and the error log are process-wide and carry their own locking.</li>
 *   <li>Listeners run on the calling thread while the session lock is held; they may call back
 *       into the service for the same session.</li>
 * </ul>
 */
public final class CollaborationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CollaborationService.class);

    /** User id carried by events the service emits on its own behalf. */
    public static final String SYSTEM_USER = "system";

    private final CollaborationConfig config;
    private final SnapshotStore snapshots;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ExpiryPolicy snapshotRetention;
    private final Instant startedAt;

    private final EventBus events;
    private final CollaborationMetrics metrics = new CollaborationMetrics();
    private final ErrorLog errors;
    private final ConflictResolver resolver = new ConflictResolver();
    private final OperationDispatcher dispatcher = new OperationDispatcher();
    private final SessionLocks locks = new SessionLocks();
    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    public CollaborationService(CollaborationConfig config) {
        this(config, new InMemorySnapshotStore(), Clock.systemUTC(), Sleeper.THREAD);
    }

    public CollaborationService(CollaborationConfig config, SnapshotStore snapshots, Clock clock, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.snapshotRetention = FixedTtlPolicy.of(config.maxSnapshotAge());
        this.startedAt = clock.instant();
        this.events = new EventBus(config.eventHistoryLimit(), clock);
        this.errors = new ErrorLog(config.errorLogLimit(), clock);
        registerBuiltInHandlers();
        log.info("Collaboration service started: {}", config);
    }

    public CollaborationConfig config() {
        return config;
    }

    /* ============================ session membership ============================ */

    /**
     * Allocates a session with the default capacity and adds the owner with the owner role.
     *
     * @return the new session id
     */
    public String createSession(String ownerId, String displayName) {
        return createSession(ownerId, displayName, config.sessionCapacity());
    }

    /**
     * Allocates a session with an explicit capacity (e.g. a larger one for group rehearsals).
     */
    public String createSession(String ownerId, String displayName, int capacity) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        String sessionId = UUID.randomUUID().toString();
        ReentrantLock lock = locks.acquire(sessionId);
        try {
            Instant now = clock.instant();
            Session s = new Session(sessionId, capacity, now);
            s.participants.put(ownerId, new CollaboratorInfo(ownerId, displayName, config.ownerRole(), now));
            sessions.put(sessionId, s);

            takeSnapshotLocked(s);
            emit(s, CollaborationEventType.CREATE, ownerId,
                    payload("session_id", sessionId, "display_name", displayName, "capacity", capacity));
            log.info("Created session {} (owner={}, capacity={})", sessionId, ownerId, capacity);
            return sessionId;
        } finally {
            unlock(sessionId, lock);
        }
    }

    /**
     * Adds a participant with the joiner role. An unknown session id is created on first join.
     * A participant already in the session is re-activated instead of added twice.
     *
     * @throws SessionFullException when the session already holds {@code capacity} participants
     */
    public void addCollaborator(String sessionId, String userId, String displayName) throws SessionFullException {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(userId, "userId");
        ReentrantLock lock = locks.acquire(sessionId);
        try {
            Instant now = clock.instant();
            Session s = sessions.get(sessionId);
            if (s == null) {
                s = new Session(sessionId, config.sessionCapacity(), now);
                sessions.put(sessionId, s);
                log.info("Created session {} on first join", sessionId);
            }

            CollaboratorInfo existing = s.participants.get(userId);
            if (existing != null) {
                existing.setActive(true);
                if (displayName != null) {
                    existing.setDisplayName(displayName);
                }
            } else {
                if (s.isFull()) {
                    log.warn("Join refused: session {} is full ({} participants)", sessionId, s.capacity);
                    if (s.participants.isEmpty()) {
                        sessions.remove(sessionId, s);
                    }
                    throw new SessionFullException(sessionId, s.capacity);
                }
                s.participants.put(userId, new CollaboratorInfo(userId, displayName, config.joinerRole(), now));
            }
            s.touch(now);

            if (!s.replaying) {
                takeSnapshotLocked(s);
            }
            CollaboratorInfo joined = s.participants.get(userId);
            emit(s, CollaborationEventType.USER_JOINED, userId,
                    payload("session_id", sessionId, "display_name", joined.getDisplayName(),
                            "role", joined.getRole().name()));
            log.debug("User {} joined session {} ({}/{})", userId, sessionId, s.participants.size(), s.capacity);
        } finally {
            unlock(sessionId, lock);
        }
    }

    /**
     * Removes a participant; the session is deleted with its last participant.
     * Unknown session or user is a no-op, so leaving is idempotent.
     */
    public void removeCollaborator(String sessionId, String userId) {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            return;
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo removed = s.participants.remove(userId);
            if (removed == null) {
                return;
            }
            s.touch(clock.instant());
            emit(s, CollaborationEventType.USER_LEFT, userId,
                    payload("session_id", sessionId, "display_name", removed.getDisplayName()));
            log.debug("User {} left session {}", userId, sessionId);
            if (s.participants.isEmpty() && !s.replaying) {
                deleteSessionLocked(s, "last participant left");
            }
        } finally {
            unlock(sessionId, lock);
        }
    }

    /**
     * @throws UserNotFoundException if the session or the participant does not exist
     */
    public void assignRole(String sessionId, String userId, Role role) throws UserNotFoundException {
        Objects.requireNonNull(role, "role");
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new UserNotFoundException(sessionId, userId);
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo c = s.participants.get(userId);
            if (c == null) {
                throw new UserNotFoundException(sessionId, userId);
            }
            Role previous = c.getRole();
            c.setRole(role);
            s.touch(clock.instant());
            emit(s, CollaborationEventType.ROLE_CHANGED, userId,
                    payload("session_id", sessionId, "role", role.name(), "previous_role", previous.name()));
        } finally {
            unlock(sessionId, lock);
        }
    }

    /* ===================== state update & conflict resolution ===================== */

    /**
     * Applies a participant's updates with conflict detection and resolution.
     * <ol>
     *   <li>advances the updater's vector clock;</li>
     *   <li>finds active peers with a concurrent clock that hold any of the updated keys;</li>
     *   <li>drops the keys the updater loses (role priority, then last-write-wins);</li>
     *   <li>merges the survivors into the updater's last-known state and emits {@code state_update};</li>
     *   <li>takes a snapshot when the updater's last sync is older than the sync interval.</li>
     * </ol>
     *
     * @return the updates actually applied
     * @throws SessionOrUserNotFoundException if the session or participant is unknown
     */
    public Map<String, Object> updateState(String sessionId, String userId, Map<String, ?> updates)
            throws SessionOrUserNotFoundException {
        return updateState(sessionId, userId, updates, Map.of());
    }

    private Map<String, Object> updateState(String sessionId,
                                            String userId,
                                            Map<String, ?> updates,
                                            Map<String, ?> recordedAppliedAt)
            throws SessionOrUserNotFoundException {
        Objects.requireNonNull(updates, "updates");
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new SessionOrUserNotFoundException(sessionId, userId);
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo c = s.participants.get(userId);
            if (c == null) {
                throw new SessionOrUserNotFoundException(sessionId, userId);
            }
            c.getVectorClock().increment(userId);

            Instant now = clock.instant();
            Map<String, StateEntry> incoming = new LinkedHashMap<>();
            updates.forEach((key, value) -> {
                Object recorded = recordedAppliedAt.get(key);
                incoming.put(key, StateEntry.of(value,
                        recorded instanceof Number ? ((Number) recorded).longValue() : now.toEpochMilli()));
            });

            List<Conflict> conflicts = resolver.detect(c, s.participants.values(), incoming.keySet());
            Map<String, StateEntry> accepted = conflicts.isEmpty()
                    ? incoming
                    : resolveConflicts(s, c, incoming, conflicts);

            c.applyState(accepted);
            s.touch(now);

            Map<String, Object> applied = new LinkedHashMap<>();
            Map<String, Object> appliedAt = new LinkedHashMap<>();
            accepted.forEach((k, e) -> {
                applied.put(k, e.value());
                appliedAt.put(k, e.appliedAt());
            });
            emit(s, CollaborationEventType.STATE_UPDATE, userId,
                    payload("session_id", sessionId, "updates", applied, "applied_at", appliedAt,
                            "vector_clock", c.getVectorClock().timestamps()));
            log.debug("State update in session {} by {}: keys={}", sessionId, userId, applied.keySet());

            if (!s.replaying && Duration.between(c.getLastSync(), now).compareTo(config.syncInterval()) > 0) {
                c.setLastSync(now);
                takeSnapshotLocked(s);
            }
            return applied;
        } finally {
            unlock(sessionId, lock);
        }
    }

    private Map<String, StateEntry> resolveConflicts(Session s,
                                                     CollaboratorInfo updater,
                                                     Map<String, StateEntry> incoming,
                                                     List<Conflict> conflicts) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            Map<String, StateEntry> resolved = resolver.resolve(updater, s.participants, incoming, conflicts);
            success = true;

            Set<String> dropped = new LinkedHashSet<>(incoming.keySet());
            dropped.removeAll(resolved.keySet());
            List<Object> described = new ArrayList<>();
            conflicts.forEach(c -> described.add(c.toPayload()));
            log.warn("Conflict in session {}: user {} vs {} -> dropped {}",
                    s.id, updater.getUserId(), conflicts.stream().map(Conflict::peerId).toArray(), dropped);
            emit(s, CollaborationEventType.CONFLICT_DETECTED, updater.getUserId(),
                    payload("session_id", s.id,
                            "conflicts", described,
                            "dropped_keys", new ArrayList<>(dropped),
                            "vector_clock", updater.getVectorClock().timestamps()));
            return resolved;
        } catch (RuntimeException e) {
            errors.record("conflict_resolution_error",
                    payload("session_id", s.id, "user_id", updater.getUserId(), "error", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            if (!s.replaying) {
                metrics.recordConflictResolution(System.nanoTime() - start, success);
                emitMetrics(s.id, "conflict_resolution", metrics.conflictStats());
            }
        }
    }

    /**
     * Resolved view of the session's shared state: for each key, an editor's value beats a
     * non-editor's, then the newest write wins.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public Map<String, Object> getSessionState(String sessionId) throws SessionNotFoundException {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new SessionNotFoundException(sessionId);
        }
        try {
            return resolver.view(sessions.get(sessionId).participants.values());
        } finally {
            unlock(sessionId, lock);
        }
    }

    /* ============================ participant details ============================ */

    /**
     * Sets the participant's position marker (e.g. current script line).
     */
    public void updateLineProgress(String sessionId, String userId, int line) throws UserNotFoundException {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new UserNotFoundException(sessionId, userId);
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo c = requireParticipant(s, userId);
            c.setCurrentLine(line);
            s.touch(clock.instant());
            emit(s, CollaborationEventType.PROGRESS_UPDATE, userId, payload("session_id", sessionId, "line", line));
        } finally {
            unlock(sessionId, lock);
        }
    }

    public void updatePerformanceMetrics(String sessionId, String userId, Map<String, ? extends Number> values)
            throws UserNotFoundException {
        Objects.requireNonNull(values, "values");
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new UserNotFoundException(sessionId, userId);
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo c = requireParticipant(s, userId);
            c.mergePerformanceMetrics(values);
            s.touch(clock.instant());
            emit(s, CollaborationEventType.PERFORMANCE_UPDATE, userId,
                    payload("session_id", sessionId, "metrics", new LinkedHashMap<>(values)));
        } finally {
            unlock(sessionId, lock);
        }
    }

    public void updateContent(String sessionId, String userId, String content) throws UserNotFoundException {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new UserNotFoundException(sessionId, userId);
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo c = requireParticipant(s, userId);
            c.setContent(content);
            s.touch(clock.instant());
            emit(s, CollaborationEventType.CONTENT_UPDATE, userId,
                    payload("session_id", sessionId, "content", c.getContent()));
        } finally {
            unlock(sessionId, lock);
        }
    }

    /**
     * Records feedback from one participant to another as a {@code feedback} event.
     *
     * @throws UserNotFoundException if either participant is missing
     */
    public void provideFeedback(String sessionId, String fromUserId, String toUserId, Map<String, ?> feedback)
            throws UserNotFoundException {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new UserNotFoundException(sessionId, fromUserId);
        }
        try {
            Session s = sessions.get(sessionId);
            requireParticipant(s, fromUserId);
            requireParticipant(s, toUserId);
            Map<String, Object> data = StateValues.deepCopyMap(feedback);
            data.put("session_id", sessionId);
            data.put("to_user_id", toUserId);
            s.touch(clock.instant());
            emit(s, CollaborationEventType.FEEDBACK, fromUserId, data);
        } finally {
            unlock(sessionId, lock);
        }
    }

    private static CollaboratorInfo requireParticipant(Session s, String userId) throws UserNotFoundException {
        CollaboratorInfo c = s.participants.get(userId);
        if (c == null) {
            throw new UserNotFoundException(s.id, userId);
        }
        return c;
    }

    public Optional<CollaboratorInfo> getCollaboratorInfo(String sessionId, String userId) {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            return Optional.empty();
        }
        try {
            CollaboratorInfo c = sessions.get(sessionId).participants.get(userId);
            return Optional.ofNullable(c == null ? null : c.copy());
        } finally {
            unlock(sessionId, lock);
        }
    }

    /** @return copies of the session's participants in join order; empty for an unknown session */
    public List<CollaboratorInfo> getSessionCollaborators(String sessionId) {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            return new ArrayList<>();
        }
        try {
            List<CollaboratorInfo> out = new ArrayList<>();
            sessions.get(sessionId).participants.values().forEach(c -> out.add(c.copy()));
            return out;
        } finally {
            unlock(sessionId, lock);
        }
    }

    /** @return ids of the sessions the user currently participates in */
    public List<String> getUserSessions(String userId) {
        List<String> out = new ArrayList<>();
        for (String id : getSessionIds()) {
            if (getCollaboratorInfo(id, userId).isPresent()) {
                out.add(id);
            }
        }
        return out;
    }

    public Set<String> getSessionIds() {
        return new LinkedHashSet<>(sessions.keySet());
    }

    /* ================================ retries ================================ */

    /**
     * Runs one retry attempt of {@code operation} for the participant.
     * <p>
     * Sleeps for the schedule's delay at the participant's current retry count, then dispatches
     * the operation by its {@code type}. Success resets the count to 0; failure increments it,
     * records the failure and rethrows so the caller can decide whether to try again. Once the
     * count reaches the schedule length every call fails with {@link MaxRetriesExceededException}
     * without attempting; such a rejection still counts as a failed retry in the metrics.
     * </p>
     *
     * @throws SessionOrUserNotFoundException if the participant is unknown
     * @throws MaxRetriesExceededException once the schedule is exhausted
     * @throws CollaborationException whatever the dispatched operation failed with
     * @throws InterruptedException if the caller aborted the backoff wait; the count is unchanged
     */
    public void retryOperation(String sessionId, String userId, Map<String, ?> operation)
            throws CollaborationException, InterruptedException {
        Map<String, Object> op = StateValues.deepCopyMap(operation);
        BackoffSchedule schedule = config.retrySchedule();
        int attempt;
        Duration delay;

        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new SessionOrUserNotFoundException(sessionId, userId);
        }
        try {
            Session s = sessions.get(sessionId);
            CollaboratorInfo c = s.participants.get(userId);
            if (c == null) {
                throw new SessionOrUserNotFoundException(sessionId, userId);
            }
            attempt = c.getRetryCount();
            if (attempt >= schedule.maxAttempts()) {
                errors.record("max_retries_exceeded",
                        payload("session_id", sessionId, "user_id", userId, "operation", op, "retry_count", attempt));
                metrics.recordRetry(0L, false);
                emitMetrics(sessionId, "retry_mechanism", metrics.retryStats());
                throw new MaxRetriesExceededException(sessionId, userId, schedule.maxAttempts());
            }
            delay = schedule.delayFor(attempt);
            emit(s, CollaborationEventType.RETRY_OPERATION, userId,
                    payload("session_id", sessionId, "attempt", attempt + 1, "delay_ms", delay.toMillis(),
                            "operation", op));
        } finally {
            unlock(sessionId, lock);
        }

        long start = System.nanoTime();
        boolean success = false;
        try {
            sleeper.sleep(delay);
            dispatcher.dispatch(sessionId, userId, op);
            success = true;
            adjustRetryCount(sessionId, userId, true);
            log.debug("Retry attempt {} of {} succeeded for user {} in session {}", attempt + 1, op.get("type"), userId, sessionId);
        } catch (CollaborationException | RuntimeException e) {
            adjustRetryCount(sessionId, userId, false);
            errors.record("retry_error",
                    payload("session_id", sessionId, "user_id", userId, "operation", op,
                            "attempt", attempt + 1, "error", String.valueOf(e.getMessage())));
            throw e;
        } catch (InterruptedException e) {
            log.info("Retry of {} for user {} in session {} cancelled during backoff", op.get("type"), userId, sessionId);
            throw e;
        } finally {
            metrics.recordRetry(System.nanoTime() - start, success);
            emitMetrics(sessionId, "retry_mechanism", metrics.retryStats());
        }
    }

    private void adjustRetryCount(String sessionId, String userId, boolean reset) {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            return;
        }
        try {
            CollaboratorInfo c = sessions.get(sessionId).participants.get(userId);
            if (c == null) {
                return;
            }
            if (reset) {
                c.resetRetryCount();
            } else {
                c.incrementRetryCount();
            }
        } finally {
            unlock(sessionId, lock);
        }
    }

    /**
     * Adds or replaces the handler for an operation type, extending retry and replay dispatch.
     */
    public void registerOperationHandler(String type, OperationHandler handler) {
        dispatcher.register(type, handler);
    }

    @SuppressWarnings("unchecked")
    private void registerBuiltInHandlers() {
        dispatcher.register(CollaborationEventType.STATE_UPDATE.wireName(), (sessionId, userId, op) -> {
            Object updates = op.get("updates");
            if (!(updates instanceof Map)) {
                throw new IllegalArgumentException("state_update requires an 'updates' map");
            }
            Object appliedAt = op.get("applied_at");
            updateState(sessionId, userId, (Map<String, ?>) updates,
                    appliedAt instanceof Map ? (Map<String, ?>) appliedAt : Map.of());
        });
        dispatcher.register(CollaborationEventType.ROLE_CHANGED.wireName(), (sessionId, userId, op) ->
                assignRole(sessionId, userId, Role.of(String.valueOf(op.get("role")))));
        dispatcher.register(CollaborationEventType.USER_JOINED.wireName(), (sessionId, userId, op) -> {
            Object name = op.get("display_name");
            addCollaborator(sessionId, userId, name == null ? null : String.valueOf(name));
        });
        dispatcher.register(CollaborationEventType.USER_LEFT.wireName(), (sessionId, userId, op) ->
                removeCollaborator(sessionId, userId));
        dispatcher.register(CollaborationEventType.PROGRESS_UPDATE.wireName(), (sessionId, userId, op) -> {
            Object line = op.get("line");
            if (!(line instanceof Number)) {
                throw new IllegalArgumentException("progress_update requires a numeric 'line'");
            }
            updateLineProgress(sessionId, userId, ((Number) line).intValue());
        });
        dispatcher.register(CollaborationEventType.PERFORMANCE_UPDATE.wireName(), (sessionId, userId, op) -> {
            Object values = op.get("metrics");
            if (!(values instanceof Map)) {
                throw new IllegalArgumentException("performance_update requires a 'metrics' map");
            }
            Map<String, Number> numeric = new LinkedHashMap<>();
            ((Map<String, ?>) values).forEach((k, v) -> {
                if (v instanceof Number) numeric.put(k, (Number) v);
            });
            updatePerformanceMetrics(sessionId, userId, numeric);
        });
        dispatcher.register(CollaborationEventType.CONTENT_UPDATE.wireName(), (sessionId, userId, op) -> {
            Object content = op.get("content");
            updateContent(sessionId, userId, content == null ? "" : String.valueOf(content));
        });
    }

    /* ========================== snapshots & recovery ========================== */

    /**
     * Captures the session now; older snapshots past the max age are pruned.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public StateSnapshot takeSnapshot(String sessionId) throws SessionNotFoundException {
        ReentrantLock lock = lockIfPresent(sessionId);
        if (lock == null) {
            throw new SessionNotFoundException(sessionId);
        }
        try {
            return takeSnapshotLocked(sessions.get(sessionId));
        } finally {
            unlock(sessionId, lock);
        }
    }

    private StateSnapshot takeSnapshotLocked(Session s) {
        Instant now = clock.instant();
        StateSnapshot snapshot = new StateSnapshot(s.id, s.participants, now, events.lastSequence());
        snapshots.append(snapshot);
        int pruned = snapshots.prune(s.id, snapshotRetention, now.toEpochMilli());
        log.debug("Snapshot of session {} at seq {} ({} participants, {} pruned)",
                s.id, snapshot.lastEventSequence(), snapshot.size(), pruned);
        return snapshot;
    }

    /** @return retained snapshots of the session in capture order */
    public List<StateSnapshot> getSnapshots(String sessionId) {
        return snapshots.list(sessionId);
    }

    /** Recovers from the most recent snapshot. */
    public void recoverState(String sessionId) throws CollaborationException {
        recoverState(sessionId, null);
    }

    /**
     * Restores the session from the snapshot nearest to {@code targetTime} (the most recent when
     * null) and replays every later replayable event of the session through the operation
     * dispatcher. Replay neither records new events nor takes snapshots.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws NoValidSnapshotException if the session has no snapshot
     * @throws ReplayHistoryIncompleteException if events after the snapshot were evicted from
     *         history; the session is left untouched
     * @throws CollaborationException if replaying an event fails
     */
    public void recoverState(String sessionId, Instant targetTime) throws CollaborationException {
        long start = System.nanoTime();
        boolean success = false;
        try {
            ReentrantLock lock = lockIfPresent(sessionId);
            if (lock == null) {
                throw new SessionNotFoundException(sessionId);
            }
            try {
                Session s = sessions.get(sessionId);
                StateSnapshot snapshot = nearestSnapshot(sessionId, targetTime)
                        .orElseThrow(() -> new NoValidSnapshotException(sessionId));
                int replayed = replay(s, snapshot);
                success = true;
                log.info("Recovered session {} from snapshot at {} (seq {}), replayed {} events",
                        sessionId, snapshot.capturedAt(), snapshot.lastEventSequence(), replayed);
            } finally {
                unlock(sessionId, lock);
            }
        } catch (CollaborationException | RuntimeException e) {
            errors.record("state_recovery_error",
                    payload("session_id", sessionId, "target_time", targetTime == null ? null : targetTime.toString(),
                            "error", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            metrics.recordRecovery(System.nanoTime() - start, success);
            emitMetrics(sessionId, "state_recovery", metrics.recoveryStats());
        }
    }

    /**
     * Brings back a session that is not live in this service from the newest snapshot in the
     * store, typically a {@link org.sessionsync.persistence.FileSnapshotStore} written by an
     * earlier process. Event sequences restart with the process, so the stored snapshots are
     * discarded and replaced by a fresh one; later recoveries replay from that point.
     *
     * @return false if the session is already live
     * @throws NoValidSnapshotException if the store holds no snapshot of the session
     */
    public boolean restoreSession(String sessionId) throws NoValidSnapshotException {
        Objects.requireNonNull(sessionId, "sessionId");
        ReentrantLock lock = locks.acquire(sessionId);
        try {
            if (sessions.containsKey(sessionId)) {
                return false;
            }
            StateSnapshot stored = nearestSnapshot(sessionId, null)
                    .orElseThrow(() -> new NoValidSnapshotException(sessionId));
            Map<String, CollaboratorInfo> participants = stored.collaborators();
            if (participants.isEmpty()) {
                snapshots.remove(sessionId);
                throw new NoValidSnapshotException(sessionId);
            }
            Instant now = clock.instant();
            Session s = new Session(sessionId, Math.max(config.sessionCapacity(), participants.size()), now);
            s.participants = participants;
            snapshots.remove(sessionId);
            sessions.put(sessionId, s);
            takeSnapshotLocked(s);
            log.info("Restored session {} from stored snapshot captured at {} ({} participants)",
                    sessionId, stored.capturedAt(), participants.size());
            return true;
        } finally {
            unlock(sessionId, lock);
        }
    }

    private Optional<StateSnapshot> nearestSnapshot(String sessionId, Instant targetTime) {
        List<StateSnapshot> all = snapshots.list(sessionId);
        if (all.isEmpty()) {
            return Optional.empty();
        }
        if (targetTime == null) {
            return Optional.of(all.get(all.size() - 1));
        }
        return all.stream().min(Comparator.comparingLong(
                s -> Math.abs(Duration.between(s.capturedAt(), targetTime).toMillis())));
    }

    private int replay(Session s, StateSnapshot snapshot) throws CollaborationException {
        long evictedUpTo = events.lastEvictedReplayableSequence(s.id);
        if (evictedUpTo > snapshot.lastEventSequence()) {
            throw new ReplayHistoryIncompleteException(s.id, snapshot.lastEventSequence(), evictedUpTo);
        }
        s.participants = snapshot.collaborators();

        List<CollaborationEvent> toReplay = new ArrayList<>();
        for (CollaborationEvent e : events.sessionHistoryAfter(s.id, snapshot.lastEventSequence())) {
            if (e.type().isReplayable()) {
                toReplay.add(e);
            }
        }

        s.replaying = true;
        try {
            for (CollaborationEvent e : toReplay) {
                Map<String, Object> op = e.payload();
                op.put(OperationDispatcher.TYPE, e.type().wireName());
                dispatcher.dispatch(s.id, e.userId(), op);
            }
        } finally {
            s.replaying = false;
        }

        s.touch(clock.instant());
        if (s.participants.isEmpty()) {
            deleteSessionLocked(s, "empty after recovery");
        }
        return toReplay.size();
    }

    /* ============================ inactivity cleanup ============================ */

    /** Cleanup with the configured inactivity timeout. */
    public int cleanupInactiveSessions() {
        return cleanupInactiveSessions(config.inactivityTimeout());
    }

    /**
     * Removes every session whose last activity is at least {@code timeout} old, after emitting
     * one {@code session_timeout} event per participant. Meant for a periodic timer.
     *
     * @return number of sessions removed
     */
    public int cleanupInactiveSessions(Duration timeout) {
        ExpiryPolicy policy = FixedTtlPolicy.of(timeout);
        int removed = 0;
        for (String sessionId : getSessionIds()) {
            ReentrantLock lock = lockIfPresent(sessionId);
            if (lock == null) {
                continue;
            }
            try {
                Session s = sessions.get(sessionId);
                Instant now = clock.instant();
                if (!policy.isExpired(s.lastActivity.toEpochMilli(), now.toEpochMilli())) {
                    continue;
                }
                long idleMs = Duration.between(s.lastActivity, now).toMillis();
                for (CollaboratorInfo c : new ArrayList<>(s.participants.values())) {
                    emit(s, CollaborationEventType.SESSION_TIMEOUT, c.getUserId(),
                            payload("session_id", sessionId, "idle_ms", idleMs));
                }
                deleteSessionLocked(s, "inactive for " + idleMs + "ms");
                removed++;
            } finally {
                unlock(sessionId, lock);
            }
        }
        if (removed > 0) {
            log.info("Inactivity cleanup removed {} session(s)", removed);
        }
        return removed;
    }

    private void deleteSessionLocked(Session s, String reason) {
        sessions.remove(s.id, s);
        snapshots.remove(s.id);
        events.forgetSession(s.id);
        log.info("Removed session {}: {}", s.id, reason);
    }

    /* ================================ events ================================ */

    public void addEventListener(CollaborationEventType type, CollaborationListener listener) {
        events.addListener(type, listener);
    }

    public void removeEventListener(CollaborationEventType type, CollaborationListener listener) {
        events.removeListener(type, listener);
    }

    /** @return a copy of the event history, restricted to {@code type} unless null */
    public List<CollaborationEvent> getEventHistory(CollaborationEventType type) {
        return events.history(type);
    }

    public List<CollaborationEvent> getEventHistory() {
        return events.history();
    }

    private void emit(Session s, CollaborationEventType type, String userId, Map<String, ?> data) {
        if (s.replaying) {
            return;
        }
        events.emit(type, s.id, userId, data);
    }

    private void emitMetrics(String sessionId, String kind, OperationStats stats) {
        events.emit(CollaborationEventType.METRICS_UPDATE, sessionId, SYSTEM_USER,
                payload("type", kind, "session_id", sessionId, "metrics", stats.toMap()));
    }

    /* ================================ metrics ================================ */

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot(sessions.size(), Duration.between(startedAt, clock.instant()), errors.count());
    }

    /**
     * @param type only this error type, or all when null
     * @param limit newest {@code limit} entries
     */
    public List<ErrorLogEntry> getErrorLog(String type, int limit) {
        return errors.entries(type, limit);
    }

    /* ================================ internals ================================ */

    /**
     * Locks an existing session. Returns null, holding nothing, when the session does not exist.
     */
    private ReentrantLock lockIfPresent(String sessionId) {
        if (sessionId == null || !sessions.containsKey(sessionId)) {
            return null;
        }
        ReentrantLock lock = locks.acquire(sessionId);
        if (!sessions.containsKey(sessionId)) {
            unlock(sessionId, lock);
            return null;
        }
        return lock;
    }

    private void unlock(String sessionId, ReentrantLock lock) {
        locks.release(sessionId, lock, !sessions.containsKey(sessionId));
    }

    /** @return number of session locks currently allocated */
    int lockCount() {
        return locks.size();
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            m.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return m;
    }

    /** Drops all sessions, snapshots, listeners and history. */
    @Override
    public void close() {
        for (String id : getSessionIds()) {
            snapshots.remove(id);
        }
        sessions.clear();
        events.clear();
        log.info("Collaboration service closed");
    }
}
