package org.sessionsync.event;

import org.sessionsync.interfaces.CollaborationListener;
import org.sessionsync.model.CollaborationEvent;
import org.sessionsync.model.CollaborationEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Typed event log plus listener registry.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Sequence assignment and history append happen under one monitor, so history
 *       order equals sequence order even when several sessions emit at once.</li>
 *   <li>Listeners run on the emitting thread, outside that monitor, in registration order.</li>
 *   <li>A listener exception is logged and swallowed; it never reaches the emitter or
 *       the remaining listeners.</li>
 *   <li>History is bounded by {@code historyLimit} (0 = unbounded); the oldest events go first.
 *       The sequence of the newest evicted replayable event is kept per session.</li>
 * </ul>
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<CollaborationEventType, CopyOnWriteArrayList<CollaborationListener>> listeners =
            new EnumMap<>(CollaborationEventType.class);
    private final Deque<CollaborationEvent> history = new ArrayDeque<>();
    private final Object mon = new Object();
    private final int historyLimit;
    private final Clock clock;
    private long lastSequence;
    private long evicted;
    private final Map<String, Long> lastEvictedReplayable = new HashMap<>();

    public EventBus(int historyLimit, Clock clock) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be >= 0: " + historyLimit);
        }
        this.historyLimit = historyLimit;
        this.clock = clock;
        for (CollaborationEventType t : CollaborationEventType.values()) {
            listeners.put(t, new CopyOnWriteArrayList<>());
        }
    }

    /** Registers a listener; registering the same instance twice has no effect. */
    public void addListener(CollaborationEventType type, CollaborationListener listener) {
        listeners.get(type).addIfAbsent(listener);
    }

    public void removeListener(CollaborationEventType type, CollaborationListener listener) {
        listeners.get(type).remove(listener);
    }

    /**
     * Records the event in history and delivers it to every listener of its type.
     */
    public CollaborationEvent emit(CollaborationEventType type, String sessionId, String userId, Map<String, ?> data) {
        CollaborationEvent event;
        synchronized (mon) {
            event = new CollaborationEvent(++lastSequence, type, sessionId, userId, data, clock.instant());
            history.addLast(event);
            if (historyLimit > 0) {
                while (history.size() > historyLimit) {
                    CollaborationEvent dropped = history.removeFirst();
                    evicted++;
                    if (dropped.type().isReplayable() && dropped.sessionId() != null) {
                        lastEvictedReplayable.put(dropped.sessionId(), dropped.sequence());
                    }
                }
            }
        }
        deliver(event);
        return event;
    }

    private void deliver(CollaborationEvent event) {
        for (CollaborationListener l : listeners.get(event.type())) {
            try {
                l.onEvent(event);
            } catch (Exception e) {
                log.error("Error notifying listener for {} (seq={}): {}", event.type(), event.sequence(), e.getMessage(), e);
            }
        }
    }

    /** @return a copy of the whole history, oldest first */
    public List<CollaborationEvent> history() {
        return select(e -> true);
    }

    /** @return a copy of the history restricted to {@code type}; all events when null */
    public List<CollaborationEvent> history(CollaborationEventType type) {
        return type == null ? history() : select(e -> e.type() == type);
    }

    /** Events of one session with a sequence above {@code afterSequence}, oldest first. */
    public List<CollaborationEvent> sessionHistoryAfter(String sessionId, long afterSequence) {
        return select(e -> e.sequence() > afterSequence && sessionId.equals(e.sessionId()));
    }

    private List<CollaborationEvent> select(Predicate<CollaborationEvent> filter) {
        synchronized (mon) {
            List<CollaborationEvent> out = new ArrayList<>();
            for (CollaborationEvent e : history) {
                if (filter.test(e)) out.add(e);
            }
            return out;
        }
    }

    /** @return sequence of the newest event ever emitted, 0 before the first */
    public long lastSequence() {
        synchronized (mon) {
            return lastSequence;
        }
    }

    /** @return sequence of the oldest event still retained, or lastSequence + 1 when empty */
    public long oldestRetainedSequence() {
        synchronized (mon) {
            return history.isEmpty() ? lastSequence + 1 : history.peekFirst().sequence();
        }
    }

    /** @return number of events dropped to respect the history limit */
    public long evictedCount() {
        synchronized (mon) {
            return evicted;
        }
    }

    /**
     * @return sequence of the newest replayable event of {@code sessionId} dropped from history,
     *         0 when none was
     */
    public long lastEvictedReplayableSequence(String sessionId) {
        synchronized (mon) {
            return lastEvictedReplayable.getOrDefault(sessionId, 0L);
        }
    }

    /** Forgets the eviction mark of a session that no longer exists. */
    public void forgetSession(String sessionId) {
        synchronized (mon) {
            lastEvictedReplayable.remove(sessionId);
        }
    }

    public int listenerCount(CollaborationEventType type) {
        return listeners.get(type).size();
    }

    /** Drops listeners and history; sequences keep growing. */
    public void clear() {
        listeners.values().forEach(List::clear);
        synchronized (mon) {
            history.clear();
            lastEvictedReplayable.clear();
        }
    }
}
