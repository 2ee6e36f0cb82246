package org.sessionsync.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One reentrant lock per session id, created lazily and dropped with the session.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>A thread that acquired a lock which was dropped while it waited releases it and retries,
 *       so two threads never hold different locks for the same id.</li>
 *   <li>Reentrant so listeners and replay handlers may call back into the same session.</li>
 *   <li>A lock is dropped on the outermost release after its session is gone, so a session
 *       deleted from a nested call does not leave its lock behind.</li>
 * </ul>
 */
final class SessionLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /** Blocks until the session's current lock is held by the calling thread. */
    ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock(); // dropped while waiting
        }
    }

    /**
     * Releases one hold of {@code lock}. When {@code sessionGone} and this is the calling thread's
     * last hold, the lock is dropped from the table first.
     */
    void release(String sessionId, ReentrantLock lock, boolean sessionGone) {
        if (sessionGone && lock.getHoldCount() == 1) {
            locks.remove(sessionId, lock);
        }
        lock.unlock();
    }

    int size() {
        return locks.size();
    }
}
