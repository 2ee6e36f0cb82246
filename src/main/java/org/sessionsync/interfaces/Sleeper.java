package org.sessionsync.interfaces;

import java.time.Duration;

/**
 * Timed suspension used between retry attempts.
 * Implementations must be interruptible so a caller can abort an in-progress backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
