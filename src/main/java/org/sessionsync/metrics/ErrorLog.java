package org.sessionsync.metrics;

import org.sessionsync.model.ErrorLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory log of recoverable failures, kept for later inspection
 * alongside the exception returned to the caller. Oldest entries are evicted first.
 */
public final class ErrorLog {

    private static final Logger log = LoggerFactory.getLogger(ErrorLog.class);

    private final Deque<ErrorLogEntry> entries = new ArrayDeque<>();
    private final int limit;
    private final Clock clock;
    private long total;

    public ErrorLog(int limit, Clock clock) {
        if (limit < 1) {
            throw new IllegalArgumentException("error log limit must be >= 1: " + limit);
        }
        this.limit = limit;
        this.clock = clock;
    }

    public ErrorLogEntry record(String type, Map<String, ?> details) {
        ErrorLogEntry entry = new ErrorLogEntry(type, clock.instant(), details);
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > limit) {
                entries.removeFirst();
            }
            total++;
        }
        log.error("Collaboration error: {} - {}", type, entry.details());
        return entry;
    }

    /**
     * @param type only entries of this type, or all when null
     * @param max at most this many, newest last
     */
    public List<ErrorLogEntry> entries(String type, int max) {
        List<ErrorLogEntry> matching = new ArrayList<>();
        synchronized (entries) {
            for (ErrorLogEntry e : entries) {
                if (type == null || type.equals(e.type())) {
                    matching.add(e);
                }
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, max));
        return new ArrayList<>(matching.subList(from, matching.size()));
    }

    /** @return number of entries ever recorded, including evicted ones */
    public int count() {
        synchronized (entries) {
            return (int) Math.min(Integer.MAX_VALUE, total);
        }
    }
}
