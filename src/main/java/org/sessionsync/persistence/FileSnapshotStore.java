package org.sessionsync.persistence;

import org.sessionsync.interfaces.ExpiryPolicy;
import org.sessionsync.interfaces.SnapshotStore;
import org.sessionsync.model.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileSnapshotStore persists session snapshots as JSON files.
 * <p>
 * Layout: one directory per session under {@code dir}; each snapshot is written to
 * <ul>
 *     <li>a capture-ordered file (e.g. {@code snapshot-1728900000123-000007.json})</li>
 *     <li>{@code latest.json}, which always holds the newest snapshot of that session</li>
 * </ul>
 * <b>Notes:</b>
 * <ul>
 *     <li>Writes go to a temporary file followed by an atomic move.</li>
 *     <li>I/O errors are logged, not rethrown.</li>
 *     <li>Unreadable files are skipped when listing.</li>
 *     <li>A stored snapshot's {@code lastEventSequence} only means something to the process that
 *         wrote it. After a restart, load a session with
 *         {@code CollaborationService.restoreSession} before recovering it.</li>
 * </ul>
 */
public final class FileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".json";
    private static final String LATEST = "latest.json";

    private final Path dir;

    // Disambiguates snapshots captured in the same millisecond
    private final AtomicLong counter = new AtomicLong();

    /**
     * @param dir root directory; created on first write
     */
    public FileSnapshotStore(Path dir) {
        this.dir = dir;
    }

    /** Directory holding one session's snapshots; the id is URL-encoded to stay a single path segment. */
    Path sessionDir(String sessionId) {
        return dir.resolve(URLEncoder.encode(sessionId, StandardCharsets.UTF_8));
    }

    /**
     * Writes the snapshot and refreshes {@code latest.json}.
     */
    @Override
    public void append(StateSnapshot snapshot) {
        Path sdir = sessionDir(snapshot.sessionId());
        try {
            Files.createDirectories(sdir);
            String json = SnapshotJson.write(snapshot);

            // 1) capture-ordered file; zero padding keeps lexical order == chronological order
            String name = String.format("%s%013d-%06d%s", PREFIX,
                    snapshot.capturedAt().toEpochMilli(), counter.incrementAndGet() % 1_000_000, SUFFIX);
            writeAtomically(sdir.resolve(name), json);

            // 2) latest.json
            writeAtomically(sdir.resolve(LATEST), json);
            log.debug("Persisted snapshot {} for session {}", name, snapshot.sessionId());
        } catch (IOException e) {
            log.error("Snapshot save failed for session {}: {}", snapshot.sessionId(), e.getMessage());
        }
    }

    private static void writeAtomically(Path target, String json) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, json, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Reads every snapshot file of the session in capture order.
     */
    @Override
    public List<StateSnapshot> list(String sessionId) {
        List<StateSnapshot> out = new ArrayList<>();
        for (Path p : snapshotFiles(sessionId)) {
            try {
                out.add(SnapshotJson.read(Files.readString(p, StandardCharsets.UTF_8)));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable snapshot {}: {}", p, e.getMessage());
            }
        }
        return out;
    }

    /** @return the newest snapshot via {@code latest.json}, or null */
    public StateSnapshot latest(String sessionId) {
        Path latest = sessionDir(sessionId).resolve(LATEST);
        if (!Files.exists(latest)) {
            return null;
        }
        try {
            return SnapshotJson.read(Files.readString(latest, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable {}: {}", latest, e.getMessage());
            return null;
        }
    }

    @Override
    public int prune(String sessionId, ExpiryPolicy policy, long nowMillis) {
        int removed = 0;
        for (Path p : snapshotFiles(sessionId)) {
            long captured = capturedAtFromName(p);
            if (captured >= 0 && policy.isExpired(captured, nowMillis)) {
                try {
                    Files.deleteIfExists(p);
                    removed++;
                } catch (IOException e) {
                    log.warn("Failed to prune snapshot {}: {}", p, e.getMessage());
                }
            }
        }
        if (removed > 0 && snapshotFiles(sessionId).isEmpty()) {
            deleteQuietly(sessionDir(sessionId).resolve(LATEST));
        }
        return removed;
    }

    @Override
    public void remove(String sessionId) {
        Path sdir = sessionDir(sessionId);
        if (!Files.exists(sdir)) {
            return;
        }
        try (Stream<Path> s = Files.list(sdir)) {
            s.forEach(FileSnapshotStore::deleteQuietly);
        } catch (IOException e) {
            log.warn("Failed to list {} for removal: {}", sdir, e.getMessage());
        }
        deleteQuietly(sdir);
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", p, e.getMessage());
        }
    }

    private List<Path> snapshotFiles(String sessionId) {
        Path sdir = sessionDir(sessionId);
        if (!Files.exists(sdir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> s = Files.list(sdir)) {
            return s.filter(p -> {
                        String f = p.getFileName().toString();
                        return f.startsWith(PREFIX) && f.endsWith(SUFFIX);
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list snapshots in {}: {}", sdir, e.getMessage());
            return new ArrayList<>();
        }
    }

    /** "snapshot-1728900000123-000007.json" → 1728900000123; -1 if the name does not parse. */
    private static long capturedAtFromName(Path p) {
        String f = p.getFileName().toString();
        try {
            String body = f.substring(PREFIX.length(), f.length() - SUFFIX.length());
            return Long.parseLong(body.substring(0, body.indexOf('-')));
        } catch (RuntimeException e) {
            return -1L;
        }
    }
}
