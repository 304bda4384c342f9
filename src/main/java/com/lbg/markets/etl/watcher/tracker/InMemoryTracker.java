package com.lbg.markets.etl.watcher.tracker;

import com.lbg.markets.etl.watcher.domain.Transition;
import com.lbg.markets.etl.watcher.domain.TrackerSnapshot;
import com.lbg.markets.etl.watcher.domain.WatchedFile;
import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory tracker guarded by one lock around the whole map.
 * Not persistent - state is rebuilt from disk on restart.
 */
@ApplicationScoped
public class InMemoryTracker implements Tracker {

    private static final Logger LOG = Logger.getLogger(InMemoryTracker.class);

    private final Object lock = new Object();
    private final Map<String, WatchedFile> files = new HashMap<>();
    private final Clock clock;

    @Inject
    public InMemoryTracker() {
        this(Clock.systemUTC());
    }

    public InMemoryTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Transition observe(String path, long mtimeEpochMs, long sizeBytes) {
        synchronized (lock) {
            WatchedFile existing = files.get(path);
            if (existing == null) {
                files.put(path, WatchedFile.candidate(path, mtimeEpochMs, sizeBytes, clock.instant()));
                LOG.debugf("New candidate: %s", path);
                return Transition.NEW;
            }

            if (existing.lastSeenMtime() != mtimeEpochMs) {
                files.put(path, existing.withObservation(mtimeEpochMs, sizeBytes, FileStatus.CANDIDATE, clock.instant()));
                LOG.debugf("Modified, was %s: %s", existing.status(), path);
                return Transition.MODIFIED;
            }

            if (existing.status() == FileStatus.CANDIDATE) {
                if (existing.lastSeenSize() != sizeBytes) {
                    files.put(path, existing.withObservation(mtimeEpochMs, sizeBytes, FileStatus.CANDIDATE, clock.instant()));
                }
                return Transition.SETTLING;
            }
            return Transition.UNCHANGED;
        }
    }

    @Override
    public void recordBaseline(String path, long mtimeEpochMs, long sizeBytes) {
        synchronized (lock) {
            WatchedFile entry = WatchedFile.candidate(path, mtimeEpochMs, sizeBytes, clock.instant())
                    .withStatus(FileStatus.BASELINE, "present at startup", clock.instant());
            files.put(path, entry);
        }
    }

    @Override
    public boolean markStable(String path, long mtimeEpochMs) {
        return transition(path, mtimeEpochMs, FileStatus.CANDIDATE, FileStatus.STABLE, null);
    }

    @Override
    public boolean markIgnored(String path, long mtimeEpochMs, String reason) {
        synchronized (lock) {
            WatchedFile existing = files.get(path);
            if (existing == null || existing.lastSeenMtime() != mtimeEpochMs) {
                return false;
            }
            if (existing.status() != FileStatus.CANDIDATE && existing.status() != FileStatus.STABLE) {
                return false;
            }
            files.put(path, existing.withStatus(FileStatus.IGNORED, reason, clock.instant()));
            return true;
        }
    }

    @Override
    public boolean markDispatched(String path, long mtimeEpochMs, String correlationId) {
        synchronized (lock) {
            WatchedFile existing = files.get(path);
            if (existing == null || existing.lastSeenMtime() != mtimeEpochMs || existing.status() != FileStatus.STABLE) {
                LOG.debugf("Refusing dispatched transition for %s at mtime %d (current: %s)",
                        path, mtimeEpochMs, existing != null ? existing.status() : "unknown");
                return false;
            }
            files.put(path, existing.dispatched(correlationId, clock.instant()));
            return true;
        }
    }

    @Override
    public boolean revertToCandidate(String path, long mtimeEpochMs, String reason) {
        synchronized (lock) {
            WatchedFile existing = files.get(path);
            if (existing == null || existing.lastSeenMtime() != mtimeEpochMs) {
                return false;
            }
            if (existing.status() != FileStatus.STABLE && existing.status() != FileStatus.DISPATCHED) {
                return false;
            }
            files.put(path, existing.withStatus(FileStatus.CANDIDATE, reason, clock.instant()));
            return true;
        }
    }

    @Override
    public boolean markCompleted(String path, FileStatus outcome, String details) {
        if (outcome != FileStatus.COMPLETED && outcome != FileStatus.FAILED) {
            throw new IllegalArgumentException("Completion outcome must be COMPLETED or FAILED, got " + outcome);
        }
        synchronized (lock) {
            WatchedFile existing = files.get(path);
            if (existing == null || existing.status() != FileStatus.DISPATCHED) {
                return false;
            }
            files.put(path, existing.withStatus(outcome, details, clock.instant()));
            return true;
        }
    }

    @Override
    public int resetIgnored() {
        synchronized (lock) {
            int reset = 0;
            for (Map.Entry<String, WatchedFile> entry : files.entrySet()) {
                if (entry.getValue().status() == FileStatus.IGNORED) {
                    entry.setValue(entry.getValue().withStatus(FileStatus.CANDIDATE, null, clock.instant()));
                    reset++;
                }
            }
            return reset;
        }
    }

    @Override
    public Optional<WatchedFile> find(String path) {
        synchronized (lock) {
            return Optional.ofNullable(files.get(path));
        }
    }

    @Override
    public TrackerSnapshot snapshot() {
        synchronized (lock) {
            Map<FileStatus, Integer> counts = new EnumMap<>(FileStatus.class);
            for (WatchedFile file : files.values()) {
                counts.merge(file.status(), 1, Integer::sum);
            }
            int queued = counts.getOrDefault(FileStatus.STABLE, 0) + counts.getOrDefault(FileStatus.DISPATCHED, 0);
            int processed = counts.getOrDefault(FileStatus.COMPLETED, 0) + counts.getOrDefault(FileStatus.FAILED, 0);
            return new TrackerSnapshot(queued, processed, files.size(), counts);
        }
    }

    private boolean transition(String path, long mtimeEpochMs, FileStatus from, FileStatus to, String detail) {
        synchronized (lock) {
            WatchedFile existing = files.get(path);
            if (existing == null || existing.lastSeenMtime() != mtimeEpochMs || existing.status() != from) {
                return false;
            }
            files.put(path, existing.withStatus(to, detail, clock.instant()));
            return true;
        }
    }
}
