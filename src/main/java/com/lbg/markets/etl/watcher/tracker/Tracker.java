package com.lbg.markets.etl.watcher.tracker;

import com.lbg.markets.etl.watcher.domain.Transition;
import com.lbg.markets.etl.watcher.domain.TrackerSnapshot;
import com.lbg.markets.etl.watcher.domain.WatchedFile;
import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;

import java.util.Optional;

/**
 * Per-path lifecycle state. The authority on whether a given {@code (path, mtime)}
 * has already been dispatched.
 * <p>
 * Implementations must be thread-safe: the poll thread and completion callbacks both mutate it.
 */
public interface Tracker {

    /**
     * Record the latest stat of a file and report what the scanner should do with it.
     */
    Transition observe(String path, long mtimeEpochMs, long sizeBytes);

    /**
     * Record a file seen on the initial scan so it is not dispatched unless modified later.
     */
    void recordBaseline(String path, long mtimeEpochMs, long sizeBytes);

    /**
     * Candidate to stable. Fails if the entry moved to another mtime meanwhile.
     */
    boolean markStable(String path, long mtimeEpochMs);

    /**
     * Remember that this observation is not to be dispatched (no rule matched, or rejected).
     */
    boolean markIgnored(String path, long mtimeEpochMs, String reason);

    /**
     * Stable to dispatched. Succeeds at most once per {@code (path, mtime)}.
     */
    boolean markDispatched(String path, long mtimeEpochMs, String correlationId);

    /**
     * Put a stable or dispatched entry back to candidate after its dispatch failed, so it is retried.
     * Fails if the entry moved to another mtime or a completion was already applied.
     */
    boolean revertToCandidate(String path, long mtimeEpochMs, String reason);

    /**
     * Dispatched to completed or failed. Ignored unless the entry is still dispatched.
     */
    boolean markCompleted(String path, FileStatus outcome, String details);

    /**
     * Move every ignored entry back to candidate so it is classified again.
     *
     * @return number of entries reset
     */
    int resetIgnored();

    Optional<WatchedFile> find(String path);

    TrackerSnapshot snapshot();
}
