package com.lbg.markets.etl.watcher.domain;

import java.time.Instant;

/**
 * Tracker entry for one file path. Replaced, never mutated.
 */
public record WatchedFile(
        String path,
        long lastSeenMtime,
        long lastSeenSize,
        FileStatus status,
        String correlationId,
        String detail,
        Instant updatedAt
) {
    public WatchedFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static WatchedFile candidate(String path, long mtime, long size, Instant now) {
        return new WatchedFile(path, mtime, size, FileStatus.CANDIDATE, null, null, now);
    }

    public WatchedFile withStatus(FileStatus newStatus, String newDetail, Instant now) {
        return new WatchedFile(path, lastSeenMtime, lastSeenSize, newStatus, correlationId, newDetail, now);
    }

    public WatchedFile withObservation(long mtime, long size, FileStatus newStatus, Instant now) {
        return new WatchedFile(path, mtime, size, newStatus, correlationId, null, now);
    }

    public WatchedFile dispatched(String newCorrelationId, Instant now) {
        return new WatchedFile(path, lastSeenMtime, lastSeenSize, FileStatus.DISPATCHED, newCorrelationId, null, now);
    }

    public enum FileStatus {
        CANDIDATE,
        STABLE,
        DISPATCHED,
        COMPLETED,
        FAILED,
        IGNORED,
        BASELINE
    }
}
