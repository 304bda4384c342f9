package com.lbg.markets.etl.watcher.domain;

import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;

import java.util.Map;

/**
 * Point-in-time counts for status reporting.
 */
public record TrackerSnapshot(
        int queued,
        int processed,
        int total,
        Map<FileStatus, Integer> byStatus
) {
    public TrackerSnapshot {
        byStatus = byStatus != null ? Map.copyOf(byStatus) : Map.of();
    }

    public int count(FileStatus status) {
        return byStatus.getOrDefault(status, 0);
    }
}
