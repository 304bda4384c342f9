package com.lbg.markets.etl.watcher.orchestration;

import java.time.Instant;
import java.util.List;

/**
 * Liveness view: which watch root is in use, how many supported files it holds,
 * and whether the poll loop is running.
 */
public record WatcherHealth(
        String status,
        Instant timestamp,
        List<String> watchPaths,
        String activePath,
        int fileCount,
        boolean pollLoopRunning,
        long pollIntervalSeconds,
        long processDelaySeconds,
        String dispatchStrategy,
        int pendingDispatches
) {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
