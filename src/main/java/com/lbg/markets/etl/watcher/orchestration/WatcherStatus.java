package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.domain.TrackerSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Configuration summary plus in-memory counters, as shown by {@code status}.
 */
public record WatcherStatus(
        String configFile,
        List<String> watchPaths,
        long pollIntervalSeconds,
        long stabilityDelaySeconds,
        long processDelaySeconds,
        boolean initialScanBaseline,
        boolean initialScanComplete,
        long maxFileSizeMb,
        List<String> supportedExtensions,
        Map<String, String> patternMappings,
        String dispatchStrategy,
        String queue,
        String taskName,
        boolean pollLoopRunning,
        int pendingDispatches,
        TrackerSnapshot files
) {
}
