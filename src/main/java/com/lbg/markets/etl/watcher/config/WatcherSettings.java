package com.lbg.markets.etl.watcher.config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scanner settings: roots, timings, file filters and size limits.
 */
public record WatcherSettings(
        List<String> watchPaths,
        String backupWatchPath,
        Duration pollInterval,
        Duration stabilityDelay,
        Duration processDelay,
        boolean initialScanBaseline,
        Set<String> supportedExtensions,
        long maxFileSizeBytes
) {
    public static final long BYTES_PER_MB = 1024L * 1024L;

    public WatcherSettings {
        watchPaths = watchPaths != null ? List.copyOf(watchPaths) : List.of();
        supportedExtensions = supportedExtensions != null
                ? supportedExtensions.stream()
                        .map(WatcherSettings::normalizeExtension)
                        .collect(Collectors.toUnmodifiableSet())
                : Set.of();
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (stabilityDelay == null || stabilityDelay.isNegative()) {
            throw new IllegalArgumentException("Stability delay cannot be negative");
        }
        if (processDelay == null || processDelay.isNegative()) {
            throw new IllegalArgumentException("Process delay cannot be negative");
        }
    }

    public boolean isSupported(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && supportedExtensions.contains(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    static String normalizeExtension(String ext) {
        String trimmed = ext.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }
}
