package com.lbg.markets.etl.watcher.domain;

/**
 * Describes a file found under a watch root, as seen by a single stat.
 */
public record FileDescriptor(
        String sourcePath,
        long sizeBytes,
        long mtimeEpochMs
) {
    public FileDescriptor {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("sourcePath cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }

    public String fileName() {
        int lastSep = Math.max(sourcePath.lastIndexOf('/'), sourcePath.lastIndexOf('\\'));
        return lastSep >= 0 ? sourcePath.substring(lastSep + 1) : sourcePath;
    }
}
