package com.lbg.markets.etl.watcher.domain;

/**
 * A stable file routed to a destination, ready to be enqueued.
 */
public record DispatchRequest(
        String path,
        String fileName,
        long sizeBytes,
        long mtimeEpochMs,
        Destination destination
) {
    public DispatchRequest {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be blank");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
    }

    public static DispatchRequest of(FileDescriptor descriptor, Destination destination) {
        return new DispatchRequest(descriptor.sourcePath(), descriptor.fileName(),
                descriptor.sizeBytes(), descriptor.mtimeEpochMs(), destination);
    }
}
