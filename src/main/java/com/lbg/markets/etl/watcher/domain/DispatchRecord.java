package com.lbg.markets.etl.watcher.domain;

import java.time.Instant;

/**
 * One dispatch attempt. Kept in memory only, for history and completion matching.
 */
public record DispatchRecord(
        String correlationId,
        String path,
        String fileName,
        long mtimeEpochMs,
        Destination destination,
        Instant dispatchedAt,
        Status status,
        String detail
) {
    public enum Status {
        SENT,
        ACKNOWLEDGED,
        ERROR
    }

    public static DispatchRecord sent(String correlationId, DispatchRequest request, Instant at) {
        return new DispatchRecord(correlationId, request.path(), request.fileName(),
                request.mtimeEpochMs(), request.destination(), at, Status.SENT, null);
    }

    public DispatchRecord failed(String error) {
        return new DispatchRecord(correlationId, path, fileName, mtimeEpochMs, destination,
                dispatchedAt, Status.ERROR, error);
    }

    public DispatchRecord acknowledged(String outcome) {
        return new DispatchRecord(correlationId, path, fileName, mtimeEpochMs, destination,
                dispatchedAt, Status.ACKNOWLEDGED, outcome);
    }
}
