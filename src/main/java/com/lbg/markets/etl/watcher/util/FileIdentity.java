package com.lbg.markets.etl.watcher.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Utility for naming dispatch attempts.
 * Correlation ids combine the file name, the dispatch timestamp and a process-wide sequence.
 */
public final class FileIdentity {

    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final DateTimeFormatter SOURCE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private FileIdentity() {
        // Utility class
    }

    /**
     * Unique id for one dispatch attempt of {@code fileName} at {@code dispatchedAt}.
     */
    public static String correlationId(String fileName, Instant dispatchedAt) {
        return fileName + "_" + dispatchedAt.toEpochMilli() + "-" + SEQUENCE.incrementAndGet();
    }

    /**
     * Source label handed to the worker: file stem plus a local timestamp, e.g. {@code jan_20250101_093000}.
     */
    public static String sourceName(String fileName, Instant dispatchedAt, ZoneId zone) {
        return stem(fileName) + "_" + SOURCE_STAMP.format(dispatchedAt.atZone(zone));
    }

    public static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
