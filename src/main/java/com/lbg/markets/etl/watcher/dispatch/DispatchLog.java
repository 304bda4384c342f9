package com.lbg.markets.etl.watcher.dispatch;

import com.lbg.markets.etl.watcher.domain.DispatchRecord;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Bounded in-memory history of dispatch attempts, oldest evicted first.
 */
@ApplicationScoped
public class DispatchLog {

    static final int DEFAULT_CAPACITY = 500;

    private final Object lock = new Object();
    private final List<DispatchRecord> records = new ArrayList<>();
    private final int capacity;

    public DispatchLog() {
        this(DEFAULT_CAPACITY);
    }

    public DispatchLog(int capacity) {
        this.capacity = capacity;
    }

    public void record(DispatchRecord record) {
        synchronized (lock) {
            records.add(record);
            if (records.size() > capacity) {
                records.remove(0);
            }
        }
    }

    /**
     * Most recent successful dispatch for a file name. Completion callbacks only carry the
     * name, so an exact match is tried first and a case-insensitive one second.
     */
    public Optional<DispatchRecord> latestFor(String fileName) {
        synchronized (lock) {
            DispatchRecord caseInsensitive = null;
            for (int i = records.size() - 1; i >= 0; i--) {
                DispatchRecord record = records.get(i);
                if (record.status() == DispatchRecord.Status.ERROR) {
                    continue;
                }
                if (record.fileName().equals(fileName) || record.path().equals(fileName)) {
                    return Optional.of(record);
                }
                if (caseInsensitive == null && record.fileName().equalsIgnoreCase(fileName)) {
                    caseInsensitive = record;
                }
            }
            return Optional.ofNullable(caseInsensitive);
        }
    }

    /**
     * Mark the record with {@code correlationId} as acknowledged by a worker.
     */
    public Optional<DispatchRecord> acknowledge(String correlationId, String outcome) {
        return replace(correlationId, record -> record.acknowledged(outcome));
    }

    /**
     * Mark the record with {@code correlationId} as never having reached the queue.
     */
    public Optional<DispatchRecord> fail(String correlationId, String error) {
        return replace(correlationId, record -> record.failed(error));
    }

    private Optional<DispatchRecord> replace(String correlationId, UnaryOperator<DispatchRecord> update) {
        synchronized (lock) {
            for (int i = records.size() - 1; i >= 0; i--) {
                if (records.get(i).correlationId().equals(correlationId)) {
                    DispatchRecord updated = update.apply(records.get(i));
                    records.set(i, updated);
                    return Optional.of(updated);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Up to {@code limit} records, newest first.
     */
    public List<DispatchRecord> recent(int limit) {
        synchronized (lock) {
            List<DispatchRecord> result = new ArrayList<>();
            for (int i = records.size() - 1; i >= 0 && result.size() < limit; i--) {
                result.add(records.get(i));
            }
            return result;
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }
}
