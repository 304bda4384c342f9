package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.domain.DispatchRequest;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable files waiting out the configured process delay, keyed by path.
 * Rescheduling a path replaces its earlier entry.
 */
@ApplicationScoped
public class PendingDispatches {

    private final Object lock = new Object();
    private final Map<String, Pending> pending = new LinkedHashMap<>();

    public void schedule(DispatchRequest request, Instant fireAt) {
        synchronized (lock) {
            pending.put(request.path(), new Pending(request, fireAt));
        }
    }

    /**
     * Remove and return every entry due at {@code now}.
     */
    public List<DispatchRequest> drainDue(Instant now) {
        List<DispatchRequest> due = new ArrayList<>();
        synchronized (lock) {
            Iterator<Pending> it = pending.values().iterator();
            while (it.hasNext()) {
                Pending entry = it.next();
                if (!entry.fireAt().isAfter(now)) {
                    due.add(entry.request());
                    it.remove();
                }
            }
        }
        return due;
    }

    public Map<String, Instant> scheduled() {
        synchronized (lock) {
            Map<String, Instant> copy = new LinkedHashMap<>();
            pending.forEach((path, entry) -> copy.put(path, entry.fireAt()));
            return copy;
        }
    }

    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private record Pending(DispatchRequest request, Instant fireAt) {
    }
}
