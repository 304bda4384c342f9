package com.lbg.markets.etl.watcher.dispatch;

import com.lbg.markets.etl.watcher.domain.DispatchRequest;

/**
 * Puts one unit of work for a stable file on the processing queue.
 * <p>
 * Implementations do not deduplicate; the tracker guarantees one dispatch per observation
 * and workers must tolerate redelivery.
 */
public interface DispatchClient {

    /**
     * Enqueue the work for {@code request} under {@code correlationId}. The caller has already
     * recorded the attempt, so a worker may report completion before this returns.
     *
     * @return the task id the queue reports, normally {@code correlationId}
     * @throws DispatchException if the work could not be enqueued
     */
    String dispatch(DispatchRequest request, String correlationId) throws DispatchException;

    /**
     * Short name for logs and status output.
     */
    String strategy();
}
