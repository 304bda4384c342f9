package com.lbg.markets.etl.watcher.dispatch;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured enqueue: submit a named task with arguments; the wire format is the client's concern.
 */
public interface TaskQueueClient {

    /**
     * @param taskId id to assign to the task
     * @return the id the queue assigned, normally {@code taskId}
     */
    String enqueue(String taskName, List<Object> args, Map<String, Object> kwargs, String taskId) throws DispatchException;

    default String enqueue(String taskName, List<Object> args, Map<String, Object> kwargs) throws DispatchException {
        return enqueue(taskName, args, kwargs, UUID.randomUUID().toString());
    }
}
