package com.lbg.markets.etl.watcher.dispatch;

import com.lbg.markets.etl.watcher.config.DispatchSettings;
import com.lbg.markets.etl.watcher.domain.DispatchRequest;

import java.time.Clock;
import java.time.Instant;

/**
 * Dispatches by submitting a named task through a {@link TaskQueueClient}.
 */
public class StructuredDispatchClient implements DispatchClient {

    private final TaskQueueClient queueClient;
    private final DispatchSettings settings;
    private final Clock clock;

    public StructuredDispatchClient(TaskQueueClient queueClient, DispatchSettings settings, Clock clock) {
        this.queueClient = queueClient;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String dispatch(DispatchRequest request, String correlationId) throws DispatchException {
        Instant now = clock.instant();
        DispatchTask task = DispatchTask.forFile(request, settings, now, clock.getZone());
        return queueClient.enqueue(task.taskName(), task.args(), task.kwargs(), correlationId);
    }

    @Override
    public String strategy() {
        return "structured";
    }
}
