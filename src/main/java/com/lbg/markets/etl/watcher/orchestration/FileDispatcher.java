package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.dispatch.DispatchClient;
import com.lbg.markets.etl.watcher.dispatch.DispatchException;
import com.lbg.markets.etl.watcher.dispatch.DispatchLog;
import com.lbg.markets.etl.watcher.domain.DispatchRecord;
import com.lbg.markets.etl.watcher.domain.DispatchRequest;
import com.lbg.markets.etl.watcher.tracker.Tracker;
import com.lbg.markets.etl.watcher.util.FileIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Hands stable files to the dispatch client, immediately or after the process delay,
 * and records the outcome in the tracker and the dispatch log.
 */
@ApplicationScoped
public class FileDispatcher {

    private static final Logger LOG = Logger.getLogger(FileDispatcher.class);
    private static final Logger EVENTS = Logger.getLogger("watcher.events");

    private final DispatchClient client;
    private final Tracker tracker;
    private final DispatchLog dispatchLog;
    private final PendingDispatches pending;
    private final Clock clock;

    @Inject
    public FileDispatcher(DispatchClient client, Tracker tracker, DispatchLog dispatchLog, PendingDispatches pending) {
        this(client, tracker, dispatchLog, pending, Clock.systemUTC());
    }

    public FileDispatcher(DispatchClient client, Tracker tracker, DispatchLog dispatchLog,
                          PendingDispatches pending, Clock clock) {
        this.client = client;
        this.tracker = tracker;
        this.dispatchLog = dispatchLog;
        this.pending = pending;
        this.clock = clock;
    }

    /**
     * Dispatch now when {@code delay} is zero, otherwise park the request until it is due.
     *
     * @return true if the file was dispatched during this call
     */
    public boolean submit(DispatchRequest request, Duration delay) {
        if (delay.isZero()) {
            return dispatchNow(request);
        }
        Instant fireAt = clock.instant().plus(delay);
        pending.schedule(request, fireAt);
        LOG.infof("Scheduled %s for processing in %d seconds", request.fileName(), delay.toSeconds());
        return false;
    }

    /**
     * Dispatch every parked request whose delay has elapsed.
     *
     * @return number dispatched
     */
    public int drainDue() {
        List<DispatchRequest> due = pending.drainDue(clock.instant());
        int dispatched = 0;
        for (DispatchRequest request : due) {
            if (dispatchNow(request)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * The attempt is recorded as dispatched before the client is called, so a worker callback that
     * races the return of the push still finds it. A failed push rolls the file back to candidate.
     */
    boolean dispatchNow(DispatchRequest request) {
        Instant now = clock.instant();
        String correlationId = FileIdentity.correlationId(request.fileName(), now);
        if (!tracker.markDispatched(request.path(), request.mtimeEpochMs(), correlationId)) {
            LOG.debugf("Dropping dispatch of %s: no longer stable at mtime %d", request.path(), request.mtimeEpochMs());
            return false;
        }
        dispatchLog.record(DispatchRecord.sent(correlationId, request, now));

        String taskId;
        try {
            taskId = client.dispatch(request, correlationId);
        } catch (DispatchException e) {
            LOG.errorf(e, "Failed to dispatch %s -> %s", request.path(), request.destination().table());
            if (!tracker.revertToCandidate(request.path(), request.mtimeEpochMs(), e.getMessage())) {
                LOG.warnf("File %s moved on while dispatch %s was failing", request.path(), correlationId);
            }
            dispatchLog.fail(correlationId, e.getMessage());
            EVENTS.infof("outcome=error path=%s destination=%s correlationId=%s reason=%s",
                    request.path(), request.destination().qualifiedName(), correlationId, e.getMessage());
            return false;
        }

        if (taskId != null && !taskId.equals(correlationId)) {
            LOG.debugf("Queue reported task id %s for dispatch %s", taskId, correlationId);
        }
        EVENTS.infof("outcome=dispatched path=%s destination=%s correlationId=%s strategy=%s",
                request.path(), request.destination().qualifiedName(), correlationId, client.strategy());
        return true;
    }
}
