package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.dispatch.DispatchLog;
import com.lbg.markets.etl.watcher.domain.CompletionNotice;
import com.lbg.markets.etl.watcher.domain.DispatchRecord;
import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;
import com.lbg.markets.etl.watcher.tracker.Tracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Optional;

/**
 * Matches completion callbacks to the latest dispatch of the named file and records the outcome.
 * The file's mtime, not the callback, stays the source of truth for reprocessing.
 */
@ApplicationScoped
public class TrackerCompletionListener implements CompletionListener {

    private static final Logger LOG = Logger.getLogger(TrackerCompletionListener.class);
    private static final Logger EVENTS = Logger.getLogger("watcher.events");

    private final Tracker tracker;
    private final DispatchLog dispatchLog;

    @Inject
    public TrackerCompletionListener(Tracker tracker, DispatchLog dispatchLog) {
        this.tracker = tracker;
        this.dispatchLog = dispatchLog;
    }

    @Override
    public Outcome onCompletion(CompletionNotice notice) {
        if (notice == null || notice.filename() == null || notice.filename().isBlank()) {
            throw new IllegalArgumentException("Completion notice must carry a filename");
        }
        if (!notice.isSuccess() && !notice.isFailure()) {
            throw new IllegalArgumentException("Completion status must be 'success' or 'failure', got '"
                    + notice.status() + "'");
        }

        Optional<DispatchRecord> match = dispatchLog.latestFor(notice.filename());
        if (match.isEmpty()) {
            LOG.infof("Completion for unknown file %s (%s) from %s", notice.filename(), notice.status(), notice.workerId());
            return Outcome.UNKNOWN;
        }

        DispatchRecord record = match.get();
        FileStatus outcome = notice.isSuccess() ? FileStatus.COMPLETED : FileStatus.FAILED;
        dispatchLog.acknowledge(record.correlationId(), notice.status());

        if (!tracker.markCompleted(record.path(), outcome, notice.detailsText())) {
            LOG.infof("Completion for %s (%s) is stale; file is no longer awaiting that dispatch",
                    record.path(), record.correlationId());
            return Outcome.STALE;
        }

        EVENTS.infof("outcome=%s path=%s destination=%s correlationId=%s worker=%s",
                outcome.name().toLowerCase(Locale.ROOT), record.path(), record.destination().qualifiedName(),
                record.correlationId(), notice.workerId());
        return Outcome.APPLIED;
    }
}
