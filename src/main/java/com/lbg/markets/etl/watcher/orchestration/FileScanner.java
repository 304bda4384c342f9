package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import com.lbg.markets.etl.watcher.config.WatcherSettings;
import com.lbg.markets.etl.watcher.domain.Destination;
import com.lbg.markets.etl.watcher.domain.DispatchRequest;
import com.lbg.markets.etl.watcher.domain.FileDescriptor;
import com.lbg.markets.etl.watcher.domain.StabilityResult;
import com.lbg.markets.etl.watcher.domain.Transition;
import com.lbg.markets.etl.watcher.routing.PatternRouter;
import com.lbg.markets.etl.watcher.source.SourceProvider;
import com.lbg.markets.etl.watcher.tracker.Tracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One poll tick: list watch roots, debounce each file through the tracker, classify the
 * stable ones and hand them to the dispatcher.
 * <p>
 * A file is never dispatched on the tick it is first seen. On a later tick with an unchanged
 * mtime it waits out the settle delay and is re-statted before being classified.
 */
@ApplicationScoped
public class FileScanner {

    private static final Logger LOG = Logger.getLogger(FileScanner.class);

    private final SourceProvider source;
    private final Tracker tracker;
    private final Supplier<WatchConfig> config;
    private final FileDispatcher dispatcher;
    private final Sleeper sleeper;

    private volatile boolean initialScanDone;

    @Inject
    public FileScanner(SourceProvider source, Tracker tracker, ConfigHolder config, FileDispatcher dispatcher) {
        this(source, tracker, config, dispatcher, Sleeper.SYSTEM);
    }

    public FileScanner(SourceProvider source, Tracker tracker, Supplier<WatchConfig> config,
                       FileDispatcher dispatcher, Sleeper sleeper) {
        this.source = source;
        this.tracker = tracker;
        this.config = config;
        this.dispatcher = dispatcher;
        this.sleeper = sleeper;
    }

    /**
     * Run one scan over all watch roots. Called from the poll thread only.
     */
    public ScanSummary tick() {
        WatchConfig current = config.get();
        WatcherSettings settings = current.watcher();
        PatternRouter router = new PatternRouter(current.patternRules());
        boolean baseline = !initialScanDone && settings.initialScanBaseline();
        Counts counts = new Counts();
        int listedRoots = 0;

        for (Path root : source.resolveRoots(settings)) {
            List<Path> files;
            try {
                files = source.list(root, settings);
            } catch (IOException e) {
                LOG.errorf("Error listing watch path %s: %s", root, e.getMessage());
                counts.errors++;
                continue;
            }
            listedRoots++;
            for (Path file : files) {
                scanFile(file, settings, router, baseline, counts);
            }
        }

        // The baseline only ends once a root was actually listed
        if (!initialScanDone) {
            if (listedRoots > 0) {
                initialScanDone = true;
                if (baseline) {
                    LOG.infof("Initial scan complete: %d existing files recorded (ignored)", counts.baseline);
                }
            } else {
                LOG.warnf("Initial scan listed no watch path; retrying next tick");
            }
        }

        ScanSummary summary = counts.toSummary();
        if (summary.hasActivity()) {
            LOG.infof("Scan complete: %d files, %d new, %d modified, %d submitted, %d ignored, %d errors",
                    summary.filesSeen(), summary.newFiles(), summary.modified(), summary.submitted(),
                    summary.ignored(), summary.errors());
        } else {
            LOG.debugf("Scan complete: %d files, nothing to do", summary.filesSeen());
        }
        return summary;
    }

    public boolean isInitialScanDone() {
        return initialScanDone;
    }

    private void scanFile(Path file, WatcherSettings settings, PatternRouter router, boolean baseline, Counts counts) {
        FileDescriptor descriptor;
        try {
            descriptor = source.stat(file);
        } catch (IOException e) {
            LOG.warnf("Cannot stat %s, skipping this tick: %s", file, e.getMessage());
            counts.errors++;
            return;
        }
        counts.seen++;

        if (baseline) {
            tracker.recordBaseline(descriptor.sourcePath(), descriptor.mtimeEpochMs(), descriptor.sizeBytes());
            counts.baseline++;
            return;
        }

        Transition transition = tracker.observe(descriptor.sourcePath(), descriptor.mtimeEpochMs(), descriptor.sizeBytes());
        switch (transition) {
            case NEW -> {
                LOG.infof("NEW file detected: %s", descriptor.fileName());
                counts.newFiles++;
            }
            case MODIFIED -> {
                LOG.infof("MODIFIED file detected: %s", descriptor.fileName());
                counts.modified++;
            }
            case SETTLING -> settle(file, descriptor, settings, router, counts);
            case UNCHANGED -> {
            }
        }
    }

    private void settle(Path file, FileDescriptor observed, WatcherSettings settings, PatternRouter router, Counts counts) {
        StabilityResult result = checkStability(file, observed, settings.stabilityDelay());
        switch (result.kind()) {
            case ERROR -> {
                LOG.warnf("Stability check failed for %s: %s", observed.sourcePath(), result.reason());
                counts.errors++;
                return;
            }
            case NOT_READY -> {
                LOG.debugf("Not ready: %s (%s)", observed.fileName(), result.reason());
                FileDescriptor latest = result.descriptor();
                if (latest != null && latest.mtimeEpochMs() != observed.mtimeEpochMs()) {
                    LOG.infof("File still being written, skipping: %s", observed.fileName());
                    tracker.observe(latest.sourcePath(), latest.mtimeEpochMs(), latest.sizeBytes());
                }
                counts.notReady++;
                return;
            }
            case STABLE -> {
            }
        }

        FileDescriptor stable = result.descriptor();
        Optional<Destination> destination = router.classify(stable.sourcePath());
        if (destination.isEmpty()) {
            tracker.markIgnored(stable.sourcePath(), stable.mtimeEpochMs(), "no pattern matched");
            LOG.debugf("No pattern matched, ignoring: %s", stable.sourcePath());
            counts.ignored++;
            return;
        }

        if (stable.sizeBytes() > settings.maxFileSizeBytes()) {
            LOG.warnf("File %s exceeds size limit: %.1fMB > %.1fMB", stable.fileName(),
                    stable.sizeBytes() / (double) WatcherSettings.BYTES_PER_MB,
                    settings.maxFileSizeBytes() / (double) WatcherSettings.BYTES_PER_MB);
            tracker.markIgnored(stable.sourcePath(), stable.mtimeEpochMs(), "exceeds size limit");
            counts.ignored++;
            return;
        }

        if (!tracker.markStable(stable.sourcePath(), stable.mtimeEpochMs())) {
            LOG.debugf("State of %s changed during settle check", stable.sourcePath());
            return;
        }
        LOG.infof("Stable: %s -> %s", stable.fileName(), destination.get().qualifiedName());
        dispatcher.submit(DispatchRequest.of(stable, destination.get()), settings.processDelay());
        counts.submitted++;
    }

    /**
     * Wait the settle delay and re-stat. The tracker lock is not held here.
     */
    StabilityResult checkStability(Path file, FileDescriptor observed, Duration settleDelay) {
        if (observed.sizeBytes() == 0) {
            return StabilityResult.notReady(observed, "empty");
        }
        try {
            sleeper.sleep(settleDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StabilityResult.error("interrupted during settle delay");
        }

        FileDescriptor again;
        try {
            again = source.stat(file);
        } catch (IOException e) {
            return StabilityResult.error(e.getMessage());
        }
        if (again.mtimeEpochMs() != observed.mtimeEpochMs()) {
            return StabilityResult.notReady(again, "still being written");
        }
        if (again.sizeBytes() == 0) {
            return StabilityResult.notReady(again, "empty");
        }
        return StabilityResult.stable(again);
    }

    private static final class Counts {
        int seen;
        int newFiles;
        int modified;
        int baseline;
        int notReady;
        int ignored;
        int submitted;
        int errors;

        ScanSummary toSummary() {
            return new ScanSummary(seen, newFiles, modified, baseline, notReady, ignored, submitted, errors);
        }
    }
}
