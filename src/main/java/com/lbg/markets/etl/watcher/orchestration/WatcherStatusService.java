package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import com.lbg.markets.etl.watcher.config.WatcherSettings;
import com.lbg.markets.etl.watcher.dispatch.DispatchClient;
import com.lbg.markets.etl.watcher.domain.PatternRule;
import com.lbg.markets.etl.watcher.source.SourceProvider;
import com.lbg.markets.etl.watcher.tracker.Tracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ApplicationScoped
public class WatcherStatusService {

    private final ConfigHolder config;
    private final Tracker tracker;
    private final FileScanner scanner;
    private final PollLoop pollLoop;
    private final PendingDispatches pending;
    private final DispatchClient client;
    private final SourceProvider source;
    private final Clock clock;

    @Inject
    public WatcherStatusService(ConfigHolder config, Tracker tracker, FileScanner scanner, PollLoop pollLoop,
                                PendingDispatches pending, DispatchClient client, SourceProvider source) {
        this.config = config;
        this.tracker = tracker;
        this.scanner = scanner;
        this.pollLoop = pollLoop;
        this.pending = pending;
        this.client = client;
        this.source = source;
        this.clock = Clock.systemUTC();
    }

    public WatcherStatus status() {
        WatchConfig current = config.get();
        WatcherSettings watcher = current.watcher();

        Map<String, String> mappings = new LinkedHashMap<>();
        for (PatternRule rule : current.patternRules()) {
            mappings.put(rule.pattern(), rule.destination().qualifiedName());
        }

        return new WatcherStatus(
                current.source(),
                watcher.watchPaths(),
                watcher.pollInterval().toSeconds(),
                watcher.stabilityDelay().toSeconds(),
                watcher.processDelay().toSeconds(),
                watcher.initialScanBaseline(),
                scanner.isInitialScanDone(),
                watcher.maxFileSizeBytes() / WatcherSettings.BYTES_PER_MB,
                List.copyOf(watcher.supportedExtensions()),
                mappings,
                client.strategy(),
                current.dispatch().queue(),
                current.dispatch().taskName(),
                pollLoop.isRunning(),
                pending.size(),
                tracker.snapshot()
        );
    }

    /**
     * Resolve the watch roots and count the supported files under them. Unhealthy when no root is available.
     *
     * @throws IOException if a root cannot be listed
     */
    public WatcherHealth health() throws IOException {
        WatchConfig current = config.get();
        WatcherSettings watcher = current.watcher();

        List<Path> roots = source.resolveRoots(watcher);
        int fileCount = 0;
        for (Path root : roots) {
            fileCount += source.list(root, watcher).size();
        }

        return new WatcherHealth(
                roots.isEmpty() ? WatcherHealth.UNHEALTHY : WatcherHealth.HEALTHY,
                clock.instant(),
                watcher.watchPaths(),
                roots.isEmpty() ? null : roots.get(0).toString(),
                fileCount,
                pollLoop.isRunning(),
                watcher.pollInterval().toSeconds(),
                watcher.processDelay().toSeconds(),
                client.strategy(),
                pending.size()
        );
    }
}
