package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the scanner on a single thread at a fixed delay, so ticks never overlap and a slow
 * tick only postpones the next one. The delayed-dispatch sweep shares the same thread.
 */
@ApplicationScoped
public class PollLoop {

    private static final Logger LOG = Logger.getLogger(PollLoop.class);
    static final Duration SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final FileScanner scanner;
    private final FileDispatcher dispatcher;
    private final ConfigHolder config;

    private ScheduledExecutorService executor;

    @Inject
    public PollLoop(FileScanner scanner, FileDispatcher dispatcher, ConfigHolder config) {
        this.scanner = scanner;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        WatchConfig current = config.get();
        long pollMillis = current.watcher().pollInterval().toMillis();

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "watch-poll");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::runTick, 0, pollMillis, TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(this::runSweep, SWEEP_INTERVAL.toMillis(), SWEEP_INTERVAL.toMillis(),
                TimeUnit.MILLISECONDS);

        LOG.infof("Poll loop started: every %d seconds, settle delay %d seconds, process delay %d seconds",
                current.watcher().pollInterval().toSeconds(),
                current.watcher().stabilityDelay().toSeconds(),
                current.watcher().processDelay().toSeconds());
    }

    /**
     * Stop scheduling and wait for the tick in progress to finish.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                LOG.warn("Poll tick still running after 60 seconds; abandoning it");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        executor = null;
        LOG.info("Poll loop stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    private void runTick() {
        try {
            scanner.tick();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error in polling loop");
        }
    }

    private void runSweep() {
        try {
            dispatcher.drainDue();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error dispatching delayed files");
        }
    }
}
