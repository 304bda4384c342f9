package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.RecordingDispatchClient;
import com.lbg.markets.etl.watcher.TestConfigs;
import com.lbg.markets.etl.watcher.TestFiles;
import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.ConfigLoader;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import com.lbg.markets.etl.watcher.config.WatcherSettings;
import com.lbg.markets.etl.watcher.dispatch.DispatchLog;
import com.lbg.markets.etl.watcher.domain.CompletionNotice;
import com.lbg.markets.etl.watcher.domain.DispatchRecord;
import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;
import com.lbg.markets.etl.watcher.source.LocalFsSource;
import com.lbg.markets.etl.watcher.tracker.InMemoryTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.lbg.markets.etl.watcher.TestConfigs.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileScannerTest {

    private static final long T0 = 1_700_000_000_000L;

    private Path root;
    private InMemoryTracker tracker;
    private RecordingDispatchClient client;
    private DispatchLog dispatchLog;
    private PendingDispatches pending;
    private FileDispatcher dispatcher;

    private final List<Duration> sleeps = new ArrayList<>();
    private IoAction duringSettle = () -> { };

    @BeforeEach
    void setup() throws IOException {
        root = Files.createTempDirectory("watch-root-");
        tracker = new InMemoryTracker();
        client = new RecordingDispatchClient();
        dispatchLog = new DispatchLog();
        pending = new PendingDispatches();
        dispatcher = new FileDispatcher(client, tracker, dispatchLog, pending);
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(root);
    }

    private FileScanner scanner(WatchConfig config) {
        return scanner(ConfigHolder.of(config));
    }

    private FileScanner scanner(ConfigHolder holder) {
        return new FileScanner(new LocalFsSource(), tracker, holder, dispatcher, duration -> {
            sleeps.add(duration);
            try {
                duringSettle.run();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
    }

    private FileStatus statusOf(Path file) {
        return tracker.find(TestFiles.key(file)).orElseThrow().status();
    }

    @Test
    void shouldDispatchOnlyAfterSettleAndRecordCompletion() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("customer_data", "dim_customers")));
        Path file = TestFiles.write(root.resolve("customer_data/jan.csv"), "id,name\n1,alice\n", T0);

        // First sighting is never dispatched
        scanner.tick();
        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.CANDIDATE, statusOf(file));

        // Unchanged on the next tick: settle, re-stat, dispatch
        ScanSummary summary = scanner.tick();
        assertEquals(1, summary.submitted());
        assertEquals(1, client.requests.size());
        assertEquals("dim_customers", client.requests.get(0).destination().table());
        assertEquals("jan.csv", client.requests.get(0).fileName());
        assertEquals(List.of(TestConfigs.SETTLE), sleeps);
        assertEquals(FileStatus.DISPATCHED, statusOf(file));

        // Nothing more while the file is unchanged
        scanner.tick();
        scanner.tick();
        assertEquals(1, client.requests.size());

        TrackerCompletionListener listener = new TrackerCompletionListener(tracker, dispatchLog);
        CompletionListener.Outcome outcome = listener.onCompletion(
                new CompletionNotice("jan.csv", "success", null, "worker-1", null));

        assertEquals(CompletionListener.Outcome.APPLIED, outcome);
        assertEquals(FileStatus.COMPLETED, statusOf(file));
    }

    @Test
    void shouldNotDispatchFileModifiedDuringSettleCheck() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("sales_data", "fact_sales")));
        Path file = TestFiles.write(root.resolve("sales_data/q1.csv"), "a,b\n", T0);

        scanner.tick();

        // Writer appends while we wait out the settle delay
        duringSettle = () -> TestFiles.write(file, "a,b\n1,2\n", T0 + 5_000);
        ScanSummary summary = scanner.tick();

        assertEquals(1, summary.notReady());
        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.CANDIDATE, statusOf(file));
        assertEquals(T0 + 5_000, tracker.find(TestFiles.key(file)).orElseThrow().lastSeenMtime());

        // Once the writer is done it goes through
        duringSettle = () -> { };
        scanner.tick();
        assertEquals(1, client.requests.size());
        assertEquals(T0 + 5_000, client.requests.get(0).mtimeEpochMs());
    }

    @Test
    void shouldNeverDispatchEmptyFile() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("reports", "staging_reports", "staging")));
        Path file = TestFiles.write(root.resolve("reports/q1.xlsx"), "", T0);

        for (int i = 0; i < 5; i++) {
            scanner.tick();
        }

        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.CANDIDATE, statusOf(file));
        assertTrue(sleeps.isEmpty(), "empty files should not wait out the settle delay");

        // Gaining content makes it eligible again
        TestFiles.write(file, "data", T0 + 60_000);
        scanner.tick();
        scanner.tick();
        assertEquals(1, client.requests.size());
        assertEquals("staging.staging_reports", client.requests.get(0).destination().qualifiedName());
    }

    @Test
    void shouldBaselineFilesPresentAtStartup() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, true, Duration.ZERO, Long.MAX_VALUE,
                rule("customer_data", "dim_customers")));
        Path existing = TestFiles.write(root.resolve("customer_data/old.csv"), "old", T0);

        ScanSummary first = scanner.tick();
        assertEquals(1, first.baseline());
        assertTrue(scanner.isInitialScanDone());
        assertEquals(FileStatus.BASELINE, statusOf(existing));

        scanner.tick();
        scanner.tick();
        assertTrue(client.requests.isEmpty());

        // Files arriving after startup are dispatched
        Path arrived = TestFiles.write(root.resolve("customer_data/new.csv"), "new", T0 + 1_000);
        scanner.tick();
        scanner.tick();
        assertEquals(1, client.requests.size());
        assertEquals("new.csv", client.requests.get(0).fileName());
        assertEquals(FileStatus.DISPATCHED, statusOf(arrived));

        // A baseline file that is modified is dispatched too
        TestFiles.touch(existing, T0 + 2_000);
        scanner.tick();
        scanner.tick();
        assertEquals(2, client.requests.size());
        assertEquals("old.csv", client.requests.get(1).fileName());
    }

    @Test
    void shouldKeepBaselineUntilWatchPathIsListed() throws IOException {
        boolean[] unreachable = {true};
        LocalFsSource flakySource = new LocalFsSource() {
            @Override
            public List<Path> list(Path watchRoot, WatcherSettings settings) throws IOException {
                if (unreachable[0]) {
                    throw new IOException("network share unavailable");
                }
                return super.list(watchRoot, settings);
            }
        };
        FileScanner scanner = new FileScanner(flakySource, tracker,
                ConfigHolder.of(TestConfigs.config(root, true, Duration.ZERO, Long.MAX_VALUE,
                        rule("customer_data", "dim_customers"))),
                dispatcher, duration -> { });
        Path existing = TestFiles.write(root.resolve("customer_data/old.csv"), "old", T0);

        ScanSummary failed = scanner.tick();
        assertEquals(1, failed.errors());
        assertFalse(scanner.isInitialScanDone());

        unreachable[0] = false;
        ScanSummary first = scanner.tick();
        assertEquals(1, first.baseline());
        assertTrue(scanner.isInitialScanDone());

        scanner.tick();
        scanner.tick();
        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.BASELINE, statusOf(existing));
    }

    @Test
    void shouldDispatchExistingFilesWhenBaselineDisabled() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("customer_data", "dim_customers")));
        TestFiles.write(root.resolve("customer_data/old.csv"), "old", T0);

        ScanSummary first = scanner.tick();
        assertEquals(0, first.baseline());
        assertEquals(1, first.newFiles());

        scanner.tick();
        assertEquals(1, client.requests.size());
    }

    @Test
    void shouldIgnoreUnmatchedFilesWithoutReevaluating() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("customer_data", "dim_customers")));
        Path unmatched = TestFiles.write(root.resolve("misc/notes.csv"), "x", T0);
        TestFiles.write(root.resolve("customer_data/feb.csv"), "y", T0);

        scanner.tick();
        ScanSummary second = scanner.tick();

        assertEquals(1, second.ignored());
        assertEquals(1, client.requests.size());
        assertEquals(FileStatus.IGNORED, statusOf(unmatched));
        assertEquals("no pattern matched", tracker.find(TestFiles.key(unmatched)).orElseThrow().detail());

        // Remembered as ignored: no settle wait on later ticks
        int sleepsBefore = sleeps.size();
        scanner.tick();
        assertEquals(sleepsBefore, sleeps.size());
        assertEquals(FileStatus.IGNORED, statusOf(unmatched));
    }

    @Test
    void shouldIgnoreFilesOverSizeLimit() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, false, Duration.ZERO, 10,
                rule("customer_data", "dim_customers")));
        Path big = TestFiles.write(root.resolve("customer_data/big.csv"), "0123456789012345678901234", T0);

        scanner.tick();
        scanner.tick();

        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.IGNORED, statusOf(big));
        assertEquals("exceeds size limit", tracker.find(TestFiles.key(big)).orElseThrow().detail());
    }

    @Test
    void shouldSkipUnsupportedExtensions() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("customer_data", "dim_customers")));
        Path text = TestFiles.write(root.resolve("customer_data/readme.txt"), "hello", T0);

        scanner.tick();
        scanner.tick();

        assertTrue(client.requests.isEmpty());
        assertFalse(tracker.find(TestFiles.key(text)).isPresent());
    }

    @Test
    void shouldRetryAfterDispatchFailure() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, rule("customer_data", "dim_customers")));
        Path file = TestFiles.write(root.resolve("customer_data/mar.csv"), "data", T0);
        client.failing = true;

        scanner.tick();
        scanner.tick();

        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.CANDIDATE, statusOf(file));
        DispatchRecord failure = dispatchLog.recent(1).get(0);
        assertEquals(DispatchRecord.Status.ERROR, failure.status());
        assertTrue(failure.correlationId().startsWith("mar.csv_"));

        // Broker back: retried on the next tick
        client.failing = false;
        scanner.tick();
        assertEquals(1, client.requests.size());
        assertEquals(FileStatus.DISPATCHED, statusOf(file));
    }

    @Test
    void shouldHoldStableFilesForProcessDelay() throws IOException {
        FileScanner scanner = scanner(TestConfigs.config(root, false, Duration.ofSeconds(30), Long.MAX_VALUE,
                rule("customer_data", "dim_customers")));
        Path file = TestFiles.write(root.resolve("customer_data/apr.csv"), "data", T0);

        scanner.tick();
        scanner.tick();

        assertTrue(client.requests.isEmpty());
        assertEquals(FileStatus.STABLE, statusOf(file));
        assertEquals(1, pending.size());
    }

    @Test
    void shouldReevaluateIgnoredFilesAfterReload() throws IOException {
        Path configFile = root.resolve("pattern_config.yaml");
        Path watchDir = Files.createDirectories(root.resolve("incoming"));
        writeConfig(configFile, watchDir, "customer_data: dim_customers\n");

        ConfigLoader loader = new ConfigLoader(root, root);
        ConfigHolder holder = new ConfigHolder(loader.load(configFile), loader, Optional.of(configFile.toString()));
        FileScanner scanner = scanner(holder);
        Path file = TestFiles.write(watchDir.resolve("sales_data/q2.csv"), "data", T0);

        scanner.tick();
        scanner.tick();
        assertEquals(FileStatus.IGNORED, statusOf(file));

        // Add a rule for it and reload
        writeConfig(configFile, watchDir, "customer_data: dim_customers\n  sales_data: fact_sales\n");
        new ConfigReloader(holder, tracker).reload();
        assertEquals(FileStatus.CANDIDATE, statusOf(file));

        scanner.tick();
        assertEquals(1, client.requests.size());
        assertEquals("fact_sales", client.requests.get(0).destination().table());
    }

    private static void writeConfig(Path configFile, Path watchDir, String mappings) throws IOException {
        Files.writeString(configFile, "watcher_settings:\n"
                + "  watch_paths: ['" + watchDir + "']\n"
                + "  poll_interval: 10\n"
                + "  stability_delay: 2\n"
                + "  initial_scan_baseline: false\n"
                + "pattern_mappings:\n"
                + "  " + mappings);
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
