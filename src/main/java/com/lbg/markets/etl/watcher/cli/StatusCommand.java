package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;
import com.lbg.markets.etl.watcher.orchestration.WatcherStatus;
import com.lbg.markets.etl.watcher.orchestration.WatcherStatusService;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "status", description = "Print the active configuration and file counts.")
public class StatusCommand implements Callable<Integer> {

    @Inject
    WatcherStatusService statusService;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        print(statusService.status(), spec.commandLine().getOut());
        return 0;
    }

    static void print(WatcherStatus status, PrintWriter out) {
        out.println("Configuration:   " + status.configFile());
        out.println("Watch paths:     " + String.join(", ", status.watchPaths()));
        out.printf("Poll interval:   %ds (settle %ds, process delay %ds)%n",
                status.pollIntervalSeconds(), status.stabilityDelaySeconds(), status.processDelaySeconds());
        out.println("Extensions:      " + String.join(", ", status.supportedExtensions()));
        out.println("Max file size:   " + status.maxFileSizeMb() + "MB");
        out.printf("Dispatch:        %s -> %s (%s)%n", status.dispatchStrategy(), status.queue(), status.taskName());
        out.println("Pattern mappings:");
        for (Map.Entry<String, String> mapping : status.patternMappings().entrySet()) {
            out.printf("  %-24s -> %s%n", mapping.getKey(), mapping.getValue());
        }
        out.printf("Files:           %d tracked, %d queued, %d processed, %d pending%n",
                status.files().total(), status.files().queued(), status.files().processed(),
                status.pendingDispatches());
        for (FileStatus fileStatus : FileStatus.values()) {
            int count = status.files().count(fileStatus);
            if (count > 0) {
                out.printf("  %-10s %d%n", fileStatus, count);
            }
        }
        out.flush();
    }
}
