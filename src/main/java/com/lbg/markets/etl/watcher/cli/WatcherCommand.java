package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.orchestration.PollLoop;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Entry point. With no subcommand the watcher runs in the foreground.
 * The watcher's own configuration file is chosen with {@code -Dwatcher.config-file=...} or
 * {@code WATCHER_CONFIG_FILE}, since it is loaded before the command line is parsed;
 * {@code validate} and {@code patterns} take {@code --config} for any other file.
 */
@TopCommand
@CommandLine.Command(
        name = "etl-file-watcher",
        mixinStandardHelpOptions = true,
        description = "Watches directories for data files and dispatches them to the ETL task queue.",
        subcommands = {RunCommand.class, StatusCommand.class, ValidateCommand.class, PatternsCommand.class,
                CommandLine.HelpCommand.class})
public class WatcherCommand implements Callable<Integer> {

    @Inject
    PollLoop pollLoop;

    @Override
    public Integer call() {
        return RunCommand.runUntilExit(pollLoop);
    }
}
