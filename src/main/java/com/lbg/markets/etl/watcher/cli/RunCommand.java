package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.orchestration.PollLoop;
import io.quarkus.runtime.Quarkus;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "run", description = "Start watching and dispatching until stopped.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(RunCommand.class);

    @Inject
    PollLoop pollLoop;

    @Override
    public Integer call() {
        return runUntilExit(pollLoop);
    }

    static int runUntilExit(PollLoop pollLoop) {
        LOG.info("Starting file watcher");
        pollLoop.start();
        Quarkus.waitForExit();
        return 0;
    }
}
