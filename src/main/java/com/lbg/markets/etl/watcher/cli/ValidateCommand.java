package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.ConfigLoader;
import com.lbg.markets.etl.watcher.config.ConfigurationException;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "validate", description = "Check a watch configuration file and list every problem found.")
public class ValidateCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ConfigFileOption configFile = new ConfigFileOption();

    @Inject
    ConfigHolder activeConfig;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ConfigLoader loader = new ConfigLoader();
        PrintWriter out = spec.commandLine().getOut();
        try {
            Path file = configFile.resolve(loader, activeConfig);
            WatchConfig config = loader.load(file);
            out.printf("%s is valid: %d pattern rules, %s dispatch to '%s'%n", file, config.patternRules().size(),
                    config.dispatch().mode().name().toLowerCase(Locale.ROOT), config.dispatch().queue());
            out.flush();
            return 0;
        } catch (ConfigurationException e) {
            printErrors(e.errors(), spec.commandLine().getErr());
            return 1;
        }
    }

    static void printErrors(List<String> errors, PrintWriter err) {
        err.println("Configuration is invalid:");
        for (String error : errors) {
            err.println("  - " + error);
        }
        err.flush();
    }
}
