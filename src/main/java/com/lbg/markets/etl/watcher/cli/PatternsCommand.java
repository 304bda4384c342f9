package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.ConfigLoader;
import com.lbg.markets.etl.watcher.config.ConfigurationException;
import com.lbg.markets.etl.watcher.config.PatternConfigEditor;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import com.lbg.markets.etl.watcher.domain.PatternRule;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Pattern rule management on the configuration file. Changes reach a running watcher
 * through {@code POST /config/reload}.
 */
@CommandLine.Command(
        name = "patterns",
        description = "List, add or remove pattern rules in the watch configuration file.",
        subcommands = {
                PatternsCommand.ListPatterns.class,
                PatternsCommand.AddPattern.class,
                PatternsCommand.RemovePattern.class})
public class PatternsCommand {

    static void printRules(WatchConfig config, PrintWriter out) {
        if (config.patternRules().isEmpty()) {
            out.println("No pattern rules defined");
        }
        for (PatternRule rule : config.patternRules()) {
            String description = rule.destination().description();
            out.printf("  %-24s -> %s%s%n", rule.pattern(), rule.destination().qualifiedName(),
                    description != null ? "  (" + description + ")" : "");
        }
        out.flush();
    }

    @CommandLine.Command(name = "list", description = "Show the pattern rules in match order.")
    static class ListPatterns implements Callable<Integer> {

        @CommandLine.Mixin
        ConfigFileOption configFile = new ConfigFileOption();

        @Inject
        ConfigHolder activeConfig;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            ConfigLoader loader = new ConfigLoader();
            try {
                Path file = configFile.resolve(loader, activeConfig);
                PrintWriter out = spec.commandLine().getOut();
                out.println("Pattern rules in " + file + ":");
                printRules(loader.load(file), out);
                return 0;
            } catch (ConfigurationException e) {
                ValidateCommand.printErrors(e.errors(), spec.commandLine().getErr());
                return 1;
            }
        }
    }

    @CommandLine.Command(name = "add", description = "Add a pattern rule, or replace the rule with the same pattern.")
    static class AddPattern implements Callable<Integer> {

        @CommandLine.Mixin
        ConfigFileOption configFile = new ConfigFileOption();

        @CommandLine.Parameters(index = "0", paramLabel = "PATTERN", description = "Substring matched against the file path.")
        String pattern;

        @CommandLine.Parameters(index = "1", paramLabel = "TABLE", description = "Destination table.")
        String table;

        @CommandLine.Option(names = "--schema", description = "Destination schema.")
        String schema;

        @CommandLine.Option(names = "--description", description = "What the files are.")
        String description;

        @Inject
        ConfigHolder activeConfig;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            ConfigLoader loader = new ConfigLoader();
            try {
                Path file = configFile.resolve(loader, activeConfig);
                WatchConfig config = new PatternConfigEditor(loader).addPattern(file, pattern, table, schema, description);
                PrintWriter out = spec.commandLine().getOut();
                out.printf("Added pattern %s -> %s in %s%n", pattern, table, file);
                printRules(config, out);
                return 0;
            } catch (ConfigurationException e) {
                ValidateCommand.printErrors(e.errors(), spec.commandLine().getErr());
                return 1;
            }
        }
    }

    @CommandLine.Command(name = "remove", description = "Remove the rule with the given pattern.")
    static class RemovePattern implements Callable<Integer> {

        @CommandLine.Mixin
        ConfigFileOption configFile = new ConfigFileOption();

        @CommandLine.Parameters(index = "0", paramLabel = "PATTERN")
        String pattern;

        @Inject
        ConfigHolder activeConfig;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            ConfigLoader loader = new ConfigLoader();
            try {
                Path file = configFile.resolve(loader, activeConfig);
                WatchConfig config = new PatternConfigEditor(loader).removePattern(file, pattern);
                PrintWriter out = spec.commandLine().getOut();
                out.printf("Removed pattern %s from %s%n", pattern, file);
                printRules(config, out);
                return 0;
            } catch (ConfigurationException e) {
                ValidateCommand.printErrors(e.errors(), spec.commandLine().getErr());
                return 1;
            }
        }
    }
}
