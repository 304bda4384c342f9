package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.ConfigLoader;
import com.lbg.markets.etl.watcher.config.ConfigurationException;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * {@code --config} for commands that work on a configuration file rather than the running watcher.
 */
public class ConfigFileOption {

    @CommandLine.Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "Watch configuration file (YAML or JSON). Defaults to the file the watcher loads.")
    String file;

    /**
     * The named file, which must exist, else the file the application loaded, else the standard search.
     */
    Path resolve(ConfigLoader loader, ConfigHolder active) {
        if (file != null && !file.isBlank()) {
            Path explicit = Paths.get(file).toAbsolutePath();
            if (!Files.isRegularFile(explicit)) {
                throw new ConfigurationException("Config file not found: " + explicit);
            }
            return explicit;
        }
        if (active != null) {
            return Paths.get(active.get().source());
        }
        return loader.locate(Optional.empty());
    }
}
