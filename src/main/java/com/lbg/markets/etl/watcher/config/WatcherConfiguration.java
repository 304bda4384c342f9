package com.lbg.markets.etl.watcher.config;

import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * Loads the watch configuration once at startup. An invalid file stops the application.
 */
@ApplicationScoped
public class WatcherConfiguration {

    @ConfigProperty(name = "watcher.config-file")
    Optional<String> configFile;

    @Produces
    @Singleton
    @Startup
    ConfigHolder configHolder() {
        ConfigLoader loader = new ConfigLoader();
        return new ConfigHolder(loader.load(configFile), loader, configFile);
    }
}
