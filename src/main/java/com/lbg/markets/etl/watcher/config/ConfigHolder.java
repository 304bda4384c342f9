package com.lbg.markets.etl.watcher.config;

import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the active {@link WatchConfig}. Readers take one reference per unit of work;
 * a reload swaps the whole object.
 */
public class ConfigHolder implements Supplier<WatchConfig> {

    private static final Logger LOG = Logger.getLogger(ConfigHolder.class);

    private final AtomicReference<WatchConfig> current;
    private final ConfigLoader loader;
    private final Optional<String> configFile;

    public ConfigHolder(WatchConfig initial, ConfigLoader loader, Optional<String> configFile) {
        this.current = new AtomicReference<>(initial);
        this.loader = loader;
        this.configFile = configFile;
    }

    /**
     * Fixed configuration with no backing file; {@link #reload()} is not available.
     */
    public static ConfigHolder of(WatchConfig config) {
        return new ConfigHolder(config, null, Optional.empty());
    }

    @Override
    public WatchConfig get() {
        return current.get();
    }

    /**
     * Re-read the configuration file and swap it in. The previous configuration stays active on failure.
     *
     * @return the previous configuration
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public WatchConfig reload() {
        if (loader == null) {
            throw new ConfigurationException("Configuration reload not available");
        }
        String file = Optional.ofNullable(current.get().source()).or(() -> configFile).orElse(null);
        WatchConfig fresh = loader.load(Optional.ofNullable(file));
        WatchConfig previous = current.getAndSet(fresh);

        if (!previous.watcher().pollInterval().equals(fresh.watcher().pollInterval())) {
            LOG.warnf("poll_interval changed from %s to %s; takes effect after restart",
                    previous.watcher().pollInterval(), fresh.watcher().pollInterval());
        }
        if (!previous.dispatch().equals(fresh.dispatch())) {
            LOG.warn("celery_settings changed; the dispatch client keeps its startup settings until restart");
        }
        LOG.infof("Configuration reloaded from %s (%d pattern rules)", fresh.source(), fresh.patternRules().size());
        return previous;
    }
}
