package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.config.ConfigHolder;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import com.lbg.markets.etl.watcher.tracker.Tracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Swaps in a freshly loaded configuration and returns files ignored under the old rules
 * to candidate, so changed rules apply to them on the next tick.
 */
@ApplicationScoped
public class ConfigReloader {

    private static final Logger LOG = Logger.getLogger(ConfigReloader.class);

    private final ConfigHolder config;
    private final Tracker tracker;

    @Inject
    public ConfigReloader(ConfigHolder config, Tracker tracker) {
        this.config = config;
        this.tracker = tracker;
    }

    /**
     * @return the new configuration
     * @throws com.lbg.markets.etl.watcher.config.ConfigurationException if the file is invalid;
     *         the previous configuration and ignored markings are kept
     */
    public WatchConfig reload() {
        config.reload();
        int reset = tracker.resetIgnored();
        LOG.infof("Re-evaluating %d previously ignored files under the new rules", reset);
        return config.get();
    }
}
