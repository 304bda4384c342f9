package com.lbg.markets.etl.watcher.config;

import com.lbg.markets.etl.watcher.domain.PatternRule;

import java.util.List;

/**
 * Immutable, validated watch configuration. Reloads replace the whole object.
 */
public record WatchConfig(
        WatcherSettings watcher,
        DispatchSettings dispatch,
        List<PatternRule> patternRules,
        String source
) {
    public WatchConfig {
        if (watcher == null) {
            throw new IllegalArgumentException("Watcher settings cannot be null");
        }
        if (dispatch == null) {
            throw new IllegalArgumentException("Dispatch settings cannot be null");
        }
        patternRules = patternRules != null ? List.copyOf(patternRules) : List.of();
    }
}
