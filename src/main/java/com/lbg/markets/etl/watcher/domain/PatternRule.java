package com.lbg.markets.etl.watcher.domain;

/**
 * Maps a case-insensitive path substring to a destination.
 * Rules are evaluated in declaration order; the first match wins.
 */
public record PatternRule(
        String pattern,
        Destination destination
) {
    public PatternRule {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern cannot be blank");
        }
        if (destination == null) {
            throw new IllegalArgumentException("Pattern '" + pattern + "' has no destination");
        }
    }
}
