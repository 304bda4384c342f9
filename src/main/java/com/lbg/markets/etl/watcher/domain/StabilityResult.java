package com.lbg.markets.etl.watcher.domain;

/**
 * Result of re-statting a candidate after the settle delay.
 */
public record StabilityResult(
        Kind kind,
        FileDescriptor descriptor,
        String reason
) {
    public enum Kind {
        NOT_READY,
        STABLE,
        ERROR
    }

    public static StabilityResult stable(FileDescriptor descriptor) {
        return new StabilityResult(Kind.STABLE, descriptor, null);
    }

    public static StabilityResult notReady(FileDescriptor descriptor, String reason) {
        return new StabilityResult(Kind.NOT_READY, descriptor, reason);
    }

    public static StabilityResult error(String reason) {
        return new StabilityResult(Kind.ERROR, null, reason);
    }

    public boolean isStable() {
        return kind == Kind.STABLE;
    }
}
