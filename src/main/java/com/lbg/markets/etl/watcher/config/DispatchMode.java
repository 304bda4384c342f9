package com.lbg.markets.etl.watcher.config;

import java.util.Locale;

public enum DispatchMode {
    /** Hand-built Celery envelope pushed straight onto the broker list. */
    RAW,
    /** Named task submitted through a queue client that owns the wire format. */
    STRUCTURED;

    public static DispatchMode parse(String value) {
        return DispatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
