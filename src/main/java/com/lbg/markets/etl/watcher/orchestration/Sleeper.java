package com.lbg.markets.etl.watcher.orchestration;

import java.time.Duration;

/**
 * Blocking pause used for the settle delay.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
