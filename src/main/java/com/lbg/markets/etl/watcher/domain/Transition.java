package com.lbg.markets.etl.watcher.domain;

/**
 * Outcome of observing a file's current stat against tracked state.
 */
public enum Transition {
    /** First sighting; recorded as a candidate and never dispatched on this tick. */
    NEW,
    /** The mtime moved; the entry was reset to candidate. */
    MODIFIED,
    /** Unchanged candidate, due for the stability check. */
    SETTLING,
    /** Nothing to do for this file on this tick. */
    UNCHANGED
}
