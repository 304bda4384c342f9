package com.lbg.markets.etl.watcher.orchestration;

import com.lbg.markets.etl.watcher.domain.CompletionNotice;

/**
 * Inbound notification that a worker finished a dispatched file.
 * May be called from any thread, in any order relative to other completions.
 */
public interface CompletionListener {

    Outcome onCompletion(CompletionNotice notice);

    enum Outcome {
        /** Matched a dispatched file and updated its state. */
        APPLIED,
        /** Matched a dispatch, but the file has moved on (modified or already completed). */
        STALE,
        /** No dispatch on record for that file name. */
        UNKNOWN
    }
}
