package com.lbg.markets.etl.watcher.orchestration;

/**
 * Counts for one scanner tick.
 */
public record ScanSummary(
        int filesSeen,
        int newFiles,
        int modified,
        int baseline,
        int notReady,
        int ignored,
        int submitted,
        int errors
) {
    public boolean hasActivity() {
        return newFiles > 0 || modified > 0 || submitted > 0 || errors > 0;
    }
}
