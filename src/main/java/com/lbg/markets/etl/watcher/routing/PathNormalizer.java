package com.lbg.markets.etl.watcher.routing;

import java.util.Locale;

/**
 * Path normalization shared by the scanner and the router, so Windows and POSIX
 * spellings of the same path key and match identically.
 */
public final class PathNormalizer {

    private PathNormalizer() {
        // Utility class
    }

    /**
     * Forward slashes, case preserved. Used as the tracker key.
     */
    public static String toKey(String path) {
        return path.replace('\\', '/');
    }

    /**
     * Forward slashes, lower-cased. Used only for pattern matching.
     */
    public static String forMatching(String path) {
        return toKey(path).toLowerCase(Locale.ROOT);
    }
}
