package com.lbg.markets.etl.watcher.source;

import com.lbg.markets.etl.watcher.config.WatcherSettings;
import com.lbg.markets.etl.watcher.domain.FileDescriptor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Directory listing and stat capability consumed by the scanner.
 */
public interface SourceProvider {

    /**
     * Watch roots to scan this tick.
     */
    List<Path> resolveRoots(WatcherSettings settings);

    /**
     * Regular files under {@code root}, recursively, whose extension is supported.
     * Unreadable subtrees are skipped rather than failing the listing.
     */
    List<Path> list(Path root, WatcherSettings settings) throws IOException;

    FileDescriptor stat(Path file) throws IOException;
}
