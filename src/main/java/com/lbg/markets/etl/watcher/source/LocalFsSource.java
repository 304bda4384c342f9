package com.lbg.markets.etl.watcher.source;

import com.lbg.markets.etl.watcher.config.WatcherSettings;
import com.lbg.markets.etl.watcher.domain.FileDescriptor;
import com.lbg.markets.etl.watcher.routing.PathNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Source provider for local and mounted network filesystems.
 * Handles file:// URIs or plain paths.
 */
@ApplicationScoped
public class LocalFsSource implements SourceProvider {

    private static final Logger LOG = Logger.getLogger(LocalFsSource.class);

    @Override
    public List<Path> resolveRoots(WatcherSettings settings) {
        List<Path> roots = new ArrayList<>();
        for (String watchPath : settings.watchPaths()) {
            Path root = extractPath(watchPath);
            if (Files.isDirectory(root)) {
                roots.add(root);
            } else {
                LOG.warnf("Watch path %s is not available, skipping", root);
            }
        }

        if (roots.isEmpty() && settings.backupWatchPath() != null) {
            Path backup = extractPath(settings.backupWatchPath());
            try {
                Files.createDirectories(backup);
                LOG.infof("Using backup watch path: %s", backup);
                roots.add(backup);
            } catch (IOException e) {
                LOG.errorf(e, "Failed to create backup watch path: %s", backup);
            }
        }
        return roots;
    }

    @Override
    public List<Path> list(Path root, WatcherSettings settings) throws IOException {
        List<Path> files = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && settings.isSupported(file.getFileName().toString())) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOG.warnf("Cannot access %s: %s", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        return files;
    }

    @Override
    public FileDescriptor stat(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return new FileDescriptor(
                PathNormalizer.toKey(file.toAbsolutePath().normalize().toString()),
                attrs.size(),
                attrs.lastModifiedTime().toMillis()
        );
    }

    private Path extractPath(String uri) {
        if (uri.startsWith("file://")) {
            return Paths.get(uri.substring(7));
        }
        return Paths.get(uri);
    }
}
