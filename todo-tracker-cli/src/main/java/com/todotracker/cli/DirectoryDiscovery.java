package com.todotracker.cli;

import com.todotracker.core.discovery.FileDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Walks a directory tree and returns the regular files to scan.
 *
 * <p>Hidden directories (names starting with a dot, such as {@code .git} and the cache
 * directory) are not entered. Files larger than the size limit and files matching an exclude
 * glob (relative to the root, {@code /}-separated) are left out. The result is sorted.
 */
public class DirectoryDiscovery implements FileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(DirectoryDiscovery.class);

    private final Path root;
    private final long maxFileSize;
    private final List<PathMatcher> excludes;

    public DirectoryDiscovery(Path root, long maxFileSize, List<String> excludeGlobs) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.maxFileSize = maxFileSize;
        this.excludes = excludeGlobs.stream()
            .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
            .toList();
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public List<Path> discover() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }

        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                if (attrs.size() > maxFileSize) {
                    log.debug("Skipping {} ({} bytes exceeds limit of {})", file, attrs.size(), maxFileSize);
                } else if (isExcluded(file)) {
                    log.debug("Excluded: {}", file);
                } else {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(null);
        log.debug("Discovered {} files under {}", files.size(), root);
        return files;
    }

    private static boolean isHidden(Path dir) {
        Path name = dir.getFileName();
        return name != null && name.toString().startsWith(".") && !name.toString().equals(".");
    }

    private boolean isExcluded(Path file) {
        if (excludes.isEmpty()) {
            return false;
        }
        Path relative = Path.of(root.relativize(file).toString().replace('\\', '/'));
        return excludes.stream().anyMatch(matcher -> matcher.matches(relative));
    }
}
