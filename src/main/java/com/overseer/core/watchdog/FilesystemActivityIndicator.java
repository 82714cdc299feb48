package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Signals when any file under the workspace, outside {@code .git}, was modified after the
 * previous sample.
 */
public class FilesystemActivityIndicator implements ProgressIndicator {

    @Override
    public Indicator kind() {
        return Indicator.FILESYSTEM;
    }

    @Override
    public IndicatorReading sample(SampleContext context) {
        Path root = context.workspace();
        if (!Files.isDirectory(root)) {
            return IndicatorReading.quiet("workspace missing");
        }
        var newest = new Path[1];
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return isGitMetadata(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (isGitMetadata(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    Instant modified = attrs.lastModifiedTime().toInstant();
                    if (modified.isAfter(context.windowStart())) {
                        newest[0] = file;
                        return FileVisitResult.TERMINATE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    // files may vanish while the worker runs
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan workspace " + root, e);
        }
        if (newest[0] != null) {
            return IndicatorReading.signal("modified " + root.relativize(newest[0]));
        }
        return IndicatorReading.quiet("no file changes");
    }

    private static boolean isGitMetadata(Path path) {
        Path name = path.getFileName();
        return name != null && ".git".equals(name.toString());
    }
}
