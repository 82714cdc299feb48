package com.overseer.core.watchdog;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the last lines of a (possibly large, still growing) log file.
 */
public final class LogTail {

    private static final int MAX_BYTES = 64 * 1024;

    private LogTail() {}

    /**
     * Returns up to {@code maxLines} trailing lines. Only the last 64 KiB of the file are read;
     * a partial first line in that range is dropped.
     */
    public static List<String> lastLines(Path file, int maxLines) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try (var raf = new RandomAccessFile(file.toFile(), "r")) {
            long length = raf.length();
            int toRead = (int) Math.min(length, MAX_BYTES);
            byte[] buffer = new byte[toRead];
            raf.seek(length - toRead);
            raf.readFully(buffer);
            String text = new String(buffer, StandardCharsets.UTF_8);
            var lines = new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));
            if (toRead < length && !lines.isEmpty()) {
                lines.remove(0);
            }
            if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
                lines.remove(lines.size() - 1);
            }
            int from = Math.max(0, lines.size() - maxLines);
            return List.copyOf(lines.subList(from, lines.size()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read log tail of " + file, e);
        }
    }
}
