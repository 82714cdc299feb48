package com.overseer.core.watchdog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemActivityIndicatorTest {

    private static final Instant WINDOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path workspace;

    private final FilesystemActivityIndicator indicator = new FilesystemActivityIndicator();

    private SampleContext context(Path root) {
        return new SampleContext("schema", root, "task/schema", root.resolve("worker.log"),
                WINDOW, WINDOW.plusSeconds(30));
    }

    private Path touch(String relative, Instant modified) throws IOException {
        Path file = workspace.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    @Test
    @DisplayName("A file modified inside the window signals")
    void modifiedFile() throws IOException {
        touch("src/Schema.java", WINDOW.minusSeconds(600));
        touch("src/Api.java", WINDOW.plusSeconds(5));

        IndicatorReading reading = indicator.sample(context(workspace));

        assertTrue(reading.signaled());
        assertTrue(reading.detail().contains("Api.java"));
    }

    @Test
    @DisplayName("Old files are quiet")
    void oldFiles() throws IOException {
        touch("src/Schema.java", WINDOW.minusSeconds(600));

        assertFalse(indicator.sample(context(workspace)).signaled());
    }

    @Test
    @DisplayName("Changes under .git are ignored")
    void gitMetadataIgnored() throws IOException {
        touch(".git/index", WINDOW.plusSeconds(5));
        touch("README.md", WINDOW.minusSeconds(600));

        assertFalse(indicator.sample(context(workspace)).signaled());
    }

    @Test
    @DisplayName("A missing workspace is quiet")
    void missingWorkspace() {
        IndicatorReading reading = indicator.sample(context(workspace.resolve("gone")));

        assertFalse(reading.signaled());
        assertEquals("workspace missing", reading.detail());
    }
}
