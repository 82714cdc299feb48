package com.overseer.core.engine;

import com.overseer.core.config.RunConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunPathsTest {

    private static final Path CONFIG = Path.of("/work/project/config/tasks.yml");

    private static RunConfig config(String projectRoot, String logsDir, String summaryDir) {
        return new RunConfig(CONFIG, projectRoot, logsDir, summaryDir, null, Map.of(), List.of());
    }

    @Test
    @DisplayName("Defaults to the config directory with logs beneath it")
    void defaults() {
        RunPaths paths = RunPaths.resolve(config(null, null, null));

        assertEquals(Path.of("/work/project/config"), paths.projectRoot());
        assertEquals(Path.of("/work/project/config/logs"), paths.logsDir());
        assertEquals(paths.logsDir(), paths.summaryDir());
    }

    @Test
    @DisplayName("Relative entries resolve against the config directory and project root")
    void relativeEntries() {
        RunPaths paths = RunPaths.resolve(config("..", "var/log", "reports"));

        assertEquals(Path.of("/work/project"), paths.projectRoot());
        assertEquals(Path.of("/work/project/var/log"), paths.logsDir());
        assertEquals(Path.of("/work/project/reports"), paths.summaryDir());
    }

    @Test
    @DisplayName("Absolute entries are kept")
    void absoluteEntries() {
        RunPaths paths = RunPaths.resolve(config("/srv/repo", "/var/log/overseer", ""));

        assertEquals(Path.of("/srv/repo"), paths.projectRoot());
        assertEquals(Path.of("/var/log/overseer"), paths.logsDir());
        assertEquals(Path.of("/var/log/overseer"), paths.summaryDir());
    }
}
