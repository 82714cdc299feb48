package com.overseer.core.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunConfigLoaderTest {

    @TempDir
    Path tempDir;

    private RunConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RunConfigLoader();
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Reads a YAML task file")
        void yaml() throws IOException {
            Path file = tempDir.resolve("tasks.yml");
            Files.writeString(file, """
                    project_root: repo
                    logs_dir: out/logs
                    runners:
                      claude:
                        command: claude -p {prompt}
                    tasks:
                      - id: api
                        phase: main
                        workspace_path: ../wt/{task}
                        runner: claude
                        prompt: prompts/api.md
                      - id: ui
                        workspace_path: ../wt/{task}
                        command: make ui
                        depends_on: [api]
                        manual: true
                        watchdog:
                          stuck_threshold: 5m
                        escalation:
                          strategies: [notify, kill_and_retry]
                          max_retries: 1
                    """);
            RunConfig config = loader.load(file);
            assertEquals("repo", config.projectRoot());
            assertEquals("out/logs", config.logsDir());
            assertEquals(2, config.tasks().size());
            assertEquals("claude -p {prompt}", config.runners().get("claude").command());
            var ui = config.tasks().get(1);
            assertEquals(List.of("api"), ui.dependsOn());
            assertTrue(ui.manual());
            assertEquals("5m", ui.watchdog().stuckThreshold());
            assertEquals(1, ui.escalation().maxRetries());
            assertEquals(file.toAbsolutePath().normalize(), config.source());
        }

        @Test
        @DisplayName("Reads a JSON task file")
        void json() throws IOException {
            Path file = tempDir.resolve("tasks.json");
            Files.writeString(file, """
                    {"tasks": [{"id": "a", "workspace_path": "wt/a", "command": "true"}]}
                    """);
            RunConfig config = loader.load(file);
            assertEquals("a", config.tasks().get(0).id());
            assertTrue(config.runners().isEmpty());
        }

        @Test
        @DisplayName("Files without a known extension are tried as JSON, then YAML")
        void sniffs() throws IOException {
            Path file = tempDir.resolve("tasks.conf");
            Files.writeString(file, "tasks:\n  - id: a\n    workspace_path: wt/a\n    command: 'true'\n");
            assertEquals(1, loader.load(file).tasks().size());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Missing file is a ConfigException")
        void missingFile() {
            var e = assertThrows(ConfigException.class, () -> loader.load(tempDir.resolve("nope.yml")));
            assertTrue(e.getMessage().contains("not found"));
        }

        @Test
        @DisplayName("Unknown fields are rejected")
        void unknownField() throws IOException {
            Path file = tempDir.resolve("tasks.yml");
            Files.writeString(file, "tasks:\n  - id: a\n    colour: blue\n");
            assertThrows(ConfigException.class, () -> loader.load(file));
        }

        @Test
        @DisplayName("Empty file is a ConfigException")
        void emptyFile() throws IOException {
            Path file = tempDir.resolve("tasks.yml");
            Files.writeString(file, "");
            assertThrows(ConfigException.class, () -> loader.load(file));
        }
    }

    @Nested
    @DisplayName("Durations")
    class Durations {

        @Test
        @DisplayName("Accepts simple units, bare seconds and ISO-8601")
        void formats() {
            assertEquals(Duration.ofSeconds(30), RunConfigLoader.parseDuration("30s", "f"));
            assertEquals(Duration.ofMinutes(15), RunConfigLoader.parseDuration("15m", "f"));
            assertEquals(Duration.ofSeconds(300), RunConfigLoader.parseDuration("300", "f"));
            assertEquals(Duration.ofMinutes(2), RunConfigLoader.parseDuration("PT2M", "f"));
            assertNull(RunConfigLoader.parseDuration(null, "f"));
        }

        @Test
        @DisplayName("Rejects garbage and negative values")
        void rejects() {
            assertThrows(ConfigException.class, () -> RunConfigLoader.parseDuration("soon", "f"));
            assertThrows(ConfigException.class, () -> RunConfigLoader.parseDuration("-5s", "f"));
        }
    }
}
