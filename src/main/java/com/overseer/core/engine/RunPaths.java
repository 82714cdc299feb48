package com.overseer.core.engine;

import com.overseer.core.config.RunConfig;

import java.nio.file.Path;

/**
 * Directories of one task file. Relative entries resolve against the config file's directory
 * (project root) and the project root (logs and summary directories).
 */
public record RunPaths(Path configFile, Path projectRoot, Path logsDir, Path summaryDir) {

    public static RunPaths resolve(RunConfig config) {
        Path configFile = config.source();
        Path configDir = configFile.toAbsolutePath().getParent();
        Path projectRoot = blank(config.projectRoot()) ? configDir : configDir.resolve(config.projectRoot());
        projectRoot = projectRoot.normalize();
        Path logsDir = blank(config.logsDir()) ? projectRoot.resolve("logs") : projectRoot.resolve(config.logsDir());
        Path summaryDir = blank(config.summaryDir()) ? logsDir : projectRoot.resolve(config.summaryDir());
        return new RunPaths(configFile, projectRoot, logsDir.normalize(), summaryDir.normalize());
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
