package com.overseer.supervisor;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything a backend needs to start one worker process.
 *
 * @param taskId           owning task
 * @param attempt          1-based launch attempt of the task in this run
 * @param command          fully expanded command line
 * @param workingDirectory the task's workspace
 * @param logPath          per-task log, opened in append mode
 * @param environment      variables added to the inherited environment
 */
public record LaunchRequest(
    String taskId,
    int attempt,
    String command,
    Path workingDirectory,
    Path logPath,
    Map<String, String> environment
) {
    public LaunchRequest {
        environment = Map.copyOf(environment);
    }
}
