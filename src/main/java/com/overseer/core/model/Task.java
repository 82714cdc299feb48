package com.overseer.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single unit of work in the task graph, executed by one worker in its own workspace.
 *
 * @param id            unique identifier within the graph
 * @param phase         run class the task belongs to
 * @param branch        branch the task's workspace is created on
 * @param workspacePath absolute path of the task's git worktree
 * @param baseRef       reference the branch is created from
 * @param runner        runner launching the worker (inline commands get a synthetic runner)
 * @param promptPath    prompt reference substituted for {@code {prompt}}, may be null
 * @param logPath       per-task worker log
 * @param dependsOn     ids of tasks that must succeed first
 * @param manual        excluded from automatic scheduling unless explicitly requested
 * @param watchdog      liveness sampling settings
 * @param escalation    recovery ladder
 */
public record Task(
    String id,
    Phase phase,
    String branch,
    Path workspacePath,
    String baseRef,
    RunnerSpec runner,
    Path promptPath,
    Path logPath,
    Set<String> dependsOn,
    boolean manual,
    WatchdogSettings watchdog,
    EscalationSettings escalation
) {
    public Task {
        dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }
}
