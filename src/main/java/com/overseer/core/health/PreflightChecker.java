package com.overseer.core.health;

import com.overseer.core.config.ConfigException;
import com.overseer.core.graph.TaskGraph;
import com.overseer.core.graph.TaskGraphBuilder;
import com.overseer.core.model.Phase;
import com.overseer.core.model.Task;
import com.overseer.workspace.GitWorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Environment checks that run before any lock is taken or task is started.
 *
 * <p>Every check contributes to one problem list; {@link #verify} reports them together so an
 * operator can fix a configuration in one pass.
 */
@Service
public class PreflightChecker {

    private static final Logger log = LoggerFactory.getLogger(PreflightChecker.class);

    /** Interpreters and built-ins that need no PATH lookup. */
    private static final Set<String> SHELL_WORDS = Set.of(
            "sh", "bash", "zsh", "exec", "cd", "echo", "true", "false", "test", "[", "printf",
            "sleep", "exit", "export", "set", "env", ":");

    private final GitWorkspaceManager git;

    public PreflightChecker(GitWorkspaceManager git) {
        this.git = git;
    }

    /**
     * What a run is about to do.
     *
     * @param projectRoot repository the workspaces branch from
     * @param logsDir     directory for logs, events and locks
     * @param graph       the full validated graph
     * @param selected    tasks of the requested phases that will be scheduled
     * @param phases      requested phases
     * @param runnerNoop  workers are not actually launched
     */
    public record Request(Path projectRoot, Path logsDir, TaskGraph graph, List<Task> selected,
                          Set<Phase> phases, boolean runnerNoop) {}

    public List<String> check(Request request) {
        var problems = new ArrayList<String>();
        checkGit(request.projectRoot(), problems);
        checkLogsDir(request.logsDir(), problems);
        checkRunners(request.selected(), request.runnerNoop(), problems);
        checkPrompts(request.selected(), problems);
        checkUnique(request.selected(), "workspace path", t -> t.workspacePath().toAbsolutePath().normalize(), problems);
        checkUnique(request.selected(), "branch", Task::branch, problems);
        checkUnique(request.selected(), "log path", t -> t.logPath().toAbsolutePath().normalize(), problems);
        checkLogPaths(request.selected(), problems);
        checkWorkspaces(request.selected(), problems);
        checkPhaseBoundaries(request.graph(), request.selected(), request.phases(), problems);
        return problems;
    }

    /**
     * @throws ConfigException listing every problem found
     */
    public void verify(Request request) {
        List<String> problems = check(request);
        if (!problems.isEmpty()) {
            throw new ConfigException("Pre-flight checks failed", problems);
        }
        log.info("Pre-flight checks passed for {} task(s)", request.selected().size());
    }

    private void checkGit(Path projectRoot, List<String> problems) {
        if (!Files.isDirectory(projectRoot)) {
            problems.add("Project root does not exist: " + projectRoot);
            return;
        }
        if (!git.isGitAvailable(projectRoot)) {
            problems.add("git is not runnable");
            return;
        }
        if (!git.isGitRepository(projectRoot)) {
            problems.add("Project root is not a git repository: " + projectRoot);
        }
    }

    private void checkLogsDir(Path logsDir, List<String> problems) {
        try {
            Files.createDirectories(logsDir);
        } catch (IOException e) {
            problems.add("Cannot create logs directory " + logsDir + ": " + e.getMessage());
            return;
        }
        if (!Files.isWritable(logsDir)) {
            problems.add("Logs directory is not writable: " + logsDir);
        }
    }

    private void checkRunners(Collection<Task> tasks, boolean runnerNoop, List<String> problems) {
        if (runnerNoop) {
            return;
        }
        var checked = new HashMap<String, Boolean>();
        for (Task task : tasks) {
            if (!TaskGraphBuilder.SHELL_BACKEND.equals(task.runner().backend())) {
                continue;
            }
            String binary = firstWord(task.runner().command());
            if (binary == null || binary.contains("{") || SHELL_WORDS.contains(binary) || binary.contains("=")) {
                continue;
            }
            boolean found = checked.computeIfAbsent(binary, this::isExecutable);
            if (!found) {
                problems.add("Task '" + task.id() + "': runner binary '" + binary + "' not found on PATH");
            }
        }
    }

    static String firstWord(String command) {
        String trimmed = command == null ? "" : command.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        String word = trimmed.substring(0, end);
        if (word.length() > 1 && (word.charAt(0) == '"' || word.charAt(0) == '\'')) {
            word = word.replace(String.valueOf(word.charAt(0)), "");
        }
        return word;
    }

    boolean isExecutable(String binary) {
        if (binary.contains("/")) {
            return Files.isExecutable(Path.of(binary));
        }
        String path = pathVariable();
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, binary))) {
                return true;
            }
        }
        return false;
    }

    String pathVariable() {
        return System.getenv("PATH");
    }

    private void checkPrompts(Collection<Task> tasks, List<String> problems) {
        for (Task task : tasks) {
            checkPromptFile(task.id(), "prompt", task.promptPath(), problems);
            checkPromptFile(task.id(), "simplified_prompt", task.escalation().simplifiedPrompt(), problems);
        }
    }

    private void checkPromptFile(String taskId, String field, Path prompt, List<String> problems) {
        if (prompt == null) {
            return;
        }
        if (!Files.exists(prompt)) {
            problems.add("Task '" + taskId + "': " + field + " file not found: " + prompt);
        } else if (Files.isDirectory(prompt)) {
            problems.add("Task '" + taskId + "': " + field + " is a directory: " + prompt);
        }
    }

    private <K> void checkUnique(Collection<Task> tasks, String what, Function<Task, K> key, List<String> problems) {
        var owners = new HashMap<K, String>();
        for (Task task : tasks) {
            String other = owners.putIfAbsent(key.apply(task), task.id());
            if (other != null) {
                problems.add("Tasks '" + other + "' and '" + task.id() + "' share the same " + what
                        + ": " + key.apply(task));
            }
        }
    }

    private void checkLogPaths(Collection<Task> tasks, List<String> problems) {
        for (Task task : tasks) {
            if (Files.isDirectory(task.logPath())) {
                problems.add("Task '" + task.id() + "': log path is a directory: " + task.logPath());
            }
        }
    }

    private void checkWorkspaces(Collection<Task> tasks, List<String> problems) {
        for (Task task : tasks) {
            Path workspace = task.workspacePath();
            if (Files.exists(workspace) && !git.isWorktree(workspace)) {
                problems.add("Task '" + task.id() + "': workspace path exists but is not a git worktree: "
                        + workspace);
            }
        }
    }

    private void checkPhaseBoundaries(TaskGraph graph, Collection<Task> selected, Set<Phase> phases,
                                      List<String> problems) {
        for (Task task : selected) {
            for (String dep : task.dependsOn()) {
                Phase depPhase = graph.task(dep).phase();
                if (!phases.contains(depPhase)) {
                    problems.add("Task '" + task.id() + "' depends on '" + dep + "' in phase "
                            + depPhase.wireName() + ", which is not part of this run");
                }
            }
        }
    }
}
