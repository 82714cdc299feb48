package com.overseer.core.graph;

import com.overseer.core.config.ConfigException;
import com.overseer.core.config.RunConfig;
import com.overseer.core.config.RunConfigLoader;
import com.overseer.core.config.TemplateExpander;
import com.overseer.core.model.EscalationSettings;
import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.Indicator;
import com.overseer.core.model.Phase;
import com.overseer.core.model.RunnerSpec;
import com.overseer.core.model.Task;
import com.overseer.core.model.WatchdogSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns declarative task entries into a validated {@link TaskGraph}.
 *
 * <p>Construction is pure: nothing is read from or written to disk. Every structural problem
 * (duplicate ids, dangling dependencies, missing fields, bad phases or templates) is collected
 * and reported together in one {@link ConfigException}. Cycles are checked afterwards with a
 * depth-first search and reported as a {@link DependencyCycleException}.
 */
@Component
public class TaskGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphBuilder.class);

    public static final String DEFAULT_BRANCH = "task/{task}";
    public static final String SHELL_BACKEND = "shell";
    public static final String NOOP_BACKEND = "noop";

    private static final Pattern TASK_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    public TaskGraph build(RunConfig config, TaskDefaults defaults) {
        return build(config.tasks(), config.runners(), defaults);
    }

    public TaskGraph build(List<RunConfig.TaskEntry> entries,
                           Map<String, RunConfig.RunnerEntry> runnerEntries,
                           TaskDefaults defaults) {
        var problems = new ArrayList<String>();
        Map<String, RunnerSpec> runners = resolveRunners(runnerEntries, defaults, problems);

        var tasks = new ArrayList<Task>();
        var seen = new HashMap<String, Integer>();
        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            if (entry == null) {
                problems.add("tasks[" + i + "]: empty entry");
                continue;
            }
            String id = entry.id();
            if (id == null || id.isBlank()) {
                problems.add("tasks[" + i + "]: missing required field 'id'");
                continue;
            }
            if (!TASK_ID.matcher(id).matches()) {
                problems.add("Task '" + id + "': id may only contain letters, digits, '.', '_' and '-'");
                continue;
            }
            Integer previous = seen.putIfAbsent(id, i);
            if (previous != null) {
                problems.add("Duplicate task id '" + id + "' (tasks[" + previous + "] and tasks[" + i + "])");
                continue;
            }
            Task task = buildTask(entry, runners, defaults, problems);
            if (task != null) {
                tasks.add(task);
            }
        }

        for (Task task : tasks) {
            for (String dep : task.dependsOn()) {
                if (!seen.containsKey(dep)) {
                    problems.add("Task '" + task.id() + "' depends on unknown task '" + dep + "'");
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid task configuration", problems);
        }

        detectCycle(tasks);
        log.debug("Built task graph with {} task(s)", tasks.size());
        return new TaskGraph(tasks, runners);
    }

    private Map<String, RunnerSpec> resolveRunners(Map<String, RunConfig.RunnerEntry> entries,
                                                   TaskDefaults defaults, List<String> problems) {
        var runners = new LinkedHashMap<String, RunnerSpec>();
        entries.forEach((name, entry) -> {
            if (entry == null || entry.command() == null || entry.command().isBlank()) {
                problems.add("Runner '" + name + "' has an empty command");
                return;
            }
            String backend = entry.backend() == null ? SHELL_BACKEND : entry.backend();
            if (!defaults.backends().contains(backend)) {
                problems.add("Runner '" + name + "': unknown backend '" + backend + "'");
                return;
            }
            String error = TemplateExpander.validate(entry.command(), TemplateExpander.COMMAND_KEYS);
            if (error != null) {
                problems.add("Runner '" + name + "': " + error);
                return;
            }
            runners.put(name, new RunnerSpec(name, entry.command(),
                    defaults.runnerNoop() ? NOOP_BACKEND : backend));
        });
        return runners;
    }

    private Task buildTask(RunConfig.TaskEntry entry, Map<String, RunnerSpec> runners,
                           TaskDefaults defaults, List<String> problems) {
        String id = entry.id();
        String prefix = "Task '" + id + "': ";
        int before = problems.size();

        Phase phase = Phase.MAIN;
        if (entry.phase() != null) {
            phase = Phase.fromWire(entry.phase()).orElse(null);
            if (phase == null) {
                problems.add(prefix + "invalid phase '" + entry.phase() + "'");
                return null;
            }
        }
        var vars = Map.of("run_id", defaults.runId(), "phase", phase.wireName(), "task", id);

        Path workspace = null;
        if (entry.workspacePath() == null || entry.workspacePath().isBlank()) {
            problems.add(prefix + "missing required field 'workspace_path'");
        } else {
            String expanded = expandPath(entry.workspacePath(), "workspace_path", vars, prefix, problems);
            if (expanded != null) {
                workspace = defaults.projectRoot().resolve(expanded).normalize();
            }
        }

        String branch = expandPath(entry.branch() != null ? entry.branch() : DEFAULT_BRANCH,
                "branch", vars, prefix, problems);
        String baseRef = expandPath(entry.baseRef() != null ? entry.baseRef() : defaults.baseRef(),
                "base_ref", vars, prefix, problems);

        Path logPath = defaults.logsDir().resolve(id + ".log");
        if (entry.log() != null) {
            String expanded = expandPath(entry.log(), "log", vars, prefix, problems);
            if (expanded != null) {
                logPath = defaults.projectRoot().resolve(expanded).normalize();
            }
        }

        RunnerSpec runner = resolveTaskRunner(entry, runners, defaults, prefix, problems);
        Path prompt = entry.prompt() == null ? null : defaults.projectRoot().resolve(entry.prompt()).normalize();
        if (runner != null && prompt == null
                && TemplateExpander.placeholders(runner.command()).contains("prompt")) {
            problems.add(prefix + "missing required field 'prompt' (command uses {prompt})");
        }

        Set<String> dependsOn = new LinkedHashSet<>();
        if (entry.dependsOn() != null) {
            for (String dep : entry.dependsOn()) {
                if (dep == null || dep.isBlank()) {
                    problems.add(prefix + "empty entry in 'depends_on'");
                } else {
                    dependsOn.add(dep);
                }
            }
        }

        WatchdogSettings watchdog = watchdogSettings(entry.watchdog(), defaults, prefix, problems);
        EscalationSettings escalation = escalationSettings(entry.escalation(), runners, defaults, prefix, problems);

        if (problems.size() > before) {
            return null;
        }
        return new Task(id, phase, branch, workspace, baseRef, runner, prompt, logPath,
                dependsOn, Boolean.TRUE.equals(entry.manual()), watchdog, escalation);
    }

    private RunnerSpec resolveTaskRunner(RunConfig.TaskEntry entry, Map<String, RunnerSpec> runners,
                                         TaskDefaults defaults, String prefix, List<String> problems) {
        boolean hasCommand = entry.command() != null && !entry.command().isBlank();
        boolean hasRunner = entry.runner() != null && !entry.runner().isBlank();
        if (hasCommand && hasRunner) {
            problems.add(prefix + "set either 'command' or 'runner', not both");
            return null;
        }
        if (hasRunner) {
            RunnerSpec runner = runners.get(entry.runner());
            if (runner == null) {
                problems.add(prefix + "runner '" + entry.runner() + "' not found in config");
            }
            return runner;
        }
        if (hasCommand) {
            String error = TemplateExpander.validate(entry.command(), TemplateExpander.COMMAND_KEYS);
            if (error != null) {
                problems.add(prefix + error);
                return null;
            }
            return new RunnerSpec("inline:" + entry.id(), entry.command(),
                    defaults.runnerNoop() ? NOOP_BACKEND : SHELL_BACKEND);
        }
        problems.add(prefix + "missing required field 'command' or 'runner'");
        return null;
    }

    private WatchdogSettings watchdogSettings(RunConfig.WatchdogEntry entry, TaskDefaults defaults,
                                              String prefix, List<String> problems) {
        WatchdogSettings base = defaults.watchdog();
        Duration interval = base.checkInterval();
        Duration threshold = base.stuckThreshold();
        Set<Indicator> indicators = base.indicators();
        long minBytes = base.logGrowthMinBytes();

        if (entry != null) {
            interval = duration(entry.checkInterval(), "watchdog.check_interval", interval, prefix, problems);
            threshold = duration(entry.stuckThreshold(), "watchdog.stuck_threshold", threshold, prefix, problems);
            if (entry.indicators() != null) {
                var parsed = EnumSet.noneOf(Indicator.class);
                for (String name : entry.indicators()) {
                    Indicator.fromWire(name).ifPresentOrElse(parsed::add,
                            () -> problems.add(prefix + "unknown watchdog indicator '" + name + "'"));
                }
                if (entry.indicators().isEmpty()) {
                    problems.add(prefix + "watchdog.indicators must not be empty");
                }
                indicators = parsed;
            }
            if (entry.logGrowthMinBytes() != null) {
                if (entry.logGrowthMinBytes() < 0) {
                    problems.add(prefix + "watchdog.log_growth_min_bytes must not be negative");
                } else {
                    minBytes = entry.logGrowthMinBytes();
                }
            }
        }
        if (defaults.intervalOverride() != null && !defaults.intervalOverride().isZero()) {
            interval = defaults.intervalOverride();
        }
        if (interval == null || interval.isZero()) {
            problems.add(prefix + "watchdog.check_interval must be positive");
            return null;
        }
        if (threshold == null || threshold.isZero()) {
            problems.add(prefix + "watchdog.stuck_threshold must be positive");
            return null;
        }
        return new WatchdogSettings(interval, threshold, indicators, minBytes);
    }

    private EscalationSettings escalationSettings(RunConfig.EscalationEntry entry, Map<String, RunnerSpec> runners,
                                                  TaskDefaults defaults, String prefix, List<String> problems) {
        EscalationSettings base = defaults.escalation();
        if (entry == null) {
            return base;
        }
        List<EscalationStrategy> strategies = base.strategies();
        if (entry.strategies() != null) {
            var parsed = new ArrayList<EscalationStrategy>();
            for (String name : entry.strategies()) {
                EscalationStrategy.fromWire(name).ifPresentOrElse(parsed::add,
                        () -> problems.add(prefix + "unknown escalation strategy '" + name + "'"));
            }
            strategies = parsed;
        }
        int maxRetries = base.maxRetries();
        if (entry.maxRetries() != null) {
            if (entry.maxRetries() < 0) {
                problems.add(prefix + "escalation.max_retries must not be negative");
            } else {
                maxRetries = entry.maxRetries();
            }
        }
        Duration notifyGrace = duration(entry.notifyGrace(), "escalation.notify_grace",
                base.notifyGrace(), prefix, problems);
        Duration interruptGrace = duration(entry.interruptGrace(), "escalation.interrupt_grace",
                base.interruptGrace(), prefix, problems);

        String alternate = entry.alternateRunner();
        if (alternate != null && !runners.containsKey(alternate)) {
            problems.add(prefix + "alternate runner '" + alternate + "' not found in config");
        }
        if (strategies.contains(EscalationStrategy.SWITCH_AGENT) && alternate == null) {
            problems.add(prefix + "strategy switch_agent requires escalation.alternate_runner");
        }
        Path simplified = entry.simplifiedPrompt() == null ? null
                : defaults.projectRoot().resolve(entry.simplifiedPrompt()).normalize();
        if (strategies.contains(EscalationStrategy.SIMPLIFY_SCOPE) && simplified == null) {
            problems.add(prefix + "strategy simplify_scope requires escalation.simplified_prompt");
        }
        return new EscalationSettings(strategies, maxRetries, notifyGrace, interruptGrace, alternate, simplified);
    }

    private Duration duration(String value, String field, Duration fallback, String prefix, List<String> problems) {
        try {
            Duration parsed = RunConfigLoader.parseDuration(value, field);
            return parsed != null ? parsed : fallback;
        } catch (ConfigException e) {
            problems.add(prefix + e.getMessage());
            return fallback;
        }
    }

    private String expandPath(String template, String field, Map<String, String> vars,
                              String prefix, List<String> problems) {
        String error = TemplateExpander.validate(template, TemplateExpander.PATH_KEYS);
        if (error != null) {
            problems.add(prefix + field + ": " + error);
            return null;
        }
        return TemplateExpander.expand(template, vars);
    }

    // Depth-first search with an explicit recursion stack; reports the first cycle found
    private void detectCycle(List<Task> tasks) {
        var byId = new HashMap<String, Task>();
        for (Task task : tasks) {
            byId.put(task.id(), task);
        }
        var done = new HashSet<String>();
        var onStack = new LinkedHashSet<String>();
        for (Task task : tasks) {
            visit(task.id(), byId, done, onStack);
        }
    }

    private void visit(String id, Map<String, Task> byId, Set<String> done, LinkedHashSet<String> onStack) {
        if (done.contains(id)) {
            return;
        }
        if (onStack.contains(id)) {
            var cycle = new ArrayList<String>();
            boolean inCycle = false;
            for (String node : onStack) {
                if (node.equals(id)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(node);
                }
            }
            cycle.add(id);
            throw new DependencyCycleException(cycle);
        }
        onStack.add(id);
        for (String dep : byId.get(id).dependsOn()) {
            visit(dep, byId, done, onStack);
        }
        onStack.remove(id);
        done.add(id);
    }
}
