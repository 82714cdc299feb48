package com.overseer.core.engine;

import com.overseer.core.model.FailureReason;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.supervisor.LaunchPlan;
import com.overseer.supervisor.RunningProcess;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one orchestration run. Owned by the coordinating loop; no other thread
 * reads or writes it.
 */
public class RunState {

    /**
     * Everything the loop tracks for one scheduled task.
     */
    public static final class TaskState {
        private final Task task;
        private TaskStatus status = TaskStatus.PENDING;
        private FailureReason reason;
        private String detail;
        private LaunchPlan plan;
        private WorkspaceAllocation allocation;
        private RunningProcess process;
        private boolean jobInFlight;
        private Instant startedAt;
        private Instant finishedAt;

        TaskState(Task task) {
            this.task = task;
        }

        public Task task() { return task; }
        public String id() { return task.id(); }
        public TaskStatus status() { return status; }
        public FailureReason reason() { return reason; }
        public String detail() { return detail; }
        public LaunchPlan plan() { return plan; }
        public WorkspaceAllocation allocation() { return allocation; }
        public RunningProcess process() { return process; }
        public boolean jobInFlight() { return jobInFlight; }
        public Instant startedAt() { return startedAt; }
        public Instant finishedAt() { return finishedAt; }

        void status(TaskStatus status) { this.status = status; }
        void plan(LaunchPlan plan) { this.plan = plan; }
        void allocation(WorkspaceAllocation allocation) { this.allocation = allocation; }
        void process(RunningProcess process) { this.process = process; }
        void jobInFlight(boolean jobInFlight) { this.jobInFlight = jobInFlight; }
        void startedAt(Instant startedAt) { this.startedAt = startedAt; }

        void finish(TaskStatus terminal, FailureReason why, String text, Instant at) {
            this.status = terminal;
            this.reason = why;
            this.detail = text;
            this.finishedAt = at;
            this.process = null;
            this.allocation = null;
            this.jobInFlight = false;
        }
    }

    private final String runId;
    private final Map<String, TaskState> tasks = new LinkedHashMap<>();

    public RunState(String runId, Collection<Task> scheduled) {
        this.runId = runId;
        for (Task task : scheduled) {
            tasks.put(task.id(), new TaskState(task));
        }
    }

    public String runId() {
        return runId;
    }

    public TaskState get(String taskId) {
        return tasks.get(taskId);
    }

    public Collection<TaskState> tasks() {
        return tasks.values();
    }

    public Map<String, TaskStatus> statuses() {
        var statuses = new LinkedHashMap<String, TaskStatus>();
        tasks.forEach((id, ts) -> statuses.put(id, ts.status));
        return statuses;
    }

    public List<TaskState> withStatus(TaskStatus status) {
        return tasks.values().stream().filter(ts -> ts.status == status).toList();
    }

    public long count(TaskStatus status) {
        return tasks.values().stream().filter(ts -> ts.status == status).count();
    }

    public long terminalCount() {
        return tasks.values().stream().filter(ts -> ts.status.isTerminal()).count();
    }

    public boolean allTerminal() {
        return tasks.values().stream().allMatch(ts -> ts.status.isTerminal());
    }

    public boolean hasJobsInFlight() {
        return tasks.values().stream().anyMatch(ts -> ts.jobInFlight);
    }

    public int size() {
        return tasks.size();
    }
}
