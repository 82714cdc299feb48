package com.overseer.core.engine;

import com.overseer.core.model.FailureReason;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.core.watchdog.WatchdogVerdict;
import com.overseer.supervisor.LaunchPlan;
import com.overseer.supervisor.RunningProcess;

/**
 * Messages posted to the coordinating loop's inbox by worker-pool jobs and monitoring tasks.
 */
interface ConductorSignal {

    String taskId();

    /** A worker was started in a freshly allocated workspace. */
    record Launched(String taskId, LaunchPlan plan, WorkspaceAllocation allocation,
                    RunningProcess process) implements ConductorSignal {}

    /** Allocation or spawn failed; {@code relaunch} is true for escalation restarts. */
    record LaunchFailed(String taskId, LaunchPlan plan, FailureReason reason, String detail,
                        boolean relaunch) implements ConductorSignal {}

    /** The watchdog sampled a running task. */
    record Verdict(WatchdogVerdict verdict) implements ConductorSignal {
        @Override
        public String taskId() {
            return verdict.taskId();
        }
    }

    /** A finished task's worker is gone and its workspace released; the status can be recorded. */
    record Released(String taskId, TaskStatus status, FailureReason reason, String detail,
                    Integer exitCode) implements ConductorSignal {}
}
