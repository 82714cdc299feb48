package com.overseer.core.model;

/**
 * Why a task ended in {@link TaskStatus#FAILED} or {@link TaskStatus#BLOCKED}.
 */
public enum FailureReason {
    PROCESS_EXIT,
    LAUNCH_FAILED,
    WORKSPACE_CONFLICT,
    ESCALATION_EXHAUSTED,
    DEPENDENCY_FAILED,
    DEPENDENCY_EXCLUDED,
    RUN_ABORTED
}
