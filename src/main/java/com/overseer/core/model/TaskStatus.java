package com.overseer.core.model;

/**
 * Status of a task within one orchestration run.
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == BLOCKED;
    }
}
