package com.overseer.core.model;

/**
 * Watchdog classification of a running task.
 */
public enum Liveness {
    ACTIVE,
    UNCERTAIN,
    STUCK
}
