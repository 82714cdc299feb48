package com.overseer.supervisor;

/**
 * How hard a worker is asked to stop.
 */
public enum SignalTier {
    /** SIGINT: ask the worker to wrap up; it may keep running. */
    COOPERATIVE,
    /** SIGTERM. */
    GRACEFUL,
    /** SIGKILL. */
    FORCEFUL
}
