package com.overseer.dispatch.cli;

/**
 * Process exit codes of the {@code overseer} command.
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** A task failed or was blocked, or the run was aborted. */
    public static final int TASKS_FAILED = 1;
    /** Command-line usage error, same as picocli's default. */
    public static final int USAGE = 2;
    /** Invalid configuration, failed pre-flight check or dependency cycle. */
    public static final int PREFLIGHT = 3;
    /** A privileged phase lock is held by another run. */
    public static final int LOCK_HELD = 4;

    private ExitCodes() {
    }
}
