package com.overseer.core.model;

/**
 * Exit status of a finished worker process.
 */
public record ExitStatus(int code) {
    public boolean success() {
        return code == 0;
    }
}
