package com.overseer.core.model;

/**
 * How the owning task ended when its workspace is released.
 */
public enum ReleaseOutcome {
    SUCCESS,
    FAILURE,
    RESTART
}
