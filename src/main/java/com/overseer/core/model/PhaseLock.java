package com.overseer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Holder information stored in a phase lock file.
 */
public record PhaseLock(
    @JsonProperty("phase") String phase,
    @JsonProperty("run_id") String holderRunId,
    @JsonProperty("acquired_at") Instant acquiredAt
) {
}
