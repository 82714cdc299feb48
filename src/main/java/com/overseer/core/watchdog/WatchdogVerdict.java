package com.overseer.core.watchdog;

import com.overseer.core.model.Liveness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Classification of one sample.
 *
 * @param taskId        sampled task
 * @param attempt       launch attempt the sample belongs to
 * @param liveness      active, uncertain or stuck
 * @param at            sample time
 * @param sinceProgress time since the last progress signal
 * @param signals       details of the indicators that signaled
 * @param newlyStuck    this sample started a stuck episode
 * @param recovered     this sample ended a stuck episode
 */
public record WatchdogVerdict(
    String taskId,
    int attempt,
    Liveness liveness,
    Instant at,
    Duration sinceProgress,
    List<String> signals,
    boolean newlyStuck,
    boolean recovered
) {}
