package com.overseer.core.watchdog;

import java.nio.file.Path;
import java.time.Instant;

/**
 * What an indicator may look at for one sample of one task.
 *
 * @param taskId      task being sampled
 * @param workspace   the task's worktree
 * @param branch      the task's branch
 * @param logPath     the task's log
 * @param windowStart end of the previous sample; activity after this instant counts
 * @param now         time of this sample
 */
public record SampleContext(
    String taskId,
    Path workspace,
    String branch,
    Path logPath,
    Instant windowStart,
    Instant now
) {}
