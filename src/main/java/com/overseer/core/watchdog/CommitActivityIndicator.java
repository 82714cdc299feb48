package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;
import com.overseer.workspace.GitWorkspaceManager;

import java.util.Objects;

/**
 * Signals when the task branch has a commit it did not have at the previous sample.
 */
public class CommitActivityIndicator implements ProgressIndicator {

    private final GitWorkspaceManager git;
    private String lastSeenCommit;
    private boolean primed;

    public CommitActivityIndicator(GitWorkspaceManager git) {
        this.git = git;
    }

    @Override
    public Indicator kind() {
        return Indicator.COMMITS;
    }

    @Override
    public IndicatorReading sample(SampleContext context) {
        String head = git.resolveCommit(context.workspace(), context.branch());
        if (!primed) {
            primed = true;
            lastSeenCommit = head;
            boolean fresh = git.lastCommitTime(context.workspace(), context.branch())
                    .map(t -> t.getEpochSecond() >= context.windowStart().getEpochSecond())
                    .orElse(false);
            return fresh ? IndicatorReading.signal("new commit " + abbreviate(head))
                    : IndicatorReading.quiet("no new commits");
        }
        if (head != null && !Objects.equals(head, lastSeenCommit)) {
            lastSeenCommit = head;
            return IndicatorReading.signal("new commit " + abbreviate(head));
        }
        return IndicatorReading.quiet("no new commits");
    }

    private static String abbreviate(String sha) {
        return sha == null || sha.length() <= 10 ? String.valueOf(sha) : sha.substring(0, 10);
    }
}
