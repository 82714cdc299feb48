package com.overseer.core.escalation;

import com.overseer.core.OverseerException;
import com.overseer.core.model.EscalationRecord;
import com.overseer.core.model.Task;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.core.watchdog.LogTail;
import com.overseer.workspace.GitCommandException;
import com.overseer.workspace.GitWorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Writes the handoff artifact consumed by an alternate runner after {@code switch_agent}:
 * commits made so far, the last known blocker from the log tail, changed files and the
 * workspace diff.
 */
public class HandoffWriter {

    private static final Logger log = LoggerFactory.getLogger(HandoffWriter.class);

    static final int MAX_DIFF_CHARS = 20_000;
    static final int TAIL_LINES = 60;
    private static final Pattern BLOCKER = Pattern.compile(
            "(?i)\\b(error|exception|failed|failure|fatal|cannot|unable|blocked|traceback|panic)\\b");

    private final Path handoffDir;
    private final GitWorkspaceManager git;
    private final Clock clock;

    public HandoffWriter(Path handoffDir, GitWorkspaceManager git, Clock clock) {
        this.handoffDir = handoffDir;
        this.git = git;
        this.clock = clock;
    }

    public Path pathFor(String taskId) {
        return handoffDir.resolve(taskId + ".md");
    }

    /**
     * Writes {@code <handoff dir>/<task>.md}, replacing an earlier artifact of the same task.
     *
     * @throws OverseerException when the file cannot be written
     */
    public Path write(Task task, WorkspaceAllocation allocation, List<EscalationRecord> history) {
        Path target = pathFor(task.id());
        String content = render(task, allocation, history);
        try {
            Files.createDirectories(handoffDir);
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OverseerException("Cannot write handoff " + target + ": " + e.getMessage(), e);
        }
        log.info("Wrote handoff for {} to {}", task.id(), target);
        return target;
    }

    String render(Task task, WorkspaceAllocation allocation, List<EscalationRecord> history) {
        var sb = new StringBuilder();
        sb.append("# Handoff: ").append(task.id()).append("\n\n");
        sb.append("- Branch: `").append(allocation.branch()).append("`\n");
        sb.append("- Workspace: `").append(allocation.path()).append("`\n");
        sb.append("- Base commit: `").append(allocation.baseCommit() == null ? "unknown" : allocation.baseCommit()).append("`\n");
        if (task.promptPath() != null) {
            sb.append("- Original prompt: `").append(task.promptPath()).append("`\n");
        }
        sb.append("- Written: ").append(clock.instant()).append("\n\n");

        sb.append("## Escalation history\n\n");
        if (history.isEmpty()) {
            sb.append("_none_\n");
        }
        for (EscalationRecord record : history) {
            sb.append("- ").append(record.appliedAt()).append(' ')
                    .append(record.strategy().wireName()).append(" #").append(record.attemptCount())
                    .append(": ").append(record.outcome().name().toLowerCase(Locale.ROOT)).append('\n');
        }

        List<String> tail = LogTail.lastLines(task.logPath(), TAIL_LINES);
        sb.append("\n## Last known blocker\n\n");
        String blocker = lastBlocker(tail);
        sb.append(blocker == null ? "_none found in the log tail_\n" : "```\n" + blocker + "\n```\n");

        sb.append("\n## Commits so far\n\n");
        sb.append(fenced(gitText(() -> allocation.baseCommit() == null ? ""
                : git.commitLog(allocation.path(), allocation.baseCommit()))));

        sb.append("\n## Changed files\n\n");
        List<GitWorkspaceManager.FileChange> changes = gitList(allocation);
        if (changes.isEmpty()) {
            sb.append("_none_\n");
        }
        for (GitWorkspaceManager.FileChange change : changes) {
            sb.append("- ").append(change.action()).append(' ').append(change.path())
                    .append(" (").append(change.linesChanged()).append(" lines)\n");
        }

        sb.append("\n## Uncommitted changes\n\n");
        sb.append(fenced(gitText(() -> git.statusPorcelain(allocation.path()))));

        sb.append("\n## Diff\n\n");
        String diff = gitText(() -> allocation.baseCommit() == null ? ""
                : git.diff(allocation.path(), allocation.baseCommit()));
        if (diff.length() > MAX_DIFF_CHARS) {
            diff = diff.substring(0, MAX_DIFF_CHARS) + "\n... (diff truncated)";
        }
        sb.append("```diff\n").append(diff).append(diff.endsWith("\n") || diff.isEmpty() ? "" : "\n").append("```\n");

        sb.append("\n## Log tail\n\n").append(fenced(String.join("\n", tail)));
        return sb.toString();
    }

    /** Last line of the tail that looks like an error, or null. */
    static String lastBlocker(List<String> tail) {
        for (int i = tail.size() - 1; i >= 0; i--) {
            if (BLOCKER.matcher(tail.get(i)).find()) {
                return tail.get(i).strip();
            }
        }
        return null;
    }

    private List<GitWorkspaceManager.FileChange> gitList(WorkspaceAllocation allocation) {
        if (allocation.baseCommit() == null) {
            return List.of();
        }
        try {
            return git.diffStat(allocation.path(), allocation.baseCommit());
        } catch (GitCommandException e) {
            log.warn("diff --stat failed for {}: {}", allocation.path(), e.getMessage());
            return List.of();
        }
    }

    private static String gitText(Supplier<String> source) {
        try {
            String text = source.get();
            return text == null ? "" : text.strip();
        } catch (GitCommandException e) {
            log.warn("git query for handoff failed: {}", e.getMessage());
            return "(unavailable: " + e.getMessage() + ")";
        }
    }

    private static String fenced(String text) {
        if (text.isBlank()) {
            return "_none_\n";
        }
        return "```\n" + text + "\n```\n";
    }
}
