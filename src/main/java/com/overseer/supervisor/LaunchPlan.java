package com.overseer.supervisor;

import com.overseer.core.model.RunnerSpec;

import java.nio.file.Path;

/**
 * What to launch for one attempt of a task. Escalation swaps the runner (switch_agent) or the
 * prompt (simplify_scope) between attempts.
 *
 * @param runner   runner whose command template is launched
 * @param prompt   prompt reference for {@code {prompt}}, may be null
 * @param handoff  handoff artifact for {@code {handoff}}, may be null
 * @param attempt  1-based attempt number
 */
public record LaunchPlan(RunnerSpec runner, Path prompt, Path handoff, int attempt) {

    public LaunchPlan next() {
        return new LaunchPlan(runner, prompt, handoff, attempt + 1);
    }

    public LaunchPlan withRunner(RunnerSpec newRunner, Path newHandoff) {
        return new LaunchPlan(newRunner, prompt, newHandoff, attempt + 1);
    }

    public LaunchPlan withPrompt(Path newPrompt) {
        return new LaunchPlan(runner, newPrompt, handoff, attempt + 1);
    }
}
