package com.overseer.core.model;

/**
 * A named worker invocation.
 *
 * @param name     runner name referenced by tasks
 * @param command  command template, usually containing {@code {prompt}}
 * @param backend  worker backend that launches the command ("shell", "noop")
 */
public record RunnerSpec(String name, String command, String backend) {
}
