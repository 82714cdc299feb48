package com.overseer.core.config;

import com.overseer.core.OverseerException;

import java.util.List;

/**
 * Invalid run configuration: duplicate ids, dangling references, missing fields,
 * or a failed pre-flight check. Always raised before any task starts.
 */
public class ConfigException extends OverseerException {

    private final List<String> problems;

    public ConfigException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigException(String header, List<String> problems) {
        super(header + ":\n- " + String.join("\n- ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
