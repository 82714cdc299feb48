package com.overseer.core.config;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {name}} placeholders in path and command templates.
 *
 * <p>Placeholders are lower-case identifiers in braces. A brace preceded by {@code $} is left
 * alone so shell parameter expansions such as {@code ${HOME}} survive in commands.
 */
public final class TemplateExpander {

    public static final Set<String> PATH_KEYS = Set.of("run_id", "phase", "task");

    public static final Set<String> COMMAND_KEYS =
            Set.of("prompt", "handoff", "task", "workspace", "branch", "run_id", "phase");

    private static final Pattern PLACEHOLDER = Pattern.compile("(?<!\\$)\\{([a-z_]+)}");

    private TemplateExpander() {}

    /** Returns the placeholder names used by a template, in order of first appearance. */
    public static Set<String> placeholders(String template) {
        var names = new LinkedHashSet<String>();
        if (template == null) {
            return names;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Checks that a template uses only allowed placeholders.
     *
     * @return a description of the first unknown placeholder, or null when the template is valid
     */
    public static String validate(String template, Set<String> allowedKeys) {
        for (String name : placeholders(template)) {
            if (!allowedKeys.contains(name)) {
                return "unknown placeholder {" + name + "} in '" + template + "'";
            }
        }
        return null;
    }

    /**
     * Substitutes every placeholder with its value.
     *
     * @throws ConfigException when a placeholder has no value
     */
    public static String expand(String template, Map<String, String> values) {
        if (template == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                throw new ConfigException("No value for placeholder {" + name + "} in '" + template + "'");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
