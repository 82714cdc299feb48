package com.overseer.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateExpanderTest {

    @Test
    @DisplayName("Expands every placeholder")
    void expands() {
        String out = TemplateExpander.expand("wt/{phase}/{task}-{run_id}",
                Map.of("phase", "main", "task", "api", "run_id", "R1"));
        assertEquals("wt/main/api-R1", out);
    }

    @Test
    @DisplayName("Shell parameter expansions are left alone")
    void keepsShellExpansions() {
        String out = TemplateExpander.expand("cd ${HOME} && run {task}", Map.of("task", "api"));
        assertEquals("cd ${HOME} && run api", out);
        assertEquals(List.of("task"), List.copyOf(TemplateExpander.placeholders("cd ${HOME} && run {task}")));
    }

    @Test
    @DisplayName("Replacement values containing $ and backslashes are inserted literally")
    void literalValues() {
        assertEquals("echo $1\\x", TemplateExpander.expand("echo {prompt}", Map.of("prompt", "$1\\x")));
    }

    @Test
    @DisplayName("validate names the first unknown placeholder")
    void validate() {
        assertNull(TemplateExpander.validate("claude -p {prompt}", TemplateExpander.COMMAND_KEYS));
        String error = TemplateExpander.validate("wt/{workspace}", TemplateExpander.PATH_KEYS);
        assertNotNull(error);
        assertTrue(error.contains("{workspace}"));
    }

    @Test
    @DisplayName("A placeholder without a value is a ConfigException")
    void missingValue() {
        assertThrows(ConfigException.class, () -> TemplateExpander.expand("{task}", Map.of()));
    }
}
