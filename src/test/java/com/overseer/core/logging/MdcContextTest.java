package com.overseer.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId and phase in MDC")
    void setRun() {
        MdcContext.setRun("20260301T100000-01", "main");
        assertEquals("20260301T100000-01", MDC.get("runId"));
        assertEquals("main", MDC.get("phase"));
    }

    @Test
    @DisplayName("setTask puts runId and taskId in MDC")
    void setTask() {
        MdcContext.setTask("20260301T100000-01", "schema");
        assertEquals("20260301T100000-01", MDC.get("runId"));
        assertEquals("schema", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clearTask keeps the run keys")
    void clearTask() {
        MdcContext.setRun("20260301T100000-01", "main");
        MdcContext.setTask("20260301T100000-01", "schema");
        MdcContext.clearTask();
        assertNull(MDC.get("taskId"));
        assertEquals("main", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes all overseer MDC keys")
    void clear() {
        MdcContext.setRun("20260301T100000-01", "main");
        MdcContext.setTask("20260301T100000-01", "schema");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("phase"));
        assertNull(MDC.get("taskId"));
    }
}
