package com.flowcode.core.logging;

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
    @DisplayName("setTask puts taskId in MDC")
    void setTask() {
        MdcContext.setTask("FLOW-0001-0001");
        assertEquals("FLOW-0001-0001", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setStep puts taskId, stepId, and actionType in MDC")
    void setStep() {
        MdcContext.setStep("FLOW-0001-0001", "STEP-002", "edit_file");
        assertEquals("FLOW-0001-0001", MDC.get("taskId"));
        assertEquals("STEP-002", MDC.get("stepId"));
        assertEquals("edit_file", MDC.get("actionType"));
    }

    @Test
    @DisplayName("clearStep keeps the task")
    void clearStep() {
        MdcContext.setStep("FLOW-0001-0001", "STEP-002", "edit_file");
        MdcContext.clearStep();
        assertEquals("FLOW-0001-0001", MDC.get("taskId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("actionType"));
    }

    @Test
    @DisplayName("clear removes all flowcode MDC keys")
    void clear() {
        MdcContext.setStep("FLOW-0001-0001", "STEP-002", "edit_file");
        MdcContext.clear();
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("actionType"));
    }
}
