package com.flowcode.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing FlowCode-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStep(String taskId, String stepId, String actionType) {
        MDC.put("taskId", taskId);
        MDC.put("stepId", stepId);
        MDC.put("actionType", actionType);
    }

    public static void clearStep() {
        MDC.remove("stepId");
        MDC.remove("actionType");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("stepId");
        MDC.remove("actionType");
    }
}
