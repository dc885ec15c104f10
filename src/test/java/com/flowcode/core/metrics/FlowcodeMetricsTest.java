package com.flowcode.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlowcodeMetricsTest {

    private SimpleMeterRegistry registry;
    private FlowcodeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FlowcodeMetrics(registry);
    }

    @Test
    @DisplayName("recordPlanningDuration creates a timer")
    void recordPlanningDuration() {
        metrics.recordPlanningDuration(15);
        var timer = registry.find("flowcode.planning.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordStepExecution tags by action and outcome")
    void recordStepExecution() {
        metrics.recordStepExecution("edit_file", true, 20);
        metrics.recordStepExecution("edit_file", false, 30);
        metrics.recordStepExecution("run_tests", true, 900);

        assertEquals(1, registry.find("flowcode.step.duration")
                .tag("action", "edit_file").tag("success", "true").timer().count());
        assertEquals(1, registry.find("flowcode.step.duration")
                .tag("action", "edit_file").tag("success", "false").timer().count());
        assertEquals(1, registry.find("flowcode.step.duration")
                .tag("action", "run_tests").timer().count());
    }

    @Test
    @DisplayName("recordValidationResult increments correct counter")
    void recordValidationResult() {
        metrics.recordValidationResult("security.secret_scan", true);
        metrics.recordValidationResult("security.secret_scan", true);
        metrics.recordValidationResult("security.secret_scan", false);

        var passed = registry.find("flowcode.validation.evaluations").tag("result", "passed").counter();
        var failed = registry.find("flowcode.validation.evaluations").tag("result", "failed").counter();

        assertNotNull(passed);
        assertNotNull(failed);
        assertEquals(2.0, passed.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordTaskResult increments by status tag")
    void recordTaskResult() {
        metrics.recordTaskResult("completed");
        metrics.recordTaskResult("completed");
        metrics.recordTaskResult("failed");

        assertEquals(2.0, registry.find("flowcode.tasks.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("flowcode.tasks.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordTaskSteps feeds a distribution summary")
    void recordTaskSteps() {
        metrics.recordTaskSteps(3);
        metrics.recordTaskSteps(5);

        var summary = registry.find("flowcode.task.steps").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(8.0, summary.totalAmount());
    }

    @Test
    @DisplayName("escalations, rollbacks, approvals and retries are counted")
    void recoveryCounters() {
        metrics.incrementEscalations("provider_timeout");
        metrics.recordRollback("create_file", "validation");
        metrics.recordApprovalDecision(false, false);
        metrics.recordRetry("provider_unavailable");
        metrics.recordRetry("provider_unavailable");

        assertEquals(1.0, registry.find("flowcode.escalations.total")
                .tag("reason", "provider_timeout").counter().count());
        assertEquals(1.0, registry.find("flowcode.rollbacks.total")
                .tag("action", "create_file").tag("cause", "validation").counter().count());
        assertEquals(1.0, registry.find("flowcode.approvals.total")
                .tag("decision", "rejected").tag("automatic", "false").counter().count());
        assertEquals(2.0, registry.find("flowcode.retries.total")
                .tag("kind", "provider_unavailable").counter().count());
    }
}
