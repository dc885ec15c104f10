package com.flowcode.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for FlowCode task execution.
 */
@Service
public class FlowcodeMetrics {

    private final MeterRegistry registry;

    public FlowcodeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("flowcode.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepExecution(String actionType, boolean success, long ms) {
        Timer.builder("flowcode.step.duration")
                .tag("action", actionType)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordValidationResult(String validator, boolean passed) {
        Counter.builder("flowcode.validation.evaluations")
                .tag("validator", validator)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordTaskResult(String status) {
        Counter.builder("flowcode.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskSteps(int stepCount) {
        DistributionSummary.builder("flowcode.task.steps")
                .register(registry)
                .record(stepCount);
    }

    public void incrementEscalations(String reason) {
        Counter.builder("flowcode.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a step whose file changes were reverted from their backups.
     *
     * @param actionType the action that was rolled back
     * @param cause      "validation", "timeout" or "error"
     */
    public void recordRollback(String actionType, String cause) {
        Counter.builder("flowcode.rollbacks.total")
                .description("Steps reverted from pre-action backups")
                .tag("action", actionType)
                .tag("cause", cause)
                .register(registry)
                .increment();
    }

    public void recordApprovalDecision(boolean approved, boolean automatic) {
        Counter.builder("flowcode.approvals.total")
                .tag("decision", approved ? "approved" : "rejected")
                .tag("automatic", String.valueOf(automatic))
                .register(registry)
                .increment();
    }

    public void recordRetry(String failureKind) {
        Counter.builder("flowcode.retries.total")
                .description("Step or provider retries after transient failures")
                .tag("kind", failureKind)
                .register(registry)
                .increment();
    }
}
