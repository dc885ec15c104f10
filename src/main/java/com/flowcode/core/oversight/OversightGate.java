package com.flowcode.core.oversight;

import com.flowcode.core.events.EventBus;
import com.flowcode.core.events.FlowcodeEvent;
import com.flowcode.core.execution.StepFailure;
import com.flowcode.core.metrics.FlowcodeMetrics;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ApprovalRequest;
import com.flowcode.core.model.ApprovalResponse;
import com.flowcode.core.model.ApprovalStatus;
import com.flowcode.core.model.HumanIntervention;
import com.flowcode.core.model.InterventionType;
import com.flowcode.core.model.RiskAssessment;
import com.flowcode.core.model.TaskStep;
import com.flowcode.core.model.UserFeedback;
import com.flowcode.core.planning.RiskAssessor;
import com.flowcode.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Mediates every human touch point: approvals, progress display, interventions,
 * escalations and feedback.
 * <p>
 * Approval requests are tracked as futures keyed by request id. The orchestrator
 * blocks on {@link #awaitDecision} while the human interface, or any other caller of
 * {@link #resolveApproval}, completes the future.
 */
@Service
public class OversightGate {

    private static final Logger log = LoggerFactory.getLogger(OversightGate.class);

    private final HumanInterface humanInterface;
    private final ApprovalPolicy approvalPolicy;
    private final RiskAssessor riskAssessor;
    private final RemediationAdvisor remediationAdvisor;
    private final StateStore stateStore;
    private final EventBus eventBus;
    private final FlowcodeMetrics metrics;

    private final ConcurrentHashMap<String, PendingApproval> pending = new ConcurrentHashMap<>();

    public OversightGate(HumanInterface humanInterface,
                         ApprovalPolicy approvalPolicy,
                         RiskAssessor riskAssessor,
                         RemediationAdvisor remediationAdvisor,
                         StateStore stateStore,
                         EventBus eventBus,
                         @Autowired(required = false) FlowcodeMetrics metrics) {
        this.humanInterface = humanInterface;
        this.approvalPolicy = approvalPolicy;
        this.riskAssessor = riskAssessor;
        this.remediationAdvisor = remediationAdvisor;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    // --- approvals ---

    /**
     * Creates an approval request for the step's action. When the user's preferences
     * allow it the request comes back already approved; otherwise it is pending and
     * has been handed to the human interface.
     */
    public ApprovalRequest requestApproval(AgenticTask task, TaskStep step) {
        AgentAction action = step.action();
        RiskAssessment risk = riskAssessor.assessAction(action);
        var request = new ApprovalRequest(
                "APR-" + UUID.randomUUID().toString().substring(0, 8),
                task.id(), step.id(), action,
                reasonFor(action, risk), risk, riskAssessor.alternativesFor(action),
                ApprovalStatus.PENDING, null, Instant.now());

        if (approvalPolicy.canAutoApprove(action, stateStore.getUserPreferences())) {
            log.info("Auto-approved {} for step {} (risk {})", action.type().label(), step.id(), risk.level());
            recordDecision(true, true);
            var resolved = request.resolve(ApprovalResponse.approve("Auto-approved by preference"));
            publish("approval.resolved", resolved, Map.of("approved", true, "automatic", true));
            return resolved;
        }

        var future = new CompletableFuture<ApprovalResponse>();
        pending.put(request.id(), new PendingApproval(task.id(), future));
        publish("approval.requested", request, Map.of(
                "actionType", action.type().label(),
                "risk", risk.level().name(),
                "reason", request.reason()));
        log.info("Approval {} requested for step {} ({}, risk {})", request.id(), step.id(),
                action.type().label(), risk.level());

        try {
            humanInterface.onApprovalRequested(request).whenComplete((response, error) -> {
                if (error != null) {
                    resolveApproval(request.id(), ApprovalResponse.reject("Approval failed: " + error.getMessage()));
                } else if (response != null) {
                    resolveApproval(request.id(), response);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Human interface failed to present approval {}: {}", request.id(), e.getMessage(), e);
            resolveApproval(request.id(), ApprovalResponse.reject("Approval could not be presented"));
        }
        return request;
    }

    /**
     * Blocks until the request is resolved or {@code timeout} elapses. A timeout,
     * an interrupt or a failed decision all resolve the request as rejected.
     */
    public ApprovalRequest awaitDecision(ApprovalRequest request, Duration timeout) {
        if (request.status() != ApprovalStatus.PENDING) {
            return request;
        }
        PendingApproval entry = pending.get(request.id());
        if (entry == null) {
            return request.resolve(ApprovalResponse.reject("Approval request is no longer pending"));
        }
        ApprovalResponse response;
        try {
            response = entry.future().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Approval {} timed out after {}s", request.id(), timeout.toSeconds());
            response = ApprovalResponse.reject("Approval timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response = ApprovalResponse.reject("Interrupted while waiting for approval");
        } catch (ExecutionException e) {
            response = ApprovalResponse.reject("Approval failed: " + e.getCause().getMessage());
        } finally {
            pending.remove(request.id());
        }
        var resolved = request.resolve(response);
        recordDecision(response.approved(), false);
        publish("approval.resolved", resolved, Map.of("approved", response.approved(),
                "feedback", String.valueOf(response.feedback())));
        log.info("Approval {} {}: {}", request.id(), response.approved() ? "granted" : "rejected", response.feedback());
        return resolved;
    }

    /**
     * Completes a pending request. Returns false if it was unknown or already decided.
     */
    public boolean resolveApproval(String requestId, ApprovalResponse response) {
        PendingApproval entry = pending.get(requestId);
        if (entry == null) {
            return false;
        }
        return entry.future().complete(response);
    }

    /**
     * Rejects every pending request of the task, releasing a blocked orchestrator.
     */
    public void cancelPending(String taskId) {
        pending.forEach((id, entry) -> {
            if (entry.taskId().equals(taskId)) {
                entry.future().complete(ApprovalResponse.reject("Task cancelled"));
            }
        });
    }

    public boolean hasPendingApproval(String taskId) {
        return pending.values().stream().anyMatch(p -> p.taskId().equals(taskId));
    }

    // --- progress and interventions ---

    public void showProgress(AgenticTask task) {
        try {
            humanInterface.onProgressChanged(task.id(), task.progress());
        } catch (RuntimeException e) {
            log.warn("Progress display failed for task {}: {}", task.id(), e.getMessage());
        }
        var progress = task.progress();
        var payload = new HashMap<String, Object>();
        payload.put("totalSteps", progress.totalSteps());
        payload.put("completedSteps", progress.completedSteps());
        payload.put("failedSteps", progress.failedSteps());
        payload.put("skippedSteps", progress.skippedSteps());
        payload.put("percentComplete", progress.percentComplete());
        eventBus.publish(FlowcodeEvent.of("task.progress", task.id(), progress.currentStepId(), payload));
    }

    /**
     * Records an intervention against the task. Acting on it is up to the caller.
     */
    public HumanIntervention handleIntervention(AgenticTask task, InterventionType type, String reason,
                                                String instructions) {
        var intervention = new HumanIntervention(
                "INT-" + UUID.randomUUID().toString().substring(0, 8),
                task.id(), type, reason, instructions, Instant.now());
        var payload = new HashMap<String, Object>();
        payload.put("type", type.name());
        payload.put("reason", String.valueOf(reason));
        if (instructions != null) {
            payload.put("instructions", instructions);
        }
        eventBus.publish(FlowcodeEvent.of("intervention.received", task.id(), null, payload));
        log.info("Intervention {} on task {}: {}", type, task.id(), reason);
        return intervention;
    }

    /**
     * Asks the human interface whether an out-of-band signal is waiting.
     */
    public Optional<HumanIntervention> pollIntervention(String taskId) {
        try {
            return humanInterface.onInterventionAvailable(taskId);
        } catch (RuntimeException e) {
            log.warn("Intervention poll failed for task {}: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    // --- escalation and feedback ---

    /**
     * Presents a failure that automatic recovery could not fix and returns the human's
     * choice. Without a usable answer the task is aborted.
     */
    public EscalationDecision escalateIssue(AgenticTask task, TaskStep step, StepFailure failure) {
        var request = new EscalationRequest(task.id(), task.goal(), step.id(), step.action(), failure.kind(),
                failure.message(), step.attempts(), remediationAdvisor.urgencyOf(step.action(), failure),
                remediationAdvisor.suggest(step.action(), failure));
        if (metrics != null) {
            metrics.incrementEscalations(failure.kind().label());
        }
        var payload = new HashMap<String, Object>();
        payload.put("kind", failure.kind().label());
        payload.put("message", String.valueOf(failure.message()));
        payload.put("urgency", request.urgency());
        payload.put("suggestions", request.suggestions());
        eventBus.publish(FlowcodeEvent.of("step.escalated", task.id(), step.id(), payload));
        log.warn("Escalating step {} of task {} ({}): {}", step.id(), task.id(), failure.kind().label(),
                failure.message());

        EscalationDecision decision;
        try {
            decision = humanInterface.onEscalation(request);
        } catch (RuntimeException e) {
            log.warn("Escalation handler failed for step {}: {}", step.id(), e.getMessage(), e);
            decision = null;
        }
        if (decision == null) {
            decision = EscalationDecision.ABORT;
        }
        log.info("Escalation for step {} resolved as {}", step.id(), decision);
        return decision;
    }

    /**
     * Requests end-of-task feedback. Only terminal tasks are asked.
     */
    public Optional<UserFeedback> collectFeedback(AgenticTask task) {
        if (!task.status().isTerminal()) {
            return Optional.empty();
        }
        try {
            return humanInterface.onFeedbackRequested(task);
        } catch (RuntimeException e) {
            log.warn("Feedback collection failed for task {}: {}", task.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String reasonFor(AgentAction action, RiskAssessment risk) {
        if (action.requiresApproval()) {
            return "Action " + action.type().label() + " on " + action.target() + " is " +
                    risk.level().name().toLowerCase(Locale.ROOT) + " risk and needs explicit approval";
        }
        return "Action " + action.type().label() + " on " + action.target() + " flagged for review";
    }

    private void recordDecision(boolean approved, boolean automatic) {
        if (metrics != null) {
            metrics.recordApprovalDecision(approved, automatic);
        }
    }

    private void publish(String type, ApprovalRequest request, Map<String, Object> extra) {
        var payload = new HashMap<String, Object>(extra);
        payload.put("approvalId", request.id());
        eventBus.publish(FlowcodeEvent.of(type, request.taskId(), request.stepId(), payload));
    }

    private record PendingApproval(String taskId, CompletableFuture<ApprovalResponse> future) {}
}
