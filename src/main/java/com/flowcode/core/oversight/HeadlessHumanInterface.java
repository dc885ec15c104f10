package com.flowcode.core.oversight;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ApprovalRequest;
import com.flowcode.core.model.ApprovalResponse;
import com.flowcode.core.model.HumanIntervention;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.UserFeedback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Used when nobody is at the keyboard: approvals are rejected, escalations abort,
 * and no feedback or interventions are ever produced. Enabled with
 * {@code flowcode.oversight.headless=true}, which takes precedence over the console.
 */
@Component
@Primary
@ConditionalOnProperty(prefix = "flowcode.oversight", name = "headless", havingValue = "true")
public class HeadlessHumanInterface implements HumanInterface {

    private static final Logger log = LoggerFactory.getLogger(HeadlessHumanInterface.class);

    @Override
    public CompletionStage<ApprovalResponse> onApprovalRequested(ApprovalRequest request) {
        log.warn("No interactive approver available, rejecting {} for step {}", request.id(), request.stepId());
        return CompletableFuture.completedFuture(ApprovalResponse.reject("No interactive approver available"));
    }

    @Override
    public void onProgressChanged(String taskId, TaskProgress progress) {
        log.debug("Task {} progress: {}/{} ({}%)", taskId, progress.completedSteps(),
                progress.totalSteps(), progress.percentComplete());
    }

    @Override
    public Optional<HumanIntervention> onInterventionAvailable(String taskId) {
        return Optional.empty();
    }

    @Override
    public Optional<UserFeedback> onFeedbackRequested(AgenticTask task) {
        return Optional.empty();
    }

    @Override
    public EscalationDecision onEscalation(EscalationRequest request) {
        log.warn("Escalation for step {} ({}) aborts the task: {}", request.stepId(), request.kind(), request.message());
        return EscalationDecision.ABORT;
    }
}
