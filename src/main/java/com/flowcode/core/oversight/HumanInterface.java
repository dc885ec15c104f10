package com.flowcode.core.oversight;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ApprovalRequest;
import com.flowcode.core.model.ApprovalResponse;
import com.flowcode.core.model.HumanIntervention;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.UserFeedback;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Callbacks through which the core reaches a human. Implementations render however
 * they like; the core only relies on the shapes below.
 */
public interface HumanInterface {

    /**
     * Presents a pending approval. The returned stage completes when the human decides;
     * it may also never complete, in which case the gate's timeout applies.
     */
    CompletionStage<ApprovalResponse> onApprovalRequested(ApprovalRequest request);

    void onProgressChanged(String taskId, TaskProgress progress);

    /**
     * Polled between steps for out-of-band control signals.
     */
    Optional<HumanIntervention> onInterventionAvailable(String taskId);

    Optional<UserFeedback> onFeedbackRequested(AgenticTask task);

    EscalationDecision onEscalation(EscalationRequest request);
}
