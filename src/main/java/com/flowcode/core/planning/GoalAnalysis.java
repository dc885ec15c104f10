package com.flowcode.core.planning;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentActionType;

import java.util.List;

/**
 * Structured reading of a free-form goal, produced by a {@link GoalDecomposer}.
 *
 * @param goal       the original goal text
 * @param scope      how much of the workspace the goal touches
 * @param categories strategy categories that matched (e.g., "create", "delete")
 * @param actions    intended actions in the order they were recognised
 * @param risks      risks identified from the wording
 */
public record GoalAnalysis(
    String goal,
    GoalScope scope,
    List<String> categories,
    List<PlannedAction> actions,
    List<String> risks
) {

    public GoalAnalysis {
        categories = List.copyOf(categories);
        actions = List.copyOf(actions);
        risks = List.copyOf(risks);
    }

    public boolean contains(AgentActionType type) {
        return actions.stream().anyMatch(a -> a.payload().type() == type);
    }

    /**
     * @param description human-readable summary
     * @param target      file path, glob root or command
     * @param payload     kind-specific arguments
     */
    public record PlannedAction(String description, String target, ActionPayload payload) {}
}
