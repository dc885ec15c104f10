package com.flowcode.core.oversight;

import com.flowcode.core.execution.FailureKind;
import com.flowcode.core.execution.StepFailure;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds human-readable next-step hints for an escalated failure.
 */
@Component
public class RemediationAdvisor {

    public List<String> suggest(AgentAction action, StepFailure failure) {
        var suggestions = new ArrayList<String>();
        switch (failure.kind()) {
            case PROVIDER_TIMEOUT -> {
                suggestions.add("Retry the step; the operation may have been slow rather than stuck");
                if (action.type() == AgentActionType.RUN_COMMAND || action.type() == AgentActionType.RUN_TESTS) {
                    suggestions.add("Run the command manually to check whether it waits for input");
                }
            }
            case PROVIDER_UNAVAILABLE -> suggestions.add("Check that the required tool is installed and on the PATH");
            case VALIDATION_FAILURE -> {
                suggestions.add("Review the validation messages; the change was rolled back");
                suggestions.add("Modify the step so the produced change satisfies the rules");
            }
            case DEPENDENCY_NOT_SATISFIED -> suggestions.add("Re-plan the task; its step order is inconsistent");
            case APPROVAL_REJECTED -> suggestions.add("Pick one of the safer alternatives offered with the approval");
            case EXECUTION_ERROR -> {
                suggestions.add("Inspect the error output and fix the workspace before retrying");
                if (action.type().isFileMutating()) {
                    suggestions.add("Verify that " + action.target() + " exists and is writable");
                }
            }
        }
        if (failure.rolledBack()) {
            suggestions.add("Files touched by the step were restored from backup");
        }
        suggestions.add(failure.kind().isTransient() ? "Retry step" : "Skip step");
        suggestions.add("Cancel task");
        return suggestions;
    }

    /**
     * Deletions, critical-risk actions and rejected changes are critical; everything else is high.
     */
    public String urgencyOf(AgentAction action, StepFailure failure) {
        boolean critical = action.riskLevel() == RiskLevel.CRITICAL
                || action.type() == AgentActionType.DELETE_FILE
                || failure.kind() == FailureKind.VALIDATION_FAILURE;
        return critical ? "critical" : "high";
    }
}
