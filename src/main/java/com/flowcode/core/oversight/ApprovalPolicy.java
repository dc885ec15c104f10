package com.flowcode.core.oversight;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.state.UserPreferences;
import org.springframework.stereotype.Component;

/**
 * Decides whether an approval can be granted without asking. Deletions and shell
 * commands always go to a human.
 */
@Component
public class ApprovalPolicy {

    public boolean canAutoApprove(AgentAction action, UserPreferences preferences) {
        if (action.type() == AgentActionType.DELETE_FILE || action.type() == AgentActionType.RUN_COMMAND) {
            return false;
        }
        return preferences.autoApprovalLevel()
                .map(ceiling -> ceiling.isAtLeast(action.riskLevel()))
                .orElse(false);
    }
}
