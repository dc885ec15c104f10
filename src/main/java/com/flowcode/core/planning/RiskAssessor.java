package com.flowcode.core.planning;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.RiskAssessment;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.TaskContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scores risk for whole plans and for single actions awaiting approval.
 */
@Component
public class RiskAssessor {

    static final Set<AgentActionType> HIGH_RISK_ACTIONS = EnumSet.of(
            AgentActionType.DELETE_FILE, AgentActionType.RUN_COMMAND, AgentActionType.COMMIT_CHANGES);

    /** Action types that always need an explicit human decision. */
    static final Set<AgentActionType> APPROVAL_ACTIONS = EnumSet.of(
            AgentActionType.DELETE_FILE, AgentActionType.RUN_COMMAND);

    /**
     * Risk of a single action type at the given scope.
     */
    public RiskLevel stepRisk(AgentActionType type, GoalScope scope) {
        return switch (type) {
            case DELETE_FILE, RUN_COMMAND, COMMIT_CHANGES -> scope.isBroad() ? RiskLevel.HIGH : RiskLevel.MEDIUM;
            case EDIT_FILE, REFACTOR_CODE, OPTIMIZE_PERFORMANCE, CREATE_BRANCH -> switch (scope) {
                case ARCHITECTURE -> RiskLevel.HIGH;
                case MODULE, PROJECT -> RiskLevel.MEDIUM;
                case FILE -> RiskLevel.LOW;
            };
            case CREATE_FILE -> scope == GoalScope.ARCHITECTURE ? RiskLevel.MEDIUM : RiskLevel.LOW;
            case ANALYZE_CODE, VALIDATE_SECURITY, RUN_TESTS, GENERATE_DOCUMENTATION,
                 ANALYZE_DEPENDENCIES -> RiskLevel.LOW;
        };
    }

    public boolean requiresApproval(AgentActionType type, RiskLevel risk) {
        return APPROVAL_ACTIONS.contains(type) || risk.isAtLeast(RiskLevel.HIGH);
    }

    /**
     * Aggregate risk of an analysed goal in its workspace context.
     */
    public RiskAssessment assessPlan(GoalAnalysis analysis, TaskContext context) {
        int score = 0;
        var factors = new ArrayList<String>();

        var highRisk = EnumSet.noneOf(AgentActionType.class);
        for (var action : analysis.actions()) {
            if (HIGH_RISK_ACTIONS.contains(action.payload().type())) {
                highRisk.add(action.payload().type());
            }
        }
        for (AgentActionType type : highRisk) {
            score += 3;
            factors.add("High-risk action: " + type.label());
        }
        if (analysis.scope() == GoalScope.ARCHITECTURE) {
            score += 4;
            factors.add("Architecture-level scope");
        }
        boolean sensitive = analysis.actions().stream()
                .anyMatch(a -> KeywordGoalDecomposer.isSensitive(a.target()));
        if (sensitive) {
            score += 2;
            factors.add("Sensitive files targeted");
        }
        if (intValue(context.quality().get("technicalDebtItems")) > 5) {
            score += 2;
            factors.add("High technical debt");
        }
        if (intValue(context.security().get("vulnerableDependencies")) > 0) {
            score += 2;
            factors.add("Known vulnerable dependencies");
        }
        score += analysis.risks().size();
        factors.addAll(analysis.risks());

        RiskLevel level = levelFor(score);
        var mitigations = new ArrayList<String>();
        if (level.isAtLeast(RiskLevel.MEDIUM)) {
            mitigations.add("Create backup before proceeding");
            mitigations.add("Require explicit approval for risky operations");
        }
        if (sensitive) {
            mitigations.add("Review changes to sensitive files manually");
        }
        double confidence = clamp(1.0 - score * 0.03, 0.6, 0.95);
        return new RiskAssessment(level, factors, impactFor(level, analysis.scope().label()), mitigations, confidence);
    }

    /**
     * Risk of one action, shown to the approver.
     */
    public RiskAssessment assessAction(AgentAction action) {
        var factors = new ArrayList<String>();
        var mitigations = new ArrayList<String>();
        if (HIGH_RISK_ACTIONS.contains(action.type())) {
            factors.add("Action type " + action.type().label() + " can cause irreversible changes");
        }
        if (action.target() != null && KeywordGoalDecomposer.isSensitive(action.target())) {
            factors.add("Targets sensitive file " + action.target());
            mitigations.add("Review changes to sensitive files manually");
        }
        if (action.type().isFileMutating() || action.type() == AgentActionType.RUN_COMMAND) {
            mitigations.add("A backup is taken before the action runs and restored on failure");
        }
        if (action.riskLevel().isAtLeast(RiskLevel.HIGH)) {
            mitigations.add("Consider running on a separate branch first");
        }
        double confidence = action.riskLevel().isAtLeast(RiskLevel.HIGH) ? 0.7 : 0.85;
        String scope = action.target() == null || ".".equals(action.target()) ? "workspace" : "file";
        return new RiskAssessment(action.riskLevel(), factors, impactFor(action.riskLevel(), scope),
                mitigations, confidence);
    }

    /**
     * Safer alternatives offered next to an approval request.
     */
    public List<String> alternativesFor(AgentAction action) {
        return switch (action.type()) {
            case DELETE_FILE -> List.of("Move the files to a backup directory instead of deleting them",
                    "Delete only the files listed explicitly");
            case RUN_COMMAND -> List.of("Run the command in dry-run mode first");
            case COMMIT_CHANGES -> List.of("Stage the changes without committing");
            case EDIT_FILE, REFACTOR_CODE -> List.of("Preview the diff before applying it");
            default -> List.of();
        };
    }

    static RiskLevel levelFor(int score) {
        if (score <= 2) return RiskLevel.LOW;
        if (score <= 5) return RiskLevel.MEDIUM;
        if (score <= 8) return RiskLevel.HIGH;
        return RiskLevel.CRITICAL;
    }

    private static String impactFor(RiskLevel level, String scope) {
        String prefix = switch (level) {
            case LOW -> "Minimal impact";
            case MEDIUM -> "Moderate impact";
            case HIGH -> "Significant impact";
            case CRITICAL -> "Critical impact";
        };
        return prefix + " expected for " + scope + "-level changes";
    }

    static int intValue(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
