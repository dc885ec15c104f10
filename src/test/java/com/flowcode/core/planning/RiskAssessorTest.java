package com.flowcode.core.planning;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.TaskContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RiskAssessor}.
 */
class RiskAssessorTest {

    private final RiskAssessor assessor = new RiskAssessor();

    private static GoalAnalysis analysis(GoalScope scope, ActionPayload... payloads) {
        var actions = java.util.Arrays.stream(payloads)
                .map(p -> new GoalAnalysis.PlannedAction(p.type().label(), ".", p))
                .toList();
        return new GoalAnalysis("goal", scope, List.of(), actions, List.of());
    }

    @Nested
    @DisplayName("step risk")
    class StepRisk {

        @Test
        @DisplayName("destructive actions are high risk at broad scope")
        void destructiveActions() {
            assertEquals(RiskLevel.HIGH, assessor.stepRisk(AgentActionType.DELETE_FILE, GoalScope.PROJECT));
            assertEquals(RiskLevel.MEDIUM, assessor.stepRisk(AgentActionType.DELETE_FILE, GoalScope.FILE));
        }

        @Test
        @DisplayName("read-only actions are always low risk")
        void readOnlyActions() {
            for (GoalScope scope : GoalScope.values()) {
                assertEquals(RiskLevel.LOW, assessor.stepRisk(AgentActionType.ANALYZE_CODE, scope));
                assertEquals(RiskLevel.LOW, assessor.stepRisk(AgentActionType.RUN_TESTS, scope));
            }
        }

        @Test
        @DisplayName("deletes and commands always need approval")
        void approvalActions() {
            assertTrue(assessor.requiresApproval(AgentActionType.DELETE_FILE, RiskLevel.LOW));
            assertTrue(assessor.requiresApproval(AgentActionType.RUN_COMMAND, RiskLevel.LOW));
            assertFalse(assessor.requiresApproval(AgentActionType.CREATE_FILE, RiskLevel.MEDIUM));
            assertTrue(assessor.requiresApproval(AgentActionType.EDIT_FILE, RiskLevel.HIGH));
        }
    }

    @Nested
    @DisplayName("plan assessment")
    class PlanAssessment {

        @Test
        @DisplayName("harmless plan is low risk without mitigations")
        void harmlessPlan() {
            var risk = assessor.assessPlan(analysis(GoalScope.FILE, new ActionPayload.AnalyzeCode(List.of())),
                    TaskContext.of("."));
            assertEquals(RiskLevel.LOW, risk.level());
            assertTrue(risk.mitigations().isEmpty());
        }

        @Test
        @DisplayName("workspace signals raise the score")
        void contextRaisesScore() {
            var context = new TaskContext(".", List.of(), null, List.of(), Map.of(),
                    Map.of("vulnerableDependencies", "3"), Map.of("technicalDebtItems", "9"));
            var risk = assessor.assessPlan(analysis(GoalScope.FILE,
                    new ActionPayload.DeleteFile("**/*.tmp")), context);
            // delete 3 + debt 2 + vulnerabilities 2
            assertEquals(RiskLevel.HIGH, risk.level());
            assertTrue(risk.factors().contains("Known vulnerable dependencies"));
            assertTrue(risk.mitigations().contains("Create backup before proceeding"));
        }

        @Test
        @DisplayName("malformed context numbers are ignored")
        void malformedNumbers() {
            assertEquals(0, RiskAssessor.intValue("lots"));
            assertEquals(0, RiskAssessor.intValue(null));
            assertEquals(4, RiskAssessor.intValue(" 4 "));
        }

        @Test
        @DisplayName("score buckets")
        void levelFor() {
            assertEquals(RiskLevel.LOW, RiskAssessor.levelFor(2));
            assertEquals(RiskLevel.MEDIUM, RiskAssessor.levelFor(5));
            assertEquals(RiskLevel.HIGH, RiskAssessor.levelFor(8));
            assertEquals(RiskLevel.CRITICAL, RiskAssessor.levelFor(9));
        }
    }

    @Nested
    @DisplayName("action assessment")
    class ActionAssessment {

        private final AgentAction delete = new AgentAction("ACT-001", "Delete temp files", ".",
                new ActionPayload.DeleteFile("**/*.tmp"), List.of(), RiskLevel.HIGH, 3_000, true);

        @Test
        @DisplayName("explains destructive actions to the approver")
        void explainsDestructiveAction() {
            var risk = assessor.assessAction(delete);
            assertEquals(RiskLevel.HIGH, risk.level());
            assertFalse(risk.factors().isEmpty());
            assertTrue(risk.mitigations().contains("Consider running on a separate branch first"));
            assertTrue(risk.impact().contains("workspace"));
        }

        @Test
        @DisplayName("offers safer alternatives for deletes")
        void alternatives() {
            assertEquals(2, assessor.alternativesFor(delete).size());
            assertTrue(assessor.alternativesFor(delete.withPayload(new ActionPayload.AnalyzeCode(List.of()))).isEmpty());
        }
    }
}
