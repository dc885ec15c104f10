package com.flowcode.core.planning;

import com.flowcode.core.metrics.FlowcodeMetrics;
import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ComplexityLevel;
import com.flowcode.core.model.Priority;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskContext;
import com.flowcode.core.model.TaskMetadata;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.TaskStep;
import com.flowcode.core.model.ValidationCategory;
import com.flowcode.core.model.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Turns free-form goals into ordered, risk-rated task plans.
 * <p>
 * Decomposition itself is delegated to a {@link GoalDecomposer}; this class owns
 * step ordering, dependencies, validation rules, risk and complexity scoring, and
 * feedback-driven plan adaptation. It never touches the state store.
 */
@Service
public class TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanner.class);

    private static final Set<AgentActionType> COMPLEX_ACTIONS = EnumSet.of(
            AgentActionType.REFACTOR_CODE, AgentActionType.ANALYZE_DEPENDENCIES,
            AgentActionType.OPTIMIZE_PERFORMANCE);

    private static final Pattern STEP_NUMBER = Pattern.compile("STEP-(\\d+)");

    private final GoalDecomposer decomposer;
    private final RiskAssessor riskAssessor;
    private final FlowcodeMetrics metrics;
    private final AtomicInteger taskCounter = new AtomicInteger(0);

    public TaskPlanner(GoalDecomposer decomposer, RiskAssessor riskAssessor,
                       @Autowired(required = false) FlowcodeMetrics metrics) {
        this.decomposer = decomposer;
        this.riskAssessor = riskAssessor;
        this.metrics = metrics;
    }

    public AgenticTask decomposeGoal(String goal) {
        return decomposeGoal(goal, TaskContext.of("."));
    }

    /**
     * Plans a goal into a {@link TaskStatus#READY} task.
     *
     * @throws PlanningException if the goal is blank or yields no actionable steps
     */
    public AgenticTask decomposeGoal(String goal, TaskContext context) {
        if (goal == null || goal.isBlank()) {
            throw new PlanningException("Goal must not be empty");
        }
        long start = System.currentTimeMillis();

        GoalAnalysis analysis = decomposer.analyze(goal.strip());
        if (analysis.actions().isEmpty()) {
            throw new PlanningException("Goal resolves to no actionable steps: " + goal);
        }

        List<TaskStep> steps = buildSteps(analysis);
        var complexity = estimate(analysis, context);
        var risk = riskAssessor.assessPlan(analysis, context);

        RiskLevel aggregate = risk.level();
        boolean anyStepNeedsApproval = false;
        for (TaskStep step : steps) {
            aggregate = RiskLevel.max(aggregate, step.riskLevel());
            anyStepNeedsApproval |= step.approvalRequired();
        }
        boolean approvalRequired = aggregate.isAtLeast(RiskLevel.HIGH) || anyStepNeedsApproval;

        var tags = new LinkedHashSet<String>();
        tags.add(analysis.scope().label());
        tags.add(complexity.level().name().toLowerCase(Locale.ROOT));
        tags.addAll(analysis.categories());

        long estimatedMs = complexity.estimatedTime().toMillis();
        var planning = new AgenticTask(
                generateTaskId(), goal.strip(), steps, TaskStatus.PLANNING,
                complexity.level() == ComplexityLevel.EXPERT ? Priority.HIGH : Priority.MEDIUM,
                aggregate, estimatedMs, null, approvalRequired, context,
                TaskMetadata.initial(List.copyOf(tags), "user"),
                TaskProgress.of(steps, estimatedMs, null),
                List.of(), List.of(), null, null);
        var task = planning.withStatus(TaskStatus.READY);

        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordPlanningDuration(elapsed);
            metrics.recordTaskSteps(steps.size());
        }
        log.info("Planned task {} with {} steps (scope={}, risk={}, complexity={}, approvalRequired={}) in {}ms",
                task.id(), steps.size(), analysis.scope().label(), aggregate, complexity.level(),
                approvalRequired, elapsed);
        return task;
    }

    public ComplexityEstimate estimateComplexity(String goal) {
        return estimateComplexity(goal, TaskContext.of("."));
    }

    /**
     * Side-effect-free sizing of a goal.
     */
    public ComplexityEstimate estimateComplexity(String goal, TaskContext context) {
        if (goal == null || goal.isBlank()) {
            throw new PlanningException("Goal must not be empty");
        }
        return estimate(decomposer.analyze(goal.strip()), context);
    }

    /**
     * Produces a new version of {@code task} adjusted to the feedback. The input is
     * left untouched; callers decide whether to store the result.
     */
    public AgenticTask adaptPlan(AgenticTask task, String feedback) {
        String lower = feedback == null ? "" : feedback.toLowerCase(Locale.ROOT);
        var steps = new ArrayList<>(task.steps());
        var adaptations = new ArrayList<String>();
        boolean approvalRequired = task.approvalRequired();
        int[] nextNumber = {maxStepNumber(steps) + 1};

        if (mentionsAny(lower, "risky", "risk", "careful", "safer", "dangerous")) {
            approvalRequired = true;
            tightenApprovals(steps);
            insertValidationSteps(steps, nextNumber);
            adaptations.add("reduce_risk");
        }
        if (mentionsAny(lower, "break down", "smaller", "step by step")) {
            insertAnalysisSteps(steps, nextNumber);
            adaptations.add("break_down_steps");
        }
        if (mentionsAny(lower, "add", "include") && mentionsAny(lower, "test", "tests", "testing")) {
            appendAfterMutations(steps, nextNumber, "Run the test suite", "npm test",
                    new ActionPayload.RunTests("npm test"));
            adaptations.add("add_tests");
        }
        if (mentionsAny(lower, "document", "documentation", "docs")) {
            appendAfterMutations(steps, nextNumber, "Generate documentation for changes", ".",
                    new ActionPayload.GenerateDocumentation("markdown"));
            adaptations.add("add_documentation");
        }

        TaskStatus status = task.status();
        if (status.isTerminal()) {
            // a continuation of a finished task starts over on everything not yet done
            status = TaskStatus.READY;
            steps.replaceAll(s -> s.status() == StepStatus.COMPLETED ? s : s.resetForRetry());
        }

        var metadata = task.metadata().nextVersion("adapted")
                .annotate("adaptations", adaptations.isEmpty() ? "none" : String.join(",", adaptations))
                .annotate("feedback", feedback == null ? "" : feedback);

        var adapted = new AgenticTask(task.id(), task.goal(), steps, status, task.priority(),
                task.riskLevel(), task.estimatedDurationMs(), task.actualDurationMs(), approvalRequired,
                task.context(), metadata,
                TaskProgress.of(steps, task.estimatedDurationMs(), task.progress().currentStepId()),
                task.approvals(), task.interventions(), task.feedback(), task.learning());
        log.info("Adapted task {} to version {} ({})", task.id(), metadata.version(),
                adaptations.isEmpty() ? "no changes" : String.join(", ", adaptations));
        return adapted;
    }

    // --- step construction ---

    private List<TaskStep> buildSteps(GoalAnalysis analysis) {
        var planned = new ArrayList<>(analysis.actions());

        boolean hasRefactorLike = planned.stream().anyMatch(a -> a.payload().type() == AgentActionType.REFACTOR_CODE
                || a.payload().type() == AgentActionType.OPTIMIZE_PERFORMANCE);
        if (hasRefactorLike && !analysis.contains(AgentActionType.ANALYZE_CODE)) {
            String target = planned.stream()
                    .filter(a -> COMPLEX_ACTIONS.contains(a.payload().type()))
                    .map(GoalAnalysis.PlannedAction::target).findFirst().orElse(".");
            planned.add(new GoalAnalysis.PlannedAction("Analyze " + target + " before restructuring",
                    target, new ActionPayload.AnalyzeCode(List.of("structure", "hotspots"))));
        }

        boolean createsOrEdits = analysis.contains(AgentActionType.CREATE_FILE)
                || analysis.contains(AgentActionType.EDIT_FILE);
        if (createsOrEdits) {
            planned.add(new GoalAnalysis.PlannedAction("Validate code quality of changes", ".",
                    new ActionPayload.ValidateSecurity("quality")));
            if (!analysis.contains(AgentActionType.VALIDATE_SECURITY)) {
                planned.add(new GoalAnalysis.PlannedAction("Validate security of changes", ".",
                        new ActionPayload.ValidateSecurity("security")));
            }
        }

        planned.sort(Comparator.comparingInt(a -> phaseOf(a.payload().type())));

        var steps = new ArrayList<TaskStep>();
        var idsByPhase = new ArrayList<List<String>>();
        for (int i = 0; i <= 4; i++) {
            idsByPhase.add(new ArrayList<>());
        }
        int n = 1;
        for (var p : planned) {
            AgentActionType type = p.payload().type();
            int phase = phaseOf(type);
            List<String> deps = List.of();
            for (int earlier = phase - 1; earlier >= 0; earlier--) {
                if (!idsByPhase.get(earlier).isEmpty()) {
                    deps = List.copyOf(idsByPhase.get(earlier));
                    break;
                }
            }
            String stepId = String.format("STEP-%03d", n);
            AgentAction action = buildAction(String.format("ACT-%03d", n), p, analysis.scope());
            steps.add(TaskStep.pending(stepId, action, deps));
            idsByPhase.get(phase).add(stepId);
            n++;
        }
        return steps;
    }

    private AgentAction buildAction(String actionId, GoalAnalysis.PlannedAction planned, GoalScope scope) {
        AgentActionType type = planned.payload().type();
        RiskLevel risk = riskAssessor.stepRisk(type, scope);
        return new AgentAction(actionId, planned.description(), planned.target(), planned.payload(),
                rulesFor(type), risk, estimatedTimeMs(type), riskAssessor.requiresApproval(type, risk));
    }

    static List<ValidationRule> rulesFor(AgentActionType type) {
        var performance = ValidationRule.warning("performance-budget", ValidationCategory.PERFORMANCE,
                "performance.budget");
        return switch (type) {
            case CREATE_FILE, EDIT_FILE -> List.of(
                    ValidationRule.error("no-secrets", ValidationCategory.SECURITY, "security.secrets"),
                    ValidationRule.error("workspace-paths", ValidationCategory.SECURITY, "security.paths"),
                    ValidationRule.warning("content-quality", ValidationCategory.QUALITY, "quality.content"),
                    ValidationRule.error("file-size", ValidationCategory.COMPLIANCE, "compliance.file-size"),
                    performance);
            case DELETE_FILE -> List.of(
                    ValidationRule.error("workspace-paths", ValidationCategory.SECURITY, "security.paths"),
                    performance);
            case RUN_COMMAND -> List.of(
                    ValidationRule.warning("command-output", ValidationCategory.QUALITY, "quality.content"),
                    performance);
            default -> List.of(performance);
        };
    }

    static long estimatedTimeMs(AgentActionType type) {
        return switch (type) {
            case CREATE_FILE, EDIT_FILE, COMMIT_CHANGES -> 5_000;
            case DELETE_FILE, CREATE_BRANCH -> 3_000;
            case ANALYZE_CODE -> 10_000;
            case VALIDATE_SECURITY, GENERATE_DOCUMENTATION, ANALYZE_DEPENDENCIES -> 15_000;
            case REFACTOR_CODE, OPTIMIZE_PERFORMANCE -> 30_000;
            case RUN_COMMAND -> 60_000;
            case RUN_TESTS -> 120_000;
        };
    }

    private static int phaseOf(AgentActionType type) {
        return switch (type) {
            case CREATE_BRANCH -> 0;
            case ANALYZE_CODE, ANALYZE_DEPENDENCIES -> 1;
            case CREATE_FILE, EDIT_FILE, DELETE_FILE, RUN_COMMAND, REFACTOR_CODE, OPTIMIZE_PERFORMANCE -> 2;
            case VALIDATE_SECURITY, RUN_TESTS, GENERATE_DOCUMENTATION -> 3;
            case COMMIT_CHANGES -> 4;
        };
    }

    // --- complexity ---

    private ComplexityEstimate estimate(GoalAnalysis analysis, TaskContext context) {
        int score = analysis.scope().complexityWeight();
        var factors = new ArrayList<String>();
        factors.add("Scope: " + analysis.scope().label());

        for (var action : analysis.actions()) {
            if (COMPLEX_ACTIONS.contains(action.payload().type())) {
                score += 3;
                factors.add("Complex action: " + action.payload().type().label());
            }
        }
        if (context.dependencies().size() > 10) {
            score += 2;
            factors.add("Many dependencies (" + context.dependencies().size() + ")");
        }
        String languages = context.architecture().get("languages");
        if (languages != null && languages.split(",").length > 2) {
            score += 2;
            factors.add("Multiple languages");
        }
        score += analysis.risks().size();
        factors.addAll(analysis.risks());

        ComplexityLevel level = ComplexityLevel.fromScore(score);
        var recommendations = new ArrayList<String>();
        if (level == ComplexityLevel.COMPLEX || level == ComplexityLevel.EXPERT) {
            recommendations.add("Consider breaking down into smaller tasks");
            recommendations.add("Review and approve each step carefully");
        }
        double confidence = RiskAssessor.clamp(1.0 - score * 0.05, 0.3, 0.9);
        return new ComplexityEstimate(level, level.estimatedTime(), confidence, score, factors, recommendations);
    }

    // --- adaptation helpers ---

    private void tightenApprovals(List<TaskStep> steps) {
        steps.replaceAll(step -> {
            if (step.status() != StepStatus.PENDING) {
                return step;
            }
            if (step.riskLevel().isAtLeast(RiskLevel.MEDIUM) || step.action().type().isMutating()) {
                return step.withAction(step.action().withRequiresApproval(true));
            }
            return step;
        });
    }

    private void insertValidationSteps(List<TaskStep> steps, int[] nextNumber) {
        for (int i = 0; i < steps.size(); i++) {
            TaskStep step = steps.get(i);
            if (step.status() != StepStatus.PENDING || !step.action().type().isMutating()) {
                continue;
            }
            String stepId = step.id();
            boolean validated = steps.stream().anyMatch(s ->
                    s.action().type() == AgentActionType.VALIDATE_SECURITY && s.dependencies().contains(stepId));
            if (validated) {
                continue;
            }
            var validation = newStep(nextNumber, "Validate security of " + step.id(), step.action().target(),
                    new ActionPayload.ValidateSecurity("security"), List.of(stepId));
            steps.add(i + 1, validation);
            i++;
        }
    }

    private void insertAnalysisSteps(List<TaskStep> steps, int[] nextNumber) {
        for (int i = 0; i < steps.size(); i++) {
            TaskStep step = steps.get(i);
            AgentActionType type = step.action().type();
            if (step.status() != StepStatus.PENDING
                    || (type != AgentActionType.REFACTOR_CODE && type != AgentActionType.OPTIMIZE_PERFORMANCE)) {
                continue;
            }
            var analysis = newStep(nextNumber, "Analyze " + step.action().target() + " in detail",
                    step.action().target(), new ActionPayload.AnalyzeCode(List.of("structure")), step.dependencies());
            var deps = new ArrayList<>(step.dependencies());
            deps.add(analysis.id());
            steps.set(i, step.withDependencies(deps));
            steps.add(i, analysis);
            i++;
        }
    }

    private void appendAfterMutations(List<TaskStep> steps, int[] nextNumber, String description,
                                      String target, ActionPayload payload) {
        var deps = steps.stream()
                .filter(s -> s.action().type().isMutating())
                .map(TaskStep::id)
                .toList();
        steps.add(newStep(nextNumber, description, target, payload, deps));
    }

    private TaskStep newStep(int[] nextNumber, String description, String target,
                             ActionPayload payload, List<String> deps) {
        int n = nextNumber[0]++;
        AgentActionType type = payload.type();
        RiskLevel risk = riskAssessor.stepRisk(type, GoalScope.FILE);
        var action = new AgentAction(String.format("ACT-%03d", n), description, target, payload,
                rulesFor(type), risk, estimatedTimeMs(type), riskAssessor.requiresApproval(type, risk));
        return TaskStep.pending(String.format("STEP-%03d", n), action, deps);
    }

    private static int maxStepNumber(List<TaskStep> steps) {
        int max = 0;
        for (TaskStep step : steps) {
            var m = STEP_NUMBER.matcher(step.id());
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max;
    }

    private static boolean mentionsAny(String lower, String... words) {
        return KeywordGoalDecomposer.matchesAny(lower, List.of(words));
    }

    private String generateTaskId() {
        return String.format("FLOW-%04d-%04x", taskCounter.incrementAndGet(),
                ThreadLocalRandom.current().nextInt(0x10000));
    }
}
