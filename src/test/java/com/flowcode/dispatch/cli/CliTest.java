package com.flowcode.dispatch.cli;

import com.flowcode.core.engine.OrchestrationResult;
import com.flowcode.core.engine.TaskOrchestrator;
import com.flowcode.core.events.EventBus;
import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.Priority;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskContext;
import com.flowcode.core.model.TaskMetadata;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.TaskStep;
import com.flowcode.core.planning.KeywordGoalDecomposer;
import com.flowcode.core.planning.PlanningException;
import com.flowcode.core.planning.RiskAssessor;
import com.flowcode.core.planning.TaskPlanner;
import com.flowcode.core.state.StateStore;
import com.flowcode.core.state.UserPreferences;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the FlowCode CLI command structure.
 * These tests exercise picocli directly without Spring context, with a mocked
 * orchestrator and a real state store in a temporary directory.
 */
class CliTest {

    @TempDir
    Path tempDir;

    private TaskOrchestrator orchestrator;
    private StateStore stateStore;
    private TaskPlanner planner;
    private EventBus eventBus;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() {
        orchestrator = mock(TaskOrchestrator.class);
        stateStore = new StateStore(tempDir.resolve(".flowcode/agent-state.json"), Duration.ofHours(1), 100,
                UserPreferences.defaults());
        planner = new TaskPlanner(new KeywordGoalDecomposer(), new RiskAssessor(), null);
        eventBus = new EventBus();
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        var console = new ConsoleHumanInterface(new BufferedReader(new StringReader("")), false);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GoalCommand.class) {
                    return (K) new GoalCommand(orchestrator, eventBus, console);
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(planner);
                }
                if (cls == ResumeCommand.class) {
                    return (K) new ResumeCommand(orchestrator, stateStore, eventBus);
                }
                if (cls == CancelCommand.class) {
                    return (K) new CancelCommand(orchestrator);
                }
                if (cls == AdaptCommand.class) {
                    return (K) new AdaptCommand(orchestrator);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(stateStore);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(stateStore);
                }
                if (cls == StatsCommand.class) {
                    return (K) new StatsCommand(stateStore);
                }
                if (cls == PrefsCommand.class) {
                    return (K) new PrefsCommand(stateStore);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new FlowcodeCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static AgenticTask task(String id, TaskStatus status) {
        var action = new AgentAction("ACT-001", "Analyze the code", ".", new ActionPayload.AnalyzeCode(List.of()),
                List.of(), RiskLevel.LOW, 1_000, false);
        var step = TaskStep.pending("STEP-001", action, List.of());
        if (status == TaskStatus.COMPLETED) {
            step = step.withStatus(StepStatus.COMPLETED);
        }
        var steps = List.of(step);
        return new AgenticTask(id, "Analyze the code", steps, status, Priority.MEDIUM, RiskLevel.LOW, 1_000,
                null, false, TaskContext.of("."), TaskMetadata.initial(List.of("analyze"), "user"),
                TaskProgress.of(steps, 1_000, null), List.of(), List.of(), null, null);
    }

    private static OrchestrationResult resultOf(AgenticTask task) {
        return new OrchestrationResult(task.status() == TaskStatus.COMPLETED, task,
                task.progress().completedSteps(), task.progress().failedSteps(), 1_200, List.of(), null);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "plan", "resume", "cancel", "adapt", "status", "history", "stats",
                    "prefs", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
            assertTrue(result.output().contains("Plans coding goals into steps"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FlowCode 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows run options")
        void runHelpOutput() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Plan and execute a goal"));
            assertTrue(result.output().contains("--queue"));
        }

        @Test
        @DisplayName("run without a goal is a usage error")
        void runWithoutGoal() {
            CliResult result = execute("run");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // =====================================================================
    //  Planning and running
    // =====================================================================

    @Nested
    @DisplayName("plan and run")
    class PlanAndRun {

        @Test
        @DisplayName("plan prints the steps without storing anything")
        void planDryRun() {
            CliResult result = execute("plan", "Create a new module");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("STEP-001"));
            assertTrue(result.output().contains("create_file"));
            assertTrue(result.output().contains("Complexity:"));
            assertTrue(stateStore.getQueue().isEmpty());
            assertTrue(stateStore.getCurrentTask().isEmpty());
        }

        @Test
        @DisplayName("plan reports goals that cannot be planned")
        void planBlankGoal() {
            CliResult result = execute("plan", " ");
            assertTrue(result.output().contains("Could not plan goal"));
        }

        @Test
        @DisplayName("run waits for the task and reports completion")
        void runCompletes() {
            var done = task("FLOW-0001-0001", TaskStatus.COMPLETED);
            when(orchestrator.executeGoal("Analyze the code")).thenReturn("FLOW-0001-0001");
            when(orchestrator.completionOf("FLOW-0001-0001"))
                    .thenReturn(CompletableFuture.completedFuture(resultOf(done)));

            CliResult result = execute("run", "Analyze the code");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Started task FLOW-0001-0001"));
            assertTrue(result.output().contains("1 of 1 step(s) completed in 1s"));
            assertTrue(result.output().contains("Task complete."));
        }

        @Test
        @DisplayName("run shows the failure reason of a failed task")
        void runFails() {
            var failed = task("FLOW-0001-0001", TaskStatus.FAILED).annotate("failureReason", "Step STEP-001 failed");
            when(orchestrator.executeGoal(anyString())).thenReturn("FLOW-0001-0001");
            when(orchestrator.completionOf("FLOW-0001-0001"))
                    .thenReturn(CompletableFuture.completedFuture(resultOf(failed)));

            CliResult result = execute("run", "Analyze the code");

            assertTrue(result.output().contains("Task failed: Step STEP-001 failed"));
        }

        @Test
        @DisplayName("run --queue only queues the goal")
        void runQueueOnly() {
            when(orchestrator.queueGoal("Analyze the code")).thenReturn("FLOW-0001-0002");

            CliResult result = execute("run", "--queue", "Analyze the code");

            assertTrue(result.output().contains("Queued task FLOW-0001-0002"));
            verify(orchestrator, never()).executeGoal(anyString());
        }

        @Test
        @DisplayName("run reports planning errors")
        void runPlanningError() {
            when(orchestrator.executeGoal(anyString())).thenThrow(new PlanningException("Goal must not be blank"));

            CliResult result = execute("run", "x");

            assertTrue(result.output().contains("Could not plan goal: Goal must not be blank"));
        }

        @Test
        @DisplayName("resume picks the first queued task when there is no current one")
        void resumeQueued() {
            var queued = task("FLOW-0001-0003", TaskStatus.READY);
            stateStore.addTaskToQueue(queued);
            var done = task("FLOW-0001-0003", TaskStatus.COMPLETED);
            when(orchestrator.executeTask("FLOW-0001-0003"))
                    .thenReturn(CompletableFuture.completedFuture(resultOf(done)));

            CliResult result = execute("resume");

            assertTrue(result.output().contains("Resuming task FLOW-0001-0003"));
            assertTrue(result.output().contains("Task complete."));
        }

        @Test
        @DisplayName("resume with nothing stored says so")
        void resumeNothing() {
            assertTrue(execute("resume").output().contains("Nothing to resume."));
        }

        @Test
        @DisplayName("resume reports finished tasks")
        void resumeFinished() {
            when(orchestrator.executeTask("FLOW-0001-0001"))
                    .thenThrow(new IllegalStateException("Task FLOW-0001-0001 is COMPLETED"));

            CliResult result = execute("resume", "FLOW-0001-0001");

            assertTrue(result.output().contains("Task FLOW-0001-0001 is COMPLETED"));
        }
    }

    // =====================================================================
    //  Control and state commands
    // =====================================================================

    @Nested
    @DisplayName("control and state")
    class ControlAndState {

        @Test
        @DisplayName("cancel reports whether a task was cancelled")
        void cancel() {
            when(orchestrator.cancelExecution()).thenReturn(true, false);

            assertTrue(execute("cancel").output().contains("Current task cancelled."));
            assertTrue(execute("cancel").output().contains("No active task to cancel."));
        }

        @Test
        @DisplayName("adapt shows the new version")
        void adapt() {
            var adapted = task("FLOW-0001-0001", TaskStatus.READY);
            adapted = adapted.withMetadata(adapted.metadata().nextVersion("feedback"))
                    .annotate("adaptations", "reduce_risk");
            when(orchestrator.adaptTask("FLOW-0001-0001", "too risky")).thenReturn(adapted);

            CliResult result = execute("adapt", "FLOW-0001-0001", "too risky");

            assertTrue(result.output().contains("Task FLOW-0001-0001 is now version 2 (reduce_risk)"));
        }

        @Test
        @DisplayName("adapt reports unknown tasks")
        void adaptUnknown() {
            when(orchestrator.adaptTask(anyString(), anyString()))
                    .thenThrow(new IllegalArgumentException("Unknown task: FLOW-9"));
            assertTrue(execute("adapt", "FLOW-9", "x").output().contains("Unknown task: FLOW-9"));
        }

        @Test
        @DisplayName("status without tasks")
        void statusEmpty() {
            CliResult result = execute("status");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No current task."));
        }

        @Test
        @DisplayName("status of an unknown task")
        void statusUnknown() {
            assertTrue(execute("status", "FLOW-9").output().contains("Task not found: FLOW-9"));
        }

        @Test
        @DisplayName("status shows the current task and the queue")
        void statusCurrentAndQueue() {
            stateStore.setCurrentTask(task("FLOW-0001-0001", TaskStatus.PAUSED));
            stateStore.addTaskToQueue(task("FLOW-0001-0002", TaskStatus.READY));

            CliResult result = execute("status");

            assertTrue(result.output().contains("TASK FLOW-0001-0001 (v1)"));
            assertTrue(result.output().contains("Status: PAUSED"));
            assertTrue(result.output().contains("QUEUED:"));
            assertTrue(result.output().contains("FLOW-0001-0002"));
        }

        @Test
        @DisplayName("history lists execution records and can be cleared")
        void history() {
            stateStore.addTaskToQueue(task("FLOW-0001-0001", TaskStatus.READY));
            stateStore.recordExecutionStep("FLOW-0001-0001", "STEP-001", "analyze_code", StepStatus.COMPLETED,
                    250, true, null, false);

            CliResult listed = execute("history", "FLOW-0001-0001");
            assertTrue(listed.output().contains("STEP-001"));
            assertTrue(listed.output().contains("analyze_code"));
            assertTrue(listed.output().contains("250ms"));

            assertTrue(execute("history", "--clear").output().contains("Execution history cleared."));
            assertTrue(execute("history", "FLOW-0001-0001").output()
                    .contains("No execution history for FLOW-0001-0001"));
        }

        @Test
        @DisplayName("stats prints totals and can reset the store")
        void stats() {
            CliResult result = execute("stats");
            assertTrue(result.output().contains("Tasks: 0"));
            assertTrue(result.output().contains("Learning entries: 0"));

            stateStore.addTaskToQueue(task("FLOW-0001-0001", TaskStatus.READY));
            assertTrue(execute("stats", "--reset").output().contains("State reset."));
            assertEquals(0, stateStore.queueSize());
        }

        @Test
        @DisplayName("prefs --set updates valid preferences")
        void prefsSet() {
            CliResult result = execute("prefs", "--set", "autoApprovalLevel=low");

            assertTrue(result.output().contains("Updated autoApprovalLevel"));
            assertEquals(RiskLevel.LOW, stateStore.getUserPreferences().autoApprovalLevel().orElseThrow());
        }

        @Test
        @DisplayName("prefs --set rejects malformed values")
        void prefsInvalid() {
            CliResult result = execute("prefs", "-s", "autoApprovalLevel=always");

            assertTrue(result.output().contains("must be one of"));
            assertTrue(stateStore.getUserPreferences().autoApprovalLevel().isEmpty());
        }
    }
}
