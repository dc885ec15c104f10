package com.flowcode.dispatch.cli;

import com.flowcode.core.engine.TaskOrchestrator;
import com.flowcode.core.events.EventBus;
import com.flowcode.core.planning.PlanningException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flowcode run "&lt;goal&gt;"
 * <p>
 * Plans the goal, runs it to completion (or until it pauses) and prints the outcome.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute a goal")
@Component
public class GoalCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language goal")
    private String goal;

    @Option(names = {"--queue", "-q"}, description = "Only plan and queue the goal; do not run it")
    private boolean queueOnly;

    @Option(names = {"--feedback"}, description = "Ask for a rating when the task ends")
    private boolean feedback;

    @Option(names = {"--quiet"}, description = "Hide the progress bar and print only approvals, failures and the outcome")
    private boolean quiet;

    private final TaskOrchestrator orchestrator;
    private final EventBus eventBus;
    private final ConsoleHumanInterface console;

    public GoalCommand(TaskOrchestrator orchestrator, EventBus eventBus, ConsoleHumanInterface console) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.console = console;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        console.setFeedbackPrompts(feedback);
        console.setShowProgress(!quiet);

        String taskId;
        try {
            if (queueOnly) {
                taskId = orchestrator.queueGoal(goal);
                ConsoleOutput.success("Queued task " + taskId);
                return;
            }
            taskId = orchestrator.executeGoal(goal);
        } catch (PlanningException e) {
            ConsoleOutput.error("Could not plan goal: " + e.getMessage());
            return;
        }
        ConsoleOutput.info("Started task " + taskId);
        TaskRunSupport.awaitAndReport(eventBus, taskId, orchestrator.completionOf(taskId), quiet);
    }
}
