package com.flowcode.dispatch.cli;

import com.flowcode.core.engine.TaskOrchestrator;
import com.flowcode.core.model.AgenticTask;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flowcode adapt &lt;task-id&gt; "&lt;feedback&gt;"
 * <p>
 * Revises a stored task from free-text feedback, e.g. "too risky" or "add tests".
 */
@Command(name = "adapt", mixinStandardHelpOptions = true, description = "Revise a task's plan from feedback")
@Component
public class AdaptCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Parameters(index = "1", description = "Feedback describing the desired change")
    private String feedback;

    private final TaskOrchestrator orchestrator;

    public AdaptCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        AgenticTask adapted;
        try {
            adapted = orchestrator.adaptTask(taskId, feedback);
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        ConsoleOutput.success("Task " + adapted.id() + " is now version " + adapted.metadata().version()
                + " (" + adapted.metadata().annotations().getOrDefault("adaptations", "none") + ")");
        ConsoleOutput.steps(adapted);
    }
}
