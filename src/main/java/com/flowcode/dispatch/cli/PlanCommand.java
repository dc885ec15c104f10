package com.flowcode.dispatch.cli;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.planning.ComplexityEstimate;
import com.flowcode.core.planning.PlanningException;
import com.flowcode.core.planning.TaskPlanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flowcode plan "&lt;goal&gt;"
 * <p>
 * Dry run: shows the steps, risk and complexity a goal would produce without storing
 * or executing anything.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the plan for a goal without running it")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language goal")
    private String goal;

    private final TaskPlanner planner;

    public PlanCommand(TaskPlanner planner) {
        this.planner = planner;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        AgenticTask task;
        ComplexityEstimate complexity;
        try {
            task = planner.decomposeGoal(goal);
            complexity = planner.estimateComplexity(goal);
        } catch (PlanningException e) {
            ConsoleOutput.error("Could not plan goal: " + e.getMessage());
            return;
        }

        ConsoleOutput.taskHeader(task);
        ConsoleOutput.info(String.format("Complexity: %s (score %d, ~%s, confidence %d%%)",
                complexity.level(), complexity.score(),
                ConsoleOutput.formatDuration(complexity.estimatedTime().toMillis()),
                Math.round(complexity.confidence() * 100)));
        complexity.factors().forEach(f -> System.out.println("    - " + f));
        ConsoleOutput.steps(task);
        if (!complexity.recommendations().isEmpty()) {
            System.out.println();
            System.out.println("RECOMMENDATIONS:");
            complexity.recommendations().forEach(r -> System.out.println("  - " + r));
        }
    }
}
