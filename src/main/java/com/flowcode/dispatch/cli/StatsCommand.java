package com.flowcode.dispatch.cli;

import com.flowcode.core.state.StateStore;
import com.flowcode.core.state.TaskStatistics;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

/**
 * CLI command: flowcode stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show task statistics")
@Component
public class StatsCommand implements Runnable {

    @Option(names = {"--reset"}, description = "Clear all tasks, history, statistics and learning data")
    private boolean reset;

    private final StateStore stateStore;

    public StatsCommand(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (reset) {
            stateStore.resetState();
            ConsoleOutput.success("State reset.");
            return;
        }

        TaskStatistics stats = stateStore.getTaskStatistics();
        System.out.println();
        System.out.println("Tasks: " + stats.totalTasks()
                + " (" + stats.completedTasks() + " completed, "
                + stats.failedTasks() + " failed, "
                + stats.cancelledTasks() + " cancelled)");
        System.out.printf("Success rate: %.0f%%%n", stats.successRate() * 100);
        System.out.println("Average duration: " + ConsoleOutput.formatDuration(Math.round(stats.averageDurationMs())));
        if (!stats.mostCommonActions().isEmpty()) {
            System.out.println("Most common actions: " + String.join(", ", stats.mostCommonActions()));
        }
        printDistribution("Risk", stats.riskDistribution());
        printDistribution("Complexity", stats.complexityDistribution());
        System.out.println("Learning entries: " + stateStore.getLearningData().size());
    }

    private static void printDistribution(String title, Map<String, Integer> distribution) {
        if (distribution.isEmpty()) {
            return;
        }
        System.out.println(title + ":");
        distribution.forEach((k, v) -> System.out.printf("  %-12s %d%n", k, v));
    }
}
