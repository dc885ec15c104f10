package com.flowcode.dispatch.cli;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.state.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: flowcode status [task-id]
 * <p>
 * Shows a stored task with its step table, plus the queue and parked tasks.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Task ID (default: current task)")
    private String taskId;

    private final StateStore stateStore;

    public StatusCommand(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<AgenticTask> task = taskId != null ? stateStore.findTask(taskId) : stateStore.getCurrentTask();
        if (task.isEmpty()) {
            if (taskId != null) {
                ConsoleOutput.error("Task not found: " + taskId);
            } else {
                ConsoleOutput.info("No current task.");
            }
        } else {
            AgenticTask t = task.get();
            ConsoleOutput.taskHeader(t);
            ConsoleOutput.progress(t.id(), t.progress());
            ConsoleOutput.steps(t);
            t.metadata().annotations().forEach((k, v) -> System.out.println("  " + k + ": " + v));
        }

        printTasks("QUEUED", stateStore.getQueue());
        printTasks("PAUSED (parked)", stateStore.getParkedTasks());
        stateStore.getLastSaveTime().ifPresent(at -> {
            System.out.println();
            ConsoleOutput.info("State last saved " + at + " to " + stateStore.getStateFile());
        });
    }

    private static void printTasks(String title, List<AgenticTask> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println(title + ":");
        for (AgenticTask t : tasks) {
            System.out.printf("  %-16s %-16s %s%n", t.id(), t.status(), ConsoleOutput.truncate(t.goal(), 50));
        }
    }
}
