package com.flowcode.dispatch.cli;

import com.flowcode.core.state.ExecutionRecord;
import com.flowcode.core.state.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: flowcode history &lt;task-id&gt;
 * <p>
 * Lists the execution records of a task in the order they were written.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show a task's execution history")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Task ID (default: current task)")
    private String taskId;

    @Option(names = {"--clear"}, description = "Delete the execution history of all tasks")
    private boolean clear;

    private final StateStore stateStore;

    public HistoryCommand(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (clear) {
            stateStore.clearExecutionHistory();
            ConsoleOutput.success("Execution history cleared.");
            return;
        }

        String id = taskId != null ? taskId
                : stateStore.getCurrentTask().map(t -> t.id()).orElse(null);
        if (id == null) {
            ConsoleOutput.info("No current task; pass a task ID.");
            return;
        }
        List<ExecutionRecord> records = stateStore.getExecutionHistory(id);
        if (records.isEmpty()) {
            ConsoleOutput.info("No execution history for " + id);
            return;
        }

        System.out.println();
        System.out.printf("  %-9s %-22s %-12s %-8s %-10s %s%n",
                "STEP", "ACTION", "STATUS", "TIME", "ROLLBACK", "ERROR");
        System.out.println("  " + "-".repeat(78));
        for (ExecutionRecord r : records) {
            System.out.printf("  %-9s %-22s %-12s %-8s %-10s %s%n",
                    r.stepId(), r.actionType() != null ? r.actionType() : "-", r.status(),
                    ConsoleOutput.formatDuration(r.durationMs()), r.rolledBack() ? "yes" : "-",
                    ConsoleOutput.truncate(r.error(), 40));
        }
    }
}
