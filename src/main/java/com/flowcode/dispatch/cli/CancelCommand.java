package com.flowcode.dispatch.cli;

import com.flowcode.core.engine.TaskOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: flowcode cancel
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel the current task")
@Component
public class CancelCommand implements Runnable {

    private final TaskOrchestrator orchestrator;

    public CancelCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        if (orchestrator.cancelExecution()) {
            ConsoleOutput.success("Current task cancelled.");
        } else {
            ConsoleOutput.info("No active task to cancel.");
        }
    }
}
