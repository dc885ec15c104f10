package com.flowcode.dispatch.cli;

import com.flowcode.core.engine.TaskOrchestrator;
import com.flowcode.core.events.EventBus;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.state.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: flowcode resume [task-id]
 * <p>
 * Continues a paused, queued or interrupted task. Without an id the current task is
 * resumed, or else the oldest queued one.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a paused or queued task")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Task ID (default: current task)")
    private String taskId;

    private final TaskOrchestrator orchestrator;
    private final StateStore stateStore;
    private final EventBus eventBus;

    public ResumeCommand(TaskOrchestrator orchestrator, StateStore stateStore, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Optional<String> target = Optional.ofNullable(taskId)
                .or(() -> stateStore.getCurrentTask().filter(t -> !t.status().isTerminal()).map(AgenticTask::id))
                .or(() -> stateStore.getQueue().stream().findFirst().map(AgenticTask::id));
        if (target.isEmpty()) {
            ConsoleOutput.info("Nothing to resume.");
            return;
        }
        String id = target.get();
        try {
            var completion = orchestrator.executeTask(id);
            ConsoleOutput.info("Resuming task " + id);
            TaskRunSupport.awaitAndReport(eventBus, id, completion);
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
