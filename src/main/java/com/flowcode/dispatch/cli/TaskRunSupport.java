package com.flowcode.dispatch.cli;

import com.flowcode.core.engine.OrchestrationResult;
import com.flowcode.core.events.EventBus;
import com.flowcode.core.events.FlowcodeEvent;
import com.flowcode.core.model.TaskStatus;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Shared by the commands that start a task and wait for it: streams events while
 * the run is in progress and prints the outcome.
 */
final class TaskRunSupport {

    private TaskRunSupport() {
    }

    static void awaitAndReport(EventBus eventBus, String taskId, CompletableFuture<OrchestrationResult> completion) {
        awaitAndReport(eventBus, taskId, completion, false);
    }

    /**
     * @param quiet stream only approvals, failures and the task outcome
     */
    static void awaitAndReport(EventBus eventBus, String taskId, CompletableFuture<OrchestrationResult> completion,
                               boolean quiet) {
        EventBus.Subscription subscription = eventBus.subscribe(streamFilter(taskId, quiet), ConsoleOutput::event);
        try {
            OrchestrationResult result = completion.get();
            report(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted; task " + taskId + " keeps its stored state.");
        } catch (ExecutionException e) {
            ConsoleOutput.error("Task " + taskId + " failed: " + rootCauseMessage(e));
        } finally {
            subscription.unsubscribe();
        }
    }

    static Predicate<FlowcodeEvent> streamFilter(String taskId, boolean quiet) {
        if (!quiet) {
            return event -> event.belongsTo(taskId);
        }
        return event -> event.belongsTo(taskId)
                && (event.isTaskOutcome()
                    || "approval".equals(event.category())
                    || "step.failed".equals(event.eventType())
                    || "step.escalated".equals(event.eventType()));
    }

    static void report(OrchestrationResult result) {
        var task = result.task();
        ConsoleOutput.taskHeader(task);
        ConsoleOutput.steps(task);
        System.out.println();
        ConsoleOutput.info(result.completedSteps() + " of " + task.steps().size() + " step(s) completed in "
                + ConsoleOutput.formatDuration(result.totalDurationMs()));
        String reason = task.metadata().annotations().get("failureReason");
        if (task.status() == TaskStatus.COMPLETED) {
            ConsoleOutput.success("Task complete.");
        } else if (task.status() == TaskStatus.FAILED) {
            ConsoleOutput.error("Task failed: " + (reason != null ? reason : "see step errors above"));
        } else if (task.status() == TaskStatus.PAUSED) {
            ConsoleOutput.info("Task paused. Resume with: flowcode resume " + task.id());
        } else if (task.status() == TaskStatus.CANCELLED) {
            ConsoleOutput.warn("Task cancelled: " + task.metadata().annotations().getOrDefault("cancelReason", "-"));
        } else {
            ConsoleOutput.info("Task status: " + task.status());
        }
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
