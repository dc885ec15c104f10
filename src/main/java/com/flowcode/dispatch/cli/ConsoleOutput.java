package com.flowcode.dispatch.cli;

import com.flowcode.core.events.FlowcodeEvent;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.TaskStep;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the FlowCode CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) FLOWCODE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLOWCODE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void prompt(String message) {
        System.out.print(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ?|@ " + message + " "));
        System.out.flush();
    }

    public static void taskHeader(AgenticTask task) {
        System.out.println();
        System.out.println("TASK " + task.id() + " (v" + task.metadata().version() + ")");
        System.out.println("Goal: " + task.goal());
        System.out.println("Risk: " + riskColored(task) + " | Priority: " + task.priority()
                + " | Approval required: " + (task.approvalRequired() ? "yes" : "no"));
        status(task.status());
    }

    public static void status(TaskStatus status) {
        switch (status) {
            case COMPLETED -> success("Status: " + status);
            case FAILED, CANCELLED -> error("Status: " + status);
            case PAUSED, WAITING_APPROVAL -> warn("Status: " + status);
            default -> info("Status: " + status);
        }
    }

    public static void steps(AgenticTask task) {
        if (task.steps().isEmpty()) {
            return;
        }
        System.out.println();
        System.out.printf("  %-9s %-22s %-17s %-8s %s%n", "STEP", "ACTION", "STATUS", "RISK", "DESCRIPTION");
        System.out.println("  " + "-".repeat(78));
        for (TaskStep step : task.steps()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-9s %-22s %s %-8s %s",
                    step.id(), step.action().type().label(), stepStatus(step.status()),
                    step.riskLevel(), truncate(step.description(), 40))));
            if (step.error() != null && step.status() != StepStatus.COMPLETED) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "            @|fg(red) " + truncate(step.error(), 70) + "|@"));
            }
        }
    }

    public static void progress(String taskId, TaskProgress progress) {
        int width = 20;
        int filled = Math.min(width, progress.percentComplete() * width / 100);
        String bar = "#".repeat(filled) + ".".repeat(width - filled);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "@|fg(cyan) [%s]|@ %3d%% %s  %d done, %d failed, %d skipped of %d",
                bar, progress.percentComplete(), taskId, progress.completedSteps(),
                progress.failedSteps(), progress.skippedSteps(), progress.totalSteps())));
    }

    public static void event(FlowcodeEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.planned", "task.queued", "task.started", "task.adapted" -> "@|fg(cyan) [TASK]|@";
            case "step.started" -> "@|fg(blue) [STEP]|@";
            case "step.completed" -> "@|fg(green) [STEP]|@";
            case "step.failed", "step.escalated" -> "@|fg(red) [STEP]|@";
            case "step.skipped", "step.retrying" -> "@|fg(yellow) [STEP]|@";
            case "approval.requested", "approval.resolved" -> "@|fg(magenta) [APPROVAL]|@";
            case "task.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "task.failed" -> "@|fg(red),bold [FAILED]|@";
            case "task.cancelled", "task.paused", "task.redirected" -> "@|fg(yellow),bold [HALTED]|@";
            case "state.persistence_warning" -> "@|fg(red) [STATE]|@";
            default -> null;
        };
        if (prefix == null) {
            return;
        }
        String subject = event.stepId() != null ? event.stepId() : event.taskId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.eventType() + " " + subject + " " + event.payload()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String stepStatus(StepStatus status) {
        String padded = String.format("%-17s", status);
        return switch (status) {
            case COMPLETED -> "@|fg(green) " + padded + "|@";
            case FAILED -> "@|fg(red) " + padded + "|@";
            case SKIPPED, WAITING_APPROVAL -> "@|fg(yellow) " + padded + "|@";
            case EXECUTING -> "@|fg(blue) " + padded + "|@";
            default -> padded;
        };
    }

    private static String riskColored(AgenticTask task) {
        String color = switch (task.riskLevel()) {
            case LOW -> "green";
            case MEDIUM -> "yellow";
            case HIGH, CRITICAL -> "red";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|fg(" + color + ") " + task.riskLevel() + "|@");
    }
}
