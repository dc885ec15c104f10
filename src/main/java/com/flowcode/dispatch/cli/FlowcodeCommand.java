package com.flowcode.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for FlowCode.
 */
@Command(
        name = "flowcode",
        mixinStandardHelpOptions = true,
        version = "FlowCode 0.1.0",
        description = "Plans coding goals into steps and runs them under human oversight",
        subcommands = {
                GoalCommand.class,
                PlanCommand.class,
                ResumeCommand.class,
                CancelCommand.class,
                AdaptCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                StatsCommand.class,
                PrefsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FlowcodeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given
        new CommandLine(this).usage(System.out);
    }
}
