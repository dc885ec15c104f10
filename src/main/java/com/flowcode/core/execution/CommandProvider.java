package com.flowcode.core.execution;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs allow-listed commands and git operations in the workspace.
 * <p>
 * Output is drained on a separate reader thread so the provider thread waits in
 * {@link Process#waitFor()}, which responds to interruption. When the executor
 * cancels a timed-out step the whole process tree is killed before
 * {@link #perform} returns.
 */
@Component
public class CommandProvider implements CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(CommandProvider.class);

    private static final int MAX_OUTPUT_CHARS = 20_000;
    private static final long KILL_WAIT_SECONDS = 5;
    private static final long OUTPUT_WAIT_SECONDS = 2;

    private final CommandAllowlist allowlist;
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "flowcode-command-output");
        thread.setDaemon(true);
        return thread;
    });

    public CommandProvider(CommandAllowlist allowlist) {
        this.allowlist = allowlist;
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    @Override
    public Set<AgentActionType> capabilities() {
        return EnumSet.of(AgentActionType.RUN_COMMAND, AgentActionType.RUN_TESTS,
                AgentActionType.COMMIT_CHANGES, AgentActionType.CREATE_BRANCH);
    }

    @Override
    public StepResult perform(AgentAction action, ExecutionContext context) {
        return switch (action.type()) {
            case RUN_COMMAND -> {
                var payload = action.payloadAs(ActionPayload.RunCommand.class);
                requireAllowed(payload.command());
                yield run(tokenize(payload.command()), context);
            }
            case RUN_TESTS -> {
                var payload = action.payloadAs(ActionPayload.RunTests.class);
                requireAllowed(payload.command());
                yield run(tokenize(payload.command()), context);
            }
            case COMMIT_CHANGES -> {
                var payload = action.payloadAs(ActionPayload.CommitChanges.class);
                StepResult staged = run(List.of("git", "add", "-A"), context);
                if (!staged.success()) {
                    yield staged;
                }
                yield run(List.of("git", "commit", "-m", payload.message()), context);
            }
            case CREATE_BRANCH -> {
                var payload = action.payloadAs(ActionPayload.CreateBranch.class);
                if (!payload.branchName().matches("[A-Za-z0-9._/-]+")) {
                    throw new CapabilityException("Invalid branch name: " + payload.branchName());
                }
                yield run(List.of("git", "checkout", "-b", payload.branchName()), context);
            }
            default -> throw new CapabilityException("Unsupported action type: " + action.type());
        };
    }

    private void requireAllowed(String command) {
        if (!allowlist.isCommandAllowed(command)) {
            throw new CapabilityException("Permission denied: command not in allowlist: " + command);
        }
    }

    private StepResult run(List<String> command, ExecutionContext context) {
        log.info("Running command: {}", String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(context.workspaceRoot().toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new ProviderUnavailableException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }
        CompletableFuture<String> output = CompletableFuture.supplyAsync(
                () -> readOutput(process.getInputStream()), outputReaders);
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            terminate(process);
            Thread.currentThread().interrupt();
            throw new CapabilityException("Command interrupted: " + String.join(" ", command), e);
        }
        String text = collect(output, command);
        if (exitCode != 0) {
            log.warn("Command {} exited with code {}", command.get(0), exitCode);
            return StepResult.failed(text, List.of("Exit code " + exitCode));
        }
        return StepResult.succeeded(text, List.of());
    }

    /**
     * Kills the process and its descendants and waits for the process to exit.
     * Runs after an interrupt, so the wait is bounded.
     */
    private static void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Process {} did not exit within {}s of being killed", process.pid(), KILL_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String collect(CompletableFuture<String> output, List<String> command) {
        try {
            // A background child can keep the pipe open after the command itself exits.
            return output.get(OUTPUT_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            output.cancel(true);
            log.warn("Output of {} still open after exit; returning without it", command.get(0));
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("Command interrupted: " + String.join(" ", command), e);
        } catch (ExecutionException e) {
            throw new CapabilityException("Failed reading output of " + command.get(0), e.getCause());
        }
    }

    private static String readOutput(InputStream in) {
        byte[] bytes;
        try (in) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String output = new String(bytes, StandardCharsets.UTF_8);
        return output.length() > MAX_OUTPUT_CHARS
                ? output.substring(output.length() - MAX_OUTPUT_CHARS)
                : output;
    }

    /**
     * Splits a command line on whitespace, honouring single and double quotes.
     */
    static List<String> tokenize(String commandLine) {
        var tokens = new ArrayList<String>();
        var current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (char c : commandLine.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new CapabilityException("Unterminated quote in command: " + commandLine);
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        if (tokens.isEmpty()) {
            throw new CapabilityException("Empty command");
        }
        return tokens;
    }
}
