package com.flowcode.core.execution;

import com.flowcode.core.config.FlowcodeProperties;
import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CommandProvider}.
 */
class CommandProviderTest {

    @TempDir
    Path workspace;

    private final CommandProvider provider = new CommandProvider(new CommandAllowlist(new FlowcodeProperties()));

    private ExecutionContext context() {
        return new ExecutionContext("FLOW-0001-0001", workspace, ExecutionContext.ResourceLimits.defaults(),
                ExecutionContext.ExecutionConstraints.defaults(), Set.of(), Set.of(), 0);
    }

    @Test
    @DisplayName("tokenize splits on whitespace")
    void tokenizeWhitespace() {
        assertEquals(List.of("npm", "run", "build"), CommandProvider.tokenize("  npm   run build "));
    }

    @Test
    @DisplayName("tokenize keeps quoted arguments together")
    void tokenizeQuotes() {
        assertEquals(List.of("git", "commit", "-m", "fix the bug"),
                CommandProvider.tokenize("git commit -m \"fix the bug\""));
        assertEquals(List.of("echo", "it's"), CommandProvider.tokenize("echo \"it's\""));
        assertEquals(List.of("echo", ""), CommandProvider.tokenize("echo ''"));
    }

    @Test
    @DisplayName("tokenize rejects unterminated quotes and empty commands")
    void tokenizeErrors() {
        assertThrows(CapabilityException.class, () -> CommandProvider.tokenize("echo \"oops"));
        assertThrows(CapabilityException.class, () -> CommandProvider.tokenize("   "));
    }

    @Test
    @DisplayName("commands outside the allowlist are refused before running")
    void refusesDisallowedCommand() {
        var action = new AgentAction("ACT-001", "Run", "rm -rf build",
                new ActionPayload.RunCommand("rm -rf build", true, List.of("build")), List.of(),
                RiskLevel.HIGH, 1_000, true);

        var e = assertThrows(CapabilityException.class, () -> provider.perform(action, context()));
        assertTrue(e.getMessage().startsWith("Permission denied"));
    }

    @Test
    @DisplayName("invalid branch names are refused")
    void refusesInvalidBranch() {
        var action = new AgentAction("ACT-001", "Branch", "x",
                new ActionPayload.CreateBranch("bad name; rm"), List.of(), RiskLevel.LOW, 1_000, false);
        assertThrows(CapabilityException.class, () -> provider.perform(action, context()));
    }

    @Test
    @DisplayName("runs an allowed command in the workspace")
    void runsAllowedCommand() {
        var action = new AgentAction("ACT-001", "Echo", "echo hello",
                new ActionPayload.RunCommand("echo hello", false, List.of()), List.of(), RiskLevel.LOW, 1_000, false);

        var result = provider.perform(action, context());

        assertTrue(result.success());
        assertEquals("hello", result.output().strip());
    }

    @Test
    @DisplayName("interrupting a running command kills it before perform returns")
    void interruptKillsProcess() throws Exception {
        var properties = new FlowcodeProperties();
        properties.getWorkspace().setCommandAllowlist(List.of("sh *"));
        var shellProvider = new CommandProvider(new CommandAllowlist(properties));
        Files.writeString(workspace.resolve("slow.sh"), "sleep 1\necho late > late.txt\n");
        var action = new AgentAction("ACT-001", "Slow", "sh slow.sh",
                new ActionPayload.RunCommand("sh slow.sh", true, List.of("late.txt")), List.of(),
                RiskLevel.MEDIUM, 1_000, false);

        var error = new AtomicReference<Throwable>();
        var returned = new CompletableFuture<Void>();
        Thread worker = new Thread(() -> {
            try {
                shellProvider.perform(action, context());
            } catch (RuntimeException e) {
                error.set(e);
            } finally {
                returned.complete(null);
            }
        });
        try {
            worker.start();
            Thread.sleep(200);
            worker.interrupt();
            returned.get();

            assertInstanceOf(CapabilityException.class, error.get());
            assertTrue(error.get().getMessage().startsWith("Command interrupted"));
            Thread.sleep(1_500);
            assertFalse(Files.exists(workspace.resolve("late.txt")));
        } finally {
            shellProvider.shutdown();
        }
    }
}
