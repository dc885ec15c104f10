package com.flowcode.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowcodePropertiesTest {

    @Test
    @DisplayName("defaults match the shipped configuration")
    void defaults() {
        var props = new FlowcodeProperties();

        assertEquals(".flowcode", props.getState().getDirectory());
        assertEquals("agent-state.json", props.getState().getFileName());
        assertEquals(Duration.ofSeconds(30), props.getState().getAutosaveInterval());
        assertEquals(3, props.getExecutor().getTimeoutFactor());
        assertEquals(Duration.ofSeconds(5), props.getExecutor().getMinStepTimeout());
        assertEquals(1, props.getOrchestrator().getTransientRetries());
        assertTrue(props.getOrchestrator().isAutoDrainQueue());
        assertEquals(Duration.ofMinutes(5), props.getOversight().getApprovalTimeout());
        assertEquals("none", props.getOversight().getAutoApprovalLevel());
        assertFalse(props.getOversight().isHeadless());
        assertEquals(List.of("node_modules", ".git"), props.getWorkspace().getRestrictedPaths());
        assertTrue(props.getWorkspace().getCommandAllowlist().contains("git status*"));
    }

    @Test
    @DisplayName("backoff grows exponentially up to the cap")
    void backoff() {
        var executor = new FlowcodeProperties().getExecutor();

        assertEquals(Duration.ofMillis(500), executor.backoffFor(1));
        assertEquals(Duration.ofMillis(1000), executor.backoffFor(2));
        assertEquals(Duration.ofMillis(2000), executor.backoffFor(3));
        assertEquals(Duration.ofSeconds(10), executor.backoffFor(10));
        assertEquals(Duration.ofMillis(500), executor.backoffFor(0));
    }

    @Test
    @DisplayName("binds relaxed property names and duration strings")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "flowcode.executor.min-step-timeout", "250ms",
                "flowcode.executor.provider-retries", "5",
                "flowcode.orchestrator.auto-drain-queue", "false",
                "flowcode.workspace.restricted-paths[0]", "vendor",
                "flowcode.oversight.auto-approval-level", "low",
                "flowcode.oversight.headless", "true"));

        var props = new Binder(source).bind("flowcode", Bindable.ofInstance(new FlowcodeProperties())).get();

        assertEquals(Duration.ofMillis(250), props.getExecutor().getMinStepTimeout());
        assertEquals(5, props.getExecutor().getProviderRetries());
        assertFalse(props.getOrchestrator().isAutoDrainQueue());
        assertEquals(List.of("vendor"), props.getWorkspace().getRestrictedPaths());
        assertEquals("low", props.getOversight().getAutoApprovalLevel());
        assertTrue(props.getOversight().isHeadless());
        assertEquals(3, props.getExecutor().getTimeoutFactor());
    }
}
