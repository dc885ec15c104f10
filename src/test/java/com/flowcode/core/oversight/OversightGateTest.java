package com.flowcode.core.oversight;

import com.flowcode.core.events.EventBus;
import com.flowcode.core.events.FlowcodeEvent;
import com.flowcode.core.execution.FailureKind;
import com.flowcode.core.execution.StepFailure;
import com.flowcode.core.metrics.FlowcodeMetrics;
import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ApprovalResponse;
import com.flowcode.core.model.ApprovalStatus;
import com.flowcode.core.model.InterventionType;
import com.flowcode.core.model.Priority;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.TaskContext;
import com.flowcode.core.model.TaskMetadata;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.TaskStep;
import com.flowcode.core.model.UserFeedback;
import com.flowcode.core.planning.RiskAssessor;
import com.flowcode.core.state.StateStore;
import com.flowcode.core.state.UserPreferences;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link OversightGate}.
 */
class OversightGateTest {

    private HumanInterface human;
    private StateStore stateStore;
    private SimpleMeterRegistry registry;
    private List<FlowcodeEvent> events;
    private OversightGate gate;

    @BeforeEach
    void setUp() {
        human = mock(HumanInterface.class);
        stateStore = mock(StateStore.class);
        when(stateStore.getUserPreferences()).thenReturn(new UserPreferences(UserPreferences.defaults()));
        registry = new SimpleMeterRegistry();
        var eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        gate = new OversightGate(human, new ApprovalPolicy(), new RiskAssessor(), new RemediationAdvisor(),
                stateStore, eventBus, new FlowcodeMetrics(registry));
    }

    private static AgentAction action(ActionPayload payload, RiskLevel risk) {
        return new AgentAction("ACT-001", payload.type().label(), "src/app.ts", payload, List.of(), risk,
                1_000, true);
    }

    private static TaskStep step(AgentAction action) {
        return TaskStep.pending("STEP-001", action, List.of());
    }

    private static AgenticTask task(TaskStatus status, TaskStep step) {
        var steps = List.of(step);
        return new AgenticTask("FLOW-0001-0001", "Edit the app", steps, status, Priority.MEDIUM, RiskLevel.LOW,
                1_000, null, true, TaskContext.of("."), TaskMetadata.initial(List.of("file"), "user"),
                TaskProgress.of(steps, 1_000, null), List.of(), List.of(), null, null);
    }

    private List<String> eventTypes() {
        return events.stream().map(FlowcodeEvent::eventType).toList();
    }

    // -- approval tests ----------------------------------------------------

    @Nested
    @DisplayName("approvals")
    class Approvals {

        private final TaskStep editStep = step(action(new ActionPayload.EditFile("a", "b"), RiskLevel.LOW));

        @Test
        @DisplayName("pending request is handed to the human interface")
        void pendingRequest() {
            when(human.onApprovalRequested(any())).thenReturn(new CompletableFuture<>());

            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            assertEquals(ApprovalStatus.PENDING, request.status());
            assertTrue(request.id().startsWith("APR-"));
            assertEquals("STEP-001", request.stepId());
            assertTrue(gate.hasPendingApproval("FLOW-0001-0001"));
            assertEquals(List.of("approval.requested"), eventTypes());
            verify(human).onApprovalRequested(request);
        }

        @Test
        @DisplayName("a decision from another thread releases the waiting caller")
        void resolvedFromAnotherThread() {
            when(human.onApprovalRequested(any())).thenReturn(new CompletableFuture<>());
            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            CompletableFuture.runAsync(() -> gate.resolveApproval(request.id(), ApprovalResponse.approve("ok")),
                    CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));
            var resolved = gate.awaitDecision(request, Duration.ofSeconds(5));

            assertEquals(ApprovalStatus.APPROVED, resolved.status());
            assertEquals("ok", resolved.response().feedback());
            assertFalse(gate.hasPendingApproval("FLOW-0001-0001"));
            assertEquals(1.0, registry.find("flowcode.approvals.total")
                    .tag("decision", "approved").tag("automatic", "false").counter().count());
            assertTrue(eventTypes().contains("approval.resolved"));
        }

        @Test
        @DisplayName("the interface's own answer completes the request")
        void interfaceAnswers() {
            when(human.onApprovalRequested(any()))
                    .thenReturn(CompletableFuture.completedFuture(ApprovalResponse.reject("not now")));
            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            var resolved = gate.awaitDecision(request, Duration.ofSeconds(1));

            assertEquals(ApprovalStatus.REJECTED, resolved.status());
            assertEquals("not now", resolved.response().feedback());
        }

        @Test
        @DisplayName("no answer within the timeout is a rejection")
        void timeout() {
            when(human.onApprovalRequested(any())).thenReturn(new CompletableFuture<>());
            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            var resolved = gate.awaitDecision(request, Duration.ofMillis(50));

            assertEquals(ApprovalStatus.REJECTED, resolved.status());
            assertEquals("Approval timed out", resolved.response().feedback());
            assertFalse(gate.hasPendingApproval("FLOW-0001-0001"));
            assertFalse(gate.resolveApproval(request.id(), ApprovalResponse.approve("late")));
        }

        @Test
        @DisplayName("cancelling the task rejects its pending approvals")
        void cancelPending() {
            when(human.onApprovalRequested(any())).thenReturn(new CompletableFuture<>());
            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            gate.cancelPending("FLOW-0001-0001");
            var resolved = gate.awaitDecision(request, Duration.ofSeconds(1));

            assertEquals("Task cancelled", resolved.response().feedback());
        }

        @Test
        @DisplayName("a failing interface rejects instead of hanging")
        void interfaceFails() {
            when(human.onApprovalRequested(any())).thenThrow(new IllegalStateException("no terminal"));
            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            var resolved = gate.awaitDecision(request, Duration.ofSeconds(1));

            assertEquals(ApprovalStatus.REJECTED, resolved.status());
            assertEquals("Approval could not be presented", resolved.response().feedback());
        }

        @Test
        @DisplayName("low-risk edits are auto-approved when preferences allow it")
        void autoApproved() {
            var prefs = new java.util.LinkedHashMap<>(UserPreferences.defaults());
            prefs.put(UserPreferences.AUTO_APPROVAL_LEVEL, "medium");
            when(stateStore.getUserPreferences()).thenReturn(new UserPreferences(prefs));

            var request = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep);

            assertEquals(ApprovalStatus.APPROVED, request.status());
            assertFalse(gate.hasPendingApproval("FLOW-0001-0001"));
            verify(human, never()).onApprovalRequested(any());
            assertEquals(1.0, registry.find("flowcode.approvals.total")
                    .tag("decision", "approved").tag("automatic", "true").counter().count());
            assertEquals(List.of("approval.resolved"), eventTypes());
        }

        @Test
        @DisplayName("deletions always go to a human")
        void deletionsNeverAutoApproved() {
            var prefs = new java.util.LinkedHashMap<>(UserPreferences.defaults());
            prefs.put(UserPreferences.AUTO_APPROVAL_LEVEL, "high");
            when(stateStore.getUserPreferences()).thenReturn(new UserPreferences(prefs));
            when(human.onApprovalRequested(any())).thenReturn(new CompletableFuture<>());
            var delete = step(action(new ActionPayload.DeleteFile("**/*.tmp"), RiskLevel.LOW));

            var request = gate.requestApproval(task(TaskStatus.EXECUTING, delete), delete);

            assertEquals(ApprovalStatus.PENDING, request.status());
            assertFalse(request.alternatives().isEmpty());
        }

        @Test
        @DisplayName("resolved requests are returned without waiting")
        void alreadyResolved() {
            var resolved = gate.requestApproval(task(TaskStatus.EXECUTING, editStep), editStep)
                    .resolve(ApprovalResponse.approve("done"));
            assertSame(resolved, gate.awaitDecision(resolved, Duration.ofMillis(1)));
        }
    }

    // -- interventions and progress tests ----------------------------------

    @Test
    @DisplayName("interventions are recorded and announced")
    void handleIntervention() {
        var step = step(action(new ActionPayload.AnalyzeCode(List.of()), RiskLevel.LOW));

        var intervention = gate.handleIntervention(task(TaskStatus.EXECUTING, step), InterventionType.PAUSE,
                "lunch", null);

        assertTrue(intervention.id().startsWith("INT-"));
        assertEquals(InterventionType.PAUSE, intervention.type());
        assertEquals("intervention.received", events.get(0).eventType());
        assertEquals("PAUSE", events.get(0).payload().get("type"));
    }

    @Test
    @DisplayName("a failing intervention poll reads as no intervention")
    void pollInterventionFails() {
        when(human.onInterventionAvailable(anyString())).thenThrow(new IllegalStateException("closed"));
        assertTrue(gate.pollIntervention("FLOW-0001-0001").isEmpty());
    }

    @Test
    @DisplayName("progress is published even if the display fails")
    void showProgress() {
        doThrow(new IllegalStateException("closed")).when(human).onProgressChanged(anyString(), any());
        var step = step(action(new ActionPayload.AnalyzeCode(List.of()), RiskLevel.LOW));

        gate.showProgress(task(TaskStatus.EXECUTING, step));

        assertEquals("task.progress", events.get(0).eventType());
        assertEquals(1, events.get(0).payload().get("totalSteps"));
    }

    // -- escalation and feedback tests -------------------------------------

    @Nested
    @DisplayName("escalation")
    class Escalation {

        private final TaskStep failing = step(action(new ActionPayload.RunTests("npm test"), RiskLevel.MEDIUM));
        private final StepFailure timeout = new StepFailure(FailureKind.PROVIDER_TIMEOUT, "Timed out", false);

        @Test
        @DisplayName("passes the human's decision back")
        void humanDecides() {
            when(human.onEscalation(any())).thenReturn(EscalationDecision.SKIP);

            var decision = gate.escalateIssue(task(TaskStatus.EXECUTING, failing), failing, timeout);

            assertEquals(EscalationDecision.SKIP, decision);
            verify(human).onEscalation(argThat(r -> r.kind() == FailureKind.PROVIDER_TIMEOUT
                    && "high".equals(r.urgency())
                    && r.suggestions().contains("Retry step")));
            assertEquals(1.0, registry.find("flowcode.escalations.total")
                    .tag("reason", "provider_timeout").counter().count());
            assertEquals("step.escalated", events.get(0).eventType());
        }

        @Test
        @DisplayName("no answer aborts")
        void nullAborts() {
            when(human.onEscalation(any())).thenReturn(null);
            assertEquals(EscalationDecision.ABORT,
                    gate.escalateIssue(task(TaskStatus.EXECUTING, failing), failing, timeout));
        }

        @Test
        @DisplayName("a failing handler aborts")
        void failureAborts() {
            when(human.onEscalation(any())).thenThrow(new IllegalStateException("closed"));
            assertEquals(EscalationDecision.ABORT,
                    gate.escalateIssue(task(TaskStatus.EXECUTING, failing), failing, timeout));
        }
    }

    @Test
    @DisplayName("feedback is only requested for finished tasks")
    void collectFeedback() {
        var step = step(action(new ActionPayload.AnalyzeCode(List.of()), RiskLevel.LOW));
        var feedback = new UserFeedback(5, "great", List.of(), true, Instant.now());
        when(human.onFeedbackRequested(any())).thenReturn(Optional.of(feedback));

        assertTrue(gate.collectFeedback(task(TaskStatus.EXECUTING, step)).isEmpty());
        assertEquals(Optional.of(feedback), gate.collectFeedback(task(TaskStatus.COMPLETED, step)));
        verify(human, times(1)).onFeedbackRequested(any());
    }

    @Test
    @DisplayName("headless mode rejects approvals and aborts escalations")
    void headless() throws Exception {
        var headless = new HeadlessHumanInterface();
        var step = step(action(new ActionPayload.AnalyzeCode(List.of()), RiskLevel.LOW));
        var request = gate.requestApproval(task(TaskStatus.EXECUTING, step), step);

        var response = headless.onApprovalRequested(request).toCompletableFuture().get(1, TimeUnit.SECONDS);

        assertFalse(response.approved());
        var escalation = new EscalationRequest("FLOW-0001-0001", "Analyze", "STEP-001", step.action(),
                FailureKind.EXECUTION_ERROR, "boom", 1, "high", List.of("Cancel task"));
        assertEquals(EscalationDecision.ABORT, headless.onEscalation(escalation));
        assertTrue(headless.onInterventionAvailable("FLOW-0001-0001").isEmpty());
    }
}
