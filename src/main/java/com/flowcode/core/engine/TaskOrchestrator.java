package com.flowcode.core.engine;

import com.flowcode.core.config.FlowcodeProperties;
import com.flowcode.core.events.EventBus;
import com.flowcode.core.events.FlowcodeEvent;
import com.flowcode.core.execution.FailureKind;
import com.flowcode.core.execution.StepExecutor;
import com.flowcode.core.execution.StepFailure;
import com.flowcode.core.execution.StepOutcome;
import com.flowcode.core.logging.MdcContext;
import com.flowcode.core.metrics.FlowcodeMetrics;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ApprovalRequest;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.HumanIntervention;
import com.flowcode.core.model.InterventionType;
import com.flowcode.core.model.LearningData;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskContext;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.TaskStep;
import com.flowcode.core.model.UserFeedback;
import com.flowcode.core.oversight.EscalationDecision;
import com.flowcode.core.oversight.OversightGate;
import com.flowcode.core.planning.PlanningException;
import com.flowcode.core.planning.TaskPlanner;
import com.flowcode.core.state.PersistenceException;
import com.flowcode.core.state.StateStore;
import com.flowcode.core.state.UserPreferences;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Drives tasks from plan to terminal status.
 * <p>
 * One task runs at a time on a single worker thread; further tasks wait in the state
 * store's queue. Steps run one after another in declaration order, deferring any step
 * whose dependencies are not yet completed. Between steps the orchestrator checks for
 * pause, cancel and redirect signals, so cancellation never interrupts a step in flight.
 * <p>
 * The canonical task lives in the {@link StateStore}; every change goes through it and
 * the orchestrator only ever holds the snapshot returned by the last update.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskPlanner planner;
    private final StepExecutor executor;
    private final StateStore stateStore;
    private final OversightGate oversight;
    private final ErrorClassifier errorClassifier;
    private final EventBus eventBus;
    private final FlowcodeProperties properties;
    private final FlowcodeMetrics metrics;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "flowcode-orchestrator");
        t.setDaemon(true);
        return t;
    });

    /** Pending control signals keyed by task id. */
    private final ConcurrentHashMap<String, HumanIntervention> signals = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<OrchestrationResult>> completions =
            new ConcurrentHashMap<>();

    private boolean busy;
    private volatile String runningTaskId;
    private volatile String runningStepId;

    public TaskOrchestrator(TaskPlanner planner,
                            StepExecutor executor,
                            StateStore stateStore,
                            OversightGate oversight,
                            ErrorClassifier errorClassifier,
                            EventBus eventBus,
                            FlowcodeProperties properties,
                            @Autowired(required = false) FlowcodeMetrics metrics) {
        this.planner = planner;
        this.executor = executor;
        this.stateStore = stateStore;
        this.oversight = oversight;
        this.errorClassifier = errorClassifier;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
    }

    // --- public surface ---

    /**
     * Plans {@code goal} and starts it, or queues it behind the running task.
     *
     * @return the new task's id
     * @throws PlanningException if the goal cannot be planned
     */
    public String executeGoal(String goal) {
        AgenticTask task = plan(goal);
        completions.put(task.id(), new CompletableFuture<>());
        dispatch(task);
        return task.id();
    }

    /**
     * Plans {@code goal} and appends it to the queue without starting it.
     */
    public String queueGoal(String goal) {
        AgenticTask task = plan(goal);
        completions.put(task.id(), new CompletableFuture<>());
        persist(task.id(), () -> stateStore.addTaskToQueue(task));
        publish("task.queued", task.id(), null, Map.of("queueSize", stateStore.queueSize()));
        return task.id();
    }

    /**
     * Starts or resumes a stored task (current, queued or parked). Steps already
     * completed are not run again.
     *
     * @return a future completed when this run stops
     * @throws IllegalArgumentException if the task is unknown
     * @throws IllegalStateException    if the task already reached a terminal status
     */
    public CompletableFuture<OrchestrationResult> executeTask(String taskId) {
        AgenticTask task = stateStore.findTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (task.status().isTerminal()) {
            throw new IllegalStateException("Task " + taskId + " is " + task.status()
                    + "; adapt it to create a new version before running it again");
        }
        synchronized (this) {
            if (taskId.equals(runningTaskId)) {
                return completionOf(taskId);
            }
            CompletableFuture<OrchestrationResult> future = completions.compute(taskId,
                    (id, existing) -> existing == null || existing.isDone() ? new CompletableFuture<>() : existing);
            signals.remove(taskId);
            dispatch(task);
            return future;
        }
    }

    /**
     * Future completed when the task's current or next run stops.
     */
    public CompletableFuture<OrchestrationResult> completionOf(String taskId) {
        return completions.computeIfAbsent(taskId, id -> new CompletableFuture<>());
    }

    /**
     * Asks the running task to pause after its current step.
     *
     * @return false if nothing is running
     */
    public boolean pauseExecution() {
        return signalRunning(InterventionType.PAUSE, "User requested pause", null);
    }

    /**
     * Cancels the running task at its next suspension point, or a paused current task
     * immediately.
     *
     * @return false if there was nothing to cancel
     */
    public boolean cancelExecution() {
        if (signalRunning(InterventionType.CANCEL, "User requested cancellation", null)) {
            return true;
        }
        Optional<AgenticTask> current = stateStore.getCurrentTask();
        if (current.isEmpty() || current.get().status().isTerminal()) {
            return false;
        }
        AgenticTask task = current.get();
        var intervention = oversight.handleIntervention(task, InterventionType.CANCEL,
                "User requested cancellation", null);
        task = update(task.id(), t -> t.withIntervention(intervention));
        AgenticTask cancelled = finish(task, TaskStatus.CANCELLED, "User requested cancellation", Instant.now());
        completionOf(cancelled.id()).complete(OrchestrationResult.of(cancelled, 0L));
        return true;
    }

    public ExecutionStatus getExecutionStatus() {
        Optional<AgenticTask> current = stateStore.getCurrentTask();
        String stepId = runningStepId;
        Optional<TaskStep> step = stepId == null ? Optional.empty()
                : current.flatMap(t -> t.findStep(stepId));
        return new ExecutionStatus(runningTaskId != null, current, step);
    }

    /**
     * Replaces the action of a step that has not completed. Only allowed while the task
     * is not being driven; pause it first.
     */
    public AgenticTask modifyStep(String taskId, String stepId, AgentAction replacement) {
        requireIdle(taskId);
        AgenticTask task = stateStore.findTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (task.status().isTerminal()) {
            throw new IllegalStateException("Task " + taskId + " is " + task.status());
        }
        TaskStep step = task.findStep(stepId)
                .orElseThrow(() -> new IllegalArgumentException("Task " + taskId + " has no step " + stepId));
        if (step.status() == StepStatus.COMPLETED) {
            throw new IllegalStateException("Step " + stepId + " already completed");
        }
        var intervention = oversight.handleIntervention(task, InterventionType.MODIFY,
                "Step " + stepId + " replaced with " + replacement.type().label(), replacement.description());
        TaskStep modified = step.withAction(replacement).resetForRetry();
        AgenticTask updated = update(taskId, t -> t.withStep(modified)
                .withApprovalRequired(t.approvalRequired() || replacement.requiresApproval())
                .withIntervention(intervention));
        publish("step.modified", taskId, stepId, Map.of("actionType", replacement.type().label()));
        log.info("Step {} of task {} now runs {}", stepId, taskId, replacement.type().label());
        return updated;
    }

    /**
     * Cancels the running or current task and plans {@code newGoal} to run next.
     *
     * @return the new task's id
     */
    public String redirectExecution(String newGoal, String reason) {
        AgenticTask planned = plan(newGoal);
        Optional<AgenticTask> current = stateStore.getCurrentTask().filter(t -> !t.status().isTerminal());
        AgenticTask replacement = current.isPresent()
                ? planned.annotate("redirectedFrom", current.get().id()) : planned;
        completions.put(replacement.id(), new CompletableFuture<>());

        synchronized (this) {
            if (runningTaskId != null) {
                String from = runningTaskId;
                persist(replacement.id(), pushFront(replacement));
                signalRunning(InterventionType.REDIRECT, reason, newGoal);
                publish("task.redirected", from, null, Map.of("to", replacement.id(), "goal", newGoal));
                return replacement.id();
            }
        }
        current.ifPresent(task -> {
            var intervention = oversight.handleIntervention(task, InterventionType.REDIRECT, reason, newGoal);
            AgenticTask recorded = update(task.id(), t -> t.withIntervention(intervention));
            AgenticTask cancelled = finish(recorded, TaskStatus.CANCELLED, "Redirected: " + reason, Instant.now());
            completionOf(cancelled.id()).complete(OrchestrationResult.of(cancelled, 0L));
            publish("task.redirected", task.id(), null, Map.of("to", replacement.id(), "goal", newGoal));
        });
        dispatch(replacement);
        return replacement.id();
    }

    /**
     * Applies feedback to a stored task through the planner and stores the new version.
     */
    public AgenticTask adaptTask(String taskId, String feedback) {
        requireIdle(taskId);
        AgenticTask task = stateStore.findTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        AgenticTask adapted = planner.adaptPlan(task, feedback);
        AgenticTask stored = update(taskId, t -> adapted);
        publish("task.adapted", taskId, null, Map.of("version", stored.metadata().version()));
        return stored;
    }

    @PreDestroy
    public void shutdown() {
        String running = runningTaskId;
        if (running != null) {
            signals.put(running, new HumanIntervention("INT-shutdown", running, InterventionType.PAUSE,
                    "Shutting down", null, Instant.now()));
            oversight.cancelPending(running);
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Orchestrator worker did not stop within 5s");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    // --- scheduling ---

    private AgenticTask plan(String goal) {
        var context = TaskContext.of(workspaceRoot().toString());
        AgenticTask task = planner.decomposeGoal(goal, context);
        var payload = new HashMap<String, Object>();
        payload.put("goal", task.goal());
        payload.put("steps", task.steps().size());
        payload.put("riskLevel", task.riskLevel().name());
        payload.put("approvalRequired", task.approvalRequired());
        publish("task.planned", task.id(), null, payload);
        return task;
    }

    /**
     * Starts the task on the worker if it is idle, otherwise queues it.
     */
    private synchronized void dispatch(AgenticTask task) {
        if (busy) {
            if (stateStore.getQueue().stream().noneMatch(q -> q.id().equals(task.id()))) {
                persist(task.id(), () -> stateStore.unparkTask(task.id()));
                persist(task.id(), () -> stateStore.addTaskToQueue(task));
                publish("task.queued", task.id(), null, Map.of("queueSize", stateStore.queueSize()));
            }
            return;
        }
        busy = true;
        AgenticTask active;
        try {
            active = activate(task);
        } catch (RuntimeException e) {
            busy = false;
            throw e;
        }
        runningTaskId = active.id();
        worker.submit(() -> drive(active.id()));
    }

    /**
     * Makes the task current: a paused predecessor is parked, steps interrupted by a
     * crash are put back in line.
     */
    private AgenticTask activate(AgenticTask task) {
        String taskId = task.id();
        Optional<AgenticTask> current = stateStore.getCurrentTask();
        if (current.isPresent() && !current.get().id().equals(taskId) && !current.get().status().isTerminal()) {
            AgenticTask displaced = current.get();
            persist(displaced.id(), () -> stateStore.parkTask(displaced));
            log.info("Parked task {} ({}) in favour of {}", displaced.id(), displaced.status(), taskId);
        }
        AgenticTask latest = stateStore.findTask(taskId).orElse(task);
        persist(taskId, () -> stateStore.removeFromQueue(taskId));
        persist(taskId, () -> stateStore.unparkTask(taskId));

        var steps = new ArrayList<TaskStep>(latest.steps().size());
        boolean recovered = false;
        for (TaskStep step : latest.steps()) {
            if (step.status() == StepStatus.EXECUTING) {
                steps.add(step.resetForRetry());
                recovered = true;
            } else if (step.status() == StepStatus.WAITING_APPROVAL) {
                steps.add(step.withStatus(StepStatus.PENDING));
                recovered = true;
            } else {
                steps.add(step);
            }
        }
        AgenticTask prepared = recovered ? latest.withSteps(steps) : latest;
        if (recovered) {
            log.warn("Task {} had interrupted steps; they were reset to pending", taskId);
        }
        persist(taskId, () -> stateStore.setCurrentTask(prepared));
        return prepared;
    }

    private void drive(String firstTaskId) {
        String next = firstTaskId;
        while (next != null) {
            long start = System.currentTimeMillis();
            runSafely(next, start);
            next = completeAndAdvance(next, start);
        }
    }

    /**
     * Reports the finished run and pulls the next queued task. Both happen under the
     * orchestrator's monitor, so a caller woken by the completion sees the worker idle.
     */
    private synchronized String completeAndAdvance(String finishedTaskId, long start) {
        runningTaskId = null;
        runningStepId = null;
        AgenticTask finalState = stateStore.findTask(finishedTaskId).orElse(null);
        CompletableFuture<OrchestrationResult> future = completionOf(finishedTaskId);
        if (finalState != null) {
            future.complete(OrchestrationResult.of(finalState, System.currentTimeMillis() - start));
        } else {
            future.completeExceptionally(new IllegalStateException("Task " + finishedTaskId + " disappeared"));
        }

        if (properties.getOrchestrator().isAutoDrainQueue()) {
            Optional<AgenticTask> queued;
            try {
                queued = stateStore.getNextTask();
            } catch (PersistenceException e) {
                flushWithRetry(null, e);
                queued = Optional.empty();
            }
            if (queued.isPresent()) {
                try {
                    AgenticTask active = activate(queued.get());
                    runningTaskId = active.id();
                    log.info("Pulled task {} from the queue", active.id());
                    return active.id();
                } catch (RuntimeException e) {
                    log.error("Could not activate queued task {}: {}", queued.get().id(), e.getMessage(), e);
                }
            }
        }
        busy = false;
        return null;
    }

    private void runSafely(String taskId, long start) {
        MdcContext.setTask(taskId);
        try {
            run(taskId);
        } catch (RuntimeException e) {
            FailureKind kind = errorClassifier.classify(e);
            log.error("Task {} aborted by unexpected {}: {}", taskId, kind.label(), e.getMessage(), e);
            stateStore.findTask(taskId)
                    .filter(t -> !t.status().isTerminal())
                    .ifPresent(t -> finish(t, TaskStatus.FAILED,
                            "Unexpected " + kind.label() + ": " + e.getMessage(), Instant.ofEpochMilli(start)));
        } finally {
            MdcContext.clear();
        }
    }

    // --- the step loop ---

    private void run(String taskId) {
        Instant startedAt = Instant.now();
        AgenticTask task = transition(taskId, TaskStatus.EXECUTING);
        publish("task.started", taskId, null, Map.of("goal", task.goal(), "steps", task.steps().size()));
        oversight.showProgress(task);

        var run = new RunState();
        while (true) {
            HumanIntervention signal = takeSignal(task);
            if (signal != null) {
                task = update(taskId, recordIntervention(signal));
                switch (signal.type()) {
                    case PAUSE, MODIFY -> {
                        pause(task, signal.reason());
                        return;
                    }
                    case CANCEL -> {
                        finish(task, TaskStatus.CANCELLED, signal.reason(), startedAt);
                        return;
                    }
                    case REDIRECT -> {
                        finish(task, TaskStatus.CANCELLED, "Redirected: " + signal.reason(), startedAt);
                        return;
                    }
                }
            }

            task = cascadeSkips(task);
            Optional<TaskStep> next = nextRunnable(task);
            if (next.isEmpty()) {
                task = skipUnreachable(task);
                finish(task, TaskStatus.COMPLETED, null, startedAt);
                return;
            }

            StepRun result = runStep(task, next.get(), run);
            task = result.task();
            if (result.abortReason() != null) {
                finish(task, TaskStatus.FAILED, result.abortReason(), startedAt);
                return;
            }
        }
    }

    private StepRun runStep(AgenticTask task, TaskStep step, RunState run) {
        String taskId = task.id();
        runningStepId = step.id();
        task = update(taskId, t -> t.withCurrentStep(step.id()));
        publish("step.started", taskId, step.id(), Map.of(
                "actionType", step.action().type().label(),
                "description", step.description()));

        StepOutcome outcome = executor.executeStep(step, contextFor(task));

        if (outcome.awaitingApproval()) {
            return awaitApproval(task, outcome.step());
        }

        long durationMs = outcome.result() != null ? outcome.result().performance().executionTimeMs() : 0L;
        task = update(taskId, t -> t.withStep(outcome.step()));

        if (outcome.succeeded()) {
            recordHistory(taskId, outcome.step(), durationMs, true, null, false);
            publish("step.completed", taskId, step.id(), Map.of("durationMs", durationMs));
            oversight.showProgress(task);
            return new StepRun(task, null);
        }
        return handleFailure(task, outcome, durationMs, run);
    }

    private StepRun awaitApproval(AgenticTask task, TaskStep waiting) {
        String taskId = task.id();
        task = update(taskId, t -> t.withStep(waiting));
        task = transition(taskId, TaskStatus.WAITING_APPROVAL);

        ApprovalRequest request = oversight.requestApproval(task, waiting);
        task = update(taskId, t -> t.withApproval(request));
        Duration timeout = stateStore.getUserPreferences().approvalTimeout();
        ApprovalRequest resolved = oversight.awaitDecision(request, timeout);
        task = update(taskId, t -> t.withApproval(resolved));

        if (pendingSignal(taskId)) {
            // put the step back in line; the signal is handled at the top of the loop
            task = update(taskId, t -> t.withStep(waiting.withStatus(StepStatus.PENDING)));
            task = transition(taskId, TaskStatus.EXECUTING);
            return new StepRun(task, null);
        }

        if (resolved.isApproved()) {
            TaskStep approved = waiting.withStatus(StepStatus.PENDING);
            AgentAction modified = resolved.response().modifiedAction();
            TaskStep next = modified != null ? approved.withAction(modified) : approved;
            task = update(taskId, t -> t.withStep(next));
            task = transition(taskId, TaskStatus.EXECUTING);
            log.info("Step {} approved, resuming", waiting.id());
            return new StepRun(task, null);
        }

        String feedback = resolved.response() != null && resolved.response().feedback() != null
                ? resolved.response().feedback() : "Approval rejected";
        TaskStep skipped = waiting.skipped("Approval rejected: " + feedback);
        task = update(taskId, t -> t.withStep(skipped).annotate("rejection." + waiting.id(), feedback));
        recordHistory(taskId, skipped, 0L, false, skipped.error(), false);
        publish("step.skipped", taskId, waiting.id(), Map.of("reason", skipped.error()));
        task = cascadeSkips(task);

        boolean pendingLeft = task.steps().stream().anyMatch(s -> s.status() == StepStatus.PENDING);
        if (task.approvalRequired() && !pendingLeft) {
            return new StepRun(task, "Approval rejected for step " + waiting.id() + ": " + feedback);
        }
        task = transition(taskId, TaskStatus.EXECUTING);
        oversight.showProgress(task);
        return new StepRun(task, null);
    }

    private StepRun handleFailure(AgenticTask task, StepOutcome outcome, long durationMs, RunState run) {
        String taskId = task.id();
        TaskStep failed = outcome.step();
        StepFailure failure = outcome.failure();
        recordHistory(taskId, failed, durationMs, false, failure.message(), failure.rolledBack());
        publish("step.failed", taskId, failed.id(), Map.of(
                "kind", failure.kind().label(),
                "error", String.valueOf(failure.message()),
                "rolledBack", failure.rolledBack()));

        int retriesUsed = run.transientRetries.getOrDefault(failed.id(), 0);
        int bound = properties.getOrchestrator().getTransientRetries();
        if (errorClassifier.recoveryFor(failure.kind(), retriesUsed, bound) == ErrorClassifier.Recovery.RETRY) {
            run.transientRetries.put(failed.id(), retriesUsed + 1);
            Duration delay = properties.getExecutor().backoffFor(retriesUsed + 1);
            log.warn("Step {} hit {} (retry {}/{}), retrying in {}ms", failed.id(), failure.kind().label(),
                    retriesUsed + 1, bound, delay.toMillis());
            if (metrics != null) {
                metrics.recordRetry(failure.kind().label());
            }
            publish("step.retrying", taskId, failed.id(), Map.of("attempt", failed.attempts() + 1));
            sleep(delay);
            return new StepRun(update(taskId, t -> t.withStep(failed.resetForRetry())), null);
        }

        int escalations = run.escalations.merge(failed.id(), 1, Integer::sum);
        EscalationDecision decision;
        if (escalations > properties.getOrchestrator().getMaxEscalationsPerStep()) {
            log.warn("Step {} exceeded {} escalations, aborting", failed.id(),
                    properties.getOrchestrator().getMaxEscalationsPerStep());
            decision = EscalationDecision.ABORT;
        } else {
            decision = oversight.escalateIssue(task, failed, failure);
        }

        switch (decision) {
            case RETRY -> {
                run.transientRetries.remove(failed.id());
                return new StepRun(update(taskId, t -> t.withStep(failed.resetForRetry())), null);
            }
            case SKIP -> {
                TaskStep skipped = failed.skipped("Skipped after failure: " + failure.message());
                AgenticTask updated = cascadeSkips(update(taskId, t -> t.withStep(skipped)));
                publish("step.skipped", taskId, failed.id(), Map.of("reason", skipped.error()));
                oversight.showProgress(updated);
                return new StepRun(updated, null);
            }
            default -> {
                return new StepRun(task, "Step " + failed.id() + " (" + failed.action().type().label()
                        + ") failed: " + failure.message());
            }
        }
    }

    /**
     * First pending step, in declaration order, whose dependencies are all completed.
     */
    static Optional<TaskStep> nextRunnable(AgenticTask task) {
        Set<String> completed = completedIds(task);
        return task.steps().stream()
                .filter(s -> s.status() == StepStatus.PENDING)
                .filter(s -> completed.containsAll(s.dependencies()))
                .findFirst();
    }

    /**
     * Skips pending steps that depend on a skipped or failed step, transitively.
     */
    private AgenticTask cascadeSkips(AgenticTask task) {
        var steps = new ArrayList<>(task.steps());
        Map<String, StepStatus> statusById = new HashMap<>();
        steps.forEach(s -> statusById.put(s.id(), s.status()));
        boolean changed = false;
        boolean progress = true;
        while (progress) {
            progress = false;
            for (int i = 0; i < steps.size(); i++) {
                TaskStep step = steps.get(i);
                if (step.status() != StepStatus.PENDING) {
                    continue;
                }
                Optional<String> blocker = step.dependencies().stream()
                        .filter(dep -> statusById.get(dep) == StepStatus.SKIPPED || statusById.get(dep) == StepStatus.FAILED)
                        .findFirst();
                if (blocker.isPresent()) {
                    TaskStep skipped = step.skipped("Dependency " + blocker.get() + " did not complete");
                    steps.set(i, skipped);
                    statusById.put(step.id(), StepStatus.SKIPPED);
                    publish("step.skipped", task.id(), step.id(), Map.of("reason", skipped.error()));
                    changed = true;
                    progress = true;
                }
            }
        }
        if (!changed) {
            return task;
        }
        return update(task.id(), t -> t.withSteps(steps));
    }

    /**
     * Pending steps left when nothing is runnable wait on steps that can never finish.
     */
    private AgenticTask skipUnreachable(AgenticTask task) {
        if (task.steps().stream().noneMatch(s -> s.status() == StepStatus.PENDING)) {
            return task;
        }
        var steps = task.steps().stream()
                .map(s -> s.status() == StepStatus.PENDING ? s.skipped("Dependencies can never complete") : s)
                .toList();
        log.warn("Task {} has steps with unsatisfiable dependencies; skipping them", task.id());
        return update(task.id(), t -> t.withSteps(steps));
    }

    // --- terminal handling ---

    private void pause(AgenticTask task, String reason) {
        AgenticTask paused = update(task.id(), t -> t.withCurrentStep(null));
        paused = transition(paused.id(), TaskStatus.PAUSED);
        publish("task.paused", paused.id(), null, Map.of("reason", String.valueOf(reason),
                "completedSteps", paused.progress().completedSteps()));
        oversight.showProgress(paused);
        log.info("Task {} paused after {} of {} steps", paused.id(), paused.progress().completedSteps(),
                paused.progress().totalSteps());
    }

    private AgenticTask finish(AgenticTask task, TaskStatus status, String reason, Instant startedAt) {
        String taskId = task.id();
        long durationMs = Duration.between(startedAt, Instant.now()).toMillis();
        AgenticTask done = update(taskId, t -> {
            AgenticTask next = t.withCurrentStep(null).withActualDuration(durationMs);
            if (reason != null) {
                next = next.annotate(status == TaskStatus.FAILED ? "failureReason" : "cancelReason", reason);
            }
            return next;
        });
        done = transition(taskId, status);
        oversight.cancelPending(taskId);

        if (metrics != null) {
            metrics.recordTaskResult(status.name().toLowerCase(Locale.ROOT));
        }
        var payload = new HashMap<String, Object>();
        payload.put("status", status.name());
        payload.put("completedSteps", done.progress().completedSteps());
        payload.put("durationMs", durationMs);
        if (reason != null) {
            payload.put("reason", reason);
        }
        publish("task." + status.name().toLowerCase(Locale.ROOT), taskId, null, payload);
        oversight.showProgress(done);
        if (status == TaskStatus.COMPLETED) {
            log.info("Task {} completed in {}ms", taskId, durationMs);
        } else {
            log.warn("Task {} {}: {}", taskId, status.name().toLowerCase(Locale.ROOT), reason);
        }

        Optional<UserFeedback> feedback = oversight.collectFeedback(done);
        if (feedback.isPresent()) {
            done = learnFrom(done, feedback.get());
        }
        return done;
    }

    private AgenticTask learnFrom(AgenticTask task, UserFeedback feedback) {
        UserPreferences preferences = stateStore.getUserPreferences();
        LearningData learning = preferences.learningEnabled() ? deriveLearning(task, feedback) : null;
        AgenticTask updated = update(task.id(), t -> t.withFeedback(feedback, learning));
        if (learning != null) {
            persist(task.id(), () -> stateStore.addLearningData(learning));
            log.info("Recorded {} learning pattern(s) from feedback on task {}", learning.patterns().size(), task.id());
        }
        return updated;
    }

    /**
     * Turns a rating into pattern tags: well rated runs mark their completed action
     * types as successful, poorly rated runs mark the task profile as failed.
     */
    static LearningData deriveLearning(AgenticTask task, UserFeedback feedback) {
        String priority = task.priority().name().toLowerCase(Locale.ROOT);
        String risk = task.riskLevel().name().toLowerCase(Locale.ROOT);
        var patterns = new ArrayList<String>();
        if (feedback.rating() >= 4) {
            patterns.add("successful_" + priority + "_priority_task");
            patterns.add("successful_" + risk + "_risk_task");
            task.steps().stream()
                    .filter(s -> s.status() == StepStatus.COMPLETED)
                    .map(s -> "successful_" + s.action().type().label())
                    .distinct()
                    .forEach(patterns::add);
        }
        if (feedback.rating() <= 2) {
            patterns.add("failed_" + priority + "_priority_task");
            patterns.add("failed_" + risk + "_risk_task");
        }
        if (feedback.wouldUseAgain()) {
            patterns.add("user_satisfaction_high");
        }

        var hints = new LinkedHashMap<String, String>();
        hints.put("preferredComplexity", priority);
        hints.put("riskTolerance", feedback.rating() <= 2 && task.riskLevel().isAtLeast(RiskLevel.HIGH)
                ? "conservative" : risk);
        hints.put("feedbackStyle", feedback.comments() != null && !feedback.comments().isBlank() ? "detailed" : "minimal");

        return new LearningData(task.id(), patterns,
                feedback.rating() >= 4 ? List.of(task.goal()) : List.of(),
                feedback.rating() <= 2 ? List.of(task.goal()) : List.of(),
                hints, feedback.suggestions(), Instant.now());
    }

    // --- signals ---

    private boolean signalRunning(InterventionType type, String reason, String instructions) {
        String taskId;
        synchronized (this) {
            taskId = runningTaskId;
        }
        if (taskId == null) {
            return false;
        }
        AgenticTask task = stateStore.findTask(taskId).orElse(null);
        if (task == null) {
            return false;
        }
        HumanIntervention intervention = oversight.handleIntervention(task, type, reason, instructions);
        signals.merge(taskId, intervention, (existing, incoming) ->
                existing.type() == InterventionType.CANCEL ? existing : incoming);
        if (type == InterventionType.CANCEL || type == InterventionType.REDIRECT) {
            oversight.cancelPending(taskId);
        }
        return true;
    }

    /**
     * Signals from the public API win over ones polled from the human interface.
     */
    private HumanIntervention takeSignal(AgenticTask task) {
        HumanIntervention signal = signals.remove(task.id());
        if (signal != null) {
            return signal;
        }
        Optional<HumanIntervention> polled = oversight.pollIntervention(task.id());
        if (polled.isEmpty()) {
            return null;
        }
        HumanIntervention intervention = polled.get();
        if (intervention.type() == InterventionType.REDIRECT && intervention.instructions() != null) {
            try {
                AgenticTask replacement = plan(intervention.instructions()).annotate("redirectedFrom", task.id());
                completions.put(replacement.id(), new CompletableFuture<>());
                persist(replacement.id(), pushFront(replacement));
            } catch (PlanningException e) {
                log.warn("Redirect of task {} could not be planned, pausing instead: {}", task.id(), e.getMessage());
                return new HumanIntervention(intervention.id(), task.id(), InterventionType.PAUSE,
                        "Redirect failed: " + e.getMessage(), intervention.instructions(), intervention.timestamp());
            }
        }
        return intervention;
    }

    private boolean pendingSignal(String taskId) {
        return signals.containsKey(taskId);
    }

    private static UnaryOperator<AgenticTask> recordIntervention(HumanIntervention intervention) {
        return t -> t.interventions().stream().anyMatch(i -> i.id().equals(intervention.id()))
                ? t : t.withIntervention(intervention);
    }

    private Runnable pushFront(AgenticTask task) {
        return () -> stateStore.pushTaskToFront(task);
    }

    private void requireIdle(String taskId) {
        if (taskId.equals(runningTaskId)) {
            throw new IllegalStateException("Task " + taskId + " is running; pause it first");
        }
    }

    // --- state store access ---

    private AgenticTask transition(String taskId, TaskStatus to) {
        AgenticTask before = stateStore.findTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (before.status() == to) {
            return before;
        }
        AgenticTask after;
        try {
            after = stateStore.updateTaskStatus(taskId, to);
        } catch (PersistenceException e) {
            flushWithRetry(taskId, e);
            after = stateStore.findTask(taskId).orElseThrow(() -> e);
        }
        publish("task.status", taskId, null, Map.of("from", before.status().name(), "to", to.name()));
        return after;
    }

    private AgenticTask update(String taskId, UnaryOperator<AgenticTask> change) {
        try {
            return stateStore.updateTask(taskId, change);
        } catch (PersistenceException e) {
            flushWithRetry(taskId, e);
            return stateStore.findTask(taskId).orElseThrow(() -> e);
        }
    }

    private void persist(String taskId, Runnable mutation) {
        try {
            mutation.run();
        } catch (PersistenceException e) {
            flushWithRetry(taskId, e);
        }
    }

    private void recordHistory(String taskId, TaskStep step, long durationMs, boolean success,
                               String error, boolean rolledBack) {
        persist(taskId, () -> stateStore.recordExecutionStep(taskId, step.id(), step.action().type().label(),
                step.status(), durationMs, success, error, rolledBack));
    }

    /**
     * The in-memory change already happened; only the flush is retried. If every retry
     * fails, progress is kept and a warning event goes out.
     */
    private void flushWithRetry(String taskId, PersistenceException first) {
        var config = properties.getOrchestrator();
        PersistenceException last = first;
        for (int attempt = 1; attempt <= config.getPersistenceRetries(); attempt++) {
            sleep(config.getPersistenceRetryDelay());
            try {
                stateStore.saveState();
                log.info("State flush succeeded on retry {}", attempt);
                return;
            } catch (PersistenceException e) {
                last = e;
            }
        }
        log.warn("State could not be persisted after {} retries, continuing in memory: {}",
                config.getPersistenceRetries(), last.getMessage());
        publish("state.persistence_warning", taskId, null, Map.of("error", String.valueOf(last.getMessage())));
    }

    private ExecutionContext contextFor(AgenticTask task) {
        var workspace = properties.getWorkspace();
        Set<String> approved = new HashSet<>();
        for (ApprovalRequest request : task.approvals()) {
            if (request.isApproved()) {
                approved.add(request.action().id());
                if (request.response() != null && request.response().modifiedAction() != null) {
                    approved.add(request.response().modifiedAction().id());
                }
            }
        }
        return new ExecutionContext(task.id(), workspaceRoot(),
                ExecutionContext.ResourceLimits.defaults(),
                new ExecutionContext.ExecutionConstraints(workspace.getMaxFileSizeBytes(),
                        workspace.getRestrictedPaths(), workspace.getSecurityLevel()),
                completedIds(task), approved, properties.getExecutor().getProviderRetries());
    }

    private Path workspaceRoot() {
        return Paths.get(properties.getWorkspace().getRoot()).toAbsolutePath().normalize();
    }

    private static Set<String> completedIds(AgenticTask task) {
        return task.steps().stream()
                .filter(s -> s.status() == StepStatus.COMPLETED)
                .map(TaskStep::id)
                .collect(Collectors.toSet());
    }

    private void publish(String type, String taskId, String stepId, Map<String, Object> payload) {
        eventBus.publish(FlowcodeEvent.of(type, taskId, stepId, payload));
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record StepRun(AgenticTask task, String abortReason) {}

    /** Per-run retry bookkeeping. */
    private static final class RunState {
        final Map<String, Integer> transientRetries = new HashMap<>();
        final Map<String, Integer> escalations = new HashMap<>();
    }
}
