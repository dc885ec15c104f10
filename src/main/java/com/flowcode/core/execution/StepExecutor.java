package com.flowcode.core.execution;

import com.flowcode.core.config.FlowcodeProperties;
import com.flowcode.core.logging.MdcContext;
import com.flowcode.core.metrics.FlowcodeMetrics;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.FileChange;
import com.flowcode.core.model.PerformanceMetrics;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskStep;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.validation.ValidatorRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs a single step: pre-flight checks, backups, provider dispatch under a timeout,
 * validation and rollback.
 * <p>
 * Step-level errors never escape as exceptions; they come back as a
 * {@link StepOutcome} carrying a {@link StepFailure}.
 */
@Service
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    /** How long a cancelled provider gets to stop before rollback goes ahead anyway. */
    static final Duration CANCEL_GRACE = Duration.ofSeconds(10);

    private final CapabilityRegistry capabilities;
    private final ValidatorRegistry validators;
    private final BackupManager backups;
    private final FlowcodeProperties.Executor config;
    private final FlowcodeMetrics metrics;

    private final ExecutorService providerPool = Executors.newCachedThreadPool(new ProviderThreadFactory());

    public StepExecutor(CapabilityRegistry capabilities,
                        ValidatorRegistry validators,
                        BackupManager backups,
                        FlowcodeProperties properties,
                        @Autowired(required = false) FlowcodeMetrics metrics) {
        this.capabilities = capabilities;
        this.validators = validators;
        this.backups = backups;
        this.config = properties.getExecutor();
        this.metrics = metrics;
    }

    /**
     * Executes {@code step}. The step must be pending with every dependency listed in
     * {@link ExecutionContext#completedStepIds()}.
     */
    public StepOutcome executeStep(TaskStep step, ExecutionContext context) {
        AgentAction action = step.action();
        MdcContext.setStep(context.taskId(), step.id(), action.type().label());
        try {
            try {
                preflight(step, context);
            } catch (DependencyNotSatisfiedException e) {
                log.error("Pre-flight check failed for step {}: {}", step.id(), e.getMessage());
                return failure(step, null, FailureKind.DEPENDENCY_NOT_SATISFIED, e.getMessage(), false);
            }

            if (action.requiresApproval() && !context.approvedActionIds().contains(action.id())) {
                log.info("Step {} requires approval before it can run", step.id());
                return new StepOutcome(step.withStatus(StepStatus.WAITING_APPROVAL), null, null);
            }

            TaskStep running = step.started(Instant.now());
            return run(running, context);
        } finally {
            MdcContext.clearStep();
        }
    }

    private void preflight(TaskStep step, ExecutionContext context) {
        if (step.status() != StepStatus.PENDING) {
            throw new DependencyNotSatisfiedException(
                    "Step " + step.id() + " is " + step.status() + ", expected PENDING");
        }
        var missing = step.dependencies().stream()
                .filter(dep -> !context.completedStepIds().contains(dep))
                .toList();
        if (!missing.isEmpty()) {
            throw new DependencyNotSatisfiedException(
                    "Step " + step.id() + " depends on unfinished step(s) " + String.join(", ", missing));
        }
    }

    private StepOutcome run(TaskStep step, ExecutionContext context) {
        AgentAction action = step.action();
        long start = System.currentTimeMillis();

        List<BackupManager.FileBackup> snapshot;
        try {
            snapshot = backups.snapshot(action, context);
        } catch (RuntimeException e) {
            log.error("Could not back up files for step {}: {}", step.id(), e.getMessage(), e);
            return failure(step, null, FailureKind.EXECUTION_ERROR, "Backup failed: " + e.getMessage(), false);
        }

        var provider = capabilities.providerFor(action.type());
        if (provider.isEmpty()) {
            return failure(step, null, FailureKind.EXECUTION_ERROR,
                    "No capability provider for " + action.type().label(), false);
        }

        Duration timeout = timeoutFor(action, context);
        StepResult result;
        try {
            result = invokeWithRetry(provider.get(), action, context, timeout);
        } catch (ProviderTimeoutException e) {
            return rolledBackFailure(step, snapshot, context, start, FailureKind.PROVIDER_TIMEOUT, e.getMessage(), "timeout");
        } catch (ProviderUnavailableException e) {
            return rolledBackFailure(step, snapshot, context, start, FailureKind.PROVIDER_UNAVAILABLE, e.getMessage(), "error");
        } catch (RuntimeException e) {
            log.warn("Step {} failed: {}", step.id(), e.getMessage());
            return rolledBackFailure(step, snapshot, context, start, FailureKind.EXECUTION_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), "error");
        }

        long elapsed = System.currentTimeMillis() - start;
        result = result
                .withPerformance(result.performance().withExecutionTime(elapsed))
                .withChanges(attachBackups(result.changes(), snapshot));

        if (!result.success()) {
            String reason = result.warnings().isEmpty()
                    ? "Action " + action.type().label() + " reported failure"
                    : String.join("; ", result.warnings());
            boolean restored = restore(snapshot, context, action, "error");
            result = markRolledBack(result, restored);
            record(action, false, elapsed);
            return failure(step, result, FailureKind.EXECUTION_ERROR, reason, restored);
        }

        List<ValidationResult> validations = validators.validateAll(action, result, context);
        result = result.withValidations(validations);
        var blocking = validations.stream().filter(ValidationResult::isBlocking).toList();
        for (ValidationResult v : validations) {
            if (!v.passed() && !v.isBlocking()) {
                result = result.withWarning(v.rule().id() + ": " + v.message());
            }
        }

        if (!blocking.isEmpty()) {
            String reason = "Validation failed: " + blocking.stream()
                    .map(v -> v.rule().id() + " (" + v.message() + ")")
                    .collect(Collectors.joining("; "));
            boolean restored = restore(snapshot, context, action, "validation");
            result = markRolledBack(result.withSuccess(false), restored);
            record(action, false, elapsed);
            return failure(step, result, FailureKind.VALIDATION_FAILURE, reason, restored);
        }

        record(action, true, elapsed);
        log.info("Step {} ({}) completed in {}ms", step.id(), action.type().label(), elapsed);
        return new StepOutcome(step.finished(StepStatus.COMPLETED, result, null, Instant.now()), result, null);
    }

    private StepResult invokeWithRetry(CapabilityProvider provider, AgentAction action,
                                       ExecutionContext context, Duration timeout) {
        int retries = Math.max(0, context.providerRetries());
        for (int attempt = 0; ; attempt++) {
            var stopped = new CompletableFuture<Void>();
            Future<StepResult> future = providerPool.submit(() -> {
                try {
                    return provider.perform(action, context);
                } finally {
                    stopped.complete(null);
                }
            });
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                awaitStopped(stopped, action);
                throw new ProviderTimeoutException(
                        "Action " + action.type().label() + " timed out after " + timeout.toMillis() + "ms");
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new CapabilityException("Interrupted while waiting for " + action.type().label(), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ProviderUnavailableException unavailable) {
                    if (attempt >= retries) {
                        throw unavailable;
                    }
                    Duration delay = config.backoffFor(attempt + 1);
                    log.warn("Provider unavailable for {} (attempt {}/{}), retrying in {}ms: {}",
                            action.id(), attempt + 1, retries + 1, delay.toMillis(), cause.getMessage());
                    if (metrics != null) {
                        metrics.recordRetry(FailureKind.PROVIDER_UNAVAILABLE.label());
                    }
                    sleep(delay);
                    continue;
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new CapabilityException(String.valueOf(cause.getMessage()), cause);
            }
        }
    }

    /**
     * Blocks until a cancelled provider call has returned, so a rollback cannot race
     * with writes the provider is still making.
     */
    private static void awaitStopped(CompletableFuture<Void> stopped, AgentAction action) {
        try {
            stopped.get(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Provider for {} ignored cancellation for {}ms; rolling back anyway",
                    action.id(), CANCEL_GRACE.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            // stopped is only ever completed normally
            throw new IllegalStateException(e);
        }
    }

    /**
     * Timeout for one provider call: the action's estimate scaled by the configured
     * factor, at least the configured minimum, never above the task's time limit.
     */
    Duration timeoutFor(AgentAction action, ExecutionContext context) {
        long scaled = Math.max(action.estimatedTimeMs() * config.getTimeoutFactor(),
                config.getMinStepTimeout().toMillis());
        long ceiling = context.resources().timeLimit().toMillis();
        return Duration.ofMillis(Math.min(scaled, ceiling));
    }

    private StepOutcome rolledBackFailure(TaskStep step, List<BackupManager.FileBackup> snapshot,
                                          ExecutionContext context, long start, FailureKind kind,
                                          String message, String cause) {
        long elapsed = System.currentTimeMillis() - start;
        boolean restored = restore(snapshot, context, step.action(), cause);
        record(step.action(), false, elapsed);
        var result = new StepResult(false, message, List.of(), List.of(),
                PerformanceMetrics.wallClock(elapsed), List.of(message), List.of());
        if (restored) {
            result = result.withWarning("Changes rolled back from backup");
        }
        log.warn("Step {} failed with {}: {}", step.id(), kind, message);
        return failure(step, result, kind, message, restored);
    }

    private boolean restore(List<BackupManager.FileBackup> snapshot, ExecutionContext context,
                            AgentAction action, String cause) {
        if (snapshot.isEmpty()) {
            return false;
        }
        var restored = backups.restore(snapshot, context.workspaceRoot());
        if (metrics != null && !restored.isEmpty()) {
            metrics.recordRollback(action.type().label(), cause);
        }
        log.info("Rolled back {} file(s) for action {} ({})", restored.size(), action.id(), cause);
        return !restored.isEmpty();
    }

    private static List<FileChange> attachBackups(List<FileChange> changes, List<BackupManager.FileBackup> snapshot) {
        if (snapshot.isEmpty()) {
            return changes;
        }
        Map<String, BackupManager.FileBackup> byPath = snapshot.stream()
                .collect(Collectors.toMap(BackupManager.FileBackup::relativePath, Function.identity(), (a, b) -> a));
        var attached = new ArrayList<FileChange>(changes.size());
        for (FileChange change : changes) {
            var backup = byPath.get(change.path());
            attached.add(backup != null ? change.withBackup(backup.contentAsText()) : change);
        }
        return attached;
    }

    private static StepResult markRolledBack(StepResult result, boolean restored) {
        if (!restored) {
            return result;
        }
        return result.withChanges(result.changes().stream().map(FileChange::markRolledBack).toList())
                .withWarning("Changes rolled back from backup");
    }

    private StepOutcome failure(TaskStep step, StepResult result, FailureKind kind, String message,
                                boolean rolledBack) {
        var failed = step.finished(StepStatus.FAILED, result, message, Instant.now());
        return new StepOutcome(failed, result, new StepFailure(kind, message, rolledBack));
    }

    private void record(AgentAction action, boolean success, long elapsed) {
        if (metrics != null) {
            metrics.recordStepExecution(action.type().label(), success, elapsed);
        }
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("Interrupted during retry backoff", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        providerPool.shutdownNow();
    }

    private static final class ProviderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "flowcode-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
