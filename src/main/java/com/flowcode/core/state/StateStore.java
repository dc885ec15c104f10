package com.flowcode.core.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flowcode.core.config.FlowcodeProperties;
import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.IllegalTaskTransitionException;
import com.flowcode.core.model.LearningData;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.TaskStep;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Durable single source of truth for task state.
 * <p>
 * Holds the current task, a FIFO queue of pending tasks, paused tasks displaced
 * by newer work, the append-only execution history, the task ledger statistics are
 * derived from, user preferences and the learning ledger. Every mutation runs under
 * one lock and is followed by a flush of the whole state to {@code agent-state.json};
 * a scheduled autosave flushes again on a fixed interval.
 */
@Service
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final Path stateFile;
    private final Duration autosaveInterval;
    private final int learningLimit;
    private final Map<String, String> defaultPreferences;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    private AgenticTask currentTask;
    private final Deque<AgenticTask> queue = new ArrayDeque<>();
    private final Map<String, AgenticTask> parked = new LinkedHashMap<>();
    private final Map<String, List<ExecutionRecord>> history = new LinkedHashMap<>();
    private final Map<String, TaskLedgerEntry> ledger = new LinkedHashMap<>();
    private final Map<String, String> preferences = new LinkedHashMap<>();
    private final Deque<LearningData> learning = new ArrayDeque<>();
    private Instant sessionStartTime = Instant.now();
    private Instant lastSaveTime;
    private boolean dirty;

    private ScheduledExecutorService autosaveScheduler;
    private ScheduledFuture<?> autosaveHandle;

    @Autowired
    public StateStore(FlowcodeProperties properties) {
        this(resolveStateFile(properties), properties.getState().getAutosaveInterval(),
                properties.getState().getLearningLimit(), preferenceDefaults(properties));
    }

    public StateStore(Path stateFile, Duration autosaveInterval, int learningLimit,
                      Map<String, String> defaultPreferences) {
        this.stateFile = stateFile;
        this.autosaveInterval = autosaveInterval;
        this.learningLimit = learningLimit;
        this.defaultPreferences = Map.copyOf(defaultPreferences);
        this.preferences.putAll(defaultPreferences);
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    private static Path resolveStateFile(FlowcodeProperties properties) {
        var state = properties.getState();
        return Paths.get(properties.getWorkspace().getRoot())
                .resolve(state.getDirectory())
                .resolve(state.getFileName())
                .toAbsolutePath()
                .normalize();
    }

    private static Map<String, String> preferenceDefaults(FlowcodeProperties properties) {
        var defaults = UserPreferences.defaults();
        defaults.put(UserPreferences.AUTO_APPROVAL_LEVEL, properties.getOversight().getAutoApprovalLevel());
        defaults.put(UserPreferences.APPROVAL_TIMEOUT, properties.getOversight().getApprovalTimeout().toString());
        return defaults;
    }

    // --- lifecycle ---

    /**
     * Loads persisted state and starts the autosave schedule.
     */
    @PostConstruct
    public void initialize() {
        loadState();
        startAutosave();
        log.info("State store initialized from {} (autosave every {}s)", stateFile, autosaveInterval.toSeconds());
    }

    /**
     * Stops the autosave schedule and performs a final flush.
     */
    @PreDestroy
    public void dispose() {
        stopAutosave();
        try {
            saveState();
        } catch (PersistenceException e) {
            log.error("Final state flush failed, last {} may be stale: {}", stateFile, e.getMessage(), e);
        }
    }

    void startAutosave() {
        lock.lock();
        try {
            if (autosaveHandle != null) {
                return;
            }
            autosaveScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "flowcode-autosave");
                t.setDaemon(true);
                return t;
            });
            long ms = autosaveInterval.toMillis();
            autosaveHandle = autosaveScheduler.scheduleAtFixedRate(this::autosave, ms, ms, TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    void stopAutosave() {
        lock.lock();
        try {
            if (autosaveHandle != null) {
                autosaveHandle.cancel(false);
                autosaveHandle = null;
            }
            if (autosaveScheduler != null) {
                autosaveScheduler.shutdown();
                autosaveScheduler = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isAutosaveRunning() {
        lock.lock();
        try {
            return autosaveHandle != null && !autosaveHandle.isCancelled();
        } finally {
            lock.unlock();
        }
    }

    private void autosave() {
        try {
            saveState();
        } catch (RuntimeException e) {
            log.warn("Autosave failed, will retry in {}s: {}", autosaveInterval.toSeconds(), e.getMessage());
        }
    }

    // --- persistence ---

    /**
     * Writes the whole state to disk via a temporary file and an atomic move.
     *
     * @throws PersistenceException if the file cannot be written; in-memory state is kept
     */
    public void saveState() {
        lock.lock();
        try {
            Instant now = Instant.now();
            var snapshot = new PersistedState(PersistedState.CURRENT_SCHEMA, currentTask, List.copyOf(queue),
                    new LinkedHashMap<>(parked), copyHistory(), new LinkedHashMap<>(ledger),
                    computeStatistics(), new LinkedHashMap<>(preferences), List.copyOf(learning),
                    sessionStartTime, now);
            try {
                Files.createDirectories(stateFile.getParent());
                Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
                mapper.writeValue(temp.toFile(), snapshot);
                try {
                    Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                dirty = true;
                throw new PersistenceException("Failed to write state file " + stateFile + ": " + e.getMessage(), e);
            }
            lastSaveTime = now;
            dirty = false;
            log.debug("State saved to {}", stateFile);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces in-memory state with the persisted file, merged over defaults. An
     * unreadable file is set aside as {@code .corrupt} and defaults are used.
     */
    public void loadState() {
        lock.lock();
        try {
            clearInMemory();
            if (!Files.exists(stateFile)) {
                log.info("No state file at {}, starting fresh", stateFile);
                return;
            }
            PersistedState loaded;
            try {
                loaded = mapper.readValue(stateFile.toFile(), PersistedState.class);
            } catch (IOException e) {
                log.warn("State file {} is unreadable, falling back to defaults: {}", stateFile, e.getMessage());
                setAsideCorruptFile();
                return;
            }
            currentTask = loaded.currentTask();
            if (loaded.taskQueue() != null) {
                queue.addAll(loaded.taskQueue());
            }
            if (loaded.parkedTasks() != null) {
                parked.putAll(loaded.parkedTasks());
            }
            if (loaded.executionHistory() != null) {
                loaded.executionHistory().forEach((id, records) -> history.put(id, new ArrayList<>(records)));
            }
            if (loaded.taskLedger() != null) {
                ledger.putAll(loaded.taskLedger());
            }
            if (loaded.userPreferences() != null) {
                preferences.putAll(loaded.userPreferences());
            }
            if (loaded.learningData() != null) {
                learning.addAll(loaded.learningData());
                trimLearning();
            }
            if (loaded.sessionStartTime() != null) {
                sessionStartTime = loaded.sessionStartTime();
            }
            lastSaveTime = loaded.lastSaveTime();
            log.info("Loaded state: current={}, queued={}, parked={}, tracked tasks={}",
                    currentTask != null ? currentTask.id() : "none", queue.size(), parked.size(), ledger.size());
        } finally {
            lock.unlock();
        }
    }

    private void setAsideCorruptFile() {
        try {
            Files.move(stateFile, stateFile.resolveSibling(stateFile.getFileName() + ".corrupt"),
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Could not move corrupt state file aside: {}", e.getMessage());
        }
    }

    /**
     * Clears tasks, history, ledger and learning data, restores default preferences and flushes.
     */
    public void resetState() {
        mutate(() -> {
            clearInMemory();
            sessionStartTime = Instant.now();
            return null;
        });
        log.info("State reset");
    }

    private void clearInMemory() {
        currentTask = null;
        queue.clear();
        parked.clear();
        history.clear();
        ledger.clear();
        preferences.clear();
        preferences.putAll(defaultPreferences);
        learning.clear();
    }

    // --- tasks ---

    public void setCurrentTask(AgenticTask task) {
        mutate(() -> {
            currentTask = task;
            if (task != null) {
                ledger.merge(task.id(), TaskLedgerEntry.from(task), (old, fresh) -> old.refresh(task));
            }
            return null;
        });
    }

    public Optional<AgenticTask> getCurrentTask() {
        return read(() -> Optional.ofNullable(currentTask));
    }

    public void addTaskToQueue(AgenticTask task) {
        mutate(() -> {
            queue.addLast(task);
            return null;
        });
        log.info("Queued task {} ({} waiting)", task.id(), queueSize());
    }

    /**
     * Queues a task ahead of everything already waiting.
     */
    public void pushTaskToFront(AgenticTask task) {
        mutate(() -> {
            queue.addFirst(task);
            return null;
        });
        log.info("Queued task {} at the front ({} waiting)", task.id(), queueSize());
    }

    /**
     * Removes and returns the oldest queued task.
     */
    public Optional<AgenticTask> getNextTask() {
        return mutate(() -> Optional.ofNullable(queue.pollFirst()));
    }

    public List<AgenticTask> getQueue() {
        return read(() -> List.copyOf(queue));
    }

    public int queueSize() {
        return read(queue::size);
    }

    public Optional<AgenticTask> removeFromQueue(String taskId) {
        return mutate(() -> {
            var it = queue.iterator();
            while (it.hasNext()) {
                AgenticTask task = it.next();
                if (task.id().equals(taskId)) {
                    it.remove();
                    return Optional.of(task);
                }
            }
            return Optional.<AgenticTask>empty();
        });
    }

    /**
     * Keeps a paused task aside so a queued task can become current.
     */
    public void parkTask(AgenticTask task) {
        mutate(() -> {
            parked.put(task.id(), task);
            return null;
        });
    }

    public Optional<AgenticTask> unparkTask(String taskId) {
        return mutate(() -> Optional.ofNullable(parked.remove(taskId)));
    }

    public List<AgenticTask> getParkedTasks() {
        return read(() -> List.copyOf(parked.values()));
    }

    /**
     * Looks the task up as current, queued or parked.
     */
    public Optional<AgenticTask> findTask(String taskId) {
        return read(() -> Optional.ofNullable(locate(taskId)));
    }

    /**
     * Replaces a stored task with {@code mutator}'s result, wherever it is kept.
     *
     * @return the stored result
     * @throws IllegalArgumentException if no such task is stored
     */
    public AgenticTask updateTask(String taskId, UnaryOperator<AgenticTask> mutator) {
        return mutate(() -> {
            AgenticTask existing = locate(taskId);
            if (existing == null) {
                throw new IllegalArgumentException("Unknown task: " + taskId);
            }
            AgenticTask updated = mutator.apply(existing);
            if (!updated.id().equals(taskId)) {
                throw new IllegalArgumentException("Task id cannot change from " + taskId + " to " + updated.id());
            }
            replace(updated);
            ledger.computeIfPresent(taskId, (id, entry) -> entry.refresh(updated));
            return updated;
        });
    }

    /**
     * Moves a task to {@code status}. Re-applying the current status is a no-op.
     *
     * @throws IllegalTaskTransitionException if the state machine forbids the change
     */
    public AgenticTask updateTaskStatus(String taskId, TaskStatus status) {
        return updateTask(taskId, task -> {
            if (task.status() == status) {
                return task;
            }
            if (!task.status().canTransitionTo(status)) {
                throw new IllegalTaskTransitionException(taskId, task.status(), status);
            }
            return task.withStatus(status);
        });
    }

    public AgenticTask updateTaskProgress(String taskId, TaskProgress progress) {
        return updateTask(taskId, task -> {
            int finished = progress.completedSteps() + progress.failedSteps() + progress.skippedSteps();
            if (progress.totalSteps() != task.steps().size() || finished > progress.totalSteps()) {
                throw new IllegalArgumentException("Inconsistent progress for task " + taskId + ": " + progress);
            }
            return task.withProgress(progress);
        });
    }

    public AgenticTask updateStep(String taskId, TaskStep step) {
        return updateTask(taskId, task -> task.withStep(step));
    }

    // --- history ---

    public void recordExecutionStep(String taskId, String stepId, StepStatus status, long durationMs, boolean success) {
        recordExecutionStep(taskId, stepId, null, status, durationMs, success, null, false);
    }

    public void recordExecutionStep(String taskId, String stepId, String actionType, StepStatus status,
                                    long durationMs, boolean success, String error, boolean rolledBack) {
        var entry = new ExecutionRecord(taskId, stepId, actionType, status, durationMs, success, error,
                rolledBack, Instant.now());
        mutate(() -> {
            history.computeIfAbsent(taskId, id -> new ArrayList<>()).add(entry);
            if (!ledger.containsKey(taskId)) {
                AgenticTask task = locate(taskId);
                ledger.put(taskId, task != null ? TaskLedgerEntry.from(task) : TaskLedgerEntry.unknown(taskId));
            }
            return null;
        });
    }

    public List<ExecutionRecord> getExecutionHistory(String taskId) {
        return read(() -> List.copyOf(history.getOrDefault(taskId, List.of())));
    }

    public void clearExecutionHistory() {
        mutate(() -> {
            history.clear();
            return null;
        });
    }

    // --- statistics ---

    public TaskStatistics getTaskStatistics() {
        return read(this::computeStatistics);
    }

    private TaskStatistics computeStatistics() {
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        long durationTotal = 0;
        int durationCount = 0;
        var risk = new TreeMap<String, Integer>();
        var complexity = new TreeMap<String, Integer>();
        for (TaskLedgerEntry entry : ledger.values()) {
            if (entry.status() == TaskStatus.COMPLETED) completed++;
            if (entry.status() == TaskStatus.FAILED) failed++;
            if (entry.status() == TaskStatus.CANCELLED) cancelled++;
            if (entry.durationMs() != null) {
                durationTotal += entry.durationMs();
                durationCount++;
            }
            if (entry.riskLevel() != null) {
                risk.merge(entry.riskLevel().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
            complexity.merge(entry.complexity() != null ? entry.complexity() : "unknown", 1, Integer::sum);
        }

        var actionCounts = new HashMap<String, Integer>();
        for (List<ExecutionRecord> records : history.values()) {
            for (ExecutionRecord record : records) {
                if (record.actionType() != null) {
                    actionCounts.merge(record.actionType(), 1, Integer::sum);
                }
            }
        }
        List<String> mostCommon = actionCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(5)
                .map(Map.Entry::getKey)
                .toList();

        int finished = completed + failed;
        return new TaskStatistics(ledger.size(), completed, failed, cancelled,
                durationCount == 0 ? 0.0 : (double) durationTotal / durationCount,
                finished == 0 ? 0.0 : (double) completed / finished,
                mostCommon, risk, complexity);
    }

    // --- preferences and learning ---

    public UserPreferences getUserPreferences() {
        return read(() -> new UserPreferences(new LinkedHashMap<>(preferences)));
    }

    /**
     * Merges the given entries into the stored preferences.
     *
     * @throws IllegalArgumentException if a known key gets a malformed value; nothing is stored then
     */
    public UserPreferences updateUserPreferences(Map<String, String> updates) {
        updates.forEach(UserPreferences::validate);
        return mutate(() -> {
            preferences.putAll(updates);
            return new UserPreferences(new LinkedHashMap<>(preferences));
        });
    }

    public void addLearningData(LearningData data) {
        mutate(() -> {
            learning.addLast(data);
            trimLearning();
            return null;
        });
    }

    public List<LearningData> getLearningData() {
        return read(() -> List.copyOf(learning));
    }

    public Optional<Instant> getLastSaveTime() {
        return read(() -> Optional.ofNullable(lastSaveTime));
    }

    public Path getStateFile() {
        return stateFile;
    }

    // --- internals ---

    private void trimLearning() {
        while (learning.size() > learningLimit) {
            learning.pollFirst();
        }
    }

    private AgenticTask locate(String taskId) {
        if (currentTask != null && currentTask.id().equals(taskId)) {
            return currentTask;
        }
        for (AgenticTask task : queue) {
            if (task.id().equals(taskId)) {
                return task;
            }
        }
        return parked.get(taskId);
    }

    private void replace(AgenticTask updated) {
        if (currentTask != null && currentTask.id().equals(updated.id())) {
            currentTask = updated;
            return;
        }
        if (parked.containsKey(updated.id())) {
            parked.put(updated.id(), updated);
            return;
        }
        var rebuilt = new ArrayDeque<AgenticTask>(queue.size());
        for (AgenticTask task : queue) {
            rebuilt.addLast(task.id().equals(updated.id()) ? updated : task);
        }
        queue.clear();
        queue.addAll(rebuilt);
    }

    private Map<String, List<ExecutionRecord>> copyHistory() {
        var copy = new LinkedHashMap<String, List<ExecutionRecord>>();
        history.forEach((id, records) -> copy.put(id, List.copyOf(records)));
        return copy;
    }

    /**
     * Applies a mutation and flushes. If the flush fails the mutation stays in memory
     * and {@link PersistenceException} reaches the caller.
     */
    private <T> T mutate(Supplier<T> mutation) {
        lock.lock();
        try {
            T result = mutation.get();
            dirty = true;
            saveState();
            return result;
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> reader) {
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isDirty() {
        return read(() -> dirty);
    }
}
