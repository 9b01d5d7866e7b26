package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ExecutionStrategy;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Outcome of one run of a task system.
 *
 * <p>
 * A successful result means every task completed. A failed result names the
 * first task whose body threw; tasks not yet dispatched at that point were
 * skipped. Side effects of tasks that did run are not rolled back.
 *
 * <p>
 * A successful result also carries a snapshot of the shared state taken as the
 * run ended, by default the value of every variable some task writes.
 */
public final class ExecutionResult {
    private final ExecutionStrategy strategy;
    private final long runId;
    private final int taskCount;
    private final int tasksCompleted;
    private final long elapsedNanos;
    private final List<String> startOrder;
    private final TaskExecutionException failure;
    private final Map<String, Object> snapshot;

    ExecutionResult(ExecutionStrategy strategy, long runId, int taskCount, int tasksCompleted, long elapsedNanos,
            List<String> startOrder, TaskExecutionException failure, Map<String, Object> snapshot) {
        this.strategy = strategy;
        this.runId = runId;
        this.taskCount = taskCount;
        this.tasksCompleted = tasksCompleted;
        this.elapsedNanos = elapsedNanos;
        this.startOrder = List.copyOf(startOrder);
        this.failure = failure;
        // Snapshots may hold nulls for unset variables, so no Map.copyOf
        this.snapshot = snapshot == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(snapshot));
    }

    public ExecutionStrategy strategy() {
        return strategy;
    }

    public long runId() {
        return runId;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public int taskCount() {
        return taskCount;
    }

    public int tasksCompleted() {
        return tasksCompleted;
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    /** Names of the tasks in the order their bodies were started. */
    public List<String> startOrder() {
        return startOrder;
    }

    /** State captured after a successful run; empty for a failed one. */
    public Map<String, Object> snapshot() {
        return snapshot;
    }

    public Optional<TaskExecutionException> failure() {
        return Optional.ofNullable(failure);
    }

    public Optional<String> failedTask() {
        return failure == null ? Optional.empty() : Optional.of(failure.taskName());
    }

    /**
     * Returns this result if the run succeeded.
     *
     * @throws TaskExecutionException the recorded failure otherwise.
     */
    public ExecutionResult orThrow() {
        if (failure != null)
            throw failure;
        return this;
    }

    @Override
    public String toString() {
        return strategy + " run " + runId + ": " + (isSuccess() ? "completed" : "failed at " + failure.taskName())
                + " (" + tasksCompleted + "/" + taskCount + " tasks, " + elapsedNanos / 1_000 + " us)";
    }
}
