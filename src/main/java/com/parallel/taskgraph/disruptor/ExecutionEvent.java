package com.parallel.taskgraph.disruptor;

import com.parallel.taskgraph.api.ExecutionStrategy;

/**
 * A mutable holder for one {@link com.parallel.taskgraph.api.ExecutionListener}
 * callback, carried through the LMAX Disruptor ring buffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated with the ring buffer
 * and reused for the lifetime of the listener. The consumer clears each event
 * after delivery so failed tasks' exceptions are not retained.
 */
public final class ExecutionEvent {

    public enum Type {
        RUN_START, TASK_STARTED, TASK_COMPLETED, TASK_ERROR, RUN_END
    }

    private Type type;
    private long runId;
    private ExecutionStrategy strategy;
    private int taskIndex = -1;
    private String taskName;
    private int count;
    private long durationNanos;
    private Throwable error;
    private boolean success;

    void setRunStart(long runId, ExecutionStrategy strategy, int taskCount) {
        clear();
        this.type = Type.RUN_START;
        this.runId = runId;
        this.strategy = strategy;
        this.count = taskCount;
    }

    void setTaskStarted(long runId, int taskIndex, String taskName) {
        clear();
        this.type = Type.TASK_STARTED;
        this.runId = runId;
        this.taskIndex = taskIndex;
        this.taskName = taskName;
    }

    void setTaskCompleted(long runId, int taskIndex, String taskName, long durationNanos) {
        clear();
        this.type = Type.TASK_COMPLETED;
        this.runId = runId;
        this.taskIndex = taskIndex;
        this.taskName = taskName;
        this.durationNanos = durationNanos;
    }

    void setTaskError(long runId, int taskIndex, String taskName, Throwable error) {
        clear();
        this.type = Type.TASK_ERROR;
        this.runId = runId;
        this.taskIndex = taskIndex;
        this.taskName = taskName;
        this.error = error;
    }

    void setRunEnd(long runId, int tasksCompleted, boolean success) {
        clear();
        this.type = Type.RUN_END;
        this.runId = runId;
        this.count = tasksCompleted;
        this.success = success;
    }

    public Type type() {
        return type;
    }

    public long runId() {
        return runId;
    }

    public ExecutionStrategy strategy() {
        return strategy;
    }

    public int taskIndex() {
        return taskIndex;
    }

    public String taskName() {
        return taskName;
    }

    /** Task count for RUN_START, tasks completed for RUN_END. */
    public int count() {
        return count;
    }

    public long durationNanos() {
        return durationNanos;
    }

    public Throwable error() {
        return error;
    }

    public boolean success() {
        return success;
    }

    public void clear() {
        type = null;
        runId = 0;
        strategy = null;
        taskIndex = -1;
        taskName = null;
        count = 0;
        durationNanos = 0;
        error = null;
        success = false;
    }
}
