package com.parallel.taskgraph.api;

/**
 * Observability interface for monitoring task execution.
 *
 * <p>
 * Listeners receive callbacks from both executors. Under the parallel
 * scheduler, task callbacks arrive concurrently from worker threads, so
 * implementations must be thread-safe. Run start and run end are always
 * delivered on the thread that called the executor.
 *
 * <p>
 * Callbacks execute on the worker's path between tasks. Keep them cheap, or
 * wrap the listener in
 * {@link com.parallel.taskgraph.disruptor.AsyncExecutionListener}.
 */
public interface ExecutionListener {

    /**
     * Called before the first task of a run is dispatched.
     *
     * @param runId     Incrementing run number of the owning system.
     * @param strategy  Which executor is running.
     * @param taskCount Number of tasks in the graph.
     */
    void onRunStart(long runId, ExecutionStrategy strategy, int taskCount);

    /**
     * Called on the executing thread just before a task body runs.
     *
     * @param runId     Current run.
     * @param taskIndex Declaration index of the task.
     * @param taskName  Name of the task.
     */
    default void onTaskStarted(long runId, int taskIndex, String taskName) {
    }

    /**
     * Called after a task body returned normally.
     *
     * @param durationNanos Wall time spent in the body.
     */
    void onTaskCompleted(long runId, int taskIndex, String taskName, long durationNanos);

    /**
     * Called when a task body threw.
     *
     * @param error The exception raised by the body.
     */
    void onTaskError(long runId, int taskIndex, String taskName, Throwable error);

    /**
     * Called once the run finished, successfully or not.
     *
     * @param tasksCompleted Number of task bodies that returned normally.
     * @param success        false if any task failed.
     */
    void onRunEnd(long runId, int tasksCompleted, boolean success);
}
