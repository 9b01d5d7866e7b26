package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.Task;

/** Runs one task body for either executor and reports it to the listener. */
final class TaskInvoker {
    private TaskInvoker() {
    }

    /**
     * @throws TaskExecutionException if the body throws.
     */
    static void invoke(long runId, int index, Task task, SharedState state, boolean validateAccess,
            ExecutionListener listener) {
        SharedState view = validateAccess ? new AccessCheckingState(task, state) : state;
        if (listener != null)
            listener.onTaskStarted(runId, index, task.name());

        long start = System.nanoTime();
        try {
            task.body().run(view);
        } catch (Throwable e) {
            if (listener != null)
                listener.onTaskError(runId, index, task.name(), e);
            throw new TaskExecutionException(task.name(), e);
        }

        if (listener != null)
            listener.onTaskCompleted(runId, index, task.name(), System.nanoTime() - start);
    }
}
