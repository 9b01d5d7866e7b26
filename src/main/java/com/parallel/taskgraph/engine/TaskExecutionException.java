package com.parallel.taskgraph.engine;

/** A task body threw. The run that executed it was aborted. */
public class TaskExecutionException extends RuntimeException {
    private final String taskName;

    public TaskExecutionException(String taskName, Throwable cause) {
        super("Task '" + taskName + "' failed: " + cause, cause);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
