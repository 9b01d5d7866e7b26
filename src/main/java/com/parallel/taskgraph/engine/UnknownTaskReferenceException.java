package com.parallel.taskgraph.engine;

/** A precedence hint names a task that was never declared. */
public class UnknownTaskReferenceException extends IllegalArgumentException {
    private final String taskName;

    public UnknownTaskReferenceException(String taskName, String context) {
        super("Unknown task '" + taskName + "' referenced " + context);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
