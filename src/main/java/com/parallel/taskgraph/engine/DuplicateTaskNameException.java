package com.parallel.taskgraph.engine;

/** Two tasks of one system share a name. */
public class DuplicateTaskNameException extends IllegalArgumentException {
    private final String taskName;

    public DuplicateTaskNameException(String taskName) {
        super("Duplicate task name: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
