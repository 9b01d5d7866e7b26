package com.parallel.taskgraph.engine;

/**
 * A task body touched a shared variable outside its declared read/write sets.
 * Raised only when access validation is enabled.
 */
public class UndeclaredAccessException extends IllegalStateException {
    private final String taskName;
    private final String variable;

    public UndeclaredAccessException(String taskName, String variable, String access) {
        super("Task '" + taskName + "' performed undeclared " + access + " of '" + variable + "'");
        this.taskName = taskName;
        this.variable = variable;
    }

    public String taskName() {
        return taskName;
    }

    public String variable() {
        return variable;
    }
}
