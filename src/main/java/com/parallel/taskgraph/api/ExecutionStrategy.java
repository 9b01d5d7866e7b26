package com.parallel.taskgraph.api;

/** The two ways a task system can be executed. */
public enum ExecutionStrategy {
    /** One task at a time, stable topological order. The reference semantics. */
    SEQUENTIAL,
    /** Ready tasks dispatched to a bounded worker pool. */
    PARALLEL
}
