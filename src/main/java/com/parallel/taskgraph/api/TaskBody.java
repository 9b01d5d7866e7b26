package com.parallel.taskgraph.api;

/**
 * The work a {@link Task} performs against the shared-state context.
 *
 * <p>
 * A body may only touch the variables its task declares. Any exception thrown
 * fails the task and aborts the current run.
 */
@FunctionalInterface
public interface TaskBody {

    /** A body that does nothing. Used for tasks declared without work. */
    TaskBody NOOP = state -> {
    };

    void run(SharedState state) throws Exception;
}
