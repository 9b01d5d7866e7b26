package com.parallel.taskgraph.util;

import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.ExecutionStrategy;

import java.util.Arrays;

/**
 * Fans {@link ExecutionListener} callbacks out to several listeners.
 *
 * <p>
 * The array is replaced copy-on-write, so registration may race with a running
 * execution: a run sees either the old or the new set of listeners.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public synchronized void addForComposite(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(long runId, ExecutionStrategy strategy, int taskCount) {
        for (ExecutionListener l : listeners)
            l.onRunStart(runId, strategy, taskCount);
    }

    @Override
    public void onTaskStarted(long runId, int taskIndex, String taskName) {
        for (ExecutionListener l : listeners)
            l.onTaskStarted(runId, taskIndex, taskName);
    }

    @Override
    public void onTaskCompleted(long runId, int taskIndex, String taskName, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onTaskCompleted(runId, taskIndex, taskName, durationNanos);
    }

    @Override
    public void onTaskError(long runId, int taskIndex, String taskName, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onTaskError(runId, taskIndex, taskName, error);
    }

    @Override
    public void onRunEnd(long runId, int tasksCompleted, boolean success) {
        for (ExecutionListener l : listeners)
            l.onRunEnd(runId, tasksCompleted, success);
    }
}
