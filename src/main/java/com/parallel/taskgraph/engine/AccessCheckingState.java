package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.Task;

import java.util.Map;

/**
 * View of the shared state handed to one task body when access validation is
 * on. Reads must be declared as reads or writes; writes must be declared as
 * writes. Anything else raises {@link UndeclaredAccessException}.
 */
final class AccessCheckingState implements SharedState {
    private final Task task;
    private final SharedState delegate;

    AccessCheckingState(Task task, SharedState delegate) {
        this.task = task;
        this.delegate = delegate;
    }

    @Override
    public <T> T get(String name) {
        if (!task.mayRead(name))
            throw new UndeclaredAccessException(task.name(), name, "read");
        return delegate.get(name);
    }

    @Override
    public void put(String name, Object value) {
        if (!task.mayWrite(name))
            throw new UndeclaredAccessException(task.name(), name, "write");
        delegate.put(name, value);
    }

    @Override
    public Map<String, Object> snapshot() {
        throw new UndeclaredAccessException(task.name(), "*", "snapshot");
    }

    @Override
    public void restore(Map<String, Object> values) {
        throw new UndeclaredAccessException(task.name(), "*", "restore");
    }
}
