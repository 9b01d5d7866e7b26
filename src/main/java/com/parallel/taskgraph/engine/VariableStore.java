package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.SharedState;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link SharedState}: a map of variable name to value.
 *
 * <p>
 * Backed by a {@link ConcurrentHashMap} so the map structure survives
 * concurrent writes to different variables. It imposes no ordering between
 * tasks; that is the execution graph's job.
 */
public final class VariableStore implements SharedState {
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public VariableStore() {
    }

    public VariableStore(Map<String, ?> initial) {
        initial.forEach(this::put);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        return (T) values.get(name);
    }

    @Override
    public void put(String name, Object value) {
        if (value == null)
            values.remove(name);
        else
            values.put(name, value);
    }

    /** Sorted copy of every set variable. */
    @Override
    public Map<String, Object> snapshot() {
        return new TreeMap<>(values);
    }

    @Override
    public void restore(Map<String, Object> snapshot) {
        values.clear();
        snapshot.forEach(this::put);
    }

    @Override
    public String toString() {
        return "VariableStore" + snapshot();
    }
}
