package com.parallel.taskgraph.api;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Extracts the part of the shared state that defines a run's outcome. Two runs
 * are considered equivalent when their snapshots are equal.
 */
@FunctionalInterface
public interface StateSnapshot {

    Map<String, Object> capture(SharedState state);

    /**
     * Captures the named variables into a sorted map. Unset variables map to
     * null, so set vs unset is compared too.
     */
    static StateSnapshot of(Collection<String> variables) {
        final Set<String> vars = new TreeSet<>(variables);
        return state -> {
            Map<String, Object> out = new TreeMap<>();
            for (String v : vars)
                out.put(v, state.get(v));
            return out;
        };
    }
}
