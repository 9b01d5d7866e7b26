package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.Task;

import java.util.Set;
import java.util.TreeSet;

/**
 * Bernstein's conditions for two tasks.
 *
 * <p>
 * Tasks A and B may run concurrently only if
 * {@code W(A) ∩ R(B)}, {@code R(A) ∩ W(B)} and {@code W(A) ∩ W(B)} are all
 * empty. Shared reads never conflict.
 */
public final class ConflictAnalyzer {

    /** @return true if {@code a} and {@code b} must not run concurrently. */
    public boolean conflicts(Task a, Task b) {
        return intersects(a.writes(), b.reads())
                || intersects(a.reads(), b.writes())
                || intersects(a.writes(), b.writes());
    }

    /**
     * Names the variables responsible for a conflict, sorted. Empty when the
     * tasks do not conflict.
     */
    public Set<String> sharedVariables(Task a, Task b) {
        var out = new TreeSet<String>();
        collect(a.writes(), b.reads(), out);
        collect(a.reads(), b.writes(), out);
        collect(a.writes(), b.writes(), out);
        return out;
    }

    private static boolean intersects(Set<String> x, Set<String> y) {
        // Iterate the smaller set, look up in the larger.
        if (x.size() > y.size()) {
            Set<String> t = x;
            x = y;
            y = t;
        }
        for (String v : x)
            if (y.contains(v))
                return true;
        return false;
    }

    private static void collect(Set<String> x, Set<String> y, Set<String> out) {
        for (String v : x)
            if (y.contains(v))
                out.add(v);
    }
}
