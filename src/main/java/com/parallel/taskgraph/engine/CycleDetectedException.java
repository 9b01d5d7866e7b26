package com.parallel.taskgraph.engine;

import java.util.List;

/**
 * The explicit precedence hints alone form a cycle, so no execution order can
 * satisfy them.
 *
 * <p>
 * {@link #from()} and {@link #to()} name one hint edge on the cycle;
 * {@link #cycle()} lists the whole cycle, first task repeated at the end.
 */
public class CycleDetectedException extends IllegalStateException {
    private final String from;
    private final String to;
    private final List<String> cycle;

    public CycleDetectedException(String from, String to, List<String> cycle) {
        super("Cycle detected in precedences: " + String.join(" -> ", cycle));
        this.from = from;
        this.to = to;
        this.cycle = List.copyOf(cycle);
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    public List<String> cycle() {
        return cycle;
    }
}
