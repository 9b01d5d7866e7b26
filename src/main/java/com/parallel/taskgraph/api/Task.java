package com.parallel.taskgraph.api;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one unit of work.
 *
 * <p>
 * A task carries a unique name, the set of shared variables it reads, the set
 * it writes, and the {@link TaskBody} to execute. The read and write sets are a
 * contract: they must name every variable the body accesses. The graph builder
 * relies on them to decide which tasks may run concurrently, so an incomplete
 * declaration voids every ordering guarantee.
 *
 * <pre>{@code
 * Task sum = Task.builder("sum")
 *         .reads("x", "y")
 *         .writes("z")
 *         .body(s -> s.put("z", s.getInt("x") + s.getInt("y")))
 *         .build();
 * }</pre>
 */
public final class Task {
    private final String name;
    private final Set<String> reads;
    private final Set<String> writes;
    private final TaskBody body;

    public Task(String name, Collection<String> reads, Collection<String> writes, TaskBody body) {
        Objects.requireNonNull(name, "Task name must not be null");
        if (name.isBlank())
            throw new IllegalArgumentException("Task name must not be blank");
        this.name = name;
        this.reads = copyOf(name, reads);
        this.writes = copyOf(name, writes);
        this.body = body != null ? body : TaskBody.NOOP;
    }

    /** Creates a task with no declared accesses. */
    public Task(String name, TaskBody body) {
        this(name, null, null, body);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static Set<String> copyOf(String task, Collection<String> vars) {
        if (vars == null || vars.isEmpty())
            return Collections.emptySet();
        var copy = new LinkedHashSet<String>(vars.size() * 2);
        for (String v : vars) {
            if (v == null)
                throw new IllegalArgumentException("Null variable name in access set of task " + task);
            copy.add(v);
        }
        return Collections.unmodifiableSet(copy);
    }

    public String name() {
        return name;
    }

    public Set<String> reads() {
        return reads;
    }

    public Set<String> writes() {
        return writes;
    }

    public TaskBody body() {
        return body;
    }

    /** True if the body may read {@code variable}. Written variables are readable too. */
    public boolean mayRead(String variable) {
        return reads.contains(variable) || writes.contains(variable);
    }

    public boolean mayWrite(String variable) {
        return writes.contains(variable);
    }

    @Override
    public String toString() {
        return "Task(" + name + ", reads=" + reads + ", writes=" + writes + ")";
    }

    /** Fluent construction of a {@link Task}. */
    public static final class Builder {
        private final String name;
        private final Set<String> reads = new LinkedHashSet<>();
        private final Set<String> writes = new LinkedHashSet<>();
        private TaskBody body;

        private Builder(String name) {
            this.name = name;
        }

        public Builder reads(String... variables) {
            Collections.addAll(reads, variables);
            return this;
        }

        public Builder reads(Collection<String> variables) {
            reads.addAll(variables);
            return this;
        }

        public Builder writes(String... variables) {
            Collections.addAll(writes, variables);
            return this;
        }

        public Builder writes(Collection<String> variables) {
            writes.addAll(variables);
            return this;
        }

        public Builder body(TaskBody body) {
            this.body = body;
            return this;
        }

        public Task build() {
            return new Task(name, reads, writes, body);
        }
    }
}
