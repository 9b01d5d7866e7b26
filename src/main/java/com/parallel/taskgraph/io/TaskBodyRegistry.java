package com.parallel.taskgraph.io;

import com.parallel.taskgraph.api.TaskBody;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry mapping the body names used in system files to {@link TaskBody}
 * instances.
 *
 * <p>
 * The name {@value #NOOP} is registered from the start and binds a body that
 * does nothing.
 */
public final class TaskBodyRegistry {
    public static final String NOOP = "noop";

    private final Map<String, TaskBody> bodies = new TreeMap<>();

    public TaskBodyRegistry() {
        bodies.put(NOOP, TaskBody.NOOP);
    }

    /**
     * Binds a body name. Re-registering a name replaces the earlier body.
     */
    public TaskBodyRegistry register(String name, TaskBody body) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Body name must not be blank");
        if (body == null)
            throw new IllegalArgumentException("Body '" + name + "' must not be null");
        bodies.put(name, body);
        return this;
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under the name.
     */
    public TaskBody get(String name) {
        TaskBody body = bodies.get(name);
        if (body == null)
            throw new IllegalArgumentException("Unknown task body: " + name + " (registered: " + bodies.keySet() + ")");
        return body;
    }

    public boolean contains(String name) {
        return bodies.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(bodies.keySet());
    }
}
