package com.parallel.taskgraph.api;

import java.util.Map;

/**
 * The caller-owned store of shared variables that task bodies read and write.
 *
 * <p>
 * The engine never synchronizes access to this store. Safety comes from the
 * execution graph alone: two tasks that touch the same variable (with at least
 * one write) are always ordered.
 *
 * <p>
 * Variables are identified by the same names tasks declare in their read and
 * write sets. A {@code null} value means the variable is unset.
 */
public interface SharedState {

    /**
     * Reads a variable.
     *
     * @param name variable name.
     * @param <T>  expected value type.
     * @return the current value, or null if unset.
     */
    <T> T get(String name);

    /**
     * Writes a variable. Writing {@code null} unsets it.
     */
    void put(String name, Object value);

    default int getInt(String name) {
        Number n = get(name);
        return n == null ? 0 : n.intValue();
    }

    default long getLong(String name) {
        Number n = get(name);
        return n == null ? 0L : n.longValue();
    }

    default double getDouble(String name) {
        Number n = get(name);
        return n == null ? 0.0 : n.doubleValue();
    }

    /** Copies every set variable. The copy is detached from the store. */
    Map<String, Object> snapshot();

    /**
     * Replaces the whole content of the store with the given values. Variables
     * not present in {@code values} become unset.
     */
    void restore(Map<String, Object> values);
}
