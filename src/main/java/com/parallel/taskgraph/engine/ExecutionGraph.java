package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * CSR-encoded, immutable execution DAG.
 *
 * <p>
 * Nodes are the tasks of a system, indexed by declaration order. An edge
 * {@code (a, b)} means task {@code a} must complete before task {@code b}
 * starts. Instances are produced by {@link GraphBuilder} and never change.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>{@code succOffset}/{@code succList}: successors of node {@code i} are
 * {@code succList[succOffset[i]] .. succList[succOffset[i+1]-1]}, ascending.
 * {@code succKind} is aligned with {@code succList}.</li>
 * <li>{@code predOffset}/{@code predList}: same layout for predecessors.</li>
 * <li>{@code reach}: one bitset row per node, 64 targets per long. Bit
 * {@code j} of row {@code i} is set iff a non-empty path {@code i -> j}
 * exists.</li>
 * <li>{@code stableOrder}: topological order where ties are broken by
 * declaration index.</li>
 * </ul>
 */
public final class ExecutionGraph {
    private final Task[] tasks;
    private final Map<String, Integer> nameToIndex;

    private final int[] succOffset;
    private final int[] succList;
    private final EdgeKind[] succKind;

    private final int[] predOffset;
    private final int[] predList;

    private final long[][] reach;
    private final int[] stableOrder;

    ExecutionGraph(Task[] tasks, Map<String, Integer> nameToIndex, int[] succOffset, int[] succList,
            EdgeKind[] succKind, int[] predOffset, int[] predList, long[][] reach, int[] stableOrder) {
        this.tasks = tasks;
        this.nameToIndex = nameToIndex;
        this.succOffset = succOffset;
        this.succList = succList;
        this.succKind = succKind;
        this.predOffset = predOffset;
        this.predList = predList;
        this.reach = reach;
        this.stableOrder = stableOrder;
    }

    public int taskCount() {
        return tasks.length;
    }

    /** Returns the task at the given declaration index. */
    public Task task(int index) {
        return tasks[index];
    }

    /** Tasks in declaration order. */
    public List<Task> tasks() {
        return List.of(tasks);
    }

    /** Resolves a task name to its declaration index. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown task: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public int successorCount(int index) {
        return succOffset[index + 1] - succOffset[index];
    }

    public int successor(int index, int i) {
        return succList[succOffset[index] + i];
    }

    public EdgeKind successorKind(int index, int i) {
        return succKind[succOffset[index] + i];
    }

    public int predecessorCount(int index) {
        return predOffset[index + 1] - predOffset[index];
    }

    public int predecessor(int index, int i) {
        return predList[predOffset[index] + i];
    }

    /** Number of predecessors; the scheduler's initial dependency counter. */
    public int inDegree(int index) {
        return predecessorCount(index);
    }

    public int edgeCount() {
        return succList.length;
    }

    /** True if the graph holds the direct edge {@code from -> to}. */
    public boolean hasEdge(int from, int to) {
        int start = succOffset[from], end = succOffset[from + 1];
        for (int i = start; i < end; i++)
            if (succList[i] == to)
                return true;
        return false;
    }

    public boolean hasEdge(String from, String to) {
        return hasEdge(indexOf(from), indexOf(to));
    }

    /** True if a non-empty path {@code from -> ... -> to} exists. */
    public boolean hasPath(int from, int to) {
        return (reach[from][to >> 6] & (1L << to)) != 0;
    }

    public boolean hasPath(String from, String to) {
        return hasPath(indexOf(from), indexOf(to));
    }

    /** True if neither task can reach the other, so they may run concurrently. */
    public boolean independent(int a, int b) {
        return a != b && !hasPath(a, b) && !hasPath(b, a);
    }

    /**
     * Topological order in which, among the tasks whose predecessors are all
     * placed, the lowest declaration index always goes first.
     */
    public int[] stableTopologicalOrder() {
        return stableOrder.clone();
    }

    /** All edges, grouped by source in declaration order. */
    public List<Edge> edges() {
        var out = new ArrayList<Edge>(succList.length);
        for (int i = 0; i < tasks.length; i++)
            for (int k = succOffset[i]; k < succOffset[i + 1]; k++)
                out.add(new Edge(tasks[i].name(), tasks[succList[k]].name(), succKind[k]));
        return Collections.unmodifiableList(out);
    }

    /** Every variable some task declares as written, sorted. */
    public Set<String> writtenVariables() {
        Set<String> written = new TreeSet<>();
        for (Task t : tasks)
            written.addAll(t.writes());
        return Collections.unmodifiableSet(written);
    }

    /** Names of the direct prerequisites of a task, ascending by declaration index. */
    public List<String> prerequisites(String name) {
        int idx = indexOf(name);
        var out = new ArrayList<String>(predecessorCount(idx));
        for (int i = 0; i < predecessorCount(idx); i++)
            out.add(tasks[predecessor(idx, i)].name());
        return out;
    }

    /** Where an edge came from. */
    public enum EdgeKind {
        /** Declared by the caller as a precedence hint. */
        EXPLICIT,
        /** Added by the builder to order a Bernstein conflict. */
        INFERRED
    }

    public record Edge(String from, String to, EdgeKind kind) {
    }
}
