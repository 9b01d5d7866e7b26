package com.parallel.taskgraph.util;

import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.engine.ConflictAnalyzer;
import com.parallel.taskgraph.engine.ExecutionGraph;
import com.parallel.taskgraph.engine.ExecutionGraph.EdgeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic utility for inspecting an execution graph.
 *
 * <p>
 * Generates human-readable text: per-task detail, a whole-graph dump, the
 * groups of tasks that may run side by side, and a Mermaid diagram for
 * external renderers. Not meant for hot paths.
 */
public final class GraphExplain {
    private final ExecutionGraph graph;
    private final ConflictAnalyzer analyzer = new ConflictAnalyzer();

    public GraphExplain(ExecutionGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the declaration and placement of one task.
     */
    public String explainTask(String taskName) {
        int idx = graph.indexOf(taskName);
        Task task = graph.task(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Task: ").append(taskName).append('\n')
                .append("  Declaration index: ").append(idx).append('\n')
                .append("  Reads: ").append(task.reads()).append('\n')
                .append("  Writes: ").append(task.writes()).append('\n');

        int pc = graph.predecessorCount(idx);
        sb.append("  After (").append(pc).append("): ");
        for (int i = 0; i < pc; i++) {
            int p = graph.predecessor(idx, i);
            sb.append(graph.task(p).name()).append(describeEdge(p, idx));
            if (i < pc - 1)
                sb.append(", ");
        }
        sb.append('\n');

        int sc = graph.successorCount(idx);
        sb.append("  Before (").append(sc).append("): ");
        for (int i = 0; i < sc; i++) {
            sb.append(graph.task(graph.successor(idx, i)).name());
            if (i < sc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    private String describeEdge(int from, int to) {
        for (int i = 0; i < graph.successorCount(from); i++) {
            if (graph.successor(from, i) != to)
                continue;
            if (graph.successorKind(from, i) == EdgeKind.EXPLICIT)
                return " [explicit]";
            return " [conflict on " + analyzer.sharedVariables(graph.task(from), graph.task(to)) + "]";
        }
        return "";
    }

    /**
     * Dumps the whole graph in declaration order. Inferred edges are marked
     * with {@code ~>}.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.taskCount()).append(" tasks, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (int i = 0; i < graph.taskCount(); i++) {
            sb.append("  [").append(i).append("] ").append(graph.task(i).name());
            int sc = graph.successorCount(i);
            if (sc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < sc; j++) {
                    if (graph.successorKind(i, j) == EdgeKind.INFERRED)
                        sb.append('~');
                    sb.append(graph.task(graph.successor(i, j)).name());
                    if (j < sc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Groups tasks by depth (longest path from a root). Tasks of one level have
     * no path between them and may all run at once.
     */
    public List<List<String>> levels() {
        int[] depth = new int[graph.taskCount()];
        int maxDepth = -1;
        for (int ti : graph.stableTopologicalOrder()) {
            for (int i = 0; i < graph.predecessorCount(ti); i++)
                depth[ti] = Math.max(depth[ti], depth[graph.predecessor(ti, i)] + 1);
            maxDepth = Math.max(maxDepth, depth[ti]);
        }
        List<List<String>> levels = new ArrayList<>();
        for (int d = 0; d <= maxDepth; d++)
            levels.add(new ArrayList<>());
        for (int i = 0; i < graph.taskCount(); i++)
            levels.get(depth[i]).add(graph.task(i).name());
        return levels;
    }

    /**
     * Generates a Mermaid JS graph diagram. Explicit edges are solid, inferred
     * edges dotted and labelled with the conflicting variables.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        for (int i = 0; i < graph.taskCount(); i++) {
            Task t = graph.task(i);
            sb.append("  ").append(sanitize(t.name())).append("[\"").append(t.name()).append("\"];\n");
        }

        for (int i = 0; i < graph.taskCount(); i++) {
            String from = sanitize(graph.task(i).name());
            for (int j = 0; j < graph.successorCount(i); j++) {
                int child = graph.successor(i, j);
                String to = sanitize(graph.task(child).name());
                if (graph.successorKind(i, j) == EdgeKind.INFERRED) {
                    String label = String.join(",", analyzer.sharedVariables(graph.task(i), graph.task(child)));
                    sb.append("  ").append(from).append(" -. \"").append(label).append("\" .-> ").append(to)
                            .append(";\n");
                } else {
                    sb.append("  ").append(from).append(" --> ").append(to).append(";\n");
                }
            }
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
