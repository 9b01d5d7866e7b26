package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.engine.ExecutionGraph.EdgeKind;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the maximal-parallelism {@link ExecutionGraph} of a task system.
 *
 * <p>
 * Build steps:
 * <ol>
 * <li>Index the tasks by declaration order, rejecting duplicate names.</li>
 * <li>Turn the precedence hints into explicit edges, rejecting unknown names,
 * and check them for cycles (Kahn's algorithm).</li>
 * <li>Compute the transitive closure of the explicit edges.</li>
 * <li>Visit every pair {@code i < j} not yet ordered by the closure. If the
 * {@link ConflictAnalyzer} reports a conflict, add the edge {@code i -> j}
 * (earlier-declared first) and extend the closure.</li>
 * <li>Sort the result into a stable topological order and compile it into CSR
 * form.</li>
 * </ol>
 *
 * <p>
 * Extending the closure after each added edge keeps the pair test exact: an
 * edge {@code i -> j} is only added while {@code j} cannot reach {@code i}, so
 * the inferred edges never close a cycle, even when a hint points from a later
 * task to an earlier one. Tasks left without a path between them are safe to
 * run concurrently.
 *
 * <p>
 * The builder is stateless and may be reused.
 */
public final class GraphBuilder {
    private static final Logger log = LogManager.getLogger(GraphBuilder.class);

    private final ConflictAnalyzer analyzer;

    public GraphBuilder() {
        this(new ConflictAnalyzer());
    }

    public GraphBuilder(ConflictAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Builds the execution graph.
     *
     * @param tasks Tasks in declaration order.
     * @param hints Task name to prerequisite task names. Tasks missing from the
     *              map have no explicit prerequisites. May be null.
     * @return the verified DAG.
     * @throws DuplicateTaskNameException   if two tasks share a name.
     * @throws UnknownTaskReferenceException if a hint names an undeclared task.
     * @throws CycleDetectedException        if the hints alone are cyclic.
     */
    public ExecutionGraph build(List<Task> tasks, Map<String, ? extends Collection<String>> hints) {
        final int n = tasks.size();

        // 1. Index tasks
        Task[] byIndex = new Task[n];
        Map<String, Integer> nameToIndex = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            Task t = tasks.get(i);
            if (t == null)
                throw new NullPointerException("Task at position " + i + " is null");
            if (nameToIndex.putIfAbsent(t.name(), i) != null)
                throw new DuplicateTaskNameException(t.name());
            byIndex[i] = t;
        }

        // 2. Explicit edges from hints
        List<TreeMap<Integer, EdgeKind>> succ = new ArrayList<>(n);
        List<TreeSet<Integer>> explicitPred = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            succ.add(new TreeMap<>());
            explicitPred.add(new TreeSet<>());
        }
        int explicitEdges = 0;
        if (hints != null) {
            for (var entry : hints.entrySet()) {
                Integer target = nameToIndex.get(entry.getKey());
                if (target == null)
                    throw new UnknownTaskReferenceException(entry.getKey(), "as a precedence key");
                if (entry.getValue() == null)
                    continue;
                for (String dep : entry.getValue()) {
                    Integer source = nameToIndex.get(dep);
                    if (source == null)
                        throw new UnknownTaskReferenceException(dep,
                                "as a prerequisite of '" + entry.getKey() + "'");
                    if (succ.get(source).put(target, EdgeKind.EXPLICIT) == null)
                        explicitEdges++;
                    explicitPred.get(target).add(source);
                }
            }
        }

        // 3. Cycle check on hints, then closure in reverse topological order
        int[] explicitOrder = kahn(n, succ, false);
        if (explicitOrder == null)
            throw cycleError(byIndex, explicitPred);

        final int words = (n + 63) >>> 6;
        long[][] reach = new long[n][words];
        for (int k = n - 1; k >= 0; k--) {
            int u = explicitOrder[k];
            for (int v : succ.get(u).keySet()) {
                orInto(reach[u], reach[v]);
                reach[u][v >> 6] |= 1L << v;
            }
        }

        // 4. Order every unordered conflicting pair by declaration
        int inferredEdges = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (test(reach[i], j) || test(reach[j], i))
                    continue;
                if (!analyzer.conflicts(byIndex[i], byIndex[j]))
                    continue;

                succ.get(i).put(j, EdgeKind.INFERRED);
                inferredEdges++;
                if (log.isDebugEnabled())
                    log.debug("Conflict {} -> {} on {}", byIndex[i].name(), byIndex[j].name(),
                            analyzer.sharedVariables(byIndex[i], byIndex[j]));

                // Everything that reaches i (and i itself) now reaches j and beyond.
                for (int u = 0; u < n; u++) {
                    if (u == i || test(reach[u], i)) {
                        orInto(reach[u], reach[j]);
                        reach[u][j >> 6] |= 1L << j;
                    }
                }
            }
        }

        // 5. Stable order + CSR
        int[] stableOrder = kahn(n, succ, true);
        if (stableOrder == null)
            throw new IllegalStateException("Execution graph has a cycle after conflict resolution");

        int totalEdges = explicitEdges + inferredEdges;
        int[] succOffset = new int[n + 1];
        int[] succList = new int[totalEdges];
        EdgeKind[] succKind = new EdgeKind[totalEdges];
        int[] predCount = new int[n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            succOffset[i] = k;
            for (var e : succ.get(i).entrySet()) {
                succList[k] = e.getKey();
                succKind[k] = e.getValue();
                predCount[e.getKey()]++;
                k++;
            }
        }
        succOffset[n] = k;

        int[] predOffset = new int[n + 1];
        for (int i = 0; i < n; i++)
            predOffset[i + 1] = predOffset[i] + predCount[i];
        int[] predList = new int[totalEdges];
        int[] fill = Arrays.copyOf(predOffset, n);
        // Sources are visited ascending, so each predecessor row ends up sorted.
        for (int i = 0; i < n; i++)
            for (int e = succOffset[i]; e < succOffset[i + 1]; e++)
                predList[fill[succList[e]]++] = i;

        log.info("Built execution graph: {} tasks, {} explicit edges, {} inferred edges",
                n, explicitEdges, inferredEdges);

        return new ExecutionGraph(byIndex, Collections.unmodifiableMap(nameToIndex), succOffset, succList,
                succKind, predOffset, predList, reach, stableOrder);
    }

    /**
     * Kahn's algorithm. With {@code stable} set, the ready set is a min-heap on
     * declaration index; otherwise a plain FIFO.
     *
     * @return the order, or null if the graph has a cycle.
     */
    private static int[] kahn(int n, List<TreeMap<Integer, EdgeKind>> succ, boolean stable) {
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++)
            for (int child : succ.get(i).keySet())
                inDegree[child]++;

        int[] order = new int[n];
        int processed = 0;
        if (stable) {
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                order[processed++] = curr;
                for (int child : succ.get(curr).keySet())
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
        } else {
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;
            while (head < tail) {
                int curr = queue[head++];
                order[processed++] = curr;
                for (int child : succ.get(curr).keySet())
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
        }
        return processed == n ? order : null;
    }

    /**
     * Extracts one cycle from hints known to be cyclic. Every node Kahn could
     * not place has an unplaced predecessor, so walking predecessors from such
     * a node must revisit one.
     */
    private static CycleDetectedException cycleError(Task[] tasks, List<TreeSet<Integer>> pred) {
        final int n = tasks.length;
        boolean[] placed = new boolean[n];
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++)
            inDegree[i] = pred.get(i).size();
        // Re-run the peel to learn which nodes are stuck.
        boolean progress = true;
        while (progress) {
            progress = false;
            for (int i = 0; i < n; i++) {
                if (placed[i] || inDegree[i] != 0)
                    continue;
                placed[i] = true;
                progress = true;
                for (int j = 0; j < n; j++)
                    if (!placed[j] && pred.get(j).contains(i))
                        inDegree[j]--;
            }
        }

        int start = 0;
        while (placed[start])
            start++;

        int[] seenAt = new int[n];
        Arrays.fill(seenAt, -1);
        List<Integer> walk = new ArrayList<>();
        int cur = start;
        while (seenAt[cur] < 0) {
            seenAt[cur] = walk.size();
            walk.add(cur);
            int next = -1;
            for (int p : pred.get(cur)) {
                if (!placed[p]) {
                    next = p;
                    break;
                }
            }
            cur = next;
        }

        List<Integer> loop = new ArrayList<>(walk.subList(seenAt[cur], walk.size()));
        Collections.reverse(loop);
        List<String> names = new ArrayList<>(loop.size() + 1);
        for (int idx : loop)
            names.add(tasks[idx].name());
        names.add(names.get(0));
        return new CycleDetectedException(names.get(0), names.get(1), names);
    }

    private static boolean test(long[] row, int bit) {
        return (row[bit >> 6] & (1L << bit)) != 0;
    }

    private static void orInto(long[] dst, long[] src) {
        for (int w = 0; w < dst.length; w++)
            dst[w] |= src[w];
    }
}
