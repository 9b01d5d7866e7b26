package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.ExecutionStrategy;
import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.StateSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a task system one task at a time on the calling thread.
 *
 * <p>
 * Tasks execute in the graph's stable topological order: whenever several
 * tasks are ready, the one declared first goes next. The order is a pure
 * function of the graph, so with deterministic task bodies two sequential runs
 * always leave the shared state identical. This executor is the reference
 * semantics the parallel scheduler and the determinism verifier are checked
 * against.
 *
 * <p>
 * Fail fast: the first task that throws stops the run. Later tasks are not
 * executed, and the failure is returned in the {@link ExecutionResult}. The
 * executor itself stays usable for further runs.
 */
public final class SequentialExecutor {
    private static final Logger log = LogManager.getLogger(SequentialExecutor.class);

    private final ExecutionGraph graph;
    private final int[] order;
    private final AtomicLong runs = new AtomicLong();

    private ExecutionListener listener;
    private boolean validateAccess;
    private StateSnapshot snapshot;

    public SequentialExecutor(ExecutionGraph graph) {
        this.graph = graph;
        this.order = graph.stableTopologicalOrder();
        this.snapshot = StateSnapshot.of(graph.writtenVariables());
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    /** Wrap the state per task so undeclared accesses fail the task. */
    public void setValidateAccess(boolean validateAccess) {
        this.validateAccess = validateAccess;
    }

    /** Replaces the default snapshot of every written variable. */
    public void setSnapshot(StateSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    /**
     * Executes every task once.
     *
     * @param state The shared state passed to every task body.
     * @return the run's outcome; never throws for a task failure.
     */
    public ExecutionResult run(SharedState state) {
        final long runId = runs.incrementAndGet();
        final int n = order.length;
        final ExecutionListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener)
            l.onRunStart(runId, ExecutionStrategy.SEQUENTIAL, n);

        List<String> started = new ArrayList<>(n);
        int completed = 0;
        TaskExecutionException failure = null;
        long start = System.nanoTime();
        try {
            for (int ti : order) {
                started.add(graph.task(ti).name());
                try {
                    TaskInvoker.invoke(runId, ti, graph.task(ti), state, validateAccess, l);
                } catch (TaskExecutionException e) {
                    failure = e;
                    break; // Nothing after a failed task may run
                }
                completed++;
            }
        } finally {
            if (hasListener)
                l.onRunEnd(runId, completed, failure == null);
        }
        long elapsed = System.nanoTime() - start;
        Map<String, Object> captured = failure == null ? snapshot.capture(state) : null;

        if (failure != null)
            log.error("Sequential run {} failed at task '{}'", runId, failure.taskName(), failure.getCause());
        else
            log.debug("Sequential run {} completed {} tasks in {} us", runId, completed, elapsed / 1_000);

        return new ExecutionResult(ExecutionStrategy.SEQUENTIAL, runId, n, completed, elapsed, started, failure,
                captured);
    }

    /** Number of runs started so far. */
    public long runCount() {
        return runs.get();
    }

    public ExecutionGraph graph() {
        return graph;
    }
}
