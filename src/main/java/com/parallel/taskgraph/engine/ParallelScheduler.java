package com.parallel.taskgraph.engine;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.ExecutionStrategy;
import com.parallel.taskgraph.api.ReadyTaskPolicy;
import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.StateSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a task system on a bounded pool of worker threads.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Every task gets a remaining-dependency counter equal to its in-degree.
 * Tasks at zero form the initial ready set.</li>
 * <li>A free worker takes one ready task, chosen by the
 * {@link ReadyTaskPolicy}, and runs its body outside the lock.</li>
 * <li>On success the worker decrements each successor's counter; successors
 * reaching zero join the ready set and idle workers are woken.</li>
 * <li>The run ends when every task completed, or at the first failure. After a
 * failure no further task is dispatched; tasks already running finish.</li>
 * </ol>
 *
 * <p>
 * Thread Safety:
 * The ready set, the counters and the run bookkeeping are only touched under
 * one lock, once per dispatch and once per completion, so a task is never
 * dispatched twice and no wake-up is lost. The lock also publishes each task's
 * effects to every task that depends on it. Task bodies run without any lock;
 * their safety comes entirely from the graph.
 *
 * <p>
 * Each call to {@code run} uses its own short-lived pool of daemon threads.
 * Concurrent calls on one scheduler are allowed but share the listener.
 */
public final class ParallelScheduler {
    private static final Logger log = LogManager.getLogger(ParallelScheduler.class);

    private final ExecutionGraph graph;
    private final AtomicLong runs = new AtomicLong();

    private ExecutionListener listener;
    private boolean validateAccess;
    private StateSnapshot snapshot;

    public ParallelScheduler(ExecutionGraph graph) {
        this.graph = graph;
        this.snapshot = StateSnapshot.of(graph.writtenVariables());
    }

    /** Worker count used when the caller does not pick one. */
    public static int defaultWorkerCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    public void setValidateAccess(boolean validateAccess) {
        this.validateAccess = validateAccess;
    }

    /** Replaces the default snapshot of every written variable. */
    public void setSnapshot(StateSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    public ExecutionResult run(SharedState state) {
        return run(state, defaultWorkerCount(), DeclarationOrderPolicy.INSTANCE);
    }

    public ExecutionResult run(SharedState state, int workerCount) {
        return run(state, workerCount, DeclarationOrderPolicy.INSTANCE);
    }

    /**
     * Executes every task once, concurrently where the graph allows.
     *
     * @param state       The shared state passed to every task body.
     * @param workerCount Maximum number of tasks running at once; at least 1.
     * @param policy      Chooses among ready tasks.
     * @return the run's outcome; never throws for a task failure.
     * @throws IllegalArgumentException if {@code workerCount < 1}.
     * @throws IllegalStateException    if the scheduler itself broke down.
     */
    public ExecutionResult run(SharedState state, int workerCount, ReadyTaskPolicy policy) {
        if (workerCount < 1)
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);

        final long runId = runs.incrementAndGet();
        final int n = graph.taskCount();
        final ExecutionListener l = this.listener;
        final Run run = new Run(runId, state, policy, l);

        if (l != null)
            l.onRunStart(runId, ExecutionStrategy.PARALLEL, n);

        long start = System.nanoTime();
        int threads = Math.min(workerCount, n);
        try {
            if (threads > 0) {
                ExecutorService pool = Executors.newFixedThreadPool(threads, DaemonThreadFactory.INSTANCE);
                try {
                    List<Future<?>> workers = new ArrayList<>(threads);
                    for (int w = 0; w < threads; w++)
                        workers.add(pool.submit(run::workLoop));
                    for (Future<?> f : workers)
                        await(f, run);
                } finally {
                    pool.shutdown();
                }
            }
        } finally {
            if (l != null)
                l.onRunEnd(runId, run.completed, run.failure == null && run.internalError == null);
        }
        long elapsed = System.nanoTime() - start;

        if (run.internalError != null)
            throw new IllegalStateException("Parallel run " + runId + " aborted", run.internalError);

        if (run.failure != null)
            log.error("Parallel run {} failed at task '{}'", runId, run.failure.taskName(),
                    run.failure.getCause());
        else
            log.debug("Parallel run {} completed {} tasks on {} workers in {} us", runId, run.completed,
                    threads, elapsed / 1_000);

        // Workers are joined, so every task's writes are visible here
        Map<String, Object> captured = run.failure == null ? snapshot.capture(state) : null;
        return new ExecutionResult(ExecutionStrategy.PARALLEL, runId, n, run.completed, elapsed,
                run.startOrder, run.failure, captured);
    }

    private static void await(Future<?> worker, Run run) {
        try {
            worker.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.abort(e);
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            // workLoop records its own errors; reaching here means it escaped anyway.
            run.abort(e.getCause());
        }
    }

    public long runCount() {
        return runs.get();
    }

    public ExecutionGraph graph() {
        return graph;
    }

    /** Bookkeeping of one run. All mutable fields are guarded by {@code lock}. */
    private final class Run {
        private final long runId;
        private final SharedState state;
        private final ReadyTaskPolicy policy;
        private final ExecutionListener listener;

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();

        private final int[] remaining;
        private final List<Integer> ready = new ArrayList<>();
        private final List<String> startOrder;
        private int inFlight;
        private int completed;
        private TaskExecutionException failure;
        private Throwable internalError;

        Run(long runId, SharedState state, ReadyTaskPolicy policy, ExecutionListener listener) {
            this.runId = runId;
            this.state = state;
            this.policy = policy;
            this.listener = listener;
            int n = graph.taskCount();
            this.remaining = new int[n];
            this.startOrder = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                remaining[i] = graph.inDegree(i);
                if (remaining[i] == 0)
                    ready.add(i);
            }
        }

        void workLoop() {
            try {
                int ti;
                while ((ti = takeNext()) >= 0) {
                    TaskExecutionException error = null;
                    try {
                        TaskInvoker.invoke(runId, ti, graph.task(ti), state, validateAccess, listener);
                    } catch (TaskExecutionException e) {
                        error = e;
                    }
                    complete(ti, error);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort(e);
            } catch (Throwable e) {
                abort(e);
            }
        }

        /** Blocks until a task is ready or the run is over. Returns -1 when over. */
        private int takeNext() throws InterruptedException {
            lock.lock();
            try {
                while (true) {
                    if (failure != null || internalError != null || completed == remaining.length)
                        return -1;
                    if (!ready.isEmpty())
                        break;
                    if (inFlight == 0) {
                        internalError = new IllegalStateException(
                                "Deadlock detected: no ready tasks but " + (remaining.length - completed)
                                        + " tasks not completed");
                        changed.signalAll();
                        return -1;
                    }
                    changed.await();
                }
                int ti = ready.remove(policy.select(Collections.unmodifiableList(ready)));
                inFlight++;
                startOrder.add(graph.task(ti).name());
                log.trace("Run {} dispatching '{}'", runId, graph.task(ti).name());
                return ti;
            } finally {
                lock.unlock();
            }
        }

        private void complete(int ti, TaskExecutionException error) {
            lock.lock();
            try {
                inFlight--;
                if (error != null) {
                    if (failure == null)
                        failure = error;
                } else {
                    completed++;
                    for (int i = 0; i < graph.successorCount(ti); i++) {
                        int child = graph.successor(ti, i);
                        if (--remaining[child] == 0)
                            ready.add(child);
                    }
                }
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        void abort(Throwable cause) {
            lock.lock();
            try {
                if (internalError == null)
                    internalError = cause;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
