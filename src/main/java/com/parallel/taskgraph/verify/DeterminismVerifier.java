package com.parallel.taskgraph.verify;

import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.StateSnapshot;
import com.parallel.taskgraph.engine.ExecutionGraph;
import com.parallel.taskgraph.engine.ExecutionResult;
import com.parallel.taskgraph.engine.ParallelScheduler;
import com.parallel.taskgraph.engine.RandomReadyTaskPolicy;
import com.parallel.taskgraph.engine.SequentialExecutor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Hunts for races the execution graph failed to order.
 *
 * <p>
 * The sequential executor defines the expected final state. The parallel
 * scheduler is then run repeatedly, each trial picking among ready tasks with a
 * {@link RandomReadyTaskPolicy} seeded with {@code seed + trial}, so that
 * unordered tasks are interleaved differently from one trial to the next. The
 * shared state is reset to its initial content before every run and again at
 * the end.
 *
 * <p>
 * A trial whose snapshot differs from the expected one, or that fails with a
 * task error, is reported as nondeterminism. For a graph built from honest
 * access declarations this never happens; a report points at a task that
 * under-declares its reads or writes. Nondeterminism is a result, never an
 * exception.
 */
public final class DeterminismVerifier {
    private static final Logger log = LogManager.getLogger(DeterminismVerifier.class);

    public static final long DEFAULT_SEED = 42L;

    private final SequentialExecutor sequential;
    private final ParallelScheduler parallel;

    public DeterminismVerifier(ExecutionGraph graph) {
        this(new SequentialExecutor(graph), new ParallelScheduler(graph));
    }

    public DeterminismVerifier(SequentialExecutor sequential, ParallelScheduler parallel) {
        if (sequential.graph() != parallel.graph())
            throw new IllegalArgumentException("Executors must share one execution graph");
        this.sequential = sequential;
        this.parallel = parallel;
    }

    /** Snapshots every written variable and uses the default worker count and seed. */
    public VerificationResult verify(SharedState state, int trials) {
        return verify(state, trials, StateSnapshots.writtenVariables(sequential.graph()));
    }

    public VerificationResult verify(SharedState state, int trials, StateSnapshot snapshot) {
        return verify(state, trials, snapshot, ParallelScheduler.defaultWorkerCount(), DEFAULT_SEED);
    }

    /**
     * Runs the check.
     *
     * @param state       Caller-owned state; restored to its initial content on return.
     * @param trials      Number of randomized parallel runs, at least 1.
     * @param snapshot    Extracts the values to compare.
     * @param workerCount Workers per parallel run.
     * @param seed        Base seed of the random ready-task policy.
     * @throws com.parallel.taskgraph.engine.TaskExecutionException if the
     *         sequential reference run itself fails.
     */
    public VerificationResult verify(SharedState state, int trials, StateSnapshot snapshot, int workerCount,
            long seed) {
        if (trials < 1)
            throw new IllegalArgumentException("trials must be >= 1, got " + trials);

        final Map<String, Object> initial = state.snapshot();
        try {
            sequential.run(state).orThrow();
            final Map<String, Object> expected = snapshot.capture(state);

            for (int trial = 0; trial < trials; trial++) {
                state.restore(initial);
                ExecutionResult result = parallel.run(state, workerCount, new RandomReadyTaskPolicy(seed + trial));
                Map<String, Object> actual = snapshot.capture(state);

                if (!result.isSuccess() || !expected.equals(actual)) {
                    VerificationResult verdict = VerificationResult.diverged(trial, seed, expected, actual,
                            result.failedTask().orElse(null));
                    log.warn("{}", verdict);
                    return verdict;
                }
            }

            log.info("Task system deterministic over {} trials on {} workers", trials, workerCount);
            return VerificationResult.deterministic(trials, seed, expected);
        } finally {
            state.restore(initial);
        }
    }
}
