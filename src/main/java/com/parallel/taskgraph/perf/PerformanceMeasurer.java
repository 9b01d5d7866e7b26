package com.parallel.taskgraph.perf;

import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.engine.ParallelScheduler;
import com.parallel.taskgraph.engine.SequentialExecutor;

import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Times the sequential executor against the parallel scheduler.
 *
 * <p>
 * Each trial runs the sequential executor and then the parallel scheduler,
 * resetting the shared state to its initial content before each run. Failed
 * runs are not timed; the failure is rethrown.
 */
@Log4j2
public final class PerformanceMeasurer {
    public static final int DEFAULT_TRIALS = 5;

    private final SequentialExecutor sequential;
    private final ParallelScheduler parallel;

    public PerformanceMeasurer(SequentialExecutor sequential, ParallelScheduler parallel) {
        this.sequential = sequential;
        this.parallel = parallel;
    }

    public PerformanceReport measure(SharedState state, int workerCount) {
        return measure(state, workerCount, DEFAULT_TRIALS);
    }

    /**
     * @throws com.parallel.taskgraph.engine.TaskExecutionException if any run fails.
     */
    public PerformanceReport measure(SharedState state, int workerCount, int trials) {
        if (trials < 1)
            throw new IllegalArgumentException("trials must be >= 1, got " + trials);
        if (workerCount < 1)
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);

        final Map<String, Object> initial = state.snapshot();
        long[] seq = new long[trials];
        long[] par = new long[trials];
        try {
            for (int i = 0; i < trials; i++) {
                state.restore(initial);
                seq[i] = sequential.run(state).orThrow().elapsedNanos();

                state.restore(initial);
                par[i] = parallel.run(state, workerCount).orThrow().elapsedNanos();

                log.debug("Trial {}: sequential {} us, parallel {} us", i + 1, seq[i] / 1_000, par[i] / 1_000);
            }
        } finally {
            state.restore(initial);
        }

        PerformanceReport report = new PerformanceReport(workerCount, seq, par);
        log.info("{}", report);
        return report;
    }
}
