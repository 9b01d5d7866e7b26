package com.parallel.taskgraph;

import com.parallel.taskgraph.engine.ParallelScheduler;
import com.parallel.taskgraph.perf.PerformanceMeasurer;
import com.parallel.taskgraph.verify.DeterminismVerifier;

import lombok.Getter;
import lombok.ToString;

/**
 * Immutable settings of a {@link TaskSystem}.
 *
 * <pre>{@code
 * TaskSystemConfig config = TaskSystemConfig.builder()
 *         .defaultWorkerCount(4)
 *         .validateAccess(true)
 *         .build();
 * }</pre>
 */
@Getter
@ToString
public final class TaskSystemConfig {
    /** Workers used by {@code runParallel()} without an explicit count. */
    private final int defaultWorkerCount;
    /** Fail tasks that touch variables outside their declared access sets. */
    private final boolean validateAccess;
    /** Base seed of the verifier's random ready-task policy. */
    private final long verificationSeed;
    /** Workers per verification trial; 0 follows {@code defaultWorkerCount}. */
    private final int verificationWorkerCount;
    /** Trials run by {@code measurePerformance(workerCount)}. */
    private final int performanceTrials;

    private TaskSystemConfig(Builder b) {
        this.defaultWorkerCount = b.defaultWorkerCount;
        this.validateAccess = b.validateAccess;
        this.verificationSeed = b.verificationSeed;
        this.verificationWorkerCount = b.verificationWorkerCount;
        this.performanceTrials = b.performanceTrials;
    }

    public static TaskSystemConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Workers per verification trial. */
    public int getVerificationWorkerCount() {
        return verificationWorkerCount > 0 ? verificationWorkerCount : defaultWorkerCount;
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .defaultWorkerCount(defaultWorkerCount)
                .validateAccess(validateAccess)
                .verificationSeed(verificationSeed)
                .performanceTrials(performanceTrials);
        b.verificationWorkerCount = verificationWorkerCount;
        return b;
    }

    public static final class Builder {
        private int defaultWorkerCount = ParallelScheduler.defaultWorkerCount();
        private boolean validateAccess;
        private long verificationSeed = DeterminismVerifier.DEFAULT_SEED;
        private int verificationWorkerCount; // 0: follow defaultWorkerCount
        private int performanceTrials = PerformanceMeasurer.DEFAULT_TRIALS;

        private Builder() {
        }

        public Builder defaultWorkerCount(int workers) {
            if (workers < 1)
                throw new IllegalArgumentException("defaultWorkerCount must be >= 1, got " + workers);
            this.defaultWorkerCount = workers;
            return this;
        }

        public Builder validateAccess(boolean validate) {
            this.validateAccess = validate;
            return this;
        }

        public Builder verificationSeed(long seed) {
            this.verificationSeed = seed;
            return this;
        }

        public Builder verificationWorkerCount(int workers) {
            if (workers < 1)
                throw new IllegalArgumentException("verificationWorkerCount must be >= 1, got " + workers);
            this.verificationWorkerCount = workers;
            return this;
        }

        public Builder performanceTrials(int trials) {
            if (trials < 1)
                throw new IllegalArgumentException("performanceTrials must be >= 1, got " + trials);
            this.performanceTrials = trials;
            return this;
        }

        public TaskSystemConfig build() {
            return new TaskSystemConfig(this);
        }
    }
}
