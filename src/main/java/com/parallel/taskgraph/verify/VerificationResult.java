package com.parallel.taskgraph.verify;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Verdict of a determinism check.
 *
 * <p>
 * When nondeterminism was detected, {@link #divergingTrial()} is the index of
 * the first trial whose final state differed from the sequential ground truth,
 * and {@link #expected()} / {@link #actual()} hold the two snapshots.
 */
public final class VerificationResult {
    private final boolean deterministic;
    private final int divergingTrial;
    private final int trialsRun;
    private final long seed;
    private final Map<String, Object> expected;
    private final Map<String, Object> actual;
    private final String failedTask;

    private VerificationResult(boolean deterministic, int divergingTrial, int trialsRun, long seed,
            Map<String, Object> expected, Map<String, Object> actual, String failedTask) {
        this.deterministic = deterministic;
        this.divergingTrial = divergingTrial;
        this.trialsRun = trialsRun;
        this.seed = seed;
        this.expected = expected;
        this.actual = actual;
        this.failedTask = failedTask;
    }

    static VerificationResult deterministic(int trialsRun, long seed, Map<String, Object> expected) {
        return new VerificationResult(true, -1, trialsRun, seed, expected, expected, null);
    }

    static VerificationResult diverged(int trial, long seed, Map<String, Object> expected,
            Map<String, Object> actual, String failedTask) {
        return new VerificationResult(false, trial, trial + 1, seed, expected, actual, failedTask);
    }

    public boolean isDeterministic() {
        return deterministic;
    }

    public OptionalInt divergingTrial() {
        return deterministic ? OptionalInt.empty() : OptionalInt.of(divergingTrial);
    }

    public int trialsRun() {
        return trialsRun;
    }

    /** Base seed; trial {@code t} used {@code seed + t}. */
    public long seed() {
        return seed;
    }

    /** Snapshot produced by the sequential executor. */
    public Map<String, Object> expected() {
        return expected;
    }

    /** Snapshot of the diverging trial, or the ground truth when deterministic. */
    public Map<String, Object> actual() {
        return actual;
    }

    /** Task that failed during the diverging trial, if the divergence was a task error. */
    public String failedTask() {
        return failedTask;
    }

    @Override
    public String toString() {
        if (deterministic)
            return "Deterministic over " + trialsRun + " trials (seed " + seed + ")";
        return "Nondeterminism detected at trial " + divergingTrial + " (seed " + (seed + divergingTrial)
                + "): expected " + expected + ", got " + actual
                + (failedTask != null ? ", task '" + failedTask + "' failed" : "");
    }
}
