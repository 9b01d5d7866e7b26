package com.parallel.taskgraph.perf;

/**
 * Wall-clock comparison of the sequential and parallel executors on one graph.
 * All times in nanoseconds.
 */
public final class PerformanceReport {
    private final int workerCount;
    private final long[] sequentialNanos;
    private final long[] parallelNanos;

    PerformanceReport(int workerCount, long[] sequentialNanos, long[] parallelNanos) {
        this.workerCount = workerCount;
        this.sequentialNanos = sequentialNanos;
        this.parallelNanos = parallelNanos;
    }

    public int workerCount() {
        return workerCount;
    }

    public int trials() {
        return sequentialNanos.length;
    }

    public long sequentialNanos(int trial) {
        return sequentialNanos[trial];
    }

    public long parallelNanos(int trial) {
        return parallelNanos[trial];
    }

    public double avgSequentialNanos() {
        return average(sequentialNanos);
    }

    public double avgParallelNanos() {
        return average(parallelNanos);
    }

    /** Average sequential time over average parallel time; 0 if the latter is 0. */
    public double speedup() {
        double par = avgParallelNanos();
        return par > 0 ? avgSequentialNanos() / par : 0;
    }

    private static double average(long[] xs) {
        if (xs.length == 0)
            return 0;
        long sum = 0;
        for (long x : xs)
            sum += x;
        return (double) sum / xs.length;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-8s | %14s | %14s%n", "Trial", "Sequential(ms)", "Parallel(ms)"));
        sb.append("--------------------------------------------\n");
        for (int i = 0; i < sequentialNanos.length; i++)
            sb.append(String.format("%-8d | %14.3f | %14.3f%n", i + 1, sequentialNanos[i] / 1e6,
                    parallelNanos[i] / 1e6));
        sb.append("--------------------------------------------\n");
        sb.append(String.format("%-8s | %14.3f | %14.3f%n", "Average", avgSequentialNanos() / 1e6,
                avgParallelNanos() / 1e6));
        sb.append(String.format("Speedup: %.2fx on %d workers%n", speedup(), workerCount));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("PerformanceReport[seq=%.3f ms, par=%.3f ms, speedup=%.2fx, workers=%d]",
                avgSequentialNanos() / 1e6, avgParallelNanos() / 1e6, speedup(), workerCount);
    }
}
