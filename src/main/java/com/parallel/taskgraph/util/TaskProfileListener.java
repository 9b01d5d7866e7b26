package com.parallel.taskgraph.util;

import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.ExecutionStrategy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Aggregates per-task execution statistics across runs to find the tasks that
 * dominate the critical path. Failures are counted and logged, throttled to one
 * line per second.
 */
public class TaskProfileListener implements ExecutionListener {
    private static final Logger log = LogManager.getLogger(TaskProfileListener.class);

    public static class TaskStats {
        public final String name;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public TaskStats(String name) {
            this.name = name;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    // Flat array mapping declaration index -> TaskStats.
    private TaskStats[] statsArray = new TaskStats[0];
    private long runs;

    @Override
    public synchronized void onRunStart(long runId, ExecutionStrategy strategy, int taskCount) {
        runs++;
        if (taskCount > statsArray.length)
            statsArray = Arrays.copyOf(statsArray, taskCount);
    }

    @Override
    public synchronized void onTaskCompleted(long runId, int taskIndex, String taskName, long durationNanos) {
        stats(taskIndex, taskName).update(durationNanos);
    }

    @Override
    public synchronized void onTaskError(long runId, int taskIndex, String taskName, Throwable error) {
        stats(taskIndex, taskName).errors++;
        errLimiter.log(runId, taskName, "failed with " + error, null);
    }

    @Override
    public void onRunEnd(long runId, int tasksCompleted, boolean success) {
        // No-op
    }

    private TaskStats stats(int taskIndex, String taskName) {
        if (taskIndex >= statsArray.length)
            statsArray = Arrays.copyOf(statsArray, Math.max(taskIndex + 1, statsArray.length * 2));
        if (statsArray[taskIndex] == null)
            statsArray[taskIndex] = new TaskStats(taskName);
        return statsArray[taskIndex];
    }

    /** Stats of one task, or null if it never ran. */
    public synchronized TaskStats stats(String taskName) {
        for (TaskStats s : statsArray)
            if (s != null && s.name.equals(taskName))
                return s;
        return null;
    }

    public synchronized long runs() {
        return runs;
    }

    public synchronized void reset() {
        runs = 0;
        Arrays.fill(statsArray, null);
    }

    /** Formatted table of task statistics, slowest total first. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %8s | %6s | %10s | %10s | %10s | %10s%n", "Task Name", "Count", "Errors",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append(
                "--------------------------------------------------------------------------------------------------------\n");

        TaskStats[] valid = Arrays.stream(statsArray)
                .filter(s -> s != null && (s.count > 0 || s.errors > 0))
                .toArray(TaskStats[]::new);
        Arrays.sort(valid, (s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (TaskStats s : valid) {
            sb.append(String.format("%-30s | %8d | %6d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.name, 30),
                    s.count,
                    s.errors,
                    s.lastDurationNanos / 1000.0,
                    s.avgMicros(),
                    s.count == 0 ? 0 : s.minDurationNanos / 1000.0,
                    s.count == 0 ? 0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
