package com.parallel.taskgraph.util;

import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.ExecutionStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records when each task of the most recent run started and finished, so that
 * concurrency can be inspected after the fact: which tasks overlapped, and
 * whether a task started only after its prerequisites ended.
 *
 * <p>
 * Times are {@link System#nanoTime()} values. Starting a new run clears the
 * previous one.
 */
public class ExecutionTimeline implements ExecutionListener {

    /** Start and end of one task body. {@code endNanos} is -1 while running. */
    public record Span(String task, long startNanos, long endNanos, String thread) {
        public long durationNanos() {
            return endNanos < 0 ? -1 : endNanos - startNanos;
        }
    }

    private final Map<String, Span> spans = new ConcurrentHashMap<>();
    private volatile long runStartNanos;

    @Override
    public void onRunStart(long runId, ExecutionStrategy strategy, int taskCount) {
        spans.clear();
        runStartNanos = System.nanoTime();
    }

    @Override
    public void onTaskStarted(long runId, int taskIndex, String taskName) {
        spans.put(taskName, new Span(taskName, System.nanoTime(), -1, Thread.currentThread().getName()));
    }

    @Override
    public void onTaskCompleted(long runId, int taskIndex, String taskName, long durationNanos) {
        finish(taskName);
    }

    @Override
    public void onTaskError(long runId, int taskIndex, String taskName, Throwable error) {
        finish(taskName);
    }

    @Override
    public void onRunEnd(long runId, int tasksCompleted, boolean success) {
        // No-op
    }

    private void finish(String taskName) {
        long now = System.nanoTime();
        spans.computeIfPresent(taskName, (k, s) -> new Span(s.task(), s.startNanos(), now, s.thread()));
    }

    public Span span(String taskName) {
        Span s = spans.get(taskName);
        if (s == null)
            throw new IllegalArgumentException("Task did not run: " + taskName);
        return s;
    }

    /** Spans ordered by start time. */
    public Map<String, Span> spans() {
        var out = new LinkedHashMap<String, Span>();
        spans.values().stream()
                .sorted((a, b) -> Long.compare(a.startNanos(), b.startNanos()))
                .forEach(s -> out.put(s.task(), s));
        return Collections.unmodifiableMap(out);
    }

    /** Nanoseconds during which both tasks were running; 0 or negative if they did not overlap. */
    public long overlapNanos(String a, String b) {
        Span sa = span(a), sb = span(b);
        return Math.min(sa.endNanos(), sb.endNanos()) - Math.max(sa.startNanos(), sb.startNanos());
    }

    /** True if {@code later} started no earlier than {@code earlier} finished. */
    public boolean startedAfter(String later, String earlier) {
        return span(later).startNanos() >= span(earlier).endNanos();
    }

    /** Text Gantt chart relative to the run start, one line per task. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        long base = runStartNanos;
        for (Span s : spans().values()) {
            sb.append(String.format("%-20s %10.3f ms -> %10.3f ms  [%s]%n", s.task(),
                    (s.startNanos() - base) / 1e6,
                    s.endNanos() < 0 ? Double.NaN : (s.endNanos() - base) / 1e6,
                    s.thread()));
        }
        return sb.toString();
    }
}
