package com.parallel.taskgraph.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Limits the rate of task error logging, so a task that fails on every run of
 * a long verification or benchmark loop does not flood the log.
 *
 * <p>
 * Each logged line names the run and the task it came from and how many errors
 * were dropped since the previous line. The first error is always logged.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final LongSupplier clock;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();
    private final AtomicLong totalSuppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, minIntervalMillis, System::nanoTime);
    }

    ErrorRateLimiter(Logger logger, long minIntervalMillis, LongSupplier clock) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.clock = clock;
    }

    /**
     * @param runId    Run the error happened in.
     * @param taskName Task involved, or null for run level errors.
     * @param context  What was being done when the error occurred.
     * @param t        The error; may be null when {@code context} already describes it.
     * @return true if a line was logged, false if the error was throttled.
     */
    public boolean log(long runId, String taskName, String context, Throwable t) {
        long now = clock.getAsLong();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // One thread wins the slot per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (taskName == null)
                    logger.error("Run {}: {} ({} similar errors suppressed)", runId, context, dropped, t);
                else
                    logger.error("Run {}, task '{}': {} ({} similar errors suppressed)", runId, taskName, context,
                            dropped, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        totalSuppressed.incrementAndGet();
        return false;
    }

    /** Errors dropped since the last logged line. */
    public long pendingSuppressed() {
        return suppressed.get();
    }

    public long totalSuppressed() {
        return totalSuppressed.get();
    }
}
