package com.parallel.taskgraph.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.ExecutionStrategy;
import com.parallel.taskgraph.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

/**
 * An {@link ExecutionListener} that hands every callback to a delegate on a
 * single background thread, through an LMAX Disruptor ring buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Worker threads of the scheduler (multiple producers) claim a slot, fill
 * in an {@link ExecutionEvent} and publish it.</li>
 * <li>The Disruptor sequences the events of all workers.</li>
 * <li>One consumer thread replays them, in sequence order, as callbacks on the
 * delegate.</li>
 * </ol>
 *
 * <p>
 * Workers therefore pay only for a slot claim, and the delegate never sees
 * concurrent calls, so it needs no synchronization of its own. Delivery is
 * asynchronous: call {@link #awaitDelivery()} before reading the delegate's
 * state, and {@link #close()} when done.
 */
public final class AsyncExecutionListener implements ExecutionListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(AsyncExecutionListener.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final ExecutionListener delegate;
    private final Disruptor<ExecutionEvent> disruptor;
    private final RingBuffer<ExecutionEvent> ringBuffer;
    private final AtomicLong delivered = new AtomicLong(-1);
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private volatile boolean closed;

    public AsyncExecutionListener(ExecutionListener delegate) {
        this(delegate, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize Ring buffer size; must be a power of two.
     */
    public AsyncExecutionListener(ExecutionListener delegate, int bufferSize) {
        this.delegate = delegate;
        this.disruptor = new Disruptor<>(
                ExecutionEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new Dispatcher());
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void onRunStart(long runId, ExecutionStrategy strategy, int taskCount) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setRunStart(runId, strategy, taskCount);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onTaskStarted(long runId, int taskIndex, String taskName) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setTaskStarted(runId, taskIndex, taskName);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onTaskCompleted(long runId, int taskIndex, String taskName, long durationNanos) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setTaskCompleted(runId, taskIndex, taskName, durationNanos);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onTaskError(long runId, int taskIndex, String taskName, Throwable error) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setTaskError(runId, taskIndex, taskName, error);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onRunEnd(long runId, int tasksCompleted, boolean success) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setRunEnd(runId, tasksCompleted, success);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /** Blocks until every event published so far has reached the delegate. */
    public void awaitDelivery() {
        long target = ringBuffer.getCursor();
        while (delivered.get() < target) {
            if (closed)
                return;
            LockSupport.parkNanos(10_000);
        }
    }

    /** Delivers the remaining events, then stops the consumer thread. */
    @Override
    public void close() {
        if (closed)
            return;
        disruptor.shutdown();
        closed = true;
    }

    private final class Dispatcher implements EventHandler<ExecutionEvent> {
        @Override
        public void onEvent(ExecutionEvent event, long sequence, boolean endOfBatch) {
            try {
                switch (event.type()) {
                    case RUN_START -> delegate.onRunStart(event.runId(), event.strategy(), event.count());
                    case TASK_STARTED -> delegate.onTaskStarted(event.runId(), event.taskIndex(), event.taskName());
                    case TASK_COMPLETED -> delegate.onTaskCompleted(event.runId(), event.taskIndex(),
                            event.taskName(), event.durationNanos());
                    case TASK_ERROR -> delegate.onTaskError(event.runId(), event.taskIndex(), event.taskName(),
                            event.error());
                    case RUN_END -> delegate.onRunEnd(event.runId(), event.count(), event.success());
                }
            } catch (RuntimeException e) {
                // A broken delegate must not stop delivery of later events.
                errLimiter.log(event.runId(), event.taskName(), "execution listener failed on " + event.type(), e);
            } finally {
                event.clear();
                delivered.set(sequence);
            }
        }
    }
}
