package com.parallel.taskgraph.util;

import com.parallel.taskgraph.api.ExecutionStrategy;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompositeExecutionListenerTest {

    @Test
    public void testFansOutToAllListeners() {
        CompositeExecutionListener composite = new CompositeExecutionListener();
        TaskProfileListener first = new TaskProfileListener();
        TaskProfileListener second = new TaskProfileListener();
        ExecutionTimeline timeline = new ExecutionTimeline();
        composite.addForComposite(first);
        composite.addForComposite(second);
        composite.addForComposite(timeline);

        composite.onRunStart(1, ExecutionStrategy.PARALLEL, 1);
        composite.onTaskStarted(1, 0, "a");
        composite.onTaskCompleted(1, 0, "a", 100);
        composite.onRunEnd(1, 1, true);

        assertEquals(3, composite.size());
        assertEquals(1, first.stats("a").count);
        assertEquals(1, second.stats("a").count);
        assertTrue(timeline.span("a").durationNanos() >= 0);
    }

    @Test
    public void testEmptyCompositeIsSilent() {
        CompositeExecutionListener composite = new CompositeExecutionListener();
        composite.onRunStart(1, ExecutionStrategy.SEQUENTIAL, 0);
        composite.onRunEnd(1, 0, true);
        assertEquals(0, composite.size());
    }
}
