package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ExecutionStrategy;
import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.util.ExecutionTimeline;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ParallelSchedulerTest {

    private List<String> executionLog;
    private VariableStore state;

    @Before
    public void setUp() {
        executionLog = Collections.synchronizedList(new ArrayList<>());
        state = new VariableStore();
    }

    private Task sleeping(String name, long millis) {
        return new Task(name, s -> {
            executionLog.add(name);
            Thread.sleep(millis);
        });
    }

    @Test
    public void testChainRunsInOrder() {
        List<Task> tasks = new ArrayList<>();
        for (String n : new String[] { "A", "B", "C", "D", "E" })
            tasks.add(sleeping(n, 1));
        Map<String, List<String>> hints = Map.of(
                "A", List.of(), "B", List.of("A"), "C", List.of("B"), "D", List.of("C"), "E", List.of("D"));
        ParallelScheduler scheduler = new ParallelScheduler(new GraphBuilder().build(tasks, hints));

        ExecutionResult result = scheduler.run(state, 4);

        assertTrue(result.isSuccess());
        assertEquals(ExecutionStrategy.PARALLEL, result.strategy());
        assertEquals(List.of("A", "B", "C", "D", "E"), executionLog);
    }

    @Test
    public void testDiamondRunsBranchesConcurrently() {
        List<Task> tasks = List.of(
                sleeping("A", 20), sleeping("B", 60), sleeping("C", 40), sleeping("D", 20), sleeping("E", 40));
        Map<String, List<String>> hints = Map.of(
                "A", List.of(), "B", List.of("A"), "C", List.of("A"), "D", List.of("B", "C"), "E", List.of("B", "C"));
        ParallelScheduler scheduler = new ParallelScheduler(new GraphBuilder().build(tasks, hints));
        ExecutionTimeline timeline = new ExecutionTimeline();
        scheduler.setListener(timeline);

        scheduler.run(state, 4).orThrow();

        assertTrue("B and C did not overlap", timeline.overlapNanos("B", "C") > 0);
        assertTrue("D and E did not overlap", timeline.overlapNanos("D", "E") > 0);
        for (String later : new String[] { "D", "E" }) {
            assertTrue(timeline.startedAfter(later, "B"));
            assertTrue(timeline.startedAfter(later, "C"));
        }
        assertTrue(timeline.startedAfter("B", "A"));
    }

    @Test
    public void testSumUnderManyWorkers() {
        List<Task> tasks = List.of(
                Task.builder("T1").writes("X").body(s -> s.put("X", 5)).build(),
                Task.builder("T2").writes("Y").body(s -> s.put("Y", 7)).build(),
                Task.builder("Tsum").reads("X", "Y").writes("Z").body(s -> s.put("Z", s.getInt("X") + s.getInt("Y")))
                        .build());
        ParallelScheduler scheduler = new ParallelScheduler(new GraphBuilder().build(tasks, Map.of()));

        for (int i = 0; i < 50; i++) {
            state.restore(Map.of());
            scheduler.run(state, 4).orThrow();
            assertEquals(12, state.getInt("Z"));
        }
    }

    @Test
    public void testConflictingIncrementsAreSerialized() {
        // Plain read-modify-write on one variable; only the graph keeps it correct
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 40; i++)
            tasks.add(Task.builder("inc" + i).reads("n").writes("n").body(s -> s.put("n", s.getInt("n") + 1)).build());
        ParallelScheduler scheduler = new ParallelScheduler(new GraphBuilder().build(tasks, Map.of()));

        scheduler.run(state, 8, new RandomReadyTaskPolicy(7)).orThrow();

        assertEquals(40, state.getInt("n"));
    }

    @Test
    public void testSingleWorkerMatchesSequential() {
        List<Task> tasks = List.of(
                Task.builder("A").writes("x").build(),
                Task.builder("B").reads("x").build(),
                Task.builder("C").reads("y").build(),
                Task.builder("D").writes("x", "y").build(),
                new Task("E", null));
        ExecutionGraph graph = new GraphBuilder().build(tasks, Map.of("E", List.of("C")));

        ExecutionResult seq = new SequentialExecutor(graph).run(state);
        ExecutionResult par = new ParallelScheduler(graph).run(state, 1);

        assertEquals(seq.startOrder(), par.startOrder());
    }

    @Test
    public void testFailureStopsDispatch() {
        List<Task> tasks = List.of(
                new Task("Fail", s -> {
                    throw new IllegalStateException("boom");
                }),
                sleeping("Next", 1),
                sleeping("Independent", 30));
        ExecutionGraph graph = new GraphBuilder().build(tasks, Map.of("Next", List.of("Fail")));
        ParallelScheduler scheduler = new ParallelScheduler(graph);

        ExecutionResult result = scheduler.run(state, 2);

        assertFalse(result.isSuccess());
        assertEquals("Fail", result.failedTask().get());
        assertFalse(executionLog.contains("Next"));
        assertFalse(result.startOrder().contains("Next"));
        assertTrue(result.tasksCompleted() < 3);
    }

    @Test
    public void testReusableAfterFailure() {
        boolean[] fail = { true };
        List<Task> tasks = List.of(new Task("Flaky", s -> {
            if (fail[0])
                throw new Exception("first run fails");
        }), sleeping("After", 1));
        ParallelScheduler scheduler = new ParallelScheduler(
                new GraphBuilder().build(tasks, Map.of("After", List.of("Flaky"))));

        assertFalse(scheduler.run(state, 2).isSuccess());
        fail[0] = false;
        ExecutionResult second = scheduler.run(state, 2);
        assertTrue(second.isSuccess());
        assertEquals(2, second.tasksCompleted());
        assertEquals(2, scheduler.runCount());
    }

    @Test
    public void testEmptyGraph() {
        ParallelScheduler scheduler = new ParallelScheduler(new GraphBuilder().build(List.of(), Map.of()));
        ExecutionResult result = scheduler.run(state, 4);
        assertTrue(result.isSuccess());
        assertEquals(0, result.tasksCompleted());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroWorkersRejected() {
        new ParallelScheduler(new GraphBuilder().build(List.of(new Task("A", null)), Map.of())).run(state, 0);
    }

    @Test
    public void testDefaultWorkerCount() {
        assertEquals(Runtime.getRuntime().availableProcessors(), ParallelScheduler.defaultWorkerCount());
    }
}
