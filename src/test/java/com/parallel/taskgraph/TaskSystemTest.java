package com.parallel.taskgraph;

import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.engine.CycleDetectedException;
import com.parallel.taskgraph.engine.DuplicateTaskNameException;
import com.parallel.taskgraph.engine.ExecutionResult;
import com.parallel.taskgraph.engine.UnknownTaskReferenceException;
import com.parallel.taskgraph.engine.VariableStore;
import com.parallel.taskgraph.perf.PerformanceReport;
import com.parallel.taskgraph.util.ExecutionTimeline;
import com.parallel.taskgraph.util.TaskProfileListener;
import com.parallel.taskgraph.verify.StateSnapshots;
import com.parallel.taskgraph.verify.VerificationResult;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * End-to-end scenarios through the public entry point.
 */
public class TaskSystemTest {

    private List<String> executionLog;
    private VariableStore state;

    @Before
    public void setUp() {
        executionLog = Collections.synchronizedList(new ArrayList<>());
        state = new VariableStore();
    }

    private Task.Builder timed(String name, long millis) {
        return Task.builder(name).body(s -> {
            executionLog.add(name);
            Thread.sleep(millis);
        });
    }

    @Test
    public void testBasicChain() {
        List<Task> tasks = new ArrayList<>();
        for (String n : new String[] { "A", "B", "C", "D", "E" })
            tasks.add(timed(n, 5).build());
        Map<String, List<String>> precedences = Map.of(
                "A", List.of(), "B", List.of("A"), "C", List.of("B"), "D", List.of("C"), "E", List.of("D"));
        TaskSystem system = new TaskSystem(tasks, precedences, state);

        system.runSequential().orThrow();
        assertEquals(List.of("A", "B", "C", "D", "E"), executionLog);

        executionLog.clear();
        system.runParallel().orThrow();
        assertEquals(List.of("A", "B", "C", "D", "E"), executionLog);
    }

    @Test
    public void testParallelDiamond() {
        List<Task> tasks = List.of(
                timed("A", 20).build(), timed("B", 60).build(), timed("C", 40).build(),
                timed("D", 20).build(), timed("E", 40).build());
        Map<String, List<String>> precedences = Map.of(
                "A", List.of(), "B", List.of("A"), "C", List.of("A"), "D", List.of("B", "C"), "E", List.of("B", "C"));
        TaskSystem system = new TaskSystem(tasks, precedences, state);
        ExecutionTimeline timeline = new ExecutionTimeline();
        system.addListener(timeline);

        system.runParallel(4).orThrow();

        assertTrue(timeline.dump(), timeline.overlapNanos("B", "C") > 0);
        assertTrue(timeline.dump(), timeline.overlapNanos("D", "E") > 0);
        assertTrue(timeline.startedAfter("D", "B") && timeline.startedAfter("D", "C"));
        assertTrue(timeline.startedAfter("E", "B") && timeline.startedAfter("E", "C"));
    }

    @Test
    public void testResourceInterference() {
        List<Task> tasks = List.of(
                timed("A", 2).writes("x").build(),
                timed("B", 3).reads("x").build(),
                timed("C", 2).reads("y").build(),
                timed("D", 1).writes("x", "y").build());
        TaskSystem system = new TaskSystem(tasks, Map.of("A", List.of(), "B", List.of(), "C", List.of(),
                "D", List.of()), state);

        assertEquals(List.of("A", "B", "C"), system.graph().prerequisites("D"));
        assertEquals(List.of("A"), system.graph().prerequisites("B"));
        assertTrue(system.graph().prerequisites("C").isEmpty());

        ExecutionResult seq = system.runSequential().orThrow();
        assertEquals(List.of("A", "B", "C", "D"), seq.startOrder());
        ExecutionResult par = system.runParallel(4).orThrow();
        assertEquals("D", par.startOrder().get(3));
    }

    @Test
    public void testErrorCases() {
        try {
            new TaskSystem(List.of(new Task("A", null), new Task("A", null)), Map.of("A", List.of()), state);
            fail("Duplicate names accepted");
        } catch (DuplicateTaskNameException expected) {
            assertTrue(expected.getMessage().contains("A"));
        }

        try {
            new TaskSystem(List.of(new Task("A", null), new Task("B", null)),
                    Map.of("A", List.of(), "B", List.of("C")), state);
            fail("Unknown dependency accepted");
        } catch (UnknownTaskReferenceException expected) {
            assertEquals("C", expected.taskName());
        }

        try {
            new TaskSystem(List.of(new Task("A", null), new Task("B", null), new Task("C", null)),
                    Map.of("A", List.of("C"), "B", List.of("A"), "C", List.of("B")), state);
            fail("Cycle accepted");
        } catch (CycleDetectedException expected) {
            assertEquals(4, expected.cycle().size());
        }
    }

    @Test
    public void testComplexWorkflow() {
        Map<String, List<String>> precedences = new LinkedHashMap<>();
        precedences.put("LoadData", List.of());
        precedences.put("ProcessA", List.of("LoadData"));
        precedences.put("ProcessB", List.of("LoadData"));
        precedences.put("ProcessC", List.of("LoadData"));
        precedences.put("MergeAB", List.of("ProcessA", "ProcessB"));
        precedences.put("MergeC", List.of("ProcessC"));
        precedences.put("FinalMerge", List.of("MergeAB", "MergeC"));

        List<Task> tasks = List.of(
                step("LoadData", 30, List.of(), "data", s -> 1),
                step("ProcessA", 20, List.of("data"), "resultA", s -> s.getInt("data") + 10),
                step("ProcessB", 40, List.of("data"), "resultB", s -> s.getInt("data") + 20),
                step("ProcessC", 30, List.of("data"), "resultC", s -> s.getInt("data") + 30),
                step("MergeAB", 20, List.of("resultA", "resultB"), "mergedAB",
                        s -> s.getInt("resultA") + s.getInt("resultB")),
                step("MergeC", 10, List.of("resultC"), "processedC", s -> s.getInt("resultC") * 2),
                step("FinalMerge", 20, List.of("mergedAB", "processedC"), "final",
                        s -> s.getInt("mergedAB") + s.getInt("processedC")));

        TaskSystem system = new TaskSystem(tasks, precedences, state,
                TaskSystemConfig.builder().defaultWorkerCount(4).validateAccess(true).build());

        system.runSequential().orThrow();
        int sequentialFinal = state.getInt("final");
        assertEquals((11 + 21) + 31 * 2, sequentialFinal);

        state.restore(Map.of());
        system.runParallel().orThrow();
        assertEquals(sequentialFinal, state.getInt("final"));

        PerformanceReport report = system.measurePerformance(4, 2);
        assertTrue(report.dump(), report.speedup() > 1.1);
    }

    private interface Compute {
        int apply(SharedState s);
    }

    private Task step(String name, long millis, List<String> reads, String write, Compute fn) {
        return Task.builder(name).reads(reads).writes(write).body(s -> {
            Thread.sleep(millis);
            s.put(write, fn.apply(s));
        }).build();
    }

    @Test
    public void testSumScenarioDeterministic() {
        state.put("x", 2);
        state.put("y", 3);
        List<Task> tasks = List.of(
                Task.builder("T1").reads("x").writes("X").body(s -> s.put("X", s.getInt("x"))).build(),
                Task.builder("T2").reads("y").writes("Y").body(s -> s.put("Y", s.getInt("y"))).build(),
                Task.builder("Tsum").reads("X", "Y").writes("Z").body(s -> s.put("Z", s.getInt("X") + s.getInt("Y")))
                        .build());
        TaskSystem system = new TaskSystem(tasks, null, state);

        VerificationResult result = system.testDeterminism(100);

        assertTrue(result.toString(), result.isDeterministic());
        assertEquals(5, result.expected().get("Z"));
        // Verification leaves the state as it found it
        assertNull(state.get("Z"));
    }

    @Test
    public void testSumScenarioResultSnapshots() {
        List<Task> tasks = List.of(
                Task.builder("T1").writes("X").body(s -> s.put("X", 1)).build(),
                Task.builder("T2").writes("Y").body(s -> s.put("Y", 2)).build(),
                Task.builder("Tsum").reads("X", "Y").writes("Z").body(s -> s.put("Z", s.getInt("X") + s.getInt("Y")))
                        .build());
        TaskSystem system = new TaskSystem(tasks, null, state);

        Map<String, Object> sequential = system.runSequential().snapshot();
        assertEquals(Map.of("X", 1, "Y", 2, "Z", 3), sequential);

        for (int k : new int[] { 1, 2, 4 }) {
            state.restore(Collections.emptyMap());
            assertEquals("k=" + k, sequential, system.runParallel(k).snapshot());
        }

        // A caller-supplied snapshot replaces the default on both executors
        system.setResultSnapshot(StateSnapshots.of("Z", "missing"));
        Map<String, Object> narrowed = system.runParallel(2).snapshot();
        assertEquals(2, narrowed.size());
        assertEquals(3, narrowed.get("Z"));
        assertTrue(narrowed.containsKey("missing"));
        assertNull(narrowed.get("missing"));
        assertEquals(narrowed, system.runSequential().snapshot());
    }

    @Test
    public void testFailedRunHasEmptySnapshot() {
        List<Task> tasks = List.of(
                Task.builder("Ok").writes("a").body(s -> s.put("a", 1)).build(),
                Task.builder("Boom").reads("a").writes("b").body(s -> {
                    throw new IllegalStateException("boom");
                }).build());
        TaskSystem system = new TaskSystem(tasks, null, state);

        ExecutionResult seq = system.runSequential();
        ExecutionResult par = system.runParallel(2);

        assertFalse(seq.isSuccess());
        assertTrue(seq.snapshot().isEmpty());
        assertFalse(par.isSuccess());
        assertTrue(par.snapshot().isEmpty());
    }

    @Test
    public void testUnderDeclaredSystemDetected() {
        List<Task> tasks = List.of(
                Task.builder("Writer").writes("x").body(s -> s.put("x", 1)).build(),
                Task.builder("Reader").writes("y").body(s -> s.put("y", s.get("x"))).build());
        TaskSystem system = new TaskSystem(tasks, Map.of(), state,
                TaskSystemConfig.builder().verificationWorkerCount(1).build());

        VerificationResult result = system.testDeterminism(100, StateSnapshots.of("y"));

        assertFalse(result.isDeterministic());
        assertEquals(42L, result.seed());
    }

    @Test
    public void testAccessValidationFromConfig() {
        List<Task> tasks = List.of(Task.builder("Sneaky").writes("a").body(s -> s.put("b", 1)).build());

        TaskSystem lenient = new TaskSystem(tasks, Map.of(), state);
        assertTrue(lenient.runSequential().isSuccess());

        TaskSystem strict = new TaskSystem(tasks, Map.of(), new VariableStore(),
                TaskSystemConfig.builder().validateAccess(true).build());
        assertFalse(strict.runSequential().isSuccess());
        assertFalse(strict.runParallel(2).isSuccess());
    }

    @Test
    public void testListenersSeeBothStrategies() {
        TaskSystem system = new TaskSystem(List.of(timed("A", 1).build(), timed("B", 1).build()), Map.of(), state);
        TaskProfileListener profile = new TaskProfileListener();
        system.addListener(profile);

        system.runSequential();
        system.runParallel(2);

        assertEquals(2, profile.runs());
        assertEquals(2, profile.stats("A").count);
    }

    @Test
    public void testExplain() {
        TaskSystem system = new TaskSystem(List.of(
                Task.builder("A").writes("x").build(),
                Task.builder("B").reads("x").build()), Map.of(), state);
        assertTrue(system.explain().toMermaid().contains("A -. \"x\" .-> B;"));
        assertSame(state, system.state());
    }

    @Test
    public void testConfigDefaults() {
        TaskSystemConfig config = TaskSystemConfig.defaults();
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getDefaultWorkerCount());
        assertEquals(config.getDefaultWorkerCount(), config.getVerificationWorkerCount());
        assertFalse(config.isValidateAccess());
        assertEquals(42L, config.getVerificationSeed());
        assertEquals(5, config.getPerformanceTrials());

        TaskSystemConfig custom = config.toBuilder().defaultWorkerCount(3).build();
        assertEquals(3, custom.getDefaultWorkerCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConfig() {
        TaskSystemConfig.builder().performanceTrials(0);
    }

    @Test(expected = NullPointerException.class)
    public void testNullState() {
        new TaskSystem(List.of(), Map.of(), null);
    }
}
