package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ExecutionStrategy;
import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.util.TaskProfileListener;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SequentialExecutorTest {

    private List<String> executionLog;
    private VariableStore state;

    @Before
    public void setUp() {
        executionLog = new ArrayList<>();
        state = new VariableStore();
    }

    private Task logging(String name) {
        return new Task(name, s -> executionLog.add(name));
    }

    @Test
    public void testChainRunsInOrder() {
        List<Task> tasks = List.of(logging("A"), logging("B"), logging("C"), logging("D"), logging("E"));
        Map<String, List<String>> hints = Map.of(
                "A", List.of(), "B", List.of("A"), "C", List.of("B"), "D", List.of("C"), "E", List.of("D"));
        SequentialExecutor executor = new SequentialExecutor(new GraphBuilder().build(tasks, hints));

        ExecutionResult result = executor.run(state);

        assertTrue(result.isSuccess());
        assertEquals(ExecutionStrategy.SEQUENTIAL, result.strategy());
        assertEquals(5, result.tasksCompleted());
        assertEquals(List.of("A", "B", "C", "D", "E"), executionLog);
        assertEquals(executionLog, result.startOrder());
    }

    @Test
    public void testSum() {
        state.put("x", 3);
        state.put("y", 4);
        List<Task> tasks = List.of(
                Task.builder("T1").reads("x").writes("X").body(s -> s.put("X", s.getInt("x") * 10)).build(),
                Task.builder("T2").reads("y").writes("Y").body(s -> s.put("Y", s.getInt("y") * 10)).build(),
                Task.builder("Tsum").reads("X", "Y").writes("Z").body(s -> s.put("Z", s.getInt("X") + s.getInt("Y")))
                        .build());

        new SequentialExecutor(new GraphBuilder().build(tasks, Map.of())).run(state).orThrow();

        assertEquals(70, state.getInt("Z"));
    }

    @Test
    public void testLaterWriteWins() {
        List<Task> tasks = List.of(
                Task.builder("First").writes("v").body(s -> s.put("v", "first")).build(),
                Task.builder("Second").writes("v").body(s -> s.put("v", "second")).build());

        new SequentialExecutor(new GraphBuilder().build(tasks, Map.of())).run(state).orThrow();

        assertEquals("second", state.get("v"));
    }

    @Test
    public void testFailureStopsRun() {
        List<Task> tasks = List.of(
                logging("A"),
                new Task("Bad", s -> {
                    throw new IllegalStateException("boom");
                }),
                logging("C"));
        SequentialExecutor executor = new SequentialExecutor(new GraphBuilder().build(tasks, Map.of()));

        ExecutionResult result = executor.run(state);

        assertFalse(result.isSuccess());
        assertEquals("Bad", result.failedTask().get());
        assertEquals(1, result.tasksCompleted());
        assertEquals(List.of("A", "Bad"), result.startOrder());
        assertEquals(List.of("A"), executionLog); // C never ran
        assertEquals("boom", result.failure().get().getCause().getMessage());

        try {
            result.orThrow();
            fail("Expected TaskExecutionException");
        } catch (TaskExecutionException e) {
            assertEquals("Bad", e.taskName());
            assertTrue(e.getMessage().contains("Bad"));
        }
    }

    @Test
    public void testReusableAfterFailure() {
        boolean[] fail = { true };
        List<Task> tasks = List.of(new Task("Flaky", s -> {
            if (fail[0])
                throw new Exception("first run fails");
            s.put("done", true);
        }));
        SequentialExecutor executor = new SequentialExecutor(new GraphBuilder().build(tasks, Map.of()));

        assertFalse(executor.run(state).isSuccess());
        fail[0] = false;
        assertTrue(executor.run(state).isSuccess());
        assertEquals(Boolean.TRUE, state.get("done"));
        assertEquals(2, executor.runCount());
    }

    @Test
    public void testListenerCallbacks() {
        List<Task> tasks = List.of(logging("A"), logging("B"), new Task("Bad", s -> {
            throw new RuntimeException("x");
        }));
        SequentialExecutor executor = new SequentialExecutor(new GraphBuilder().build(tasks, Map.of()));
        TaskProfileListener profile = new TaskProfileListener();
        executor.setListener(profile);

        executor.run(state);
        executor.run(state);

        assertEquals(2, profile.runs());
        assertEquals(2, profile.stats("A").count);
        assertEquals(2, profile.stats("Bad").errors);
        assertEquals(0, profile.stats("Bad").count);
    }

    @Test
    public void testAccessValidation() {
        state.put("secret", 1);
        List<Task> tasks = List.of(
                Task.builder("Honest").reads("a").writes("b").body(s -> s.put("b", s.getInt("a"))).build(),
                Task.builder("Sneaky").writes("c").body(s -> s.put("c", s.getInt("secret"))).build());
        SequentialExecutor executor = new SequentialExecutor(new GraphBuilder().build(tasks, Map.of()));

        // Off by default
        assertTrue(executor.run(state).isSuccess());

        executor.setValidateAccess(true);
        ExecutionResult result = executor.run(state);
        assertEquals("Sneaky", result.failedTask().get());
        Throwable cause = result.failure().get().getCause();
        assertTrue(cause instanceof UndeclaredAccessException);
        assertEquals("secret", ((UndeclaredAccessException) cause).variable());
    }

    @Test
    public void testUndeclaredWriteRejected() {
        List<Task> tasks = List.of(Task.builder("Reader").reads("a").body(s -> s.put("a", 1)).build());
        SequentialExecutor executor = new SequentialExecutor(new GraphBuilder().build(tasks, Map.of()));
        executor.setValidateAccess(true);

        ExecutionResult result = executor.run(state);

        assertTrue(result.failure().get().getCause() instanceof UndeclaredAccessException);
        assertNull(state.get("a"));
    }
}
