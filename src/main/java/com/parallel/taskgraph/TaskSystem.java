package com.parallel.taskgraph;

import com.parallel.taskgraph.api.ExecutionListener;
import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.StateSnapshot;
import com.parallel.taskgraph.api.Task;
import com.parallel.taskgraph.engine.ExecutionGraph;
import com.parallel.taskgraph.engine.ExecutionResult;
import com.parallel.taskgraph.engine.GraphBuilder;
import com.parallel.taskgraph.engine.ParallelScheduler;
import com.parallel.taskgraph.engine.SequentialExecutor;
import com.parallel.taskgraph.perf.PerformanceMeasurer;
import com.parallel.taskgraph.perf.PerformanceReport;
import com.parallel.taskgraph.util.CompositeExecutionListener;
import com.parallel.taskgraph.util.GraphExplain;
import com.parallel.taskgraph.verify.DeterminismVerifier;
import com.parallel.taskgraph.verify.StateSnapshots;
import com.parallel.taskgraph.verify.VerificationResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the library: a set of tasks over one shared state, compiled
 * into a maximal-parallelism execution graph.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the {@link ExecutionGraph} from the tasks and precedence hints,
 * eagerly, so declaration errors surface from the constructor</li>
 * <li>Wiring the sequential executor and the parallel scheduler to one
 * composite listener</li>
 * <li>Running the determinism check and the performance comparison against the
 * same state</li>
 * </ul>
 *
 * <pre>{@code
 * SharedState state = new VariableStore(Map.of("x", 1, "y", 2));
 * TaskSystem system = new TaskSystem(List.of(t1, t2, sum), Map.of(), state);
 * system.runParallel().orThrow();
 * VerificationResult check = system.testDeterminism(100);
 * }</pre>
 *
 * <p>
 * Runs on one system should not overlap: they all mutate the same state.
 */
public final class TaskSystem {
    private static final Logger log = LogManager.getLogger(TaskSystem.class);

    private final ExecutionGraph graph;
    private final SharedState state;
    private final TaskSystemConfig config;

    private final CompositeExecutionListener listeners = new CompositeExecutionListener();
    private final SequentialExecutor sequential;
    private final ParallelScheduler parallel;
    private final DeterminismVerifier verifier;
    private final PerformanceMeasurer measurer;

    public TaskSystem(List<Task> tasks, Map<String, ? extends Collection<String>> precedences, SharedState state) {
        this(tasks, precedences, state, TaskSystemConfig.defaults());
    }

    /**
     * @param tasks       Tasks in declaration order; the order breaks ties.
     * @param precedences Task name to prerequisite names; may be null or partial.
     * @param state       The state every task body works on.
     * @param config      Execution settings.
     * @throws com.parallel.taskgraph.engine.DuplicateTaskNameException    on a repeated name.
     * @throws com.parallel.taskgraph.engine.UnknownTaskReferenceException on a hint naming no task.
     * @throws com.parallel.taskgraph.engine.CycleDetectedException        on cyclic hints.
     */
    public TaskSystem(List<Task> tasks, Map<String, ? extends Collection<String>> precedences, SharedState state,
            TaskSystemConfig config) {
        Objects.requireNonNull(tasks, "tasks");
        this.state = Objects.requireNonNull(state, "state");
        this.config = Objects.requireNonNull(config, "config");

        this.graph = new GraphBuilder().build(tasks, precedences);

        this.sequential = new SequentialExecutor(graph);
        this.parallel = new ParallelScheduler(graph);
        sequential.setListener(listeners);
        parallel.setListener(listeners);
        sequential.setValidateAccess(config.isValidateAccess());
        parallel.setValidateAccess(config.isValidateAccess());

        this.verifier = new DeterminismVerifier(sequential, parallel);
        this.measurer = new PerformanceMeasurer(sequential, parallel);
    }

    public ExecutionResult runSequential() {
        ExecutionResult result = sequential.run(state);
        log.info("{}", result);
        return result;
    }

    public ExecutionResult runParallel() {
        return runParallel(config.getDefaultWorkerCount());
    }

    public ExecutionResult runParallel(int workerCount) {
        ExecutionResult result = parallel.run(state, workerCount);
        log.info("{}", result);
        return result;
    }

    /**
     * Sets what {@link ExecutionResult#snapshot()} captures after a successful
     * run of either executor. The default is every written variable.
     */
    public void setResultSnapshot(StateSnapshot snapshot) {
        sequential.setSnapshot(snapshot);
        parallel.setSnapshot(snapshot);
    }

    /** Compares randomized parallel runs with a sequential run on every written variable. */
    public VerificationResult testDeterminism(int trials) {
        return testDeterminism(trials, StateSnapshots.writtenVariables(graph));
    }

    public VerificationResult testDeterminism(int trials, StateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        return verifier.verify(state, trials, snapshot, config.getVerificationWorkerCount(),
                config.getVerificationSeed());
    }

    public PerformanceReport measurePerformance(int workerCount) {
        return measurePerformance(workerCount, config.getPerformanceTrials());
    }

    public PerformanceReport measurePerformance(int workerCount, int trials) {
        return measurer.measure(state, workerCount, trials);
    }

    /**
     * Registers a listener for run and task events of both executors.
     * Note: listeners accumulate; registering never replaces an earlier one.
     */
    public void addListener(ExecutionListener listener) {
        listeners.addForComposite(Objects.requireNonNull(listener, "listener"));
    }

    public ExecutionGraph graph() {
        return graph;
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }

    public SharedState state() {
        return state;
    }

    public TaskSystemConfig config() {
        return config;
    }
}
