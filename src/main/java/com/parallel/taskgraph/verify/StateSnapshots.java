package com.parallel.taskgraph.verify;

import com.parallel.taskgraph.api.StateSnapshot;
import com.parallel.taskgraph.engine.ExecutionGraph;

import java.util.Arrays;
import java.util.Collection;

/** Common {@link StateSnapshot} implementations. */
public final class StateSnapshots {
    private StateSnapshots() {
    }

    /** Every variable some task of the graph declares as written. */
    public static StateSnapshot writtenVariables(ExecutionGraph graph) {
        return StateSnapshot.of(graph.writtenVariables());
    }

    public static StateSnapshot of(String... variables) {
        return of(Arrays.asList(variables));
    }

    /** The named variables; unset ones map to null so that set vs unset is compared too. */
    public static StateSnapshot of(Collection<String> variables) {
        return StateSnapshot.of(variables);
    }

    /** The whole store. */
    public static StateSnapshot everything() {
        return state -> state.snapshot();
    }
}
