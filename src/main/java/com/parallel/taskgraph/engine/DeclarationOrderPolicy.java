package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ReadyTaskPolicy;

import java.util.List;

/** Picks the ready task declared first. The scheduler's default. */
public final class DeclarationOrderPolicy implements ReadyTaskPolicy {
    public static final DeclarationOrderPolicy INSTANCE = new DeclarationOrderPolicy();

    private DeclarationOrderPolicy() {
    }

    @Override
    public int select(List<Integer> ready) {
        int best = 0;
        for (int i = 1; i < ready.size(); i++)
            if (ready.get(i) < ready.get(best))
                best = i;
        return best;
    }
}
