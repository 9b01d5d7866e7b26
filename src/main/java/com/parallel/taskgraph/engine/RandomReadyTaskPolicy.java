package com.parallel.taskgraph.engine;

import com.parallel.taskgraph.api.ReadyTaskPolicy;

import java.util.List;
import java.util.Random;

/**
 * Picks a uniformly random ready task. Seeded, so a run that exposes a race
 * can be replayed with the same seed.
 *
 * <p>
 * Not thread-safe on its own; the scheduler only calls it under its lock.
 */
public final class RandomReadyTaskPolicy implements ReadyTaskPolicy {
    private final long seed;
    private final Random random;

    public RandomReadyTaskPolicy(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long seed() {
        return seed;
    }

    @Override
    public int select(List<Integer> ready) {
        return ready.size() == 1 ? 0 : random.nextInt(ready.size());
    }
}
