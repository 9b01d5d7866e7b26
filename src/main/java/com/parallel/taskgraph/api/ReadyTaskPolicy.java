package com.parallel.taskgraph.api;

import java.util.List;

/**
 * Chooses which ready task a free worker picks up next.
 *
 * <p>
 * Called under the scheduler lock, so implementations need no synchronization
 * of their own, but they must be fast and must not block.
 */
@FunctionalInterface
public interface ReadyTaskPolicy {

    /**
     * @param ready Declaration indices of the tasks currently ready, in the order
     *              they became ready. Never empty.
     * @return the position in {@code ready} of the task to dispatch.
     */
    int select(List<Integer> ready);
}
