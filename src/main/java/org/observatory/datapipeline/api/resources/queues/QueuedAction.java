package org.observatory.datapipeline.api.resources.queues;

import org.observatory.runtime.actions.Action;

import java.util.Comparator;

/**
 * An action together with its arrival number in the queue.
 *
 * @param arrival Monotonic arrival number assigned on enqueue.
 * @param action  The submitted action.
 */
public record QueuedAction(long arrival, Action action) {

    /**
     * Processing order within a tick: arrival first, agent identifier as tie-breaker.
     */
    public static final Comparator<QueuedAction> PROCESSING_ORDER = Comparator
        .comparingLong(QueuedAction::arrival)
        .thenComparing(q -> q.action().agentId(), Comparator.nullsFirst(Comparator.naturalOrder()));
}
