package org.observatory.datapipeline.api.resources.queues;

import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.runtime.actions.Action;

import java.util.List;

/**
 * Buffers submitted actions between ticks.
 * <p>
 * Any number of threads may {@link #offer(Action)}; exactly one consumer (the tick scheduler)
 * calls {@link #drainAll()}.
 */
public interface IActionQueueResource extends IResource {

    /**
     * Enqueues an action for the next tick. Never blocks.
     *
     * @return false if the queue is at capacity and the action was not accepted
     */
    boolean offer(Action action);

    /**
     * Atomically swaps the current buffer for an empty one and returns its content in
     * {@link QueuedAction#PROCESSING_ORDER}. Actions offered concurrently land either in the returned
     * batch or in the fresh buffer, never in neither.
     */
    List<QueuedAction> drainAll();

    int size();

    int capacity();
}
