package org.observatory.node;

import org.observatory.datapipeline.api.resources.queues.ActionQueueFullException;
import org.observatory.datapipeline.api.resources.queues.IActionQueueResource;
import org.observatory.runtime.actions.Action;

import java.util.Objects;

/**
 * Inbound entry point for actions of already authenticated agents. Submission only queues the
 * action; whether it takes effect is decided at the next tick.
 * <p>
 * <strong>Thread Safety:</strong> May be called from any number of threads.
 */
public final class ActionGateway {

    private final IActionQueueResource queue;

    public ActionGateway(IActionQueueResource queue) {
        this.queue = queue;
    }

    /**
     * @throws ActionQueueFullException if the queue is at capacity; the action is dropped
     */
    public void submit(Action action) {
        Objects.requireNonNull(action, "action cannot be null");
        if (!queue.offer(action)) {
            throw new ActionQueueFullException("Action queue '" + queue.getResourceName() + "' is full ("
                + queue.capacity() + "), dropped " + action.type() + " from '" + action.agentId() + "'");
        }
    }
}
