package org.observatory.datapipeline.api.resources.queues;

/**
 * Thrown to a submitter when the action queue is at capacity.
 */
public class ActionQueueFullException extends RuntimeException {

    public ActionQueueFullException(String message) {
        super(message);
    }
}
