package org.observatory.runtime.validation;

/**
 * Closed set of reasons an action can be refused. A rejection never changes world state.
 */
public enum RejectionReason {
    INSUFFICIENT_RESOURCES,
    REGION_FULL,
    AGENT_NOT_CLAIMED,
    AGENT_RETIRED,
    INVALID_TARGET,
    UNKNOWN_AGENT
}
