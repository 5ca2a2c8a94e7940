package org.observatory.runtime.events;

/**
 * Types of committed ledger events.
 * <p>
 * {@link #WORLD_CREATED} and {@link #TICK_COMPLETED} terminate a ledger batch; a batch that does not
 * end with one of them was torn by a crash and is discarded on recovery.
 */
public enum EventType {
    WORLD_CREATED,
    AGENT_REGISTERED,
    AGENT_CLAIMED,
    AGENT_MOVED,
    RESOURCES_TRADED,
    TRADE_OFFERED,
    TRADE_ACCEPTED,
    MESSAGE_DELIVERED,
    AGENT_FORKED,
    AGENTS_MERGED,
    AGENT_DIED,
    REGION_OBSERVED,
    TICK_COMPLETED;

    public boolean isBatchTerminator() {
        return this == WORLD_CREATED || this == TICK_COMPLETED;
    }
}
