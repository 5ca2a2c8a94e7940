package org.observatory.node.api;

import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.events.LedgerEvent;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a running world for outside consumers. Only committed state is ever visible;
 * nothing here can change the world.
 */
public interface IWorldObserver {

    /**
     * @return the snapshot published by the last committed tick, empty before genesis
     */
    Optional<WorldSnapshot> latestSnapshot();

    /**
     * @return the last committed tick, or -1 before genesis
     */
    long latestTick();

    /**
     * @return committed events with {@code fromTick <= tick <= toTick}, in sequence order
     */
    List<LedgerEvent> eventsBetween(long fromTick, long toTick);

    /**
     * @return committed events naming the agent within the tick range, in sequence order
     */
    List<LedgerEvent> eventsForAgent(String agentId, long fromTick, long toTick);

    /**
     * @return the world exactly as it was after {@code tick} was committed
     */
    WorldSnapshot replay(long tick);
}
