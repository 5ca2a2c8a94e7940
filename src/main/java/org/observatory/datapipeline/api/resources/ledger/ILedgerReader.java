package org.observatory.datapipeline.api.resources.ledger;

import org.observatory.runtime.events.LedgerEvent;

import java.util.List;
import java.util.Optional;

/**
 * Read access to committed ledger events. Every method only ever sees whole, durable batches.
 */
public interface ILedgerReader {

    /**
     * @return all committed events in sequence order
     */
    List<LedgerEvent> readAll();

    /**
     * @return events with {@code fromTick <= tick <= toTick}, in sequence order
     */
    List<LedgerEvent> readRange(long fromTick, long toTick);

    /**
     * @return events within the tick range that name the agent, in sequence order
     */
    List<LedgerEvent> readForAgent(String agentId, long fromTick, long toTick);

    /**
     * @return the last committed tick, or -1 if the ledger is empty
     */
    long lastCommittedTick();

    /**
     * @return the sequence number the next appended event must carry
     */
    long nextSequence();

    /**
     * @return the post-tick state hash recorded by the TICK_COMPLETED event of {@code tick}, if any
     */
    Optional<String> recordedStateHash(long tick);

    default boolean isEmpty() {
        return nextSequence() == 0;
    }
}
