package org.observatory.datapipeline.api.resources.ledger;

import org.observatory.runtime.events.LedgerEvent;

import java.util.List;

/**
 * Append-only write access. There is deliberately no way to modify or remove a record.
 */
public interface ILedgerWriter {

    /**
     * Durably appends one tick's batch. Either every event of the batch is persisted and flushed to
     * the storage device before this method returns, or none is.
     *
     * @param batch events of one tick, contiguous in sequence, ending with a batch terminator
     * @throws LedgerWriteException if the batch could not be made durable
     * @throws IllegalArgumentException if the batch does not continue the ledger
     */
    void appendBatch(List<LedgerEvent> batch) throws LedgerWriteException;
}
