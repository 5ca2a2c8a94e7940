package org.observatory.datapipeline.api.resources.ledger;

import org.observatory.datapipeline.api.resources.IResource;

/**
 * The durable, append-only event ledger.
 */
public interface ILedgerResource extends IResource, ILedgerReader, ILedgerWriter, AutoCloseable {

    @Override
    void close();
}
