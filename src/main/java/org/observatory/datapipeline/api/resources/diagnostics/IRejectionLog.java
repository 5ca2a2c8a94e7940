package org.observatory.datapipeline.api.resources.diagnostics;

import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.runtime.RejectedAction;

import java.io.IOException;
import java.util.List;

/**
 * Diagnostic record of refused actions. Kept apart from the ledger: entries are neither sequenced
 * nor replayed, and losing them never affects world state.
 */
public interface IRejectionLog extends IResource {

    void record(List<RejectedAction> rejections) throws IOException;

    List<RejectedAction> readAll() throws IOException;
}
