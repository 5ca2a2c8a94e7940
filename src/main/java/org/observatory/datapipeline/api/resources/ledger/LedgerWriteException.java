package org.observatory.datapipeline.api.resources.ledger;

import java.io.IOException;

/**
 * A batch could not be made durable. The ledger content is unchanged.
 */
public class LedgerWriteException extends IOException {

    public LedgerWriteException(String message) {
        super(message);
    }

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
