package org.observatory.datapipeline.api.resources.ledger;

/**
 * The persisted ledger violates its own structure (sequence gap, unreadable committed record).
 * This is never repaired automatically.
 */
public class LedgerCorruptedException extends RuntimeException {

    public LedgerCorruptedException(String message) {
        super(message);
    }

    public LedgerCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
