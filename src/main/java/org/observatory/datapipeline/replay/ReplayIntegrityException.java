package org.observatory.datapipeline.replay;

/**
 * Replay found the ledger, a snapshot and the recomputed state disagreeing. The persisted history
 * can no longer be trusted and is never repaired automatically.
 */
public class ReplayIntegrityException extends IllegalStateException {

    private final long tick;

    public ReplayIntegrityException(long tick, String message) {
        super("Integrity failure at tick " + tick + ": " + message);
        this.tick = tick;
    }

    public ReplayIntegrityException(long tick, String message, Throwable cause) {
        super("Integrity failure at tick " + tick + ": " + message, cause);
        this.tick = tick;
    }

    /**
     * @return the tick at which the divergence was detected
     */
    public long getTick() {
        return tick;
    }
}
