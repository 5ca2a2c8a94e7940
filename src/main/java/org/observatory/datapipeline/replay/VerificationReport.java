package org.observatory.datapipeline.replay;

/**
 * Summary of a successful full-history verification.
 *
 * @param finalTick        Last tick replayed.
 * @param eventsApplied    Ledger events applied from genesis.
 * @param ticksVerified    Ticks whose recorded state hash matched the recomputed one.
 * @param snapshotsChecked Stored snapshots found identical to the replayed state.
 * @param finalStateHash   State hash after the last tick.
 */
public record VerificationReport(long finalTick, long eventsApplied, long ticksVerified, int snapshotsChecked, String finalStateHash) {
}
