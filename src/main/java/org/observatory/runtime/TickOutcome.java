package org.observatory.runtime;

import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.model.WorldState;

import java.util.List;

/**
 * Result of preparing one tick on a working copy of the world.
 * <p>
 * Nothing in an outcome is visible to anybody until the events have been written to the ledger
 * and {@link WorldEngine#commit(TickOutcome)} has swapped the working state in.
 *
 * @param tick          The tick that was prepared.
 * @param workingState  The state after the tick; becomes canonical on commit.
 * @param events        The ledger batch, terminated by WORLD_CREATED or TICK_COMPLETED.
 * @param rejections    Refused actions, for diagnostics only.
 * @param snapshot      Immutable capture of {@code workingState}.
 * @param firstSequence Sequence number of the first event in the batch.
 * @param nextSequence  Sequence number the next batch must start at.
 */
public record TickOutcome(
    long tick,
    WorldState workingState,
    List<LedgerEvent> events,
    List<RejectedAction> rejections,
    WorldSnapshot snapshot,
    long firstSequence,
    long nextSequence
) {
    public TickOutcome {
        events = List.copyOf(events);
        rejections = List.copyOf(rejections);
    }
}
