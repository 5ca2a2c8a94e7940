package org.observatory.datapipeline.replay;

import org.observatory.datapipeline.api.resources.ledger.ILedgerReader;
import org.observatory.datapipeline.api.resources.snapshots.ISnapshotStore;
import org.observatory.runtime.EventApplier;
import org.observatory.runtime.TickPhysics;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.events.EventPayloads;
import org.observatory.runtime.events.EventType;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.internal.services.WorldCodec;
import org.observatory.runtime.model.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reconstructs the world at any committed tick from the ledger.
 * <p>
 * Replay starts from the nearest stored snapshot at or before the requested tick (or from an empty
 * world when there is none) and applies the following ledger events through the same
 * {@link EventApplier} the live engine uses. Every {@code TICK_COMPLETED} event is checked: the
 * hash of the replayed state must equal the hash recorded when the tick was committed.
 * <p>
 * A snapshot is only used if its content hash is intact and matches the hash the ledger recorded
 * for its tick. Any disagreement raises a {@link ReplayIntegrityException}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless between calls; safe for concurrent use as long as the
 * underlying ledger and snapshot store are.
 */
public class ReplayEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    private final ILedgerReader ledger;
    private final ISnapshotStore snapshots;
    private final EventApplier applier = new EventApplier(new TickPhysics());

    /**
     * @param ledger    committed history
     * @param snapshots snapshot store used as replay starting points, or {@code null} to always
     *                  replay from genesis
     */
    public ReplayEngine(ILedgerReader ledger, ISnapshotStore snapshots) {
        this.ledger = ledger;
        this.snapshots = snapshots;
    }

    public ReplayEngine(ILedgerReader ledger) {
        this(ledger, null);
    }

    /**
     * @return the snapshot of the world exactly as it was after {@code tick} was committed
     * @throws IllegalArgumentException if the tick is not committed
     * @throws ReplayIntegrityException if the ledger and the replayed state disagree
     */
    public WorldSnapshot replay(long tick) {
        return WorldCodec.snapshot(replayState(tick));
    }

    /**
     * Same as {@link #replay(long)} but returns a mutable state, e.g. to resume a world after a
     * restart.
     */
    public WorldState replayState(long tick) {
        long lastTick = ledger.lastCommittedTick();
        if (tick < 0 || tick > lastTick) {
            throw new IllegalArgumentException("Tick " + tick + " is not committed (last committed tick: " + lastTick + ")");
        }
        WorldState state = startingPoint(tick);
        long fromTick = state.isInitialized() ? state.getTick() + 1 : 0;
        if (fromTick <= tick) {
            applyAll(state, ledger.readRange(fromTick, tick));
        }
        log.debug("Replayed tick {} starting from tick {}", tick, fromTick);
        return state;
    }

    /**
     * Replays the whole ledger from genesis, ignoring snapshots as starting points, and checks every
     * recorded state hash plus every stored snapshot against the replayed state.
     *
     * @throws ReplayIntegrityException on the first disagreement
     * @throws IllegalStateException if the ledger is empty
     */
    public VerificationReport verify() {
        if (ledger.isEmpty()) {
            throw new IllegalStateException("Ledger is empty, nothing to verify");
        }
        Set<Long> snapshotTicks = new HashSet<>();
        if (snapshots != null) {
            try {
                snapshotTicks.addAll(snapshots.listTicks());
            } catch (IOException e) {
                throw new IllegalStateException("Cannot list stored snapshots: " + e.getMessage(), e);
            }
        }

        WorldState state = new WorldState();
        long events = 0;
        long ticksVerified = 0;
        int snapshotsChecked = 0;
        long expectedSequence = 0;
        String lastHash = null;

        for (LedgerEvent event : ledger.readAll()) {
            if (event.sequence() != expectedSequence) {
                throw integrityFailure(event.tick(), "expected sequence " + expectedSequence + " but found " + event.sequence());
            }
            expectedSequence++;
            String hash = applyChecked(state, event);
            events++;
            if (!event.type().isBatchTerminator()) {
                continue;
            }
            if (event.type() == EventType.TICK_COMPLETED) {
                ticksVerified++;
            } else {
                hash = WorldCodec.snapshot(state).stateHash();
            }
            lastHash = hash;
            if (snapshotTicks.contains(event.tick())) {
                checkStoredSnapshot(event.tick(), hash);
                snapshotsChecked++;
            }
        }

        log.info("Verified {} events over {} ticks, {} snapshots match", events, ticksVerified, snapshotsChecked);
        return new VerificationReport(state.getTick(), events, ticksVerified, snapshotsChecked, lastHash);
    }

    private WorldState startingPoint(long tick) {
        if (snapshots == null) {
            return new WorldState();
        }
        Optional<WorldSnapshot> stored;
        try {
            stored = snapshots.loadLatestAtOrBefore(tick);
        } catch (IOException e) {
            log.warn("Cannot read snapshot store, replaying tick {} from genesis: {}", tick, e.getMessage());
            return new WorldState();
        }
        // Genesis is a single event; its snapshot has no recorded hash to check against.
        if (stored.isEmpty() || stored.get().tick() == 0) {
            return new WorldState();
        }
        WorldSnapshot snapshot = stored.get();
        requireTrusted(snapshot);
        return WorldCodec.toState(snapshot);
    }

    private void requireTrusted(WorldSnapshot snapshot) {
        if (!WorldCodec.hasValidHash(snapshot)) {
            throw integrityFailure(snapshot.tick(), "stored snapshot content does not match its state hash");
        }
        Optional<String> recorded = ledger.recordedStateHash(snapshot.tick());
        if (recorded.isEmpty()) {
            throw integrityFailure(snapshot.tick(), "ledger has no completed tick for the stored snapshot");
        }
        if (!recorded.get().equals(snapshot.stateHash())) {
            throw integrityFailure(snapshot.tick(), "stored snapshot hash " + snapshot.stateHash()
                + " differs from ledger hash " + recorded.get());
        }
    }

    private void checkStoredSnapshot(long tick, String replayedHash) {
        WorldSnapshot stored;
        try {
            stored = snapshots.load(tick);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read stored snapshot of tick " + tick + ": " + e.getMessage(), e);
        }
        if (!WorldCodec.hasValidHash(stored)) {
            throw integrityFailure(tick, "stored snapshot content does not match its state hash");
        }
        if (!stored.stateHash().equals(replayedHash)) {
            throw integrityFailure(tick, "stored snapshot hash " + stored.stateHash() + " differs from replayed hash " + replayedHash);
        }
    }

    private void applyAll(WorldState state, List<LedgerEvent> events) {
        for (LedgerEvent event : events) {
            applyChecked(state, event);
        }
    }

    /**
     * Applies one event and, for TICK_COMPLETED, compares the resulting state hash with the recorded one.
     *
     * @return the recomputed hash for TICK_COMPLETED events, otherwise {@code null}
     */
    private String applyChecked(WorldState state, LedgerEvent event) {
        try {
            applier.apply(state, event);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw integrityFailure(event.tick(), "event " + event.sequence() + " (" + event.type()
                + ") does not apply: " + e.getMessage(), e);
        }
        if (event.type() != EventType.TICK_COMPLETED) {
            return null;
        }
        String recorded = WorldCodec.fromPayload(event.payload(), EventPayloads.TickCompleted.class).stateHash();
        String replayed = WorldCodec.snapshot(state).stateHash();
        if (!replayed.equals(recorded)) {
            throw integrityFailure(event.tick(), "replayed state hash " + replayed + " differs from recorded " + recorded);
        }
        return replayed;
    }

    private ReplayIntegrityException integrityFailure(long tick, String message) {
        return integrityFailure(tick, message, null);
    }

    private ReplayIntegrityException integrityFailure(long tick, String message, Throwable cause) {
        log.error("Replay integrity failure at tick {}: {}", tick, message);
        return cause == null ? new ReplayIntegrityException(tick, message) : new ReplayIntegrityException(tick, message, cause);
    }
}
