package org.observatory.node;

import org.observatory.datapipeline.api.resources.ledger.ILedgerReader;
import org.observatory.datapipeline.replay.ReplayEngine;
import org.observatory.node.api.IWorldObserver;
import org.observatory.runtime.WorldEngine;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.events.LedgerEvent;

import java.util.List;
import java.util.Optional;

/**
 * Serves observers from the engine's published snapshot and the ledger.
 */
public final class WorldObserver implements IWorldObserver {

    private final WorldEngine engine;
    private final ILedgerReader ledger;
    private final ReplayEngine replayEngine;

    public WorldObserver(WorldEngine engine, ILedgerReader ledger, ReplayEngine replayEngine) {
        this.engine = engine;
        this.ledger = ledger;
        this.replayEngine = replayEngine;
    }

    @Override
    public Optional<WorldSnapshot> latestSnapshot() {
        return Optional.ofNullable(engine.latestSnapshot());
    }

    @Override
    public long latestTick() {
        return ledger.lastCommittedTick();
    }

    @Override
    public List<LedgerEvent> eventsBetween(long fromTick, long toTick) {
        return ledger.readRange(fromTick, toTick);
    }

    @Override
    public List<LedgerEvent> eventsForAgent(String agentId, long fromTick, long toTick) {
        return ledger.readForAgent(agentId, fromTick, toTick);
    }

    @Override
    public WorldSnapshot replay(long tick) {
        return replayEngine.replay(tick);
    }
}
