package org.observatory.node;

import com.typesafe.config.Config;
import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.datapipeline.api.resources.ledger.LedgerWriteException;
import org.observatory.datapipeline.api.services.IService;
import org.observatory.datapipeline.replay.ReplayEngine;
import org.observatory.datapipeline.resources.diagnostics.FileSystemRejectionLog;
import org.observatory.datapipeline.resources.ledger.FileSystemLedger;
import org.observatory.datapipeline.resources.queues.InMemoryActionQueue;
import org.observatory.datapipeline.resources.snapshots.FileSystemSnapshotStore;
import org.observatory.datapipeline.services.TickScheduler;
import org.observatory.node.api.IWorldObserver;
import org.observatory.node.config.WorldConfiguration;
import org.observatory.runtime.TickOutcome;
import org.observatory.runtime.WorldEngine;
import org.observatory.runtime.model.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Wires one world together from the {@code observatory} configuration section.
 * <p>
 * Construction opens the storage resources and either creates a new world (empty ledger) or
 * recovers the existing one by replaying the ledger to its last committed tick. Ticks only run
 * after {@link #start()}.
 */
public final class WorldNode implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorldNode.class);
    private static final String ROOT_CONFIG_PATH = "observatory";

    private final WorldEngine engine = new WorldEngine();
    private final InMemoryActionQueue actionQueue;
    private final FileSystemLedger ledger;
    private final FileSystemSnapshotStore snapshotStore;
    private final FileSystemRejectionLog rejectionLog;
    private final ReplayEngine replayEngine;
    private final TickScheduler scheduler;
    private final ActionGateway gateway;
    private final WorldObserver observer;
    private Thread shutdownHook;
    private boolean closed = false;

    /**
     * @param config the fully resolved application configuration
     * @throws IllegalStateException if the world can neither be created nor recovered
     */
    public WorldNode(Config config) {
        Config root = config.getConfig(ROOT_CONFIG_PATH);
        Config storage = root.getConfig("storage");

        this.actionQueue = new InMemoryActionQueue("actions", root.getConfig("queue"));
        this.ledger = new FileSystemLedger("ledger", storage.getConfig("ledger"));
        try {
            this.snapshotStore = new FileSystemSnapshotStore("snapshots", storage.getConfig("snapshots"));
            this.rejectionLog = new FileSystemRejectionLog("rejections", storage.getConfig("rejections"));
            this.replayEngine = new ReplayEngine(ledger, snapshotStore);

            bootstrap(WorldConfiguration.fromConfig(root.getConfig("world")));

            Map<String, List<IResource>> resources = Map.of(
                "actions", List.of(actionQueue),
                "ledger", List.of(ledger),
                "snapshots", List.of(snapshotStore),
                "rejections", List.of(rejectionLog));
            this.scheduler = new TickScheduler("tick-scheduler", root.getConfig("scheduler"), resources, engine);
        } catch (RuntimeException e) {
            ledger.close();
            throw e;
        }
        this.gateway = new ActionGateway(actionQueue);
        this.observer = new WorldObserver(engine, ledger, replayEngine);
    }

    private void bootstrap(WorldConfiguration world) {
        if (!ledger.isEmpty()) {
            long lastTick = ledger.lastCommittedTick();
            WorldState recovered = replayEngine.replayState(lastTick);
            engine.restore(recovered, ledger.nextSequence());
            LOGGER.info("Recovered world at tick {} from ledger '{}' ({} events)", lastTick, ledger.getFile(), ledger.nextSequence());
            return;
        }

        TickOutcome genesis = engine.prepareGenesis(world.seed(), world.rules(), world.regions());
        try {
            ledger.appendBatch(genesis.events());
        } catch (LedgerWriteException e) {
            LOGGER.error("Cannot record genesis in ledger '{}'", ledger.getFile());
            throw new IllegalStateException("World creation failed", e);
        }
        engine.commit(genesis);
        try {
            snapshotStore.save(genesis.snapshot());
        } catch (IOException e) {
            LOGGER.warn("Failed to write genesis snapshot: {}", e.getMessage());
        }
        LOGGER.info("Created world with seed {} and {} regions", world.seed(), world.regions().size());
    }

    /**
     * Starts the tick loop and registers a shutdown hook that stops it gracefully.
     */
    public void start() {
        scheduler.start();
        shutdownHook = new Thread(this::close, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Blocks until the tick loop has ended by itself ({@code maxTicks} reached or a fatal error).
     *
     * @return the final scheduler state
     */
    public IService.State awaitTermination() throws InterruptedException {
        while (scheduler.getCurrentState() == IService.State.RUNNING
            || scheduler.getCurrentState() == IService.State.PAUSED) {
            Thread.sleep(50);
        }
        return scheduler.getCurrentState();
    }

    /**
     * Stops the tick loop, writes a final snapshot and closes the ledger. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOGGER.info("Shutdown sequence initiated...");
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }
        IService.State state = scheduler.getCurrentState();
        if (state == IService.State.RUNNING || state == IService.State.PAUSED) {
            scheduler.stop();
        }
        if (scheduler.getCurrentState() != IService.State.ERROR && scheduler.writeFinalSnapshot()) {
            LOGGER.debug("Final snapshot written at tick {}", engine.getCurrentTick());
        }
        ledger.close();
        LOGGER.info("World stopped at tick {}", engine.getCurrentTick());
    }

    public ActionGateway getGateway() {
        return gateway;
    }

    public IWorldObserver getObserver() {
        return observer;
    }

    public TickScheduler getScheduler() {
        return scheduler;
    }

    public ReplayEngine getReplayEngine() {
        return replayEngine;
    }

    public WorldEngine getEngine() {
        return engine;
    }
}
