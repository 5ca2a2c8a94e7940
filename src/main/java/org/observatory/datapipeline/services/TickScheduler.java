package org.observatory.datapipeline.services;

import com.typesafe.config.Config;
import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.datapipeline.api.resources.diagnostics.IRejectionLog;
import org.observatory.datapipeline.api.resources.ledger.ILedgerResource;
import org.observatory.datapipeline.api.resources.ledger.LedgerWriteException;
import org.observatory.datapipeline.api.resources.queues.IActionQueueResource;
import org.observatory.datapipeline.api.resources.queues.QueuedAction;
import org.observatory.datapipeline.api.resources.snapshots.ISnapshotStore;
import org.observatory.runtime.TickOutcome;
import org.observatory.runtime.WorldEngine;
import org.observatory.runtime.actions.Action;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the world forward one tick at a time.
 * <p>
 * Each tick drains the action queue, lets the {@link WorldEngine} prepare the outcome, makes the
 * resulting batch durable in the ledger and only then commits it. Snapshots and rejection records
 * are written after the commit; their failure is reported but never undoes a tick.
 * <p>
 * <strong>Resources:</strong>
 * <ul>
 *   <li>{@code actions} ({@link IActionQueueResource}, required)</li>
 *   <li>{@code ledger} ({@link ILedgerResource}, required)</li>
 *   <li>{@code snapshots} ({@link ISnapshotStore}, optional)</li>
 *   <li>{@code rejections} ({@link IRejectionLog}, optional)</li>
 * </ul>
 * <strong>Options:</strong> {@code tickIntervalMs} (default 1000), {@code snapshotInterval}
 * (default 10, 0 disables), {@code maxTicks} (default 0, unlimited), {@code commitAttempts}
 * (default 3) and {@code commitRetryDelayMs} (default 100).
 */
public class TickScheduler extends AbstractService {

    private final WorldEngine engine;
    private final IActionQueueResource actionQueue;
    private final ILedgerResource ledger;
    private final Optional<ISnapshotStore> snapshotStore;
    private final Optional<IRejectionLog> rejectionLog;

    private final long tickIntervalMs;
    private final long snapshotInterval;
    private final long maxTicks;
    private final int commitAttempts;
    private final long commitRetryDelayMs;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicLong ticksCommitted = new AtomicLong();
    private final AtomicLong actionsAccepted = new AtomicLong();
    private final AtomicLong actionsRejected = new AtomicLong();
    private final AtomicLong snapshotsWritten = new AtomicLong();
    private final AtomicLong lastTickDurationMs = new AtomicLong();
    private volatile int agentsLive;

    public TickScheduler(String name, Config options, Map<String, List<IResource>> resources, WorldEngine engine) {
        super(name, resources);
        this.engine = engine;
        this.actionQueue = requiredResource("actions", IActionQueueResource.class);
        this.ledger = requiredResource("ledger", ILedgerResource.class);
        this.snapshotStore = boundResource("snapshots", ISnapshotStore.class);
        this.rejectionLog = boundResource("rejections", IRejectionLog.class);

        this.tickIntervalMs = options.hasPath("tickIntervalMs") ? options.getLong("tickIntervalMs") : 1000L;
        this.snapshotInterval = options.hasPath("snapshotInterval") ? options.getLong("snapshotInterval") : 10L;
        this.maxTicks = options.hasPath("maxTicks") ? options.getLong("maxTicks") : 0L;
        this.commitAttempts = options.hasPath("commitAttempts") ? options.getInt("commitAttempts") : 3;
        this.commitRetryDelayMs = options.hasPath("commitRetryDelayMs") ? options.getLong("commitRetryDelayMs") : 100L;

        if (tickIntervalMs < 0) {
            throw new IllegalArgumentException("tickIntervalMs must not be negative, got " + tickIntervalMs);
        }
        if (snapshotInterval < 0) {
            throw new IllegalArgumentException("snapshotInterval must not be negative, got " + snapshotInterval);
        }
        if (commitAttempts < 1) {
            throw new IllegalArgumentException("commitAttempts must be at least 1, got " + commitAttempts);
        }
    }

    @Override
    protected void logStarted() {
        log.info("TickScheduler started: tick={}, interval={}ms, snapshotInterval={}, maxTicks={}",
            engine.getCurrentTick(), tickIntervalMs, snapshotInterval, maxTicks == 0 ? "unlimited" : maxTicks);
    }

    @Override
    protected void run() throws InterruptedException {
        long nextTickAt = System.nanoTime();
        while ((getCurrentState() == State.RUNNING || getCurrentState() == State.PAUSED)
            && !Thread.currentThread().isInterrupted()) {
            checkPause();

            if (maxTicks > 0 && ticksCommitted.get() >= maxTicks) {
                log.info("Reached maxTicks ({}), stopping tick loop", maxTicks);
                break;
            }

            try {
                processTick();
            } catch (LedgerWriteException e) {
                throw new IllegalStateException("Ledger rejected tick " + (engine.getCurrentTick() + 1), e);
            }

            // A slow tick delays the next one instead of triggering a burst.
            nextTickAt += TimeUnit.MILLISECONDS.toNanos(tickIntervalMs);
            long waitNanos = nextTickAt - System.nanoTime();
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } else {
                nextTickAt = System.nanoTime();
            }
        }
        log.info("Tick loop finished at tick {}", engine.getCurrentTick());
    }

    /**
     * Runs exactly one tick. Safe to call from tests without starting the service thread; never
     * runs concurrently with another tick.
     *
     * @return the committed outcome
     * @throws LedgerWriteException if the batch could not be made durable after all attempts; the
     *                              world is unchanged and the drained actions are lost
     * @throws InterruptedException if interrupted between commit attempts
     */
    public TickOutcome processTick() throws LedgerWriteException, InterruptedException {
        tickLock.lock();
        try {
            long started = System.nanoTime();
            List<Action> batch = actionQueue.drainAll().stream().map(QueuedAction::action).toList();
            TickOutcome outcome = engine.prepareTick(batch);

            appendWithRetry(outcome);
            engine.commit(outcome);

            int accepted = outcome.events().size() - 1;
            ticksCommitted.incrementAndGet();
            actionsAccepted.addAndGet(accepted);
            actionsRejected.addAndGet(outcome.rejections().size());
            agentsLive = (int) outcome.snapshot().agents().stream().filter(a -> !a.status().isRetired()).count();

            recordRejections(outcome);
            if (snapshotInterval > 0 && outcome.tick() % snapshotInterval == 0) {
                writeSnapshot(outcome);
            }

            lastTickDurationMs.set(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            log.debug("Tick {} committed: {} events, {} rejected, hash {}", outcome.tick(), accepted,
                outcome.rejections().size(), outcome.snapshot().stateHash());
            return outcome;
        } finally {
            tickLock.unlock();
        }
    }

    private void appendWithRetry(TickOutcome outcome) throws LedgerWriteException, InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                ledger.appendBatch(outcome.events());
                return;
            } catch (LedgerWriteException e) {
                if (attempt >= commitAttempts) {
                    log.error("Failed to append tick {} to ledger after {} attempts, world stays at tick {}",
                        outcome.tick(), attempt, engine.getCurrentTick());
                    throw e;
                }
                log.debug("Ledger append for tick {} failed (attempt {}/{}): {}", outcome.tick(), attempt,
                    commitAttempts, e.getMessage());
                Thread.sleep(commitRetryDelayMs);
            }
        }
    }

    private void recordRejections(TickOutcome outcome) {
        if (rejectionLog.isEmpty() || outcome.rejections().isEmpty()) {
            return;
        }
        try {
            rejectionLog.get().record(outcome.rejections());
        } catch (IOException e) {
            log.warn("Failed to record {} rejections of tick {}", outcome.rejections().size(), outcome.tick());
            recordError("REJECTION_LOG_FAILED", "Failed to record rejections",
                "Tick: " + outcome.tick() + ", Error: " + e.getMessage());
        }
    }

    private void writeSnapshot(TickOutcome outcome) {
        if (snapshotStore.isEmpty()) {
            return;
        }
        try {
            snapshotStore.get().save(outcome.snapshot());
            snapshotsWritten.incrementAndGet();
        } catch (IOException e) {
            log.warn("Failed to write snapshot of tick {}", outcome.tick());
            recordError("SNAPSHOT_FAILED", "Failed to write snapshot",
                "Tick: " + outcome.tick() + ", Error: " + e.getMessage());
        }
    }

    /**
     * Persists the snapshot of the current committed state regardless of the interval. Used on
     * shutdown.
     *
     * @return true if a snapshot was written
     */
    public boolean writeFinalSnapshot() {
        tickLock.lock();
        try {
            if (snapshotStore.isEmpty() || engine.latestSnapshot() == null) {
                return false;
            }
            try {
                snapshotStore.get().save(engine.latestSnapshot());
                snapshotsWritten.incrementAndGet();
                return true;
            } catch (IOException e) {
                log.warn("Failed to write final snapshot of tick {}", engine.getCurrentTick());
                recordError("SNAPSHOT_FAILED", "Failed to write final snapshot",
                    "Tick: " + engine.getCurrentTick() + ", Error: " + e.getMessage());
                return false;
            }
        } finally {
            tickLock.unlock();
        }
    }

    public long getTicksCommitted() {
        return ticksCommitted.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("current_tick", engine.getCurrentTick());
        metrics.put("ticks_committed", ticksCommitted.get());
        metrics.put("actions_accepted", actionsAccepted.get());
        metrics.put("actions_rejected", actionsRejected.get());
        metrics.put("snapshots_written", snapshotsWritten.get());
        metrics.put("last_tick_duration_ms", lastTickDurationMs.get());
        metrics.put("agents_live", agentsLive);
    }
}
