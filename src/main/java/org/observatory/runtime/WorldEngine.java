package org.observatory.runtime;

import org.observatory.runtime.actions.Action;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.events.EventPayloads;
import org.observatory.runtime.events.EventType;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.internal.services.WorldCodec;
import org.observatory.runtime.model.RegionDefinition;
import org.observatory.runtime.model.WorldRules;
import org.observatory.runtime.model.WorldState;
import org.observatory.runtime.validation.ActionValidator;
import org.observatory.runtime.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole authority over world mutation.
 * <p>
 * A tick is processed in two steps. {@link #prepareTick(List)} runs validation, action effects and
 * physics on a deep copy of the canonical state and returns the resulting ledger batch without
 * touching anything observable. Once the caller has made the batch durable,
 * {@link #commit(TickOutcome)} swaps the working copy in and publishes its snapshot. An outcome
 * that is never committed simply disappears, which is how a failed ledger write leaves the world
 * unchanged.
 * <p>
 * <strong>Thread Safety:</strong> {@code prepare*}, {@link #commit(TickOutcome)} and
 * {@link #restore(WorldState, long)} must be called from a single thread (the tick thread).
 * {@link #latestSnapshot()} may be called from any thread.
 */
public final class WorldEngine {

    private static final Logger log = LoggerFactory.getLogger(WorldEngine.class);

    private final ActionValidator validator = new ActionValidator();
    private final ActionResolver resolver = new ActionResolver();
    private final TickPhysics physics = new TickPhysics();
    private final EventApplier applier = new EventApplier(physics);
    private final Clock clock;

    private WorldState state = new WorldState();
    private long nextSequence = 0;
    private final AtomicReference<WorldSnapshot> published = new AtomicReference<>();

    public WorldEngine() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the informational event timestamps; never used for ordering
     */
    public WorldEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Prepares the genesis batch of a brand-new world: a single WORLD_CREATED event at tick 0.
     *
     * @throws IllegalStateException if this engine already holds a world
     */
    public TickOutcome prepareGenesis(long seed, WorldRules rules, List<RegionDefinition> regions) {
        if (state.isInitialized() || nextSequence != 0) {
            throw new IllegalStateException("Engine already holds a world at tick " + state.getTick());
        }
        WorldState working = new WorldState();
        LedgerEvent created = new LedgerEvent(0, 0, EventType.WORLD_CREATED, List.of(),
            WorldCodec.toPayload(new EventPayloads.WorldCreated(seed, rules, regions)), clock.millis());
        applier.apply(working, created);
        return new TickOutcome(0, working, List.of(created), List.of(), WorldCodec.snapshot(working), 0, 1);
    }

    /**
     * Prepares the next tick from the given actions, processed in list order.
     * <p>
     * Each action is validated against the state left by the actions before it. Accepted actions
     * become events; rejected ones are returned as diagnostics and leave no trace in the state.
     * After all actions, tick physics run and due trade offers are dropped. A TICK_COMPLETED event
     * carrying the post-tick state hash closes the batch.
     */
    public TickOutcome prepareTick(List<? extends Action> actions) {
        if (!state.isInitialized()) {
            throw new IllegalStateException("Cannot run a tick before the world has been created");
        }
        long tick = state.getTick() + 1;
        long timestamp = clock.millis();
        WorldState working = state.copy();
        working.advanceTo(tick);

        long sequence = nextSequence;
        List<LedgerEvent> events = new ArrayList<>();
        List<RejectedAction> rejections = new ArrayList<>();

        for (Action action : actions) {
            ValidationResult result = validator.validate(working, action);
            if (!result.isAccepted()) {
                rejections.add(new RejectedAction(tick, action.type(), action.agentId(), result.reason(), result.detail()));
                log.debug("Tick {}: rejected {} from '{}': {} ({})", tick, action.type(), action.agentId(), result.reason(), result.detail());
                continue;
            }
            ActionResolver.ResolvedEvent resolved = resolver.resolve(working, action);
            LedgerEvent event = new LedgerEvent(sequence++, tick, resolved.type(), resolved.agentIds(),
                WorldCodec.toPayload(resolved.payload()), timestamp);
            applier.apply(working, event);
            events.add(event);
        }

        List<String> casualties = physics.apply(working, tick);
        List<String> expiredOffers = working.expireTradeOffers(tick);
        if (!expiredOffers.isEmpty()) {
            log.debug("Tick {}: trade offers expired {}", tick, expiredOffers);
        }

        List<String> violations = working.findInvariantViolations();
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Tick " + tick + " violates world invariants: " + violations);
        }

        WorldSnapshot snapshot = WorldCodec.snapshot(working);
        EventPayloads.TickCompleted completed = new EventPayloads.TickCompleted(
            events.size(), rejections.size(), casualties, expiredOffers, snapshot.stateHash());
        events.add(new LedgerEvent(sequence++, tick, EventType.TICK_COMPLETED, casualties,
            WorldCodec.toPayload(completed), timestamp));

        return new TickOutcome(tick, working, events, rejections, snapshot, nextSequence, sequence);
    }

    /**
     * Makes a prepared outcome canonical and publishes its snapshot. Must only be called after the
     * outcome's events are durable.
     *
     * @throws IllegalStateException if the outcome was not prepared from the current state
     */
    public void commit(TickOutcome outcome) {
        if (outcome.firstSequence() != nextSequence) {
            throw new IllegalStateException("Outcome for tick " + outcome.tick() + " starts at sequence "
                + outcome.firstSequence() + " but engine expects " + nextSequence);
        }
        state = outcome.workingState();
        nextSequence = outcome.nextSequence();
        published.set(outcome.snapshot());
    }

    /**
     * Replaces the canonical state with one reconstructed from the ledger.
     *
     * @param recovered    the reconstructed state
     * @param nextSequence the sequence number following the last committed event
     */
    public void restore(WorldState recovered, long nextSequence) {
        this.state = recovered;
        this.nextSequence = nextSequence;
        published.set(WorldCodec.snapshot(recovered));
        log.debug("Engine restored at tick {} with next sequence {}", recovered.getTick(), nextSequence);
    }

    /**
     * @return the last committed snapshot, or {@code null} before genesis
     */
    public WorldSnapshot latestSnapshot() {
        return published.get();
    }

    public long getCurrentTick() {
        return state.getTick();
    }

    public long getNextSequence() {
        return nextSequence;
    }

    public boolean hasWorld() {
        return state.isInitialized();
    }
}
