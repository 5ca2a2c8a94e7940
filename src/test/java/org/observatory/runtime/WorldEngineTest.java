package org.observatory.runtime;

import org.observatory.runtime.actions.AcceptTradeAction;
import org.observatory.runtime.actions.Action;
import org.observatory.runtime.actions.ActionType;
import org.observatory.runtime.actions.ClaimAction;
import org.observatory.runtime.actions.CommunicateAction;
import org.observatory.runtime.actions.DieAction;
import org.observatory.runtime.actions.ForkAction;
import org.observatory.runtime.actions.MergeAction;
import org.observatory.runtime.actions.MoveAction;
import org.observatory.runtime.actions.ObserveAction;
import org.observatory.runtime.actions.RegisterAction;
import org.observatory.runtime.actions.TradeAction;
import org.observatory.runtime.api.RawAgentState;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.events.EventPayloads;
import org.observatory.runtime.events.EventType;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.internal.services.WorldCodec;
import org.observatory.runtime.model.AgentStatus;
import org.observatory.runtime.model.RegionDefinition;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.TradeOffer;
import org.observatory.runtime.model.WorldRules;
import org.observatory.runtime.validation.RejectionReason;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.observatory.runtime.WorldFixtures.commit;
import static org.observatory.runtime.WorldFixtures.engine;
import static org.observatory.runtime.WorldFixtures.region;
import static org.observatory.runtime.WorldFixtures.resources;
import static org.observatory.runtime.WorldFixtures.spawnClaimed;
import static org.observatory.runtime.WorldFixtures.staticRules;

@Tag("unit")
class WorldEngineTest {

    @Test
    void genesisProducesSingleWorldCreatedEvent() {
        WorldEngine engine = new WorldEngine();
        assertFalse(engine.hasWorld());

        TickOutcome genesis = engine.prepareGenesis(11L, staticRules(), List.of(region("nexus", 0, 0, 10)));

        assertNull(engine.latestSnapshot());
        assertThat(genesis.events()).hasSize(1);
        LedgerEvent created = genesis.events().get(0);
        assertEquals(EventType.WORLD_CREATED, created.type());
        assertEquals(0L, created.sequence());
        assertEquals(0L, created.tick());

        engine.commit(genesis);

        assertTrue(engine.hasWorld());
        assertEquals(1L, engine.getNextSequence());
        assertEquals(11L, engine.latestSnapshot().worldSeed());
        assertThrows(IllegalStateException.class,
            () -> engine.prepareGenesis(11L, staticRules(), List.of(region("nexus", 0, 0, 10))));
    }

    @Test
    void tickBeforeGenesisIsRefused() {
        assertThrows(IllegalStateException.class, () -> new WorldEngine().prepareTick(List.of()));
    }

    @Test
    void registrationAndClaimActivateAgent() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));

        TickOutcome registered = commit(engine, List.of(new RegisterAction("alice", null, 0)));
        RawAgentState pending = engine.latestSnapshot().agent("alice").orElseThrow();
        assertEquals(AgentStatus.PENDING, pending.status());
        assertEquals("nexus", pending.regionId());
        assertEquals(50L, pending.resource(ResourceType.ENERGY));
        assertEquals(EventType.AGENT_REGISTERED, registered.events().get(0).type());

        commit(engine, List.of(new ClaimAction("alice", "session-7", 1)));
        RawAgentState claimed = engine.latestSnapshot().agent("alice").orElseThrow();
        assertEquals(AgentStatus.CLAIMED, claimed.status());
        assertEquals("session-7", claimed.claimReference());
        assertEquals(1, engine.latestSnapshot().region("nexus").orElseThrow().occupancy());
    }

    @Test
    void batchIsContiguousAndEndsWithTickCompleted() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");

        TickOutcome outcome = commit(engine, List.of(
            new ObserveAction("alice", 2),
            new MoveAction("ghost", "nexus", 2),
            TradeAction.transfer("alice", "bob", ResourceType.MEMORY, 10, 2)));

        List<LedgerEvent> events = outcome.events();
        for (int i = 0; i < events.size(); i++) {
            assertEquals(outcome.firstSequence() + i, events.get(i).sequence());
            assertEquals(outcome.tick(), events.get(i).tick());
        }
        LedgerEvent last = events.get(events.size() - 1);
        assertEquals(EventType.TICK_COMPLETED, last.type());
        EventPayloads.TickCompleted completed = WorldCodec.fromPayload(last.payload(), EventPayloads.TickCompleted.class);
        assertEquals(2L, completed.actionsAccepted());
        assertEquals(1L, completed.actionsRejected());
        assertEquals(outcome.snapshot().stateHash(), completed.stateHash());
        assertEquals(outcome.nextSequence(), engine.getNextSequence());

        assertThat(outcome.rejections()).singleElement()
            .satisfies(r -> {
                assertEquals(RejectionReason.UNKNOWN_AGENT, r.reason());
                assertEquals(ActionType.MOVE, r.actionType());
            });
    }

    @Test
    void acceptedOfferConservesTradedResources() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");

        TickOutcome offered = commit(engine, List.of(new TradeAction("alice", "bob", ResourceType.ENERGY, 30, ResourceType.COMPUTE, 15, 2)));

        LedgerEvent offerEvent = offered.events().get(0);
        assertEquals(EventType.TRADE_OFFERED, offerEvent.type());
        assertThat(offerEvent.agentIds()).containsExactly("alice", "bob");
        TradeOffer offer = engine.latestSnapshot().tradeOffers().get(0);
        assertEquals("trade-00000000", offer.offerId());
        assertEquals(offered.tick() + 10, offer.expiresAtTick());
        assertEquals(50L, engine.latestSnapshot().agent("alice").orElseThrow().resource(ResourceType.ENERGY));

        TickOutcome accepted = commit(engine, List.of(new AcceptTradeAction("bob", offer.offerId(), 3)));

        assertEquals(EventType.TRADE_ACCEPTED, accepted.events().get(0).type());
        WorldSnapshot after = engine.latestSnapshot();
        RawAgentState alice = after.agent("alice").orElseThrow();
        RawAgentState bob = after.agent("bob").orElseThrow();
        assertEquals(20L, alice.resource(ResourceType.ENERGY));
        assertEquals(80L, bob.resource(ResourceType.ENERGY));
        assertEquals(100L, alice.resource(ResourceType.ENERGY) + bob.resource(ResourceType.ENERGY));
        assertEquals(55L, alice.resource(ResourceType.COMPUTE));
        assertEquals(25L, bob.resource(ResourceType.COMPUTE));
        assertThat(after.tradeOffers()).isEmpty();
    }

    @Test
    void requestWithoutAcceptanceTakesNothing() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");
        RawAgentState bobBefore = engine.latestSnapshot().agent("bob").orElseThrow();

        TickOutcome demanded = commit(engine, List.of(new TradeAction("alice", "bob", ResourceType.ENERGY, 0, ResourceType.ENERGY, 50, 2)));
        assertThat(demanded.rejections()).isEmpty();

        TickOutcome last = demanded;
        while (last.tick() < demanded.tick() + 10) {
            assertEquals(bobBefore, engine.latestSnapshot().agent("bob").orElseThrow());
            last = commit(engine, List.of());
        }

        EventPayloads.TickCompleted completed = WorldCodec.fromPayload(
            last.events().get(last.events().size() - 1).payload(), EventPayloads.TickCompleted.class);
        assertThat(completed.expiredTradeOffers()).containsExactly("trade-00000000");
        assertThat(engine.latestSnapshot().tradeOffers()).isEmpty();
        assertEquals(bobBefore, engine.latestSnapshot().agent("bob").orElseThrow());
        assertEquals(50L, engine.latestSnapshot().agent("alice").orElseThrow().resource(ResourceType.ENERGY));

        TickOutcome late = commit(engine, List.of(new AcceptTradeAction("bob", "trade-00000000", last.tick())));
        assertThat(late.rejections()).extracting(RejectedAction::reason).containsExactly(RejectionReason.INVALID_TARGET);
    }

    @Test
    void onlyTheRecipientCanAcceptAnOffer() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob", "carol");

        TickOutcome outcome = commit(engine, List.of(
            TradeAction.transfer("alice", "bob", ResourceType.MEMORY, 10, 2),
            new AcceptTradeAction("carol", "trade-00000000", 2),
            new AcceptTradeAction("alice", "trade-00000000", 2),
            new AcceptTradeAction("bob", "trade-00000000", 2)));

        assertThat(outcome.rejections()).extracting(RejectedAction::agentId).containsExactly("carol", "alice");
        assertThat(outcome.rejections()).extracting(RejectedAction::reason)
            .containsOnly(RejectionReason.INVALID_TARGET);
        assertEquals(110L, engine.latestSnapshot().agent("bob").orElseThrow().resource(ResourceType.MEMORY));
        assertEquals(100L, engine.latestSnapshot().agent("carol").orElseThrow().resource(ResourceType.MEMORY));
    }

    @Test
    void acceptanceIsCheckedAgainstCurrentHoldings() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");
        commit(engine, List.of(new TradeAction("alice", "bob", ResourceType.ENERGY, 30, ResourceType.COMPUTE, 15, 2)));
        commit(engine, List.of(TradeAction.transfer("alice", null, ResourceType.ENERGY, 45, 3)));

        TickOutcome outcome = commit(engine, List.of(new AcceptTradeAction("bob", "trade-00000000", 4)));

        assertThat(outcome.rejections()).extracting(RejectedAction::reason)
            .containsExactly(RejectionReason.INSUFFICIENT_RESOURCES);
        assertEquals(50L, engine.latestSnapshot().agent("bob").orElseThrow().resource(ResourceType.ENERGY));
        assertThat(engine.latestSnapshot().tradeOffers()).extracting(TradeOffer::offerId).containsExactly("trade-00000000");
    }

    @Test
    void underfundedTradeLeavesNoTrace() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");
        commit(engine, List.of(TradeAction.transfer("alice", null, ResourceType.ENERGY, 45, 2)));
        assertEquals(5L, engine.latestSnapshot().agent("alice").orElseThrow().resource(ResourceType.ENERGY));

        TickOutcome outcome = commit(engine, List.of(TradeAction.transfer("alice", "bob", ResourceType.ENERGY, 10, 3)));

        assertEquals(5L, engine.latestSnapshot().agent("alice").orElseThrow().resource(ResourceType.ENERGY));
        assertEquals(50L, engine.latestSnapshot().agent("bob").orElseThrow().resource(ResourceType.ENERGY));
        assertThat(outcome.events()).extracting(LedgerEvent::type).containsExactly(EventType.TICK_COMPLETED);
        assertThat(outcome.rejections()).extracting(RejectedAction::reason)
            .containsExactly(RejectionReason.INSUFFICIENT_RESOURCES);
    }

    @Test
    void tradeFeePlusHugeOfferIsRejectedInsteadOfOverflowing() {
        WorldRules rules = WorldFixtures.staticRules(
            Map.of(ActionType.TRADE, Map.of(ResourceType.ENERGY, 2L)), WorldRules.defaults().initialResources());
        WorldEngine engine = engine(1L, rules, region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");
        WorldSnapshot before = engine.latestSnapshot();

        TickOutcome outcome = commit(engine, List.of(
            TradeAction.transfer("alice", null, ResourceType.ENERGY, Long.MAX_VALUE, 2),
            TradeAction.transfer("alice", "bob", ResourceType.ENERGY, Long.MAX_VALUE - 1, 2)));

        assertThat(outcome.rejections()).extracting(RejectedAction::reason)
            .containsExactly(RejectionReason.INSUFFICIENT_RESOURCES, RejectionReason.INSUFFICIENT_RESOURCES);
        assertEquals(before.agents(), engine.latestSnapshot().agents());
        assertEquals(before.resourcePools(), engine.latestSnapshot().resourcePools());
    }

    @Test
    void regionFillsUpToCapacityAndNoFurther() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 200), region("forge", 3, 1, 10));
        String[] residents = new String[199];
        for (int i = 0; i < residents.length; i++) {
            residents[i] = String.format("resident-%03d", i);
        }
        spawnClaimed(engine, "nexus", residents);
        spawnClaimed(engine, "forge", "a", "b");
        assertEquals(199, engine.latestSnapshot().region("nexus").orElseThrow().occupancy());

        TickOutcome outcome = commit(engine, List.of(new MoveAction("a", "nexus", 4), new MoveAction("b", "nexus", 4)));

        WorldSnapshot after = engine.latestSnapshot();
        assertEquals(200, after.region("nexus").orElseThrow().occupancy());
        assertEquals("nexus", after.agent("a").orElseThrow().regionId());
        assertEquals("forge", after.agent("b").orElseThrow().regionId());
        assertThat(outcome.rejections()).singleElement()
            .satisfies(r -> {
                assertEquals("b", r.agentId());
                assertEquals(RejectionReason.REGION_FULL, r.reason());
            });
    }

    @Test
    void moveChargesDistanceScaledCost() {
        WorldRules rules = new WorldRules(WorldRules.defaults().actionCosts(), 0.5,
            resources(50, 0, 0, 0), Map.of(), Map.of(), Map.of(), 0L, "nexus", 10L);
        WorldEngine engine = engine(1L, rules, region("nexus", 0, 0, 10), region("forge", 3, 4, 10));
        spawnClaimed(engine, "nexus", "alice");

        commit(engine, List.of(new MoveAction("alice", "forge", 2)));

        // distance 5: ceil(5 * (1 + 5 * 0.5)) = 18
        assertEquals(32L, engine.latestSnapshot().agent("alice").orElseThrow().resource(ResourceType.ENERGY));
    }

    @Test
    void forkSplitsRemainingResourcesBetweenChildren() {
        WorldRules rules = WorldFixtures.staticRules(
            Map.of(ActionType.FORK, Map.of(ResourceType.MEMORY, 50L, ResourceType.COMPUTE, 30L)),
            resources(100, 0, 50, 30));
        WorldEngine engine = engine(1L, rules, region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "x");

        TickOutcome outcome = commit(engine, List.of(new ForkAction("x", 50, 2)));

        WorldSnapshot after = engine.latestSnapshot();
        RawAgentState parent = after.agent("x").orElseThrow();
        RawAgentState first = after.agent("x.1").orElseThrow();
        RawAgentState second = after.agent("x.2").orElseThrow();
        assertEquals(AgentStatus.FORKED, parent.status());
        assertEquals(AgentStatus.CLAIMED, first.status());
        assertEquals(AgentStatus.CLAIMED, second.status());
        assertEquals(50L, first.resource(ResourceType.ENERGY));
        assertEquals(50L, second.resource(ResourceType.ENERGY));
        assertEquals("x", first.parentId());
        assertEquals(0L, parent.resource(ResourceType.ENERGY));
        assertEquals(2, after.region("nexus").orElseThrow().occupancy());
        assertThat(outcome.events().get(0).agentIds()).containsExactly("x", "x.1", "x.2");

        TickOutcome later = commit(engine, List.of(new MoveAction("x", "nexus", 3), new ForkAction("x", 50, 3)));
        assertThat(later.rejections()).extracting(RejectedAction::reason)
            .containsOnly(RejectionReason.AGENT_RETIRED);
        assertThat(later.events()).noneMatch(e -> e.concerns("x") && e.type() != EventType.TICK_COMPLETED);
    }

    @Test
    void unevenForkGivesRemainderToSecondChild() {
        WorldRules rules = WorldFixtures.staticRules(Map.of(), resources(7, 0, 0, 0));
        WorldEngine engine = engine(1L, rules, region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "x");

        commit(engine, List.of(new ForkAction("x", 30, 2)));

        assertEquals(2L, engine.latestSnapshot().agent("x.1").orElseThrow().resource(ResourceType.ENERGY));
        assertEquals(5L, engine.latestSnapshot().agent("x.2").orElseThrow().resource(ResourceType.ENERGY));
    }

    @Test
    void mergeMovesAbsorbedResourcesToSurvivor() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");

        commit(engine, List.of(new MergeAction("alice", "bob", 2)));

        WorldSnapshot after = engine.latestSnapshot();
        RawAgentState alice = after.agent("alice").orElseThrow();
        RawAgentState bob = after.agent("bob").orElseThrow();
        // 50 + 50 - 20 energy, 40 + 40 - 20 compute
        assertEquals(80L, alice.resource(ResourceType.ENERGY));
        assertEquals(60L, alice.resource(ResourceType.COMPUTE));
        assertEquals(AgentStatus.MERGED, bob.status());
        assertEquals(0L, bob.resource(ResourceType.ENERGY));
        assertEquals(1, after.region("nexus").orElseThrow().occupancy());
    }

    @Test
    void deathReleasesResourcesToRegionPool() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10, Map.of(ResourceType.ENERGY, 5L)));
        spawnClaimed(engine, "nexus", "alice", "bob");

        commit(engine, List.of(new DieAction("alice", 2)));

        WorldSnapshot after = engine.latestSnapshot();
        assertEquals(AgentStatus.DEAD, after.agent("alice").orElseThrow().status());
        assertEquals(55L, after.pool("nexus").orElseThrow().amount(ResourceType.ENERGY));
        assertEquals(1, after.region("nexus").orElseThrow().occupancy());

        TickOutcome later = commit(engine, List.of(
            new CommunicateAction("alice", "bob", "still here?", 3),
            TradeAction.transfer("bob", "alice", ResourceType.ENERGY, 1, 3),
            new MergeAction("bob", "alice", 3)));
        assertThat(later.rejections()).extracting(RejectedAction::reason)
            .containsExactly(RejectionReason.AGENT_RETIRED, RejectionReason.AGENT_RETIRED, RejectionReason.AGENT_RETIRED);
        assertEquals(after.agent("alice"), engine.latestSnapshot().agent("alice"));
    }

    @Test
    void energyDepletionKillsAgentDuringPhysics() {
        WorldRules rules = new WorldRules(Map.of(), 0.0, resources(3, 0, 0, 0), Map.of(), Map.of(),
            Map.of(ResourceType.ENERGY, 1L), 0L, "nexus", 10L);
        WorldEngine engine = engine(1L, rules, region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice");
        // claim tick charged the first upkeep
        assertEquals(2L, engine.latestSnapshot().agent("alice").orElseThrow().resource(ResourceType.ENERGY));

        commit(engine, List.of());
        TickOutcome fatal = commit(engine, List.of());

        LedgerEvent completed = fatal.events().get(fatal.events().size() - 1);
        assertThat(completed.agentIds()).containsExactly("alice");
        assertThat(WorldCodec.fromPayload(completed.payload(), EventPayloads.TickCompleted.class).casualties())
            .containsExactly("alice");
        assertEquals(AgentStatus.DEAD, engine.latestSnapshot().agent("alice").orElseThrow().status());
        assertEquals(0, engine.latestSnapshot().region("nexus").orElseThrow().occupancy());
    }

    @Test
    void pendingAgentsAreFrozen() {
        WorldRules rules = new WorldRules(Map.of(), 0.0, resources(3, 0, 0, 0), Map.of(), Map.of(),
            Map.of(ResourceType.ENERGY, 1L), 0L, "nexus", 10L);
        WorldEngine engine = engine(1L, rules, region("nexus", 0, 0, 10));

        commit(engine, List.of(new RegisterAction("sleeper", "nexus", 0)));
        for (int i = 0; i < 5; i++) {
            commit(engine, List.of());
        }

        RawAgentState sleeper = engine.latestSnapshot().agent("sleeper").orElseThrow();
        assertEquals(AgentStatus.PENDING, sleeper.status());
        assertEquals(3L, sleeper.resource(ResourceType.ENERGY));
    }

    @Test
    void uncommittedOutcomeLeavesWorldUntouched() {
        WorldEngine engine = engine(1L, staticRules(), region("nexus", 0, 0, 10));
        spawnClaimed(engine, "nexus", "alice", "bob");
        WorldSnapshot before = engine.latestSnapshot();
        long sequenceBefore = engine.getNextSequence();
        List<Action> actions = List.of(new DieAction("alice", 2));

        TickOutcome discarded = engine.prepareTick(actions);

        assertEquals(before, engine.latestSnapshot());
        assertEquals(sequenceBefore, engine.getNextSequence());
        assertEquals(2L, engine.getCurrentTick());

        TickOutcome retried = engine.prepareTick(actions);
        assertEquals(discarded.snapshot().stateHash(), retried.snapshot().stateHash());
        engine.commit(retried);
        assertThrows(IllegalStateException.class, () -> engine.commit(discarded));
    }

    @Test
    void sameSeedAndActionsGiveSameHistory() {
        List<String> first = runDangerousWorld(99L);
        List<String> second = runDangerousWorld(99L);

        assertEquals(first, second);
        assertThat(runDangerousWorld(100L)).isNotEqualTo(first);
    }

    private List<String> runDangerousWorld(long seed) {
        RegionDefinition wasteland = new RegionDefinition("wasteland", "Wasteland", -4, 3, 0.7, 0.5, 50, Map.of());
        RegionDefinition nexus = new RegionDefinition("nexus", "Nexus", 0, 0, 0.05, 1.0, 200, Map.of());
        WorldEngine engine = engine(seed, WorldRules.defaults(), nexus, wasteland);
        spawnClaimed(engine, "wasteland", "a", "b", "c", "d", "e", "f");
        List<String> hashes = new ArrayList<>();
        for (int tick = 0; tick < 10; tick++) {
            hashes.add(commit(engine, List.of(new ObserveAction("a", tick))).snapshot().stateHash());
        }
        return hashes;
    }
}
