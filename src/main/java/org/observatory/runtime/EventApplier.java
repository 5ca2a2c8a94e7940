package org.observatory.runtime;

import org.observatory.runtime.events.EventPayloads;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.internal.services.WorldCodec;
import org.observatory.runtime.model.Agent;
import org.observatory.runtime.model.AgentStatus;
import org.observatory.runtime.model.Region;
import org.observatory.runtime.model.ResourcePool;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.TradeOffer;
import org.observatory.runtime.model.WorldState;

import java.util.List;
import java.util.Map;

/**
 * Applies committed events to a world state.
 * <p>
 * This is the only code path that mutates world state for actions. The live engine runs every
 * accepted action through it on the working copy, and replay runs the ledger through it, so a
 * replayed tick performs exactly the mutations the live tick performed. {@code TICK_COMPLETED}
 * runs {@link TickPhysics} for the event's tick and then drops the trade offers due at its end.
 * <p>
 * An event that does not fit the state (missing agent, overdrawn pool, backwards status change)
 * means the ledger and the state have diverged; it is reported with an
 * {@link IllegalStateException} and never patched over.
 */
public final class EventApplier {

    private final TickPhysics physics;

    public EventApplier(TickPhysics physics) {
        this.physics = physics;
    }

    public void apply(WorldState state, LedgerEvent event) {
        state.advanceTo(event.tick());
        long tick = event.tick();

        switch (event.type()) {
            case WORLD_CREATED -> {
                EventPayloads.WorldCreated p = WorldCodec.fromPayload(event.payload(), EventPayloads.WorldCreated.class);
                state.initialize(p.seed(), p.rules(), p.regions());
            }
            case AGENT_REGISTERED -> {
                EventPayloads.AgentRegistered p = WorldCodec.fromPayload(event.payload(), EventPayloads.AgentRegistered.class);
                state.addAgent(new Agent(p.agentId(), p.regionId(), ResourcePool.of(p.resources()), tick, null));
            }
            case AGENT_CLAIMED -> {
                EventPayloads.AgentClaimed p = WorldCodec.fromPayload(event.payload(), EventPayloads.AgentClaimed.class);
                Agent agent = state.requireAgent(p.agentId());
                agent.transitionTo(AgentStatus.CLAIMED, tick);
                agent.setClaimReference(p.claimReference());
                agent.markActed(tick);
            }
            case AGENT_MOVED -> {
                EventPayloads.AgentMoved p = WorldCodec.fromPayload(event.payload(), EventPayloads.AgentMoved.class);
                Agent agent = requireLive(state, p.agentId());
                agent.getResources().withdrawAll(p.cost());
                state.requireRegion(p.toRegionId()).admit();
                state.requireRegion(p.fromRegionId()).release();
                agent.relocate(p.toRegionId());
                agent.markActed(tick);
            }
            case RESOURCES_TRADED -> applyTrade(state, tick,
                WorldCodec.fromPayload(event.payload(), EventPayloads.ResourcesTraded.class));
            case TRADE_OFFERED -> {
                EventPayloads.TradeOffered p = WorldCodec.fromPayload(event.payload(), EventPayloads.TradeOffered.class);
                Agent offerer = requireLive(state, p.offer().offererId());
                offerer.getResources().withdrawAll(p.cost());
                state.openTradeOffer(p.offer());
                offerer.markActed(tick);
            }
            case TRADE_ACCEPTED -> applyAcceptedTrade(state, tick,
                WorldCodec.fromPayload(event.payload(), EventPayloads.TradeAccepted.class));
            case MESSAGE_DELIVERED -> {
                EventPayloads.MessageDelivered p = WorldCodec.fromPayload(event.payload(), EventPayloads.MessageDelivered.class);
                Agent sender = requireLive(state, p.senderId());
                requireLive(state, p.recipientId());
                sender.getResources().withdrawAll(p.cost());
                sender.markActed(tick);
            }
            case AGENT_FORKED -> applyFork(state, tick,
                WorldCodec.fromPayload(event.payload(), EventPayloads.AgentForked.class));
            case AGENTS_MERGED -> {
                EventPayloads.AgentsMerged p = WorldCodec.fromPayload(event.payload(), EventPayloads.AgentsMerged.class);
                Agent survivor = requireLive(state, p.survivorId());
                Agent absorbed = requireLive(state, p.absorbedId());
                survivor.getResources().withdrawAll(p.cost());
                Map<ResourceType, Long> transferred = absorbed.getResources().clear();
                requireSame(p.transferred(), transferred, "merged resources of '" + absorbed.getId() + "'");
                survivor.getResources().depositAll(transferred);
                absorbed.transitionTo(AgentStatus.MERGED, tick);
                state.requireRegion(absorbed.getRegionId()).release();
                survivor.markActed(tick);
            }
            case AGENT_DIED -> {
                EventPayloads.AgentDied p = WorldCodec.fromPayload(event.payload(), EventPayloads.AgentDied.class);
                Agent agent = requireLive(state, p.agentId());
                agent.markActed(tick);
                Map<ResourceType, Long> released = state.killAgent(agent, tick);
                requireSame(p.released(), released, "released resources of '" + agent.getId() + "'");
            }
            case REGION_OBSERVED -> {
                EventPayloads.RegionObserved p = WorldCodec.fromPayload(event.payload(), EventPayloads.RegionObserved.class);
                Agent agent = requireLive(state, p.agentId());
                agent.getResources().withdrawAll(p.cost());
                agent.markActed(tick);
            }
            case TICK_COMPLETED -> {
                EventPayloads.TickCompleted p = WorldCodec.fromPayload(event.payload(), EventPayloads.TickCompleted.class);
                physics.apply(state, tick);
                List<String> expired = state.expireTradeOffers(tick);
                if (!expired.equals(p.expiredTradeOffers())) {
                    throw new IllegalStateException("Tick " + tick + " recorded expired offers " + p.expiredTradeOffers()
                        + " but state expired " + expired);
                }
            }
        }
    }

    private void applyTrade(WorldState state, long tick, EventPayloads.ResourcesTraded p) {
        Agent agent = requireLive(state, p.agentId());
        ResourcePool regionPool = state.requireRegion(p.regionId()).getPool();

        agent.getResources().withdrawAll(p.cost());
        exchange(agent.getResources(), regionPool, p.offerResource(), p.offerAmount(), p.requestResource(), p.requestAmount());
        agent.markActed(tick);
    }

    private void applyAcceptedTrade(WorldState state, long tick, EventPayloads.TradeAccepted p) {
        TradeOffer offer = state.removeTradeOffer(p.offerId());
        if (!offer.recipientId().equals(p.accepterId()) || !offer.offererId().equals(p.offererId())
            || offer.offerResource() != p.offerResource() || offer.offerAmount() != p.offerAmount()
            || offer.requestResource() != p.requestResource() || offer.requestAmount() != p.requestAmount()) {
            throw new IllegalStateException("Acceptance of '" + p.offerId() + "' does not match open offer " + offer);
        }
        Agent accepter = requireLive(state, p.accepterId());
        Agent offerer = requireLive(state, p.offererId());

        accepter.getResources().withdrawAll(p.cost());
        exchange(offerer.getResources(), accepter.getResources(),
            p.offerResource(), p.offerAmount(), p.requestResource(), p.requestAmount());
        accepter.markActed(tick);
    }

    private void exchange(ResourcePool giver, ResourcePool taker, ResourceType given, long givenAmount,
                          ResourceType returned, long returnedAmount) {
        giver.withdraw(given, givenAmount);
        taker.deposit(given, givenAmount);
        taker.withdraw(returned, returnedAmount);
        giver.deposit(returned, returnedAmount);
    }

    private void applyFork(WorldState state, long tick, EventPayloads.AgentForked p) {
        Agent parent = requireLive(state, p.parentId());
        parent.getResources().withdrawAll(p.cost());
        Map<ResourceType, Long> remaining = parent.getResources().clear();
        for (ResourceType type : ResourceType.values()) {
            long split = p.firstChildResources().getOrDefault(type, 0L) + p.secondChildResources().getOrDefault(type, 0L);
            if (split != remaining.get(type)) {
                throw new IllegalStateException("Fork of '" + parent.getId() + "' splits " + split + " " + type
                    + " but parent holds " + remaining.get(type));
            }
        }
        parent.markActed(tick);
        parent.transitionTo(AgentStatus.FORKED, tick);
        Region region = state.requireRegion(p.regionId());
        region.release();
        state.addAgent(child(p.firstChildId(), parent, p.firstChildResources(), tick));
        state.addAgent(child(p.secondChildId(), parent, p.secondChildResources(), tick));
    }

    private Agent child(String id, Agent parent, Map<ResourceType, Long> resources, long tick) {
        return new Agent(id, AgentStatus.CLAIMED, parent.getRegionId(), ResourcePool.of(resources), tick, tick,
            parent.getClaimReference(), parent.getId(), null);
    }

    private Agent requireLive(WorldState state, String agentId) {
        Agent agent = state.requireAgent(agentId);
        if (!agent.isClaimed()) {
            throw new IllegalStateException("Agent '" + agentId + "' is " + agent.getStatus() + " and cannot be mutated");
        }
        return agent;
    }

    private void requireSame(Map<ResourceType, Long> recorded, Map<ResourceType, Long> actual, String what) {
        for (ResourceType type : ResourceType.values()) {
            if (recorded.getOrDefault(type, 0L).longValue() != actual.getOrDefault(type, 0L).longValue()) {
                throw new IllegalStateException("Recorded " + what + " " + recorded + " differ from state " + actual);
            }
        }
    }
}
