package org.observatory.runtime;

import org.observatory.runtime.actions.AcceptTradeAction;
import org.observatory.runtime.actions.Action;
import org.observatory.runtime.actions.ClaimAction;
import org.observatory.runtime.actions.CommunicateAction;
import org.observatory.runtime.actions.ForkAction;
import org.observatory.runtime.actions.MergeAction;
import org.observatory.runtime.actions.MoveAction;
import org.observatory.runtime.actions.RegisterAction;
import org.observatory.runtime.actions.TradeAction;
import org.observatory.runtime.events.EventPayloads;
import org.observatory.runtime.events.EventType;
import org.observatory.runtime.model.Agent;
import org.observatory.runtime.model.Region;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.TradeOffer;
import org.observatory.runtime.model.WorldState;
import org.observatory.runtime.validation.ActionCosts;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an accepted action into the event describing its effect.
 * <p>
 * The resolver only reads the state. It computes every quantity the event needs (costs, split
 * shares, transferred amounts) so that {@link EventApplier} can apply the event without pricing
 * anything itself. It must only be given actions the validator accepted against the same state.
 */
final class ActionResolver {

    record ResolvedEvent(EventType type, List<String> agentIds, Object payload) {
    }

    ResolvedEvent resolve(WorldState state, Action action) {
        return switch (action.type()) {
            case REGISTER -> register(state, (RegisterAction) action);
            case CLAIM -> {
                ClaimAction claim = (ClaimAction) action;
                yield new ResolvedEvent(EventType.AGENT_CLAIMED, List.of(claim.agentId()),
                    new EventPayloads.AgentClaimed(claim.agentId(), claim.claimReference()));
            }
            case MOVE -> move(state, (MoveAction) action);
            case TRADE -> trade(state, (TradeAction) action);
            case ACCEPT_TRADE -> acceptTrade(state, (AcceptTradeAction) action);
            case COMMUNICATE -> communicate(state, (CommunicateAction) action);
            case FORK -> fork(state, (ForkAction) action);
            case MERGE -> merge(state, (MergeAction) action);
            case DIE -> {
                Agent agent = state.requireAgent(action.agentId());
                yield new ResolvedEvent(EventType.AGENT_DIED, List.of(agent.getId()),
                    new EventPayloads.AgentDied(agent.getId(), agent.getRegionId(),
                        EventPayloads.AgentDied.CAUSE_VOLUNTARY, agent.getResources().snapshot()));
            }
            case OBSERVE -> observe(state, action);
        };
    }

    private ResolvedEvent register(WorldState state, RegisterAction action) {
        String regionId = action.regionId() != null ? action.regionId() : state.getRules().spawnRegion();
        return new ResolvedEvent(EventType.AGENT_REGISTERED, List.of(action.agentId()),
            new EventPayloads.AgentRegistered(action.agentId(), regionId, state.getRules().initialResources()));
    }

    private ResolvedEvent move(WorldState state, MoveAction action) {
        Agent agent = state.requireAgent(action.agentId());
        return new ResolvedEvent(EventType.AGENT_MOVED, List.of(agent.getId()),
            new EventPayloads.AgentMoved(agent.getId(), agent.getRegionId(), action.destinationRegionId(),
                ActionCosts.feeFor(state, action)));
    }

    private ResolvedEvent trade(WorldState state, TradeAction action) {
        Agent agent = state.requireAgent(action.agentId());
        if (action.counterpartId() == null) {
            return new ResolvedEvent(EventType.RESOURCES_TRADED, List.of(agent.getId()),
                new EventPayloads.ResourcesTraded(agent.getId(), agent.getRegionId(),
                    action.offerResource(), action.offerAmount(), action.requestResource(), action.requestAmount(),
                    ActionCosts.feeFor(state, action)));
        }
        long tick = state.getTick();
        TradeOffer offer = new TradeOffer(state.nextTradeOfferId(), agent.getId(), action.counterpartId(),
            action.offerResource(), action.offerAmount(), action.requestResource(), action.requestAmount(),
            tick, tick + state.getRules().tradeOfferWindow());
        return new ResolvedEvent(EventType.TRADE_OFFERED, List.of(agent.getId(), action.counterpartId()),
            new EventPayloads.TradeOffered(offer, ActionCosts.feeFor(state, action)));
    }

    private ResolvedEvent acceptTrade(WorldState state, AcceptTradeAction action) {
        TradeOffer offer = state.findTradeOffer(action.offerId())
            .orElseThrow(() -> new IllegalStateException("No open trade offer '" + action.offerId() + "'"));
        return new ResolvedEvent(EventType.TRADE_ACCEPTED, List.of(action.agentId(), offer.offererId()),
            new EventPayloads.TradeAccepted(offer.offerId(), action.agentId(), offer.offererId(),
                offer.offerResource(), offer.offerAmount(), offer.requestResource(), offer.requestAmount(),
                ActionCosts.feeFor(state, action)));
    }

    private ResolvedEvent communicate(WorldState state, CommunicateAction action) {
        Region from = state.requireRegion(state.requireAgent(action.agentId()).getRegionId());
        Region to = state.requireRegion(state.requireAgent(action.recipientId()).getRegionId());
        return new ResolvedEvent(EventType.MESSAGE_DELIVERED, List.of(action.agentId(), action.recipientId()),
            new EventPayloads.MessageDelivered(action.agentId(), action.recipientId(), action.content(),
                from.distanceTo(to), ActionCosts.feeFor(state, action)));
    }

    private ResolvedEvent fork(WorldState state, ForkAction action) {
        Agent parent = state.requireAgent(action.agentId());
        Map<ResourceType, Long> cost = ActionCosts.feeFor(state, action);
        Map<ResourceType, Long> first = new EnumMap<>(ResourceType.class);
        Map<ResourceType, Long> second = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            long remaining = parent.getResources().get(type) - cost.getOrDefault(type, 0L);
            long share = remaining * action.sharePercent() / 100;
            first.put(type, share);
            second.put(type, remaining - share);
        }
        return new ResolvedEvent(EventType.AGENT_FORKED,
            List.of(parent.getId(), action.firstChildId(), action.secondChildId()),
            new EventPayloads.AgentForked(parent.getId(), parent.getRegionId(), cost,
                action.firstChildId(), first, action.secondChildId(), second));
    }

    private ResolvedEvent merge(WorldState state, MergeAction action) {
        Agent absorbed = state.requireAgent(action.absorbedAgentId());
        return new ResolvedEvent(EventType.AGENTS_MERGED, List.of(action.agentId(), absorbed.getId()),
            new EventPayloads.AgentsMerged(action.agentId(), absorbed.getId(), ActionCosts.feeFor(state, action),
                absorbed.getResources().snapshot()));
    }

    private ResolvedEvent observe(WorldState state, Action action) {
        Agent agent = state.requireAgent(action.agentId());
        List<String> visible = state.agents().stream()
            .filter(other -> !other.isRetired())
            .filter(other -> other.getRegionId().equals(agent.getRegionId()))
            .map(Agent::getId)
            .filter(id -> !id.equals(agent.getId()))
            .toList();
        return new ResolvedEvent(EventType.REGION_OBSERVED, List.of(agent.getId()),
            new EventPayloads.RegionObserved(agent.getId(), agent.getRegionId(), visible, ActionCosts.feeFor(state, action)));
    }
}
