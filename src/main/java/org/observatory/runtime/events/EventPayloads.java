package org.observatory.runtime.events;

import org.observatory.runtime.model.RegionDefinition;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.TradeOffer;
import org.observatory.runtime.model.WorldRules;

import java.util.List;
import java.util.Map;

/**
 * Typed payloads for every {@link EventType}.
 * <p>
 * Each payload carries the resulting state delta in full (costs actually charged, quantities
 * actually moved), so applying an event never has to recompute a price.
 */
public final class EventPayloads {

    private EventPayloads() {
        // Namespace for payload records
    }

    public record WorldCreated(long seed, WorldRules rules, List<RegionDefinition> regions) {
    }

    public record AgentRegistered(String agentId, String regionId, Map<ResourceType, Long> resources) {
    }

    public record AgentClaimed(String agentId, String claimReference) {
    }

    public record AgentMoved(String agentId, String fromRegionId, String toRegionId, Map<ResourceType, Long> cost) {
    }

    /**
     * An immediate exchange with the pool of {@code regionId}.
     */
    public record ResourcesTraded(
        String agentId,
        String regionId,
        ResourceType offerResource,
        long offerAmount,
        ResourceType requestResource,
        long requestAmount,
        Map<ResourceType, Long> cost
    ) {
    }

    /**
     * @param cost Charged to the offerer when the offer is made.
     */
    public record TradeOffered(TradeOffer offer, Map<ResourceType, Long> cost) {
    }

    /**
     * @param cost Charged to the accepting agent.
     */
    public record TradeAccepted(
        String offerId,
        String accepterId,
        String offererId,
        ResourceType offerResource,
        long offerAmount,
        ResourceType requestResource,
        long requestAmount,
        Map<ResourceType, Long> cost
    ) {
    }

    public record MessageDelivered(String senderId, String recipientId, String content, double distance, Map<ResourceType, Long> cost) {
    }

    public record AgentForked(
        String parentId,
        String regionId,
        Map<ResourceType, Long> cost,
        String firstChildId,
        Map<ResourceType, Long> firstChildResources,
        String secondChildId,
        Map<ResourceType, Long> secondChildResources
    ) {
    }

    public record AgentsMerged(String survivorId, String absorbedId, Map<ResourceType, Long> cost, Map<ResourceType, Long> transferred) {
    }

    public record AgentDied(String agentId, String regionId, String cause, Map<ResourceType, Long> released) {
        public static final String CAUSE_VOLUNTARY = "voluntary";
        public static final String CAUSE_ENERGY_DEPLETION = "energy_depletion";
    }

    public record RegionObserved(String agentId, String regionId, List<String> visibleAgents, Map<ResourceType, Long> cost) {
    }

    /**
     * Terminates a tick batch.
     *
     * @param casualties         Agents that perished from tick physics.
     * @param expiredTradeOffers Offers dropped at the end of the tick.
     * @param stateHash          Hash of the world state after the tick, checked on replay.
     */
    public record TickCompleted(
        long actionsAccepted,
        long actionsRejected,
        List<String> casualties,
        List<String> expiredTradeOffers,
        String stateHash
    ) {
        public TickCompleted {
            casualties = casualties != null ? List.copyOf(casualties) : List.of();
            expiredTradeOffers = expiredTradeOffers != null ? List.copyOf(expiredTradeOffers) : List.of();
        }
    }
}
