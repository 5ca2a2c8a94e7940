package org.observatory.runtime.model;

import org.observatory.runtime.actions.ActionType;

import java.util.EnumMap;
import java.util.Map;

/**
 * The physical and economic constants of a world.
 * <p>
 * Rules are fixed at world creation and recorded in the genesis ledger event, so replay never
 * depends on the configuration present at replay time.
 *
 * @param actionCosts        Base cost per action type. Missing types are free.
 * @param distanceCostFactor Extra cost fraction per unit of distance for MOVE and COMMUNICATE.
 * @param initialResources   Resources a newly registered agent starts with.
 * @param resourceCaps       Ceiling for passive regeneration. Missing types are uncapped.
 * @param regenerationRates  Per-tick regeneration before the region multiplier is applied.
 * @param upkeep             Per-tick decay charged to every claimed agent.
 * @param dangerDamage       Energy lost when a danger roll hits.
 * @param spawnRegion        Region used by registrations that do not name one.
 * @param tradeOfferWindow   Ticks after its creation tick during which a trade offer between agents can be accepted.
 */
public record WorldRules(
    Map<ActionType, Map<ResourceType, Long>> actionCosts,
    double distanceCostFactor,
    Map<ResourceType, Long> initialResources,
    Map<ResourceType, Long> resourceCaps,
    Map<ResourceType, Double> regenerationRates,
    Map<ResourceType, Long> upkeep,
    long dangerDamage,
    String spawnRegion,
    long tradeOfferWindow
) {
    public WorldRules {
        Map<ActionType, Map<ResourceType, Long>> costs = new EnumMap<>(ActionType.class);
        if (actionCosts != null) {
            actionCosts.forEach((type, cost) -> costs.put(type, Map.copyOf(requireNonNegative(cost, "cost of " + type))));
        }
        actionCosts = Map.copyOf(costs);
        if (distanceCostFactor < 0.0) {
            throw new IllegalArgumentException("distanceCostFactor must not be negative");
        }
        initialResources = Map.copyOf(requireNonNegative(initialResources, "initialResources"));
        resourceCaps = Map.copyOf(requireNonNegative(resourceCaps, "resourceCaps"));
        regenerationRates = regenerationRates != null ? Map.copyOf(regenerationRates) : Map.of();
        upkeep = Map.copyOf(requireNonNegative(upkeep, "upkeep"));
        if (dangerDamage < 0) {
            throw new IllegalArgumentException("dangerDamage must not be negative");
        }
        if (tradeOfferWindow < 0) {
            throw new IllegalArgumentException("tradeOfferWindow must not be negative");
        }
    }

    private static Map<ResourceType, Long> requireNonNegative(Map<ResourceType, Long> values, String what) {
        if (values == null) {
            return Map.of();
        }
        values.forEach((type, amount) -> {
            if (amount == null || amount < 0) {
                throw new IllegalArgumentException(what + " for " + type + " must not be negative");
            }
        });
        return values;
    }

    /**
     * Returns the undiscounted base cost of an action type.
     */
    public Map<ResourceType, Long> baseCost(ActionType type) {
        return actionCosts.getOrDefault(type, Map.of());
    }

    /**
     * Returns the cost of an action whose price grows with distance: every base quantity is
     * multiplied by {@code 1 + distance * distanceCostFactor} and rounded up.
     */
    public Map<ResourceType, Long> distanceCost(ActionType type, double distance) {
        double scale = 1.0 + distance * distanceCostFactor;
        Map<ResourceType, Long> scaled = new EnumMap<>(ResourceType.class);
        baseCost(type).forEach((resource, amount) -> scaled.put(resource, (long) Math.ceil(amount * scale)));
        return scaled;
    }

    public long capOf(ResourceType type) {
        return resourceCaps.getOrDefault(type, Long.MAX_VALUE);
    }

    /**
     * Rules matching the reference world: moderate movement costs, expensive forks, energy regenerating
     * fastest.
     */
    public static WorldRules defaults() {
        Map<ActionType, Map<ResourceType, Long>> costs = new EnumMap<>(ActionType.class);
        costs.put(ActionType.MOVE, Map.of(ResourceType.ENERGY, 5L));
        costs.put(ActionType.COMMUNICATE, Map.of(ResourceType.BANDWIDTH, 5L, ResourceType.ENERGY, 1L));
        costs.put(ActionType.OBSERVE, Map.of(ResourceType.ENERGY, 1L));
        costs.put(ActionType.FORK, Map.of(ResourceType.ENERGY, 40L, ResourceType.MEMORY, 50L, ResourceType.COMPUTE, 30L));
        costs.put(ActionType.MERGE, Map.of(ResourceType.ENERGY, 20L, ResourceType.COMPUTE, 20L));
        return new WorldRules(
            costs,
            0.5,
            Map.of(ResourceType.ENERGY, 50L, ResourceType.BANDWIDTH, 25L, ResourceType.MEMORY, 100L, ResourceType.COMPUTE, 40L),
            Map.of(ResourceType.ENERGY, 100L, ResourceType.BANDWIDTH, 50L, ResourceType.MEMORY, 200L, ResourceType.COMPUTE, 80L),
            Map.of(ResourceType.ENERGY, 2.0, ResourceType.BANDWIDTH, 1.0, ResourceType.MEMORY, 0.0, ResourceType.COMPUTE, 1.5),
            Map.of(ResourceType.ENERGY, 1L),
            10L,
            "nexus",
            10L);
    }
}
