package org.observatory.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.observatory.runtime.actions.ActionType;
import org.observatory.runtime.model.RegionDefinition;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.WorldRules;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Genesis parameters read from the {@code observatory.world} section.
 * <p>
 * Only consulted when a world is created. An existing world always continues with the seed,
 * rules and regions recorded in its ledger.
 *
 * @param seed    World seed.
 * @param rules   World rules.
 * @param regions Region definitions in configuration order.
 */
public record WorldConfiguration(long seed, WorldRules rules, List<RegionDefinition> regions) {

    public WorldConfiguration {
        regions = List.copyOf(regions);
        Set<String> ids = new HashSet<>();
        for (RegionDefinition region : regions) {
            if (!ids.add(region.id())) {
                throw new IllegalArgumentException("Duplicate region id '" + region.id() + "'");
            }
        }
        if (!ids.contains(rules.spawnRegion())) {
            throw new IllegalArgumentException("Spawn region '" + rules.spawnRegion() + "' is not among the configured regions " + ids);
        }
    }

    /**
     * @param world the {@code observatory.world} subtree
     * @throws IllegalArgumentException if the section is incomplete or inconsistent
     */
    public static WorldConfiguration fromConfig(Config world) {
        try {
            long seed = world.getLong("seed");
            WorldRules rules = parseRules(world.hasPath("rules") ? world.getConfig("rules") : null,
                world.hasPath("spawnRegion") ? world.getString("spawnRegion") : WorldRules.defaults().spawnRegion());
            List<RegionDefinition> regions = new ArrayList<>();
            for (Config region : world.getConfigList("regions")) {
                regions.add(parseRegion(region));
            }
            return new WorldConfiguration(seed, rules, regions);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid world configuration: " + e.getMessage(), e);
        }
    }

    private static RegionDefinition parseRegion(Config region) {
        return new RegionDefinition(
            region.getString("id"),
            region.hasPath("name") ? region.getString("name") : null,
            region.getDouble("x"),
            region.getDouble("y"),
            region.getDouble("dangerProbability"),
            region.getDouble("resourceMultiplier"),
            region.getInt("capacity"),
            region.hasPath("initialPool") ? longAmounts(region.getConfig("initialPool")) : Map.of());
    }

    private static WorldRules parseRules(Config rules, String spawnRegion) {
        WorldRules defaults = WorldRules.defaults();
        if (rules == null) {
            return withSpawnRegion(defaults, spawnRegion);
        }
        Map<ActionType, Map<ResourceType, Long>> costs = defaults.actionCosts();
        if (rules.hasPath("actionCosts")) {
            Config costConfig = rules.getConfig("actionCosts");
            costs = new EnumMap<>(ActionType.class);
            for (String key : costConfig.root().keySet()) {
                costs.put(ActionType.valueOf(key.toUpperCase(Locale.ROOT)), longAmounts(costConfig.getConfig(key)));
            }
        }
        return new WorldRules(
            costs,
            rules.hasPath("distanceCostFactor") ? rules.getDouble("distanceCostFactor") : defaults.distanceCostFactor(),
            rules.hasPath("initialResources") ? longAmounts(rules.getConfig("initialResources")) : defaults.initialResources(),
            rules.hasPath("resourceCaps") ? longAmounts(rules.getConfig("resourceCaps")) : defaults.resourceCaps(),
            rules.hasPath("regenerationRates") ? doubleAmounts(rules.getConfig("regenerationRates")) : defaults.regenerationRates(),
            rules.hasPath("upkeep") ? longAmounts(rules.getConfig("upkeep")) : defaults.upkeep(),
            rules.hasPath("dangerDamage") ? rules.getLong("dangerDamage") : defaults.dangerDamage(),
            spawnRegion,
            rules.hasPath("tradeOfferWindow") ? rules.getLong("tradeOfferWindow") : defaults.tradeOfferWindow());
    }

    private static WorldRules withSpawnRegion(WorldRules rules, String spawnRegion) {
        return new WorldRules(rules.actionCosts(), rules.distanceCostFactor(), rules.initialResources(),
            rules.resourceCaps(), rules.regenerationRates(), rules.upkeep(), rules.dangerDamage(), spawnRegion,
            rules.tradeOfferWindow());
    }

    private static Map<ResourceType, Long> longAmounts(Config amounts) {
        Map<ResourceType, Long> result = new EnumMap<>(ResourceType.class);
        for (String key : amounts.root().keySet()) {
            result.put(resourceType(key), amounts.getLong(key));
        }
        return result;
    }

    private static Map<ResourceType, Double> doubleAmounts(Config amounts) {
        Map<ResourceType, Double> result = new EnumMap<>(ResourceType.class);
        for (String key : amounts.root().keySet()) {
            result.put(resourceType(key), amounts.getDouble(key));
        }
        return result;
    }

    private static ResourceType resourceType(String key) {
        try {
            return ResourceType.valueOf(key.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resource type '" + key + "'", e);
        }
    }
}
