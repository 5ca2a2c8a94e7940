package org.observatory.runtime.api;

import org.observatory.runtime.model.TradeOffer;
import org.observatory.runtime.model.WorldRules;

import java.util.List;
import java.util.Optional;

/**
 * Immutable capture of the complete world at the end of a tick.
 * <p>
 * Snapshots are what every non-engine component reads: observers receive the last published one,
 * the snapshot store persists them, and replay returns one. Lists are ordered by identifier.
 *
 * @param tick          Tick the snapshot was taken at.
 * @param stateHash     SHA-256 of the canonical serialization of all other fields.
 * @param worldSeed     Seed all tick randomness derives from.
 * @param rules         World rules.
 * @param regions       All regions.
 * @param agents        All agents, retired ones included.
 * @param resourcePools Region pools.
 * @param tradeOffers   Open trade offers.
 * @param tradeOffersIssued Number of trade offers ever made; the next offer id derives from it.
 */
public record WorldSnapshot(
    long tick,
    String stateHash,
    long worldSeed,
    WorldRules rules,
    List<RawRegionState> regions,
    List<RawAgentState> agents,
    List<RawResourcePool> resourcePools,
    List<TradeOffer> tradeOffers,
    long tradeOffersIssued
) {
    public WorldSnapshot {
        regions = regions != null ? List.copyOf(regions) : List.of();
        agents = agents != null ? List.copyOf(agents) : List.of();
        resourcePools = resourcePools != null ? List.copyOf(resourcePools) : List.of();
        tradeOffers = tradeOffers != null ? List.copyOf(tradeOffers) : List.of();
    }

    public WorldSnapshot withStateHash(String hash) {
        return new WorldSnapshot(tick, hash, worldSeed, rules, regions, agents, resourcePools, tradeOffers, tradeOffersIssued);
    }

    public Optional<RawAgentState> agent(String agentId) {
        return agents.stream().filter(a -> a.id().equals(agentId)).findFirst();
    }

    public Optional<RawRegionState> region(String regionId) {
        return regions.stream().filter(r -> r.id().equals(regionId)).findFirst();
    }

    public Optional<RawResourcePool> pool(String regionId) {
        return resourcePools.stream().filter(p -> p.regionId().equals(regionId)).findFirst();
    }
}
