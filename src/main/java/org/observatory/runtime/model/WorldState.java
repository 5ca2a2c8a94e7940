package org.observatory.runtime.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The complete mutable state of one world: regions, agents and their pools, open trade offers,
 * plus the seed and rules fixed at creation.
 * <p>
 * Regions and agents are kept in sorted maps so that every iteration over them happens in
 * identifier order, which keeps tick physics and serialization deterministic.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. A state instance is owned by the tick thread;
 * other threads only ever see immutable snapshots derived from it.
 */
public final class WorldState {

    private long tick;
    private long seed;
    private WorldRules rules;
    private final NavigableMap<String, Region> regions = new TreeMap<>();
    private final NavigableMap<String, Agent> agents = new TreeMap<>();
    private final NavigableMap<String, TradeOffer> tradeOffers = new TreeMap<>();
    private long tradeOffersIssued;

    /**
     * Creates the empty pre-genesis state. A world only becomes usable once it has been
     * initialized with {@link #initialize(long, WorldRules, List)}.
     */
    public WorldState() {
        this.tick = 0;
    }

    public void initialize(long seed, WorldRules rules, List<RegionDefinition> definitions) {
        if (this.rules != null) {
            throw new IllegalStateException("World has already been created");
        }
        this.seed = seed;
        this.rules = rules;
        for (RegionDefinition definition : definitions) {
            if (regions.put(definition.id(), new Region(definition)) != null) {
                throw new IllegalArgumentException("Duplicate region id '" + definition.id() + "'");
            }
        }
    }

    public boolean isInitialized() {
        return rules != null;
    }

    public long getTick() {
        return tick;
    }

    public void advanceTo(long tick) {
        if (tick < this.tick) {
            throw new IllegalStateException("World cannot move back from tick " + this.tick + " to " + tick);
        }
        this.tick = tick;
    }

    public long getSeed() {
        return seed;
    }

    public WorldRules getRules() {
        return rules;
    }

    public Optional<Region> findRegion(String regionId) {
        return regionId == null ? Optional.empty() : Optional.ofNullable(regions.get(regionId));
    }

    public Region requireRegion(String regionId) {
        return findRegion(regionId)
            .orElseThrow(() -> new IllegalStateException("Unknown region '" + regionId + "'"));
    }

    public Collection<Region> regions() {
        return Collections.unmodifiableCollection(regions.values());
    }

    public Optional<Agent> findAgent(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public Agent requireAgent(String agentId) {
        return findAgent(agentId)
            .orElseThrow(() -> new IllegalStateException("Unknown agent '" + agentId + "'"));
    }

    public Collection<Agent> agents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    /**
     * Adds a new agent and counts it against its region's capacity.
     */
    public void addAgent(Agent agent) {
        if (agents.containsKey(agent.getId())) {
            throw new IllegalStateException("Agent '" + agent.getId() + "' already exists");
        }
        requireRegion(agent.getRegionId()).admit();
        agents.put(agent.getId(), agent);
    }

    /**
     * Restores an agent record verbatim, without touching occupancy. Used when rebuilding state
     * from a snapshot that already carries occupancy counts.
     */
    public void restoreAgent(Agent agent) {
        agents.put(agent.getId(), agent);
    }

    public void restoreRegion(Region region) {
        regions.put(region.getId(), region);
    }

    public void restoreHeader(long tick, long seed, WorldRules rules) {
        this.tick = tick;
        this.seed = seed;
        this.rules = rules;
    }

    /**
     * @return the identifier the next opened trade offer receives
     */
    public String nextTradeOfferId() {
        return TradeOffer.idFor(tradeOffersIssued);
    }

    public long getTradeOffersIssued() {
        return tradeOffersIssued;
    }

    /**
     * Registers a new open offer. Offer identifiers are issued strictly in sequence.
     */
    public void openTradeOffer(TradeOffer offer) {
        if (!offer.offerId().equals(nextTradeOfferId())) {
            throw new IllegalStateException("Trade offer '" + offer.offerId() + "' is out of sequence, expected '"
                + nextTradeOfferId() + "'");
        }
        tradeOffers.put(offer.offerId(), offer);
        tradeOffersIssued++;
    }

    public Optional<TradeOffer> findTradeOffer(String offerId) {
        return offerId == null ? Optional.empty() : Optional.ofNullable(tradeOffers.get(offerId));
    }

    public TradeOffer removeTradeOffer(String offerId) {
        TradeOffer removed = tradeOffers.remove(offerId);
        if (removed == null) {
            throw new IllegalStateException("No open trade offer '" + offerId + "'");
        }
        return removed;
    }

    public Collection<TradeOffer> tradeOffers() {
        return Collections.unmodifiableCollection(tradeOffers.values());
    }

    /**
     * Drops every offer whose acceptance window ends with {@code tick} and every offer naming an
     * agent that is no longer CLAIMED.
     *
     * @return identifiers of the dropped offers, in identifier order
     */
    public List<String> expireTradeOffers(long tick) {
        List<String> expired = new ArrayList<>();
        for (TradeOffer offer : tradeOffers.values()) {
            if (offer.expiresAtTick() <= tick || !isClaimed(offer.offererId()) || !isClaimed(offer.recipientId())) {
                expired.add(offer.offerId());
            }
        }
        expired.forEach(tradeOffers::remove);
        return expired;
    }

    private boolean isClaimed(String agentId) {
        Agent agent = agents.get(agentId);
        return agent != null && agent.isClaimed();
    }

    public void restoreTradeOffers(Collection<TradeOffer> offers, long issued) {
        tradeOffers.clear();
        offers.forEach(offer -> tradeOffers.put(offer.offerId(), offer));
        tradeOffersIssued = issued;
    }

    /**
     * Retires an agent as DEAD and hands everything it held to its region's pool.
     *
     * @return the released quantities
     */
    public Map<ResourceType, Long> killAgent(Agent agent, long tick) {
        agent.transitionTo(AgentStatus.DEAD, tick);
        Region region = requireRegion(agent.getRegionId());
        region.release();
        Map<ResourceType, Long> released = agent.getResources().clear();
        region.getPool().depositAll(released);
        return released;
    }

    /**
     * Checks the structural invariants: non-negative quantities everywhere, occupancy within
     * capacity and equal to the number of live agents in each region.
     *
     * @return human-readable violations, empty when the state is consistent
     */
    public List<String> findInvariantViolations() {
        List<String> violations = new ArrayList<>();
        Map<String, Integer> live = new TreeMap<>();
        for (Agent agent : agents.values()) {
            for (ResourceType type : ResourceType.values()) {
                if (agent.getResources().get(type) < 0) {
                    violations.add("Agent '" + agent.getId() + "' holds negative " + type);
                }
            }
            if (!agent.isRetired()) {
                live.merge(agent.getRegionId(), 1, Integer::sum);
            }
        }
        for (Region region : regions.values()) {
            if (region.getOccupancy() > region.getCapacity()) {
                violations.add("Region '" + region.getId() + "' occupancy " + region.getOccupancy()
                    + " exceeds capacity " + region.getCapacity());
            }
            int expected = live.getOrDefault(region.getId(), 0);
            if (region.getOccupancy() != expected) {
                violations.add("Region '" + region.getId() + "' occupancy " + region.getOccupancy()
                    + " does not match " + expected + " live agents");
            }
            for (ResourceType type : ResourceType.values()) {
                if (region.getPool().get(type) < 0) {
                    violations.add("Region '" + region.getId() + "' pool holds negative " + type);
                }
            }
        }
        return violations;
    }

    /**
     * Deep copy used as the working state of a tick. Rules and region definitions are immutable
     * and shared.
     */
    public WorldState copy() {
        WorldState copy = new WorldState();
        copy.tick = tick;
        copy.seed = seed;
        copy.rules = rules;
        regions.forEach((id, region) -> copy.regions.put(id, region.copy()));
        agents.forEach((id, agent) -> copy.agents.put(id, agent.copy()));
        copy.tradeOffers.putAll(tradeOffers);
        copy.tradeOffersIssued = tradeOffersIssued;
        return copy;
    }
}
