package org.observatory.runtime.internal.services;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.observatory.runtime.api.RawAgentState;
import org.observatory.runtime.api.RawRegionState;
import org.observatory.runtime.api.RawResourcePool;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.model.Agent;
import org.observatory.runtime.model.Region;
import org.observatory.runtime.model.ResourcePool;
import org.observatory.runtime.model.WorldState;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Converts between the mutable world model, immutable snapshots and JSON.
 * <p>
 * All serialization in the system goes through the single canonical mapper built here:
 * properties sorted alphabetically, map entries sorted by key, nulls omitted and integers read
 * back as longs. The same logical state therefore always produces the same bytes, which is what
 * makes {@link #computeHash(WorldSnapshot)} usable for replay verification.
 */
public final class WorldCodec {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(DeserializationFeature.USE_LONG_FOR_INTS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    private WorldCodec() {
        // Utility class
    }

    /**
     * @return the shared canonical mapper; thread-safe once configured
     */
    public static ObjectMapper mapper() {
        return CANONICAL_MAPPER;
    }

    /**
     * Converts a payload record into its tree form. The value is serialized and parsed again so the
     * resulting tree is identical to what a reader of the persisted line would get.
     */
    public static JsonNode toPayload(Object payload) {
        try {
            return CANONICAL_MAPPER.readTree(CANONICAL_MAPPER.writeValueAsBytes(payload));
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Cannot serialize payload " + payload.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromPayload(JsonNode payload, Class<T> type) {
        try {
            return CANONICAL_MAPPER.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed " + type.getSimpleName() + " payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Captures the given state as an immutable snapshot including its content hash.
     */
    public static WorldSnapshot snapshot(WorldState state) {
        List<RawRegionState> regions = new ArrayList<>();
        List<RawResourcePool> pools = new ArrayList<>();
        for (Region region : state.regions()) {
            regions.add(new RawRegionState(region.getDefinition(), region.getOccupancy()));
            pools.add(new RawResourcePool(region.getId(), region.getPool().snapshot()));
        }
        List<RawAgentState> agents = new ArrayList<>();
        for (Agent agent : state.agents()) {
            agents.add(new RawAgentState(
                agent.getId(),
                agent.getStatus(),
                agent.getRegionId(),
                agent.getResources().snapshot(),
                agent.getCreationTick(),
                agent.getLastActionTick(),
                agent.getClaimReference(),
                agent.getParentId(),
                agent.getRetiredAtTick()));
        }
        WorldSnapshot unhashed = new WorldSnapshot(state.getTick(), null, state.getSeed(), state.getRules(), regions, agents, pools,
            new ArrayList<>(state.tradeOffers()), state.getTradeOffersIssued());
        return unhashed.withStateHash(computeHash(unhashed));
    }

    /**
     * Rebuilds a mutable state from a snapshot. Occupancy is taken from the snapshot as stored.
     */
    public static WorldState toState(WorldSnapshot snapshot) {
        WorldState state = new WorldState();
        state.restoreHeader(snapshot.tick(), snapshot.worldSeed(), snapshot.rules());
        for (RawRegionState raw : snapshot.regions()) {
            ResourcePool pool = snapshot.pool(raw.id())
                .map(p -> ResourcePool.of(p.amounts()))
                .orElseGet(ResourcePool::new);
            state.restoreRegion(new Region(raw.definition(), raw.occupancy(), pool));
        }
        for (RawAgentState raw : snapshot.agents()) {
            state.restoreAgent(new Agent(
                raw.id(),
                raw.status(),
                raw.regionId(),
                ResourcePool.of(raw.resources()),
                raw.creationTick(),
                raw.lastActionTick(),
                raw.claimReference(),
                raw.parentId(),
                raw.retiredAtTick()));
        }
        state.restoreTradeOffers(snapshot.tradeOffers(), snapshot.tradeOffersIssued());
        return state;
    }

    /**
     * Computes the SHA-256 content hash of a snapshot. The snapshot's own {@code stateHash} field
     * is excluded.
     *
     * @return lower-case hex digest
     */
    public static String computeHash(WorldSnapshot snapshot) {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsBytes(snapshot.withStateHash(null));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize snapshot of tick " + snapshot.tick(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * @return true if the snapshot's recorded hash matches its content
     */
    public static boolean hasValidHash(WorldSnapshot snapshot) {
        return snapshot.stateHash() != null && snapshot.stateHash().equals(computeHash(snapshot));
    }
}
