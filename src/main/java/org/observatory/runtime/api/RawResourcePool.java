package org.observatory.runtime.api;

import org.observatory.runtime.model.ResourceType;

import java.util.Map;

/**
 * Immutable view of a region's resource pool.
 */
public record RawResourcePool(String regionId, Map<ResourceType, Long> amounts) {
    public RawResourcePool {
        amounts = amounts != null ? Map.copyOf(amounts) : Map.of();
    }

    public long amount(ResourceType type) {
        return amounts.getOrDefault(type, 0L);
    }
}
