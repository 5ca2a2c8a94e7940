package org.observatory.runtime.model;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of a region as fixed at world creation.
 *
 * @param id                 Stable region identifier.
 * @param name               Display name.
 * @param x                  Planar x coordinate, used for distance-scaled costs.
 * @param y                  Planar y coordinate.
 * @param dangerProbability  Per-tick probability in [0, 1] that a resident agent takes damage.
 * @param resourceMultiplier Scale applied to per-tick regeneration of residents.
 * @param capacity           Maximum number of live agents in the region.
 * @param initialPool        Resources the region pool starts with.
 */
public record RegionDefinition(
    String id,
    String name,
    double x,
    double y,
    double dangerProbability,
    double resourceMultiplier,
    int capacity,
    Map<ResourceType, Long> initialPool
) {
    public RegionDefinition {
        Objects.requireNonNull(id, "Region id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Region id cannot be blank");
        }
        if (dangerProbability < 0.0 || dangerProbability > 1.0) {
            throw new IllegalArgumentException("Danger probability of region '" + id + "' must be in [0, 1]: " + dangerProbability);
        }
        if (resourceMultiplier < 0.0) {
            throw new IllegalArgumentException("Resource multiplier of region '" + id + "' must not be negative");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity of region '" + id + "' must not be negative");
        }
        name = name != null ? name : id;
        initialPool = initialPool != null ? Map.copyOf(initialPool) : Map.of();
    }

    public double distanceTo(RegionDefinition other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
