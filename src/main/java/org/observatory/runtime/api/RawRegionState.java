package org.observatory.runtime.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.observatory.runtime.model.RegionDefinition;

/**
 * Immutable, serializable view of one region, including its current occupancy.
 */
public record RawRegionState(RegionDefinition definition, int occupancy) {

    @JsonIgnore
    public String id() {
        return definition.id();
    }
}
