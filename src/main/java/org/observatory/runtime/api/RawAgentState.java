package org.observatory.runtime.api;

import org.observatory.runtime.model.AgentStatus;
import org.observatory.runtime.model.ResourceType;

import java.util.Map;

/**
 * Immutable, serializable view of one agent.
 */
public record RawAgentState(
    String id,
    AgentStatus status,
    String regionId,
    Map<ResourceType, Long> resources,
    long creationTick,
    long lastActionTick,
    String claimReference,
    String parentId,
    Long retiredAtTick
) {
    public RawAgentState {
        resources = resources != null ? Map.copyOf(resources) : Map.of();
    }

    public long resource(ResourceType type) {
        return resources.getOrDefault(type, 0L);
    }
}
