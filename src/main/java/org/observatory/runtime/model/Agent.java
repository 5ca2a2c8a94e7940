package org.observatory.runtime.model;

import java.util.Objects;

/**
 * An autonomous agent living in exactly one region.
 * <p>
 * Agents are never removed from the world. Retiring an agent (death, fork, merge) only changes
 * its status and records the retirement tick; the record itself is kept forever.
 */
public final class Agent {

    private final String id;
    private AgentStatus status;
    private String regionId;
    private final ResourcePool resources;
    private final long creationTick;
    private long lastActionTick;
    private String claimReference;
    private final String parentId;
    private Long retiredAtTick;

    public Agent(String id, String regionId, ResourcePool resources, long creationTick, String parentId) {
        this(id, AgentStatus.PENDING, regionId, resources, creationTick, creationTick, null, parentId, null);
    }

    public Agent(String id, AgentStatus status, String regionId, ResourcePool resources, long creationTick,
                 long lastActionTick, String claimReference, String parentId, Long retiredAtTick) {
        this.id = Objects.requireNonNull(id, "Agent id cannot be null");
        this.status = Objects.requireNonNull(status, "Agent status cannot be null");
        this.regionId = Objects.requireNonNull(regionId, "Agent region cannot be null");
        this.resources = Objects.requireNonNull(resources, "Agent resources cannot be null");
        this.creationTick = creationTick;
        this.lastActionTick = lastActionTick;
        this.claimReference = claimReference;
        this.parentId = parentId;
        this.retiredAtTick = retiredAtTick;
    }

    public String getId() {
        return id;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public boolean isClaimed() {
        return status == AgentStatus.CLAIMED;
    }

    public boolean isRetired() {
        return status.isRetired();
    }

    /**
     * Moves the agent to the next lifecycle status.
     *
     * @param next the new status
     * @param tick the tick at which the transition happens
     * @throws IllegalStateException if the transition would move backwards or sideways
     */
    public void transitionTo(AgentStatus next, long tick) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition for agent '" + id + "': " + status + " -> " + next);
        }
        status = next;
        if (next.isRetired()) {
            retiredAtTick = tick;
        }
    }

    public String getRegionId() {
        return regionId;
    }

    public void relocate(String regionId) {
        this.regionId = Objects.requireNonNull(regionId);
    }

    public ResourcePool getResources() {
        return resources;
    }

    public long getCreationTick() {
        return creationTick;
    }

    public long getLastActionTick() {
        return lastActionTick;
    }

    public void markActed(long tick) {
        this.lastActionTick = tick;
    }

    public String getClaimReference() {
        return claimReference;
    }

    public void setClaimReference(String claimReference) {
        this.claimReference = claimReference;
    }

    public String getParentId() {
        return parentId;
    }

    public Long getRetiredAtTick() {
        return retiredAtTick;
    }

    public Agent copy() {
        return new Agent(id, status, regionId, resources.copy(), creationTick, lastActionTick,
            claimReference, parentId, retiredAtTick);
    }

    @Override
    public String toString() {
        return "Agent{" + id + ", " + status + ", region=" + regionId + ", resources=" + resources + "}";
    }
}
