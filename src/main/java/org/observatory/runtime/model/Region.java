package org.observatory.runtime.model;

/**
 * A region of the world: immutable definition plus the two mutable parts, occupancy and pool.
 */
public final class Region {

    private final RegionDefinition definition;
    private int occupancy;
    private final ResourcePool pool;

    public Region(RegionDefinition definition) {
        this(definition, 0, ResourcePool.of(definition.initialPool()));
    }

    public Region(RegionDefinition definition, int occupancy, ResourcePool pool) {
        this.definition = definition;
        this.occupancy = occupancy;
        this.pool = pool;
    }

    public String getId() {
        return definition.id();
    }

    public RegionDefinition getDefinition() {
        return definition;
    }

    public int getCapacity() {
        return definition.capacity();
    }

    public int getOccupancy() {
        return occupancy;
    }

    public boolean hasSpareCapacity(int additional) {
        return occupancy + additional <= definition.capacity();
    }

    public void admit() {
        if (!hasSpareCapacity(1)) {
            throw new IllegalStateException("Region '" + getId() + "' is full (" + occupancy + "/" + getCapacity() + ")");
        }
        occupancy++;
    }

    public void release() {
        if (occupancy == 0) {
            throw new IllegalStateException("Region '" + getId() + "' has no occupant to release");
        }
        occupancy--;
    }

    public ResourcePool getPool() {
        return pool;
    }

    public double distanceTo(Region other) {
        return definition.distanceTo(other.definition);
    }

    public Region copy() {
        return new Region(definition, occupancy, pool.copy());
    }
}
