package org.observatory.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable holder of whole resource units, owned either by an agent or by a region.
 * <p>
 * Every quantity is kept non-negative: {@link #withdraw(ResourceType, long)} refuses to go below
 * zero and throws instead, so a caller that skipped validation fails loudly rather than
 * corrupting state.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Only the tick thread mutates pools.
 */
public final class ResourcePool {

    private final EnumMap<ResourceType, Long> amounts = new EnumMap<>(ResourceType.class);

    public ResourcePool() {
        for (ResourceType type : ResourceType.values()) {
            amounts.put(type, 0L);
        }
    }

    /**
     * Creates a pool pre-filled with the given quantities; missing types start at zero.
     *
     * @param initial initial quantities, all non-negative
     * @return the new pool
     */
    public static ResourcePool of(Map<ResourceType, Long> initial) {
        ResourcePool pool = new ResourcePool();
        if (initial != null) {
            initial.forEach(pool::deposit);
        }
        return pool;
    }

    public long get(ResourceType type) {
        return amounts.get(type);
    }

    public void deposit(ResourceType type, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot deposit negative amount " + amount + " of " + type);
        }
        amounts.put(type, Math.addExact(amounts.get(type), amount));
    }

    public void withdraw(ResourceType type, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot withdraw negative amount " + amount + " of " + type);
        }
        long current = amounts.get(type);
        if (current < amount) {
            throw new IllegalStateException("Withdrawal of " + amount + " " + type + " exceeds balance " + current);
        }
        amounts.put(type, current - amount);
    }

    /**
     * Removes up to {@code amount} units, stopping at zero.
     *
     * @return the number of units actually removed
     */
    public long drain(ResourceType type, long amount) {
        long current = amounts.get(type);
        long removed = Math.min(current, Math.max(0, amount));
        amounts.put(type, current - removed);
        return removed;
    }

    public boolean covers(Map<ResourceType, Long> cost) {
        for (Map.Entry<ResourceType, Long> entry : cost.entrySet()) {
            if (get(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    public void withdrawAll(Map<ResourceType, Long> cost) {
        if (!covers(cost)) {
            throw new IllegalStateException("Pool " + amounts + " does not cover " + cost);
        }
        cost.forEach(this::withdraw);
    }

    public void depositAll(Map<ResourceType, Long> quantities) {
        quantities.forEach(this::deposit);
    }

    /**
     * Empties the pool.
     *
     * @return the quantities that were held before clearing
     */
    public Map<ResourceType, Long> clear() {
        Map<ResourceType, Long> released = snapshot();
        for (ResourceType type : ResourceType.values()) {
            amounts.put(type, 0L);
        }
        return released;
    }

    public Map<ResourceType, Long> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(amounts));
    }

    public ResourcePool copy() {
        return ResourcePool.of(amounts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourcePool)) return false;
        return amounts.equals(((ResourcePool) o).amounts);
    }

    @Override
    public int hashCode() {
        return amounts.hashCode();
    }

    @Override
    public String toString() {
        return amounts.toString();
    }
}
