package org.observatory.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
class ResourcePoolTest {

    @Test
    void missingTypesStartAtZero() {
        ResourcePool pool = ResourcePool.of(Map.of(ResourceType.ENERGY, 10L));

        assertEquals(10L, pool.get(ResourceType.ENERGY));
        assertEquals(0L, pool.get(ResourceType.COMPUTE));
    }

    @Test
    void withdrawRefusesToOverdraw() {
        ResourcePool pool = ResourcePool.of(Map.of(ResourceType.ENERGY, 5L));

        assertThrows(IllegalStateException.class, () -> pool.withdraw(ResourceType.ENERGY, 10L));
        assertEquals(5L, pool.get(ResourceType.ENERGY));
    }

    @Test
    void withdrawAllIsAllOrNothing() {
        ResourcePool pool = ResourcePool.of(Map.of(ResourceType.ENERGY, 50L, ResourceType.MEMORY, 10L));

        assertThrows(IllegalStateException.class,
            () -> pool.withdrawAll(Map.of(ResourceType.ENERGY, 40L, ResourceType.MEMORY, 20L)));

        assertEquals(50L, pool.get(ResourceType.ENERGY));
        assertEquals(10L, pool.get(ResourceType.MEMORY));
    }

    @Test
    void negativeAmountsAreRejected() {
        ResourcePool pool = new ResourcePool();

        assertThrows(IllegalArgumentException.class, () -> pool.deposit(ResourceType.ENERGY, -1L));
        assertThrows(IllegalArgumentException.class, () -> pool.withdraw(ResourceType.ENERGY, -1L));
        assertThrows(IllegalArgumentException.class, () -> ResourcePool.of(Map.of(ResourceType.ENERGY, -3L)));
    }

    @Test
    void drainStopsAtZero() {
        ResourcePool pool = ResourcePool.of(Map.of(ResourceType.ENERGY, 3L));

        long removed = pool.drain(ResourceType.ENERGY, 10L);

        assertEquals(3L, removed);
        assertEquals(0L, pool.get(ResourceType.ENERGY));
    }

    @Test
    void clearReturnsWhatWasHeld() {
        ResourcePool pool = ResourcePool.of(Map.of(ResourceType.ENERGY, 7L, ResourceType.BANDWIDTH, 2L));

        Map<ResourceType, Long> released = pool.clear();

        assertThat(released).containsEntry(ResourceType.ENERGY, 7L).containsEntry(ResourceType.BANDWIDTH, 2L);
        assertThat(pool.snapshot().values()).containsOnly(0L);
    }

    @Test
    void copyIsIndependent() {
        ResourcePool pool = ResourcePool.of(Map.of(ResourceType.ENERGY, 7L));
        ResourcePool copy = pool.copy();

        copy.withdraw(ResourceType.ENERGY, 7L);

        assertEquals(7L, pool.get(ResourceType.ENERGY));
        assertThat(copy).isNotEqualTo(pool);
    }
}
