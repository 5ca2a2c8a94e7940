package org.observatory.runtime.internal.services;

import org.observatory.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void sameSeedAndTickYieldSameStream() {
        IRandomProvider a = SeededRandomProvider.forTick(42L, 17L);
        IRandomProvider b = SeededRandomProvider.forTick(42L, 17L);

        for (int i = 0; i < 100; i++) {
            assertEquals(a.nextDouble(), b.nextDouble());
        }
    }

    @Test
    void ticksAndSeedsGetIndependentStreams() {
        double base = SeededRandomProvider.forTick(42L, 17L).nextDouble();

        assertNotEquals(base, SeededRandomProvider.forTick(42L, 18L).nextDouble());
        assertNotEquals(base, SeededRandomProvider.forTick(43L, 17L).nextDouble());
    }

    @Test
    void derivationDependsOnScope() {
        SeededRandomProvider root = new SeededRandomProvider(42L);

        assertNotEquals(root.deriveFor("tick", 1).nextDouble(), root.deriveFor("danger", 1).nextDouble());
        assertEquals(root.deriveFor("tick", 1).nextDouble(), SeededRandomProvider.forTick(42L, 1).nextDouble());
    }

    @Test
    void valuesStayInRange() {
        IRandomProvider rng = SeededRandomProvider.forTick(1L, 1L);
        for (int i = 0; i < 1000; i++) {
            double d = rng.nextDouble();
            assertTrue(d >= 0.0 && d < 1.0);
        }
    }

    @Test
    void stringHashIsStable() {
        // FNV-1a 64 of the empty string is the offset basis
        assertEquals(1469598103934665603L, SeededRandomProvider.hashString(""));
        assertEquals(SeededRandomProvider.hashString("tick"), SeededRandomProvider.hashString("tick"));
        assertEquals(0L, SeededRandomProvider.hashString(null));
    }
}
