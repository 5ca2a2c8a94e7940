package org.observatory.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.observatory.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * The world never keeps a generator across ticks. Each tick derives a fresh provider from the
 * world seed and the tick number, so the randomness of tick {@code t} depends on nothing but
 * {@code (seed, t)} and replay can start at any snapshot without restoring generator state.
 * </p>
 * <p>
 * Derivation uses a stable SplitMix64/FNV-1a mixing scheme that does not depend on
 * {@link String#hashCode()} or the JVM.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    /**
     * Shortcut for the generator driving the physics of one tick.
     *
     * @param worldSeed the world seed
     * @param tick      the tick being processed
     * @return a provider that yields the same sequence for the same arguments
     */
    public static IRandomProvider forTick(long worldSeed, long tick) {
        return new SeededRandomProvider(worldSeed).deriveFor("tick", tick);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     * @param s The string to hash.
     * @return The hashed value.
     */
    static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    /**
     * A SplitMix64 mix function for good bit diffusion.
     * @param z The value to mix.
     * @return The mixed value.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
