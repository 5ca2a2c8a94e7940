package org.observatory.runtime.spi;

/**
 * Provides deterministic randomness scoped to a world.
 * Implementations must be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., per tick or per region).
     *
     * @param scope a stable, descriptive scope name (e.g., "tick", "danger")
     * @param key a stable numeric key (e.g., tick number)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
