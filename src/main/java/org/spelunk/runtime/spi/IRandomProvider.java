package org.spelunk.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a single level generation.
 * Implementations must be pure with respect to the seed they were created from and
 * support derivation of child providers for independent sub-streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider's seed and the given scope/key.
     * Use this to give each pipeline stage its own stream.
     *
     * @param scope a stable, descriptive scope name (e.g., "stage")
     * @param key a stable numeric key (e.g., the stage ordinal)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);

}
