package org.spelunk.runtime.internal.services;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.spelunk.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Level seeds are arbitrary strings. They are hashed with FNV-1a (64 bit) and diffused with the
 * SplitMix64 finalizer, so the same seed string always produces the same level.
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
     * Creates a provider from a textual level seed.
     * @param seed The level seed, must not be null.
     * @return A provider whose stream depends only on the seed text.
     */
    public static SeededRandomProvider fromSeed(String seed) {
        if (seed == null) {
            throw new IllegalArgumentException("seed must not be null");
        }
        return new SeededRandomProvider(mix64(hashString(seed)));
    }

    /**
     * @return The numeric seed this provider was created with.
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        return new RandomAdaptor(rng);
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

    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
