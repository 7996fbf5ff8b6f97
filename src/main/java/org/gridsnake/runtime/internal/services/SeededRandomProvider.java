package org.gridsnake.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.gridsnake.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;

/**
 * {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Derived seeds mix the parent seed with an FNV-1a hash of the scope and the key through the
 * SplitMix64 finalizer, so food placement stays reproducible for a given configured seed.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final long seed;
    private final Well19937c rng;

    /**
     * @param seed the seed of the generator
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return rng.nextInt(bound);
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long derived = mix64(seed);
        derived = mix64(derived ^ mix64(fnv1a(scope)));
        derived = mix64(derived ^ mix64(key));
        return new SeededRandomProvider(derived);
    }

    public long getSeed() {
        return seed;
    }

    private static long fnv1a(String text) {
        if (text == null) {
            return 0L;
        }
        long hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
