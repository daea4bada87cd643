package org.villecon.runtime.spi;

import java.util.Random;

/**
 * {@link IRandomProvider} backed by a seeded {@link Random}.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long derived = seed * 31L + (context == null ? 0 : context.hashCode());
        derived = derived * 31L + salt;
        return new SeededRandomProvider(derived);
    }
}
