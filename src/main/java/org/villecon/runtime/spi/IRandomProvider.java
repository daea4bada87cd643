package org.villecon.runtime.spi;

/**
 * Source of randomness for the simulation.
 * <p>
 * All probabilistic decisions draw from an injected provider so that runs are replayable
 * from a seed and tests can script the outcome of every draw.
 */
public interface IRandomProvider {

    /**
     * @return a uniformly distributed value in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * Derives an independent, deterministic provider for a named consumer.
     *
     * @param context name of the consumer, e.g. a plugin or village id.
     * @param salt    additional discriminator.
     * @return the derived provider.
     */
    IRandomProvider deriveFor(String context, long salt);
}
