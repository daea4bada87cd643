package org.villecon.runtime;

/**
 * The time quantum handed to every per-tick operation.
 *
 * @param currentTick the tick being processed.
 * @param deltaTime   elapsed simulated time since the previous tick, non-negative.
 */
public record GameTime(long currentTick, double deltaTime) {

    public GameTime {
        if (!Double.isFinite(deltaTime) || deltaTime < 0) {
            throw new IllegalArgumentException("deltaTime must be finite and non-negative, got " + deltaTime);
        }
    }

    /**
     * Returns the time of the next tick using the same delta.
     * @return the advanced game time.
     */
    public GameTime next() {
        return new GameTime(currentTick + 1, deltaTime);
    }
}
