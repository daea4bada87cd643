package org.villecon.runtime.spi;

import org.villecon.runtime.EconomySimulation;

/**
 * Interface for plugins that execute once per simulation tick.
 * <p>
 * Tick plugins run at the beginning of each tick, before any village is processed. They have
 * full read-write access to the simulation, including the terrain grid, all villages, the
 * current {@link org.villecon.runtime.GameTime} and the random provider.
 * </p>
 * <p>
 * Plugins are executed sequentially in their configured order.
 * </p>
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}
 * </p>
 */
public interface ITickPlugin {

    /**
     * Executes the plugin logic for the current tick.
     *
     * @param simulation the simulation providing access to terrain and villages.
     */
    void execute(EconomySimulation simulation);
}
