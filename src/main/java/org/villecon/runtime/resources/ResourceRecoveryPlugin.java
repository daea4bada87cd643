package org.villecon.runtime.resources;

import org.villecon.runtime.EconomySimulation;
import org.villecon.runtime.GameTime;
import org.villecon.runtime.spi.IRandomProvider;
import org.villecon.runtime.spi.ITickPlugin;

import com.typesafe.config.Config;

/**
 * A tick plugin that advances resource recovery on every tile of the terrain.
 * <ul>
 *   <li><b>interval:</b> number of ticks between recovery passes (default 1). The elapsed time
 *   handed to the tile model covers all ticks since the previous pass.</li>
 * </ul>
 */
public class ResourceRecoveryPlugin implements ITickPlugin {

    private final int interval;
    private double pendingTime = 0.0;
    private int ticksSinceLastPass = 0;

    /**
     * Creates the plugin from its options.
     *
     * @param randomProvider unused; recovery is deterministic.
     * @param options the plugin options, {@code interval} is optional.
     */
    public ResourceRecoveryPlugin(IRandomProvider randomProvider, Config options) {
        this.interval = options.hasPath("interval") ? options.getInt("interval") : 1;
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be at least 1, got " + interval);
        }
    }

    @Override
    public void execute(EconomySimulation simulation) {
        GameTime time = simulation.getGameTime();
        pendingTime += time.deltaTime();
        ticksSinceLastPass++;
        if (ticksSinceLastPass < interval) {
            return;
        }
        ResourceTileModel model = simulation.getTileModel();
        model.updateTick(time.currentTick());
        model.advanceAll(simulation.getTerrain(), pendingTime);
        pendingTime = 0.0;
        ticksSinceLastPass = 0;
    }

    public int getInterval() {
        return interval;
    }
}
