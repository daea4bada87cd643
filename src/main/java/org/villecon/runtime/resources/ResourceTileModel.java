package org.villecon.runtime.resources;

import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainGrid;
import org.villecon.runtime.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depletion and recovery of tile resources.
 * <p>
 * Harvesting removes resources and restarts the recovery timer of the harvested resource.
 * Every {@link #advance(Tile, double)} call adds the elapsed time to the timers of resources
 * below their maximum; once a timer exceeds the recovery delay the resource regains
 * {@code recoveryRate * max * typeMultiplier} per call until it is full again.
 */
public class ResourceTileModel {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceTileModel.class);

    private final ResourceParameters parameters;
    private long currentTick;

    public ResourceTileModel(ResourceParameters parameters) {
        this.parameters = parameters;
    }

    public ResourceParameters getParameters() {
        return parameters;
    }

    /**
     * Sets the tick stamped onto tiles by harvests and interventions.
     * @param tick the current tick.
     */
    public void updateTick(long tick) {
        this.currentTick = tick;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * Removes up to {@code amount} of a resource from a tile.
     *
     * @param tile     the tile to harvest.
     * @param resource the resource to remove.
     * @param amount   the requested amount; non-positive or non-finite requests harvest nothing.
     * @return the amount actually removed, never more than the tile held.
     */
    public double harvest(Tile tile, ResourceType resource, double amount) {
        if (!Double.isFinite(amount) || amount <= 0) {
            return 0.0;
        }
        double available = tile.getResource(resource);
        double harvested = Math.min(amount, available);
        if (harvested <= 0) {
            return 0.0;
        }
        tile.setResource(resource, available - harvested);
        tile.setRecoveryTimer(resource, 0.0);
        tile.setLastHarvestTime(currentTick);
        return harvested;
    }

    /**
     * Advances the recovery of every resource of a tile.
     *
     * @param tile    the tile.
     * @param elapsed simulated time since the last call; non-positive values only re-check timers.
     */
    public void advance(Tile tile, double elapsed) {
        double step = Double.isFinite(elapsed) && elapsed > 0 ? elapsed : 0.0;
        for (ResourceType resource : ResourceType.values()) {
            double max = tile.getMaxResource(resource);
            if (max == 0.0) {
                continue;
            }
            double current = tile.getResource(resource);
            if (current >= max) {
                tile.setRecoveryTimer(resource, 0.0);
                continue;
            }
            double timer = tile.getRecoveryTimer(resource) + step;
            tile.setRecoveryTimer(resource, timer);
            if (timer <= parameters.getRecoveryDelay()) {
                continue;
            }
            double multiplier = parameters.getTypeMultiplier(tile.getType(), resource);
            double recovered = max * parameters.getRecoveryRate() * multiplier;
            if (recovered > 0) {
                tile.setResource(resource, current + recovered);
            }
        }
    }

    /**
     * Advances every tile of the grid.
     *
     * @param grid    the terrain.
     * @param elapsed simulated time since the last call.
     */
    public void advanceAll(TerrainGrid grid, double elapsed) {
        grid.forEachTile(tile -> advance(tile, elapsed));
    }

    /**
     * Sets a resource to an arbitrary value, clamped to {@code [0, max]}. Used by administrative
     * tooling rather than the regular simulation.
     *
     * @param tile     the tile.
     * @param resource the resource to set.
     * @param amount   the requested amount; non-finite values are treated as 0.
     */
    public void divineIntervention(Tile tile, ResourceType resource, double amount) {
        double applied = tile.setResource(resource, amount);
        tile.setRecoveryTimer(resource, 0.0);
        tile.setLastHarvestTime(currentTick);
        LOG.info("Divine intervention set {} on {} tile to {} (requested {})",
                resource.key(), tile.getType().key(), applied, amount);
    }

    /**
     * @param tile     the tile.
     * @param resource the resource.
     * @return {@code true} if the tile can hold the resource but currently holds none.
     */
    public boolean isDepleted(Tile tile, ResourceType resource) {
        return !tile.isBarren(resource) && tile.getResource(resource) == 0.0;
    }
}
