package org.villecon.runtime.resources;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.villecon.runtime.Config;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainGrid;
import org.villecon.runtime.model.Tile;
import org.villecon.runtime.model.Village;

/**
 * Collects resources from the tiles inside a village's collection radius into its storage.
 * <p>
 * The harvest per tile shrinks as the surrounding terrain depletes: above 80% of the total
 * capacity the village harvests at full efficiency, below 30% at the minimum of 0.1, and
 * linearly in between. Resources are harvested in order of availability; each further
 * resource gets 25% less than the previous one. Storage never exceeds the stock capacity.
 */
public class VillageHarvester {

    private final ResourceTileModel tileModel;

    public VillageHarvester(ResourceTileModel tileModel) {
        this.tileModel = tileModel;
    }

    /**
     * Computes the harvest efficiency from the ratio of available to maximum resources.
     *
     * @param available total current resources in range.
     * @param capacity  total maximum resources in range.
     * @return an efficiency in {@code [0.1, 1.0]}.
     */
    public static double efficiency(double available, double capacity) {
        if (!(capacity > 0)) {
            return 1.0;
        }
        double ratio = available / capacity;
        if (ratio >= Config.HARVEST_FULL_EFFICIENCY_RATIO) {
            return 1.0;
        }
        if (ratio <= Config.HARVEST_MIN_EFFICIENCY_RATIO) {
            return Config.HARVEST_MIN_EFFICIENCY;
        }
        return Config.HARVEST_MIN_EFFICIENCY
                + (ratio - Config.HARVEST_MIN_EFFICIENCY_RATIO)
                / (Config.HARVEST_FULL_EFFICIENCY_RATIO - Config.HARVEST_MIN_EFFICIENCY_RATIO)
                * (1.0 - Config.HARVEST_MIN_EFFICIENCY);
    }

    /**
     * Orders resources by availability, most abundant first. Ties keep declaration order.
     *
     * @param available the per-resource availability.
     * @return the resources in harvest priority.
     */
    public static List<ResourceType> prioritize(ResourceAmounts available) {
        return Arrays.stream(ResourceType.values())
                .sorted(Comparator.comparingDouble((ResourceType r) -> available.get(r)).reversed())
                .toList();
    }

    /**
     * Harvests the tiles around a village into its storage.
     *
     * @param village the harvesting village.
     * @param terrain the terrain grid.
     * @return the amounts collected per resource.
     */
    public ResourceAmounts harvest(Village village, TerrainGrid terrain) {
        int radius = village.getCollectionRadius();
        ResourceAmounts available = terrain.availableInRadius(village.getX(), village.getY(), radius);
        ResourceAmounts capacity = terrain.capacityInRadius(village.getX(), village.getY(), radius);
        double efficiency = efficiency(available.total(), capacity.total());
        List<ResourceType> priority = prioritize(available);
        double stockCapacity = village.getEconomy().getStockCapacity();

        ResourceAmounts collected = new ResourceAmounts();
        for (Tile tile : terrain.tilesInRadius(village.getX(), village.getY(), radius)) {
            for (int i = 0; i < priority.size(); i++) {
                ResourceType resource = priority.get(i);
                if (tile.getResource(resource) <= 0) {
                    continue;
                }
                double free = stockCapacity - village.getStored(resource);
                if (free <= 0) {
                    continue;
                }
                double request = Math.max(Config.HARVEST_MIN_AMOUNT,
                        Config.HARVEST_BASE_AMOUNT * efficiency * (1.0 - i * Config.HARVEST_PRIORITY_STEP));
                double harvested = tileModel.harvest(tile, resource, Math.min(request, free));
                if (harvested > 0) {
                    village.setStored(resource, village.getStored(resource) + harvested);
                    collected.add(resource, harvested);
                }
            }
        }
        return collected;
    }
}
