package org.villecon.runtime;

import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable numeric knobs of the village economy, threaded into every component at construction.
 *
 * @param foodConsumptionPerPerson  food consumed per inhabitant per time unit.
 * @param populationGrowthRate      growth probability per time unit when growth is possible.
 * @param populationDeclineRate     decline probability per time unit when starvation applies.
 * @param buildingsPerPopulation    desired buildings per inhabitant.
 * @param buildingWoodCost          wood consumed by one building.
 * @param buildingOreCost           ore consumed by one building.
 * @param surplusThreshold          production/consumption ratio at or above which a resource may be in surplus.
 * @param shortageThreshold         ratio below which a resource may be in shortage.
 * @param criticalThreshold         ratio below which a resource is critical.
 * @param baseStorageCapacity       storage capacity of a village without buildings.
 * @param storageCapacityPerBuilding additional capacity per completed building.
 * @param constructionTimePerBuilding simulated time needed to complete one queued building.
 * @param maxPopulation             population above which a village no longer grows.
 * @param growthHorizonTicks        number of ticks of future consumption that must be in stock for growth.
 * @param starvationGraceTicks      consecutive fully exhausted ticks after which a decline is forced.
 * @param supplierSearchDistance    default radius for supplier searches.
 */
public record EconomyParameters(
        double foodConsumptionPerPerson,
        double populationGrowthRate,
        double populationDeclineRate,
        double buildingsPerPopulation,
        double buildingWoodCost,
        double buildingOreCost,
        double surplusThreshold,
        double shortageThreshold,
        double criticalThreshold,
        double baseStorageCapacity,
        double storageCapacityPerBuilding,
        double constructionTimePerBuilding,
        double maxPopulation,
        int growthHorizonTicks,
        int starvationGraceTicks,
        double supplierSearchDistance) {

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.ofEntries(
            Map.entry("foodConsumptionPerPerson", 0.2),
            Map.entry("populationGrowthRate", 0.02),
            Map.entry("populationDeclineRate", 0.05),
            Map.entry("buildingsPerPopulation", 0.1),
            Map.entry("buildingWoodCost", 10),
            Map.entry("buildingOreCost", 5),
            Map.entry("surplusThreshold", 1.5),
            Map.entry("shortageThreshold", 0.8),
            Map.entry("criticalThreshold", 0.3),
            Map.entry("baseStorageCapacity", 100),
            Map.entry("storageCapacityPerBuilding", 20),
            Map.entry("constructionTimePerBuilding", 5),
            Map.entry("maxPopulation", 100),
            Map.entry("growthHorizonTicks", 3),
            Map.entry("starvationGraceTicks", 5),
            Map.entry("supplierSearchDistance", 10)
    ));

    public EconomyParameters {
        requireRange("foodConsumptionPerPerson", foodConsumptionPerPerson, 0.0, false, 100.0);
        requireRange("populationGrowthRate", populationGrowthRate, 0.0, true, 1.0);
        requireRange("populationDeclineRate", populationDeclineRate, 0.0, true, 1.0);
        requireRange("buildingsPerPopulation", buildingsPerPopulation, 0.0, false, 1.0);
        requireRange("buildingWoodCost", buildingWoodCost, 0.0, false, 10_000.0);
        requireRange("buildingOreCost", buildingOreCost, 0.0, false, 10_000.0);
        requireRange("criticalThreshold", criticalThreshold, 0.0, false, 100.0);
        requireRange("shortageThreshold", shortageThreshold, 0.0, false, 100.0);
        requireRange("surplusThreshold", surplusThreshold, 0.0, false, 100.0);
        if (!(criticalThreshold < shortageThreshold && shortageThreshold < surplusThreshold)) {
            throw new IllegalArgumentException(String.format(
                    "Thresholds must satisfy critical < shortage < surplus, got %s < %s < %s",
                    criticalThreshold, shortageThreshold, surplusThreshold));
        }
        requireRange("baseStorageCapacity", baseStorageCapacity, 0.0, true, 1_000_000.0);
        requireRange("storageCapacityPerBuilding", storageCapacityPerBuilding, 0.0, true, 1_000_000.0);
        requireRange("constructionTimePerBuilding", constructionTimePerBuilding, 0.0, false, 1_000_000.0);
        requireRange("maxPopulation", maxPopulation, 1.0, true, 1_000_000.0);
        if (growthHorizonTicks < 1) {
            throw new IllegalArgumentException("growthHorizonTicks must be at least 1, got " + growthHorizonTicks);
        }
        if (starvationGraceTicks < 1) {
            throw new IllegalArgumentException("starvationGraceTicks must be at least 1, got " + starvationGraceTicks);
        }
        requireRange("supplierSearchDistance", supplierSearchDistance, 0.0, false, 1_000_000.0);
    }

    /**
     * @return the built-in defaults.
     */
    public static EconomyParameters defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Parses parameters from a configuration block such as {@code villecon.economy}.
     * Missing keys fall back to the built-in defaults.
     *
     * @param options the configuration block.
     * @return the validated parameters.
     * @throws IllegalArgumentException if a value has the wrong type or lies outside its valid range.
     */
    public static EconomyParameters fromConfig(Config options) {
        Config c = options.withFallback(DEFAULTS);
        try {
            return new EconomyParameters(
                    c.getDouble("foodConsumptionPerPerson"),
                    c.getDouble("populationGrowthRate"),
                    c.getDouble("populationDeclineRate"),
                    c.getDouble("buildingsPerPopulation"),
                    c.getDouble("buildingWoodCost"),
                    c.getDouble("buildingOreCost"),
                    c.getDouble("surplusThreshold"),
                    c.getDouble("shortageThreshold"),
                    c.getDouble("criticalThreshold"),
                    c.getDouble("baseStorageCapacity"),
                    c.getDouble("storageCapacityPerBuilding"),
                    c.getDouble("constructionTimePerBuilding"),
                    c.getDouble("maxPopulation"),
                    c.getInt("growthHorizonTicks"),
                    c.getInt("starvationGraceTicks"),
                    c.getDouble("supplierSearchDistance"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for economy parameters: " + e.getMessage(), e);
        }
    }

    /**
     * @param buildingCount completed buildings.
     * @return the storage capacity of a village with that many buildings.
     */
    public double storageCapacityFor(int buildingCount) {
        return baseStorageCapacity + Math.max(0, buildingCount) * storageCapacityPerBuilding;
    }

    private static void requireRange(String name, double value, double min, boolean minInclusive, double max) {
        boolean aboveMin = minInclusive ? value >= min : value > min;
        if (!Double.isFinite(value) || !aboveMin || value > max) {
            throw new IllegalArgumentException(String.format("%s must be in %s%s, %s], got %s",
                    name, minInclusive ? "[" : "(", min, max, value));
        }
    }
}
