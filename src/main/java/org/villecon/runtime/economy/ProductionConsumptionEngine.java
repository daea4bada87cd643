package org.villecon.runtime.economy;

import org.villecon.runtime.Config;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.model.Economy;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;

/**
 * Derives a village's production and consumption rates.
 * <p>
 * Production of a resource is the amount available within the collection radius scaled by a
 * population bonus, a building bonus, the squared collection radius and a per-resource yield
 * factor. Both bonuses are non-decreasing and saturate, so more inhabitants, more buildings
 * or a wider radius never lower the output. Food consumption grows with population but the
 * per-capita rate shrinks for larger settlements; wood and ore are consumed by construction.
 */
public class ProductionConsumptionEngine {

    private final EconomyParameters parameters;

    public ProductionConsumptionEngine(EconomyParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @param population the village population.
     * @return the production multiplier for that population, in {@code [0, 2]}.
     */
    public static double populationBonus(double population) {
        double bonus = 1.0 + (population - Config.POPULATION_BONUS_BASELINE) * Config.POPULATION_BONUS_PER_CAPITA;
        return Math.max(0.0, Math.min(Config.POPULATION_BONUS_CAP, bonus));
    }

    /**
     * @param buildingCount completed buildings.
     * @return the production multiplier for that many buildings, in {@code [1, 1.5]}.
     */
    public static double buildingBonus(int buildingCount) {
        return Math.min(Config.BUILDING_BONUS_CAP, 1.0 + Math.max(0, buildingCount) * Config.BUILDING_BONUS_PER_BUILDING);
    }

    public static double yieldFactor(ResourceType resource) {
        return switch (resource) {
            case FOOD -> Config.FOOD_YIELD_FACTOR;
            case WOOD -> Config.WOOD_YIELD_FACTOR;
            case ORE -> Config.ORE_YIELD_FACTOR;
        };
    }

    /**
     * Computes production rates from the resources available around the village.
     *
     * @param village   the producing village.
     * @param available per-resource totals within the collection radius.
     * @return the production rate per resource; exactly 0 where nothing is available.
     */
    public ResourceAmounts computeProduction(Village village, ResourceAmounts available) {
        double radius = Math.max(0, village.getCollectionRadius());
        double multiplier = populationBonus(village.getPopulation())
                * buildingBonus(village.getEconomy().getBuildings().getCount())
                * radius * radius;
        ResourceAmounts production = new ResourceAmounts();
        for (ResourceType r : ResourceType.values()) {
            double amount = available.get(r);
            if (amount > 0) {
                production.set(r, amount * multiplier * yieldFactor(r));
            }
        }
        return production;
    }

    /**
     * Computes food consumption of a population.
     *
     * @param population the population.
     * @return the food consumed per time unit, 0 for non-positive populations.
     */
    public double computeConsumption(double population) {
        if (!(population > 0)) {
            return 0.0;
        }
        double efficiency = Math.max(Config.CONSUMPTION_EFFICIENCY_FLOOR,
                1.0 - (population - Config.POPULATION_BONUS_BASELINE) * Config.CONSUMPTION_EFFICIENCY_PER_CAPITA);
        return population * parameters.foodConsumptionPerPerson() * efficiency;
    }

    /**
     * Computes all consumption rates of a village: food for its population, wood and ore for
     * the buildings in its construction queue.
     *
     * @param village the village.
     * @return the consumption rate per resource.
     */
    public ResourceAmounts computeConsumption(Village village) {
        int queue = Math.max(0, village.getEconomy().getBuildings().getConstructionQueue());
        return ResourceAmounts.of(
                computeConsumption(village.getPopulation()),
                queue * parameters.buildingWoodCost(),
                queue * parameters.buildingOreCost());
    }

    /**
     * Withdraws consumed resources from storage. Never withdraws more than is stored.
     *
     * @param village   the consuming village.
     * @param resource  the resource consumed.
     * @param rate      consumption per time unit.
     * @param deltaTime elapsed time.
     * @return the amount actually withdrawn.
     */
    public double applyConsumption(Village village, ResourceType resource, double rate, double deltaTime) {
        double stored = Math.max(0.0, village.getStored(resource));
        double requested = rate * deltaTime;
        if (!(requested > 0) || !Double.isFinite(requested)) {
            village.setStored(resource, stored);
            return 0.0;
        }
        double consumed = Math.min(requested, stored);
        village.setStored(resource, stored - consumed);
        return consumed;
    }

    /**
     * Mirrors storage into the stock and recomputes the storage capacity from the building count.
     *
     * @param village the village.
     */
    public void syncStock(Village village) {
        Economy economy = village.getEconomy();
        village.syncStockFromStorage();
        economy.setStockCapacity(parameters.storageCapacityFor(economy.getBuildings().getCount()));
    }
}
