package org.villecon.runtime.construction;

import org.villecon.runtime.Config;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.GameTime;
import org.villecon.runtime.integrity.IntegrityGuard;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.BuildingState;
import org.villecon.runtime.model.Economy;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sizes, starts and completes village buildings.
 * <p>
 * The building target follows the population. New construction is started only while wood
 * and ore stay above a buffer of twice the building cost, neither is critical and fewer than
 * three buildings are in progress. Queued buildings advance with elapsed time; progress is
 * carried over between ticks so that small time steps still complete buildings. A shrinking
 * population only lowers the target and never removes completed or queued buildings.
 */
public class ConstructionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConstructionEngine.class);

    private final EconomyParameters parameters;
    private final IntegrityGuard guard;

    public ConstructionEngine(EconomyParameters parameters, IntegrityGuard guard) {
        this.parameters = parameters;
        this.guard = guard;
    }

    /**
     * @param population the village population.
     * @return the number of buildings the village should have: 0 without inhabitants, otherwise
     *         the configured ratio of the population, capped at half the population, and at least
     *         one once the population reaches 1.
     */
    public int targetBuildingCount(double population) {
        if (!(population > 0)) {
            return 0;
        }
        double safePopulation = Math.min(population, Integer.MAX_VALUE);
        int byRatio = (int) Math.floor(safePopulation * parameters.buildingsPerPopulation());
        int cap = (int) Math.floor(safePopulation / 2);
        int minimum = safePopulation >= 1 ? 1 : 0;
        return Math.max(minimum, Math.min(byRatio, cap));
    }

    /**
     * @param village the village.
     * @return {@code true} if a building can be started: enough wood and ore for one building
     *         with twice its cost left over, neither resource critical and queue space available.
     */
    public boolean canBuild(Village village) {
        double wood = village.getStored(ResourceType.WOOD);
        double ore = village.getStored(ResourceType.ORE);
        double woodCost = parameters.buildingWoodCost();
        double oreCost = parameters.buildingOreCost();
        if (!(wood >= woodCost) || !(ore >= oreCost)) {
            return false;
        }
        if (wood - woodCost < woodCost * 2 || ore - oreCost < oreCost * 2) {
            return false;
        }
        Economy economy = village.getEconomy();
        if (economy.getStatus(ResourceType.WOOD) == BalanceCategory.CRITICAL
                || economy.getStatus(ResourceType.ORE) == BalanceCategory.CRITICAL) {
            return false;
        }
        return economy.getBuildings().getConstructionQueue() < Config.MAX_CONCURRENT_CONSTRUCTION;
    }

    /**
     * @param village the village.
     * @return how many buildings stored resources and free queue slots allow, never negative.
     */
    public int maxBuildable(Village village) {
        int byWood = (int) Math.floor(Math.max(0.0, village.getStored(ResourceType.WOOD)) / parameters.buildingWoodCost());
        int byOre = (int) Math.floor(Math.max(0.0, village.getStored(ResourceType.ORE)) / parameters.buildingOreCost());
        int queueSpace = Math.max(0, Config.MAX_CONCURRENT_CONSTRUCTION - village.getEconomy().getBuildings().getConstructionQueue());
        return Math.max(0, Math.min(Math.min(byWood, byOre), queueSpace));
    }

    /**
     * Completes finished construction, updates the building target and starts new buildings.
     *
     * @param village the village.
     * @param time    the current game time.
     */
    public void updateBuildings(Village village, GameTime time) {
        String id = village.getId();
        try {
            guard.sanitize(village);
            BuildingState buildings = village.getEconomy().getBuildings();

            advanceConstruction(village, time.deltaTime());

            int target = guard.safeCalculation(
                    () -> targetBuildingCount(village.getPopulation()), buildings.getTargetCount(),
                    "calculateTargetBuildingCount", id);
            buildings.setTargetCount(target);

            int needed = Math.max(0, target - (buildings.getCount() + buildings.getConstructionQueue()));
            if (needed > 0) {
                int buildable = guard.safeCalculation(() -> maxBuildable(village), 0, "calculateMaxBuildable", id);
                int toBuild = Math.min(needed, buildable);
                if (toBuild > 0 && canBuild(village)) {
                    startConstruction(village, toBuild);
                }
            }
            guard.sanitize(village);
        } catch (RuntimeException e) {
            LOG.error("Building update failed for village {}", id, e);
            guard.resetToDefaults(village);
        }
    }

    public BuildingStats getBuildingStats(Village village) {
        BuildingState buildings = village.getEconomy().getBuildings();
        return new BuildingStats(
                buildings.getCount(),
                buildings.getTargetCount(),
                buildings.getConstructionQueue(),
                canBuild(village),
                parameters.buildingWoodCost(),
                parameters.buildingOreCost(),
                maxBuildable(village));
    }

    private void advanceConstruction(Village village, double deltaTime) {
        Economy economy = village.getEconomy();
        BuildingState buildings = economy.getBuildings();
        int queue = buildings.getConstructionQueue();
        if (queue <= 0) {
            buildings.setConstructionProgress(0.0);
            return;
        }
        double timePerBuilding = parameters.constructionTimePerBuilding();
        double progress = buildings.getConstructionProgress() + deltaTime;
        double rate = progress / timePerBuilding;
        int completed = (int) Math.min(queue, Math.floor(queue * rate));
        if (completed <= 0) {
            buildings.setConstructionProgress(progress);
            return;
        }
        int remaining = queue - completed;
        buildings.setCount(buildings.getCount() + completed);
        buildings.setConstructionQueue(remaining);
        buildings.setConstructionProgress(remaining == 0 ? 0.0
                : Math.max(0.0, progress - completed * timePerBuilding / queue));
        economy.setStockCapacity(parameters.storageCapacityFor(buildings.getCount()));
        LOG.debug("Village {} completed {} building(s), {} total", village.getId(), completed, buildings.getCount());
    }

    private void startConstruction(Village village, int count) {
        double wood = count * parameters.buildingWoodCost();
        double ore = count * parameters.buildingOreCost();
        village.setStored(ResourceType.WOOD, village.getStored(ResourceType.WOOD) - wood);
        village.setStored(ResourceType.ORE, village.getStored(ResourceType.ORE) - ore);
        BuildingState buildings = village.getEconomy().getBuildings();
        buildings.setConstructionQueue(buildings.getConstructionQueue() + count);
        LOG.debug("Village {} started {} building(s) for {} wood and {} ore", village.getId(), count, wood, ore);
    }
}
