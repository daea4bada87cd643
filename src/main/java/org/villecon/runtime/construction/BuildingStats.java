package org.villecon.runtime.construction;

/**
 * Snapshot of a village's building situation.
 *
 * @param count        completed buildings.
 * @param targetCount  desired buildings for the current population.
 * @param queue        buildings under construction.
 * @param canBuild     whether a new building could be started now.
 * @param woodCost     wood per building.
 * @param oreCost      ore per building.
 * @param maxBuildable buildings that resources and queue space allow.
 */
public record BuildingStats(
        int count,
        int targetCount,
        int queue,
        boolean canBuild,
        double woodCost,
        double oreCost,
        int maxBuildable) {
}
