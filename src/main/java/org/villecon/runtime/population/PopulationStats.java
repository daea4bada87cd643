package org.villecon.runtime.population;

import org.villecon.runtime.model.PopulationTrend;

/**
 * Snapshot of a village's population situation.
 *
 * @param population      current population.
 * @param foodConsumption food required per time unit.
 * @param canGrow         whether all growth conditions hold.
 * @param shouldDecline   whether the starvation conditions hold.
 * @param trend           direction of the recent history.
 * @param starvationTicks consecutive fully exhausted ticks without a decline.
 */
public record PopulationStats(
        double population,
        double foodConsumption,
        boolean canGrow,
        boolean shouldDecline,
        PopulationTrend trend,
        int starvationTicks) {
}
