package org.villecon.runtime.population;

import java.util.List;

import org.villecon.runtime.Config;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.GameTime;
import org.villecon.runtime.economy.ProductionConsumptionEngine;
import org.villecon.runtime.integrity.ErrorCategory;
import org.villecon.runtime.integrity.IntegrityGuard;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.PopulationTrend;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;
import org.villecon.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grows and shrinks village populations.
 * <p>
 * Every tick the village eats, then at most one transition applies:
 * <ol>
 *   <li><b>decline</b> when food is critical and either nothing is left to eat (no stored food and
 *   no production) or production covers less than 30% of the requirement. The decline is random
 *   with the configured decline rate, except that a village that stays fully exhausted for
 *   {@code starvationGraceTicks} consecutive ticks declines deterministically. Population never
 *   drops below 1.</li>
 *   <li><b>growth</b> when the population is below its cap, the food left after next tick's meal
 *   still covers the growth horizon for one more inhabitant, production feeds one more
 *   inhabitant and food is not critical. Growth is random with the configured growth rate,
 *   scaled by food abundance.</li>
 * </ol>
 * The resulting population is appended to the village history.
 */
public class PopulationDynamics {

    private static final Logger LOG = LoggerFactory.getLogger(PopulationDynamics.class);

    private static final double MIN_POPULATION = 1.0;
    private static final double ABUNDANCE_HORIZON = 10.0;
    private static final double MAX_ABUNDANCE = 2.0;
    private static final double MIN_SEVERITY_CONSUMPTION = 0.1;

    private final EconomyParameters parameters;
    private final ProductionConsumptionEngine engine;
    private final IntegrityGuard guard;
    private final IRandomProvider random;

    public PopulationDynamics(EconomyParameters parameters, ProductionConsumptionEngine engine,
                              IntegrityGuard guard, IRandomProvider random) {
        this.parameters = parameters;
        this.engine = engine;
        this.guard = guard;
        this.random = random;
    }

    /**
     * Maps a per-time-unit rate to the probability of an event within {@code deltaTime}.
     *
     * @param rate      event rate per time unit.
     * @param deltaTime elapsed time.
     * @return {@code rate * deltaTime} clamped to {@code [0, 1]}; 0 for non-finite input.
     */
    public static double eventProbability(double rate, double deltaTime) {
        double p = rate * deltaTime;
        if (Double.isNaN(p) || p <= 0) {
            return 0.0;
        }
        return Math.min(1.0, p);
    }

    /**
     * Derives the trend from the newest three samples of a history.
     *
     * @param history population samples, oldest first.
     * @return growing if strictly increasing, declining if strictly decreasing, otherwise stable.
     */
    public static PopulationTrend trend(List<Double> history) {
        if (history.size() < 2) {
            return PopulationTrend.STABLE;
        }
        List<Double> recent = history.subList(Math.max(0, history.size() - Config.TREND_WINDOW), history.size());
        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < recent.size(); i++) {
            double previous = recent.get(i - 1);
            double current = recent.get(i);
            increasing &= current > previous;
            decreasing &= current < previous;
        }
        if (increasing) {
            return PopulationTrend.GROWING;
        }
        return decreasing ? PopulationTrend.DECLINING : PopulationTrend.STABLE;
    }

    /**
     * Applies one tick of food consumption and population change to a village.
     *
     * @param village the village.
     * @param time    the current game time.
     */
    public void updatePopulation(Village village, GameTime time) {
        String id = village.getId();
        try {
            guard.sanitize(village);
            double deltaTime = time.deltaTime();
            double population = village.getPopulation();
            double consumption = guard.safeCalculation(
                    () -> engine.computeConsumption(population), 0.0, "calculateFoodConsumption", id);
            guard.safeCalculation(
                    () -> engine.applyConsumption(village, ResourceType.FOOD, consumption, deltaTime),
                    0.0, "consumeFood", id);

            if (shouldDecline(village)) {
                handleStarvation(village, consumption, deltaTime);
            } else {
                village.setStarvationTicks(0);
                if (canGrow(village, deltaTime) && random.nextDouble() < growthChance(village, consumption, deltaTime)) {
                    grow(village);
                }
            }
            village.recordPopulation(village.getPopulation());
            guard.sanitize(village);
        } catch (RuntimeException e) {
            guard.getErrorLog().record(ErrorCategory.CALCULATION, id, "updatePopulation", e.toString());
            LOG.warn("Population update failed for village {}", id, e);
        }
    }

    /**
     * @param village the village.
     * @return {@code true} if food is critical and the village is starving.
     */
    public boolean shouldDecline(Village village) {
        if (village.getEconomy().getStatus(ResourceType.FOOD) != BalanceCategory.CRITICAL) {
            return false;
        }
        if (isFoodExhausted(village)) {
            return true;
        }
        double required = engine.computeConsumption(village.getPopulation());
        double production = village.getEconomy().getProduction().get(ResourceType.FOOD);
        return required > 0 && production < required * Config.STARVATION_PRODUCTION_RATIO;
    }

    /**
     * @param village   the village.
     * @param deltaTime the time step used to estimate next tick's meal.
     * @return {@code true} if every growth condition holds.
     */
    public boolean canGrow(Village village, double deltaTime) {
        double population = village.getPopulation();
        if (population >= parameters.maxPopulation()) {
            return false;
        }
        if (village.getEconomy().getStatus(ResourceType.FOOD) == BalanceCategory.CRITICAL) {
            return false;
        }
        double food = village.getStored(ResourceType.FOOD);
        double futureConsumption = engine.computeConsumption(population + 1);
        double afterNextMeal = food - futureConsumption * deltaTime;
        if (afterNextMeal < futureConsumption * parameters.growthHorizonTicks()) {
            return false;
        }
        return village.getEconomy().getProduction().get(ResourceType.FOOD) >= futureConsumption;
    }

    public PopulationStats getPopulationStats(Village village) {
        return new PopulationStats(
                village.getPopulation(),
                engine.computeConsumption(village.getPopulation()),
                canGrow(village, 1.0),
                shouldDecline(village),
                trend(village.getPopulationHistory()),
                village.getStarvationTicks());
    }

    private void handleStarvation(Village village, double consumption, double deltaTime) {
        if (village.getPopulation() <= MIN_POPULATION) {
            village.setStarvationTicks(0);
            return;
        }
        boolean exhausted = isFoodExhausted(village);
        int starvationTicks = exhausted ? village.getStarvationTicks() + 1 : 0;
        boolean forced = exhausted && starvationTicks >= parameters.starvationGraceTicks();
        if (forced || random.nextDouble() < declineChance(village, consumption, deltaTime)) {
            decline(village, forced);
            village.setStarvationTicks(0);
        } else {
            village.setStarvationTicks(starvationTicks);
        }
    }

    private boolean isFoodExhausted(Village village) {
        return village.getStored(ResourceType.FOOD) <= 0
                && village.getEconomy().getProduction().get(ResourceType.FOOD) <= 0;
    }

    private double growthChance(Village village, double consumption, double deltaTime) {
        double food = village.getStored(ResourceType.FOOD);
        double abundance = consumption > 0
                ? Math.min(MAX_ABUNDANCE, food / (consumption * ABUNDANCE_HORIZON))
                : MAX_ABUNDANCE;
        return Math.min(1.0, eventProbability(parameters.populationGrowthRate(), deltaTime) * abundance);
    }

    private double declineChance(Village village, double consumption, double deltaTime) {
        double food = village.getStored(ResourceType.FOOD);
        double severity = Math.max(1.0, 2.0 - food / Math.max(MIN_SEVERITY_CONSUMPTION, consumption));
        return Math.min(1.0, eventProbability(parameters.populationDeclineRate(), deltaTime) * severity);
    }

    private void grow(Village village) {
        double population = Math.min(parameters.maxPopulation(), village.getPopulation() + 1);
        village.setPopulation(population);
        int radius = Math.min(Config.MAX_GROWTH_RADIUS, (int) Math.floor(population / Config.RADIUS_POPULATION_STEP) + 1);
        village.setCollectionRadius(Math.max(village.getCollectionRadius(), radius));
        LOG.debug("Village {} grew to {}", village.getId(), population);
    }

    private void decline(Village village, boolean forced) {
        double population = Math.max(MIN_POPULATION, village.getPopulation() - 1);
        village.setPopulation(population);
        int radius = Math.max(1, (int) Math.floor(population / Config.RADIUS_POPULATION_STEP) + 1);
        village.setCollectionRadius(Math.min(village.getCollectionRadius(), radius));
        LOG.debug("Village {} declined to {}{}", village.getId(), population, forced ? " after sustained starvation" : "");
    }
}
