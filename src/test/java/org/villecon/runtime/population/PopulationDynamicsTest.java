package org.villecon.runtime.population;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.GameTime;
import org.villecon.runtime.economy.ProductionConsumptionEngine;
import org.villecon.runtime.integrity.EconomyErrorLog;
import org.villecon.runtime.integrity.IntegrityGuard;
import org.villecon.runtime.integrity.IntegrityLimits;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.PopulationTrend;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;
import org.villecon.runtime.spi.IRandomProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PopulationDynamics}.
 */
@ExtendWith(MockitoExtension.class)
public class PopulationDynamicsTest {

    private static final GameTime TICK = new GameTime(0L, 1.0);

    @Mock
    private IRandomProvider random;
    private PopulationDynamics dynamics;

    @BeforeEach
    void setUp() {
        EconomyParameters parameters = EconomyParameters.defaults();
        IntegrityGuard guard = new IntegrityGuard(IntegrityLimits.defaults(), parameters, new EconomyErrorLog(100));
        dynamics = new PopulationDynamics(parameters, new ProductionConsumptionEngine(parameters), guard, random);
    }

    private static Village village(double population, double food, double foodProduction, BalanceCategory foodStatus) {
        Village village = Village.founded(0, 0, 100);
        village.setPopulation(population);
        village.setStored(ResourceType.FOOD, food);
        village.getEconomy().getProduction().set(ResourceType.FOOD, foodProduction);
        village.getEconomy().setStatus(ResourceType.FOOD, foodStatus);
        return village;
    }

    @Test
    @Tag("unit")
    void eventProbabilityIsClamped() {
        assertThat(PopulationDynamics.eventProbability(0.02, 1.0)).isEqualTo(0.02);
        assertThat(PopulationDynamics.eventProbability(0.5, 4.0)).isEqualTo(1.0);
        assertThat(PopulationDynamics.eventProbability(0.5, -1.0)).isZero();
        assertThat(PopulationDynamics.eventProbability(Double.NaN, 1.0)).isZero();
    }

    @Test
    @Tag("unit")
    void trendLooksAtNewestSamples() {
        assertThat(PopulationDynamics.trend(List.of())).isEqualTo(PopulationTrend.STABLE);
        assertThat(PopulationDynamics.trend(List.of(5.0))).isEqualTo(PopulationTrend.STABLE);
        assertThat(PopulationDynamics.trend(List.of(9.0, 1.0, 2.0, 3.0))).isEqualTo(PopulationTrend.GROWING);
        assertThat(PopulationDynamics.trend(List.of(1.0, 5.0, 4.0, 3.0))).isEqualTo(PopulationTrend.DECLINING);
        assertThat(PopulationDynamics.trend(List.of(3.0, 4.0, 4.0))).isEqualTo(PopulationTrend.STABLE);
    }

    @Test
    @Tag("unit")
    void exhaustedVillageDeclinesAfterGracePeriod() {
        when(random.nextDouble()).thenReturn(0.99);
        Village village = village(10, 0, 0, BalanceCategory.CRITICAL);

        for (int i = 0; i < 4; i++) {
            dynamics.updatePopulation(village, TICK);
        }
        assertThat(village.getPopulation()).isEqualTo(10.0);
        assertThat(village.getStarvationTicks()).isEqualTo(4);

        dynamics.updatePopulation(village, TICK);
        assertThat(village.getPopulation()).isEqualTo(9.0);
        assertThat(village.getStarvationTicks()).isZero();

        for (int i = 0; i < 100; i++) {
            dynamics.updatePopulation(village, TICK);
        }
        assertThat(village.getPopulation()).isEqualTo(1.0);
        assertThat(PopulationDynamics.trend(village.getPopulationHistory())).isEqualTo(PopulationTrend.STABLE);
    }

    @Test
    @Tag("unit")
    void wellFedVillageGrowsWhenDrawSucceeds() {
        when(random.nextDouble()).thenReturn(0.0);
        Village village = village(10, 50, 10, BalanceCategory.BALANCED);

        dynamics.updatePopulation(village, TICK);

        assertThat(village.getPopulation()).isEqualTo(11.0);
        assertThat(village.getStored(ResourceType.FOOD)).isEqualTo(48.0);
        assertThat(village.getPopulationHistory()).containsExactly(11.0);
    }

    @Test
    @Tag("unit")
    void wellFedVillageKeepsPopulationWhenDrawFails() {
        when(random.nextDouble()).thenReturn(0.5);
        Village village = village(10, 50, 10, BalanceCategory.BALANCED);

        dynamics.updatePopulation(village, TICK);

        assertThat(village.getPopulation()).isEqualTo(10.0);
    }

    @Test
    @Tag("unit")
    void growthRequiresFoodBufferAndProduction() {
        assertThat(dynamics.canGrow(village(10, 50, 10, BalanceCategory.BALANCED), 1.0)).isTrue();
        assertThat(dynamics.canGrow(village(10, 5, 10, BalanceCategory.BALANCED), 1.0)).isFalse();
        assertThat(dynamics.canGrow(village(10, 50, 1, BalanceCategory.BALANCED), 1.0)).isFalse();
        assertThat(dynamics.canGrow(village(10, 50, 10, BalanceCategory.CRITICAL), 1.0)).isFalse();
        assertThat(dynamics.canGrow(village(100, 5000, 100, BalanceCategory.SURPLUS), 1.0)).isFalse();
    }

    @Test
    @Tag("unit")
    void lowProductionCausesProbabilisticDecline() {
        when(random.nextDouble()).thenReturn(0.05);
        Village village = village(10, 1, 0.1, BalanceCategory.CRITICAL);

        assertThat(dynamics.shouldDecline(village)).isTrue();
        dynamics.updatePopulation(village, TICK);

        assertThat(village.getPopulation()).isEqualTo(9.0);
        assertThat(village.getStarvationTicks()).isZero();
    }

    @Test
    @Tag("unit")
    void lowProductionWithFailedDrawKeepsPopulation() {
        when(random.nextDouble()).thenReturn(0.5);
        Village village = village(10, 1, 0.1, BalanceCategory.CRITICAL);

        dynamics.updatePopulation(village, TICK);

        assertThat(village.getPopulation()).isEqualTo(10.0);
        assertThat(village.getStarvationTicks()).isZero();
    }

    @Test
    @Tag("unit")
    void populationNeverDropsBelowOne() {
        Village village = village(1, 0, 0, BalanceCategory.CRITICAL);

        for (int i = 0; i < 20; i++) {
            dynamics.updatePopulation(village, TICK);
        }

        assertThat(village.getPopulation()).isEqualTo(1.0);
    }

    @Test
    @Tag("unit")
    void statsReflectCurrentState() {
        Village village = village(10, 0, 0, BalanceCategory.CRITICAL);

        PopulationStats stats = dynamics.getPopulationStats(village);

        assertThat(stats.population()).isEqualTo(10.0);
        assertThat(stats.foodConsumption()).isEqualTo(2.0);
        assertThat(stats.canGrow()).isFalse();
        assertThat(stats.shouldDecline()).isTrue();
        assertThat(stats.trend()).isEqualTo(PopulationTrend.STABLE);
    }
}
