package org.villecon.runtime.economy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.GameTime;
import org.villecon.runtime.balance.SupplyDemandClassifier;
import org.villecon.runtime.integrity.EconomyErrorLog;
import org.villecon.runtime.integrity.ErrorCategory;
import org.villecon.runtime.integrity.IntegrityGuard;
import org.villecon.runtime.integrity.IntegrityLimits;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainGrid;
import org.villecon.runtime.model.TerrainType;
import org.villecon.runtime.model.Village;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link VillageEconomyManager}.
 */
public class VillageEconomyManagerTest {

    private EconomyErrorLog errorLog;
    private VillageEconomyManager manager;

    @BeforeEach
    void setUp() {
        EconomyParameters parameters = EconomyParameters.defaults();
        errorLog = new EconomyErrorLog(100);
        IntegrityGuard guard = new IntegrityGuard(IntegrityLimits.defaults(), parameters, errorLog);
        manager = new VillageEconomyManager(new ProductionConsumptionEngine(parameters),
                new SupplyDemandClassifier(parameters), guard);
    }

    @Test
    @Tag("unit")
    void updateDerivesProductionConsumptionAndStatus() {
        TerrainGrid terrain = TerrainGrid.uniform(5, 5, TerrainType.LAND, ResourceAmounts.of(10, 5, 2));
        Village village = Village.founded(2, 2, 100);

        manager.updateVillageEconomy(village, new GameTime(4L, 1.0), terrain);

        ResourceAmounts production = village.getEconomy().getProduction();
        assertThat(production.get(ResourceType.FOOD)).isCloseTo(9.0, within(1e-9));
        assertThat(production.get(ResourceType.WOOD)).isCloseTo(3.6, within(1e-9));
        assertThat(production.get(ResourceType.ORE)).isCloseTo(0.9, within(1e-9));
        assertThat(village.getEconomy().getConsumption().get(ResourceType.FOOD)).isCloseTo(2.0, within(1e-9));
        assertThat(village.getEconomy().getStatus(ResourceType.FOOD)).isEqualTo(BalanceCategory.BALANCED);
        assertThat(village.getEconomy().getStatus(ResourceType.WOOD)).isEqualTo(BalanceCategory.CRITICAL);
        assertThat(village.getEconomy().getStatus(ResourceType.ORE)).isEqualTo(BalanceCategory.CRITICAL);
        assertThat(village.getEconomy().getStockCapacity()).isEqualTo(100.0);
        assertThat(village.getLastUpdateTime()).isEqualTo(4L);
        assertThat(errorLog.size()).isZero();
    }

    @Test
    @Tag("unit")
    void failingTerrainLookupFallsBackToZeroProduction() {
        TerrainGrid terrain = mock(TerrainGrid.class);
        when(terrain.availableInRadius(anyInt(), anyInt(), anyInt())).thenThrow(new IllegalStateException("broken"));
        Village village = Village.founded(2, 2, 100);

        manager.updateVillageEconomy(village, new GameTime(0L, 1.0), terrain);

        assertThat(village.getEconomy().getProduction()).isEqualTo(new ResourceAmounts());
        assertThat(errorLog.getVillageErrors(village.getId()))
                .anySatisfy(error -> {
                    assertThat(error.category()).isEqualTo(ErrorCategory.CALCULATION);
                    assertThat(error.context()).isEqualTo("getAvailableResources");
                });
    }

    @Test
    @Tag("unit")
    void invalidPopulationIsRepairedBeforeUpdating() {
        TerrainGrid terrain = TerrainGrid.uniform(3, 3, TerrainType.LAND, ResourceAmounts.of(10, 10, 10));
        Village village = Village.founded(1, 1, 100);
        village.setPopulation(Double.NaN);

        manager.updateVillageEconomy(village, new GameTime(0L, 1.0), terrain);

        assertThat(village.getPopulation()).isEqualTo(1.0);
        assertThat(errorLog.getVillageErrors(village.getId()))
                .extracting(error -> error.category())
                .contains(ErrorCategory.DATA_INTEGRITY);
        for (ResourceType r : ResourceType.values()) {
            assertThat(village.getEconomy().getProduction().get(r)).isFinite();
        }
    }

    @Test
    @Tag("unit")
    void shortageAndSurplusQueriesReadStoredStatus() {
        Village poor = Village.founded(0, 0, 100);
        poor.getEconomy().setStatus(ResourceType.FOOD, BalanceCategory.SHORTAGE);
        Village rich = Village.founded(5, 5, 100);
        rich.getEconomy().setStatus(ResourceType.ORE, BalanceCategory.SURPLUS);
        Village starving = Village.founded(9, 9, 100);
        starving.getEconomy().setStatus(ResourceType.WOOD, BalanceCategory.CRITICAL);
        List<Village> villages = List.of(poor, rich, starving);

        assertThat(manager.getResourceShortageVillages(villages)).containsExactly(poor, starving);
        assertThat(manager.getResourceSurplusVillages(villages)).containsExactly(rich);
    }
}
