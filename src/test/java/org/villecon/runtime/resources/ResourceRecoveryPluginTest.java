package org.villecon.runtime.resources;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.EconomySimulation;
import org.villecon.runtime.integrity.IntegrityLimits;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainGrid;
import org.villecon.runtime.model.TerrainType;
import org.villecon.runtime.model.Tile;
import org.villecon.runtime.spi.SeededRandomProvider;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ResourceRecoveryPlugin}.
 */
public class ResourceRecoveryPluginTest {

    private static EconomySimulation emptySimulation(TerrainGrid terrain) {
        return new EconomySimulation(terrain, List.of(), EconomyParameters.defaults(),
                ResourceParameters.defaults(), IntegrityLimits.defaults(),
                new SeededRandomProvider(1L), Duration.ofMillis(50));
    }

    @Test
    @Tag("unit")
    void defaultIntervalAdvancesEveryTick() {
        TerrainGrid terrain = TerrainGrid.uniform(1, 1, TerrainType.LAND, ResourceAmounts.of(100, 0, 0));
        EconomySimulation simulation = emptySimulation(terrain);
        ResourceRecoveryPlugin plugin = new ResourceRecoveryPlugin(new SeededRandomProvider(1L), ConfigFactory.empty());
        simulation.addTickPlugin(plugin);
        Tile tile = terrain.getTile(0, 0);
        simulation.getTileModel().harvest(tile, ResourceType.FOOD, 50);

        simulation.run(5, 1.0);
        assertThat(tile.getResource(ResourceType.FOOD)).isEqualTo(50.0);

        simulation.tick(1.0);
        assertThat(plugin.getInterval()).isEqualTo(1);
        assertThat(tile.getResource(ResourceType.FOOD)).isCloseTo(53.0, within(1e-9));
    }

    @Test
    @Tag("unit")
    void intervalAccumulatesElapsedTime() {
        TerrainGrid terrain = TerrainGrid.uniform(1, 1, TerrainType.LAND, ResourceAmounts.of(100, 0, 0));
        EconomySimulation simulation = emptySimulation(terrain);
        simulation.addTickPlugin(new ResourceRecoveryPlugin(new SeededRandomProvider(1L),
                ConfigFactory.parseString("interval = 3")));
        Tile tile = terrain.getTile(0, 0);
        simulation.getTileModel().harvest(tile, ResourceType.FOOD, 50);

        simulation.run(2, 1.0);
        assertThat(tile.getRecoveryTimer(ResourceType.FOOD)).isZero();

        simulation.tick(1.0);
        assertThat(tile.getRecoveryTimer(ResourceType.FOOD)).isEqualTo(3.0);

        simulation.run(3, 1.0);
        assertThat(tile.getRecoveryTimer(ResourceType.FOOD)).isEqualTo(6.0);
        assertThat(tile.getResource(ResourceType.FOOD)).isCloseTo(53.0, within(1e-9));
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new ResourceRecoveryPlugin(new SeededRandomProvider(1L),
                ConfigFactory.parseString("interval = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("interval");
    }
}
