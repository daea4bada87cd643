package org.villecon.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.villecon.runtime.balance.SupplyDemandClassifier;
import org.villecon.runtime.construction.ConstructionEngine;
import org.villecon.runtime.economy.ProductionConsumptionEngine;
import org.villecon.runtime.economy.VillageEconomyManager;
import org.villecon.runtime.integrity.EconomyErrorLog;
import org.villecon.runtime.integrity.ErrorCategory;
import org.villecon.runtime.integrity.IntegrityGuard;
import org.villecon.runtime.integrity.IntegrityLimits;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainGrid;
import org.villecon.runtime.model.Village;
import org.villecon.runtime.population.PopulationDynamics;
import org.villecon.runtime.resources.ResourceParameters;
import org.villecon.runtime.resources.ResourceTileModel;
import org.villecon.runtime.resources.VillageHarvester;
import org.villecon.runtime.spi.IRandomProvider;
import org.villecon.runtime.spi.ITickPlugin;
import org.villecon.runtime.spi.SeededRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Drives the village economy tick by tick.
 * <p>
 * Each tick first runs the registered {@link ITickPlugin}s in order, then processes every village
 * sequentially: harvest the surrounding tiles, refresh the economy, update the population and
 * update buildings. Processing time and errors recorded by the integrity layer are reported to
 * the {@link TickHealthMonitor}.
 */
public class EconomySimulation {

    private static final Logger LOG = LoggerFactory.getLogger(EconomySimulation.class);

    private final TerrainGrid terrain;
    private final List<Village> villages;
    private final EconomyParameters parameters;
    private final ResourceTileModel tileModel;
    private final VillageHarvester harvester;
    private final ProductionConsumptionEngine productionEngine;
    private final SupplyDemandClassifier classifier;
    private final VillageEconomyManager economyManager;
    private final PopulationDynamics populationDynamics;
    private final ConstructionEngine constructionEngine;
    private final IntegrityGuard guard;
    private final TickHealthMonitor healthMonitor;
    private final IRandomProvider randomProvider;
    private final List<ITickPlugin> tickPlugins = new ArrayList<>();
    private long currentTick = 0L;
    private GameTime gameTime = new GameTime(0L, 0.0);

    /**
     * Creates a simulation over the given terrain and villages.
     *
     * @param terrain            the terrain grid, shared by all villages.
     * @param villages           the villages, processed in list order.
     * @param parameters         economy parameters.
     * @param resourceParameters tile recovery parameters.
     * @param limits             integrity limits.
     * @param randomProvider     source of randomness for population changes.
     * @param tickBudget         processing time above which a tick counts as slow.
     */
    public EconomySimulation(TerrainGrid terrain, List<Village> villages, EconomyParameters parameters,
                             ResourceParameters resourceParameters, IntegrityLimits limits,
                             IRandomProvider randomProvider, Duration tickBudget) {
        this.terrain = terrain;
        this.villages = new ArrayList<>(villages);
        this.parameters = parameters;
        this.randomProvider = randomProvider;
        this.tileModel = new ResourceTileModel(resourceParameters);
        this.harvester = new VillageHarvester(tileModel);
        this.guard = new IntegrityGuard(limits, parameters, new EconomyErrorLog(limits.errorLogSize()));
        this.productionEngine = new ProductionConsumptionEngine(parameters);
        this.classifier = new SupplyDemandClassifier(parameters);
        this.economyManager = new VillageEconomyManager(productionEngine, classifier, guard);
        this.populationDynamics = new PopulationDynamics(parameters, productionEngine, guard,
                randomProvider.deriveFor("population", 0L));
        this.constructionEngine = new ConstructionEngine(parameters, guard);
        this.healthMonitor = new TickHealthMonitor(tickBudget);
    }

    /**
     * Creates a simulation from the {@code villecon} configuration tree, including its tick plugins.
     *
     * @param config   configuration containing a {@code villecon} block.
     * @param terrain  the terrain grid.
     * @param villages the villages.
     * @return the configured simulation.
     * @throws IllegalArgumentException if the configuration is invalid or a plugin cannot be created.
     */
    public static EconomySimulation fromConfig(Config config, TerrainGrid terrain, List<Village> villages) {
        Config root = config.hasPath("villecon") ? config.getConfig("villecon") : ConfigFactory.empty();
        Config simulationConfig = block(root, "simulation");
        try {
            long seed = simulationConfig.hasPath("seed") ? simulationConfig.getLong("seed") : 0L;
            Duration tickBudget = simulationConfig.hasPath("tickBudget")
                    ? simulationConfig.getDuration("tickBudget")
                    : Duration.ofMillis(50);
            ResourceParameters resourceParameters = ResourceParameters.fromConfig(block(root, "resources"));
            EconomySimulation simulation = new EconomySimulation(
                    terrain,
                    villages,
                    EconomyParameters.fromConfig(block(root, "economy")),
                    resourceParameters,
                    IntegrityLimits.fromConfig(block(root, "integrity")),
                    new SeededRandomProvider(seed),
                    tickBudget);
            if (simulationConfig.hasPath("plugins")) {
                simulation.initializePlugins(simulationConfig.getConfigList("plugins"));
            }
            LOG.info("Economy simulation created with {} villages on a {}x{} grid, seed {}, {}",
                    villages.size(), terrain.getWidth(), terrain.getHeight(), seed, resourceParameters);
            return simulation;
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for simulation: " + e.getMessage(), e);
        }
    }

    private static Config block(Config root, String path) {
        return root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
    }

    private void initializePlugins(List<? extends Config> configs) {
        for (Config pluginConfig : configs) {
            String className = pluginConfig.getString("className");
            Config options = pluginConfig.hasPath("options") ? pluginConfig.getConfig("options") : ConfigFactory.empty();
            try {
                Object plugin = Class.forName(className)
                        .getConstructor(IRandomProvider.class, Config.class)
                        .newInstance(randomProvider.deriveFor(className, 0L), options);
                if (!(plugin instanceof ITickPlugin tickPlugin)) {
                    throw new IllegalArgumentException("Plugin " + className + " does not implement ITickPlugin");
                }
                addTickPlugin(tickPlugin);
                LOG.info("Loaded tick plugin {}", className);
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException("Failed to instantiate plugin: " + className, e);
            }
        }
    }

    /**
     * Adds a tick plugin. Plugins run in the order they are added, at the beginning of each tick.
     * @param plugin the plugin.
     */
    public void addTickPlugin(ITickPlugin plugin) {
        tickPlugins.add(plugin);
    }

    public List<ITickPlugin> getTickPlugins() {
        return Collections.unmodifiableList(tickPlugins);
    }

    public void addVillage(Village village) {
        villages.add(village);
    }

    /**
     * Processes one tick. Failures inside plugins and village updates are recorded in the error
     * log and never abort the tick.
     *
     * @param deltaTime simulated time covered by this tick, finite and non-negative.
     * @throws IllegalArgumentException if {@code deltaTime} is negative or not finite. This is a
     *         caller error and is rejected before any state is touched.
     */
    public void tick(double deltaTime) {
        long start = System.nanoTime();
        gameTime = new GameTime(currentTick, deltaTime);
        EconomyErrorLog errorLog = guard.getErrorLog();
        long errorsBefore = errorLog.getTotalRecorded();

        for (ITickPlugin plugin : tickPlugins) {
            try {
                plugin.execute(this);
            } catch (RuntimeException e) {
                errorLog.record(ErrorCategory.CALCULATION, null,
                        plugin.getClass().getSimpleName(), e.toString());
                LOG.error("Tick plugin {} failed at tick {}", plugin.getClass().getName(), currentTick, e);
            }
        }

        tileModel.updateTick(currentTick);
        for (Village village : villages) {
            guard.sanitize(village);
            guard.safeCalculation(() -> harvester.harvest(village, terrain), new ResourceAmounts(),
                    "harvest", village.getId());
            economyManager.updateVillageEconomy(village, gameTime, terrain);
            populationDynamics.updatePopulation(village, gameTime);
            constructionEngine.updateBuildings(village, gameTime);
        }

        healthMonitor.recordTick(currentTick, System.nanoTime() - start, errorLog.getTotalRecorded() - errorsBefore);
        currentTick++;
    }

    /**
     * Processes several ticks with the same time step.
     *
     * @param ticks     number of ticks.
     * @param deltaTime simulated time per tick.
     */
    public void run(int ticks, double deltaTime) {
        for (int i = 0; i < ticks; i++) {
            tick(deltaTime);
        }
    }

    /**
     * Sets a tile resource directly, bypassing harvest and recovery.
     *
     * @param x        column.
     * @param y        row.
     * @param resource the resource.
     * @param amount   the requested amount, clamped to the tile's range.
     */
    public void divineIntervention(int x, int y, ResourceType resource, double amount) {
        tileModel.divineIntervention(terrain.getTile(x, y), resource, amount);
    }

    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * @return the time of the tick currently or most recently processed.
     */
    public GameTime getGameTime() {
        return gameTime;
    }

    public TerrainGrid getTerrain() {
        return terrain;
    }

    public List<Village> getVillages() {
        return Collections.unmodifiableList(villages);
    }

    public EconomyParameters getParameters() {
        return parameters;
    }

    public ResourceTileModel getTileModel() {
        return tileModel;
    }

    public SupplyDemandClassifier getClassifier() {
        return classifier;
    }

    public VillageEconomyManager getEconomyManager() {
        return economyManager;
    }

    public PopulationDynamics getPopulationDynamics() {
        return populationDynamics;
    }

    public ConstructionEngine getConstructionEngine() {
        return constructionEngine;
    }

    public IntegrityGuard getIntegrityGuard() {
        return guard;
    }

    public EconomyErrorLog getErrorLog() {
        return guard.getErrorLog();
    }

    public TickHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }
}
