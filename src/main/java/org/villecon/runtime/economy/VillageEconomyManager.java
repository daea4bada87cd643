package org.villecon.runtime.economy;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.villecon.runtime.GameTime;
import org.villecon.runtime.balance.SupplyDemandClassifier;
import org.villecon.runtime.integrity.IntegrityGuard;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.Economy;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainGrid;
import org.villecon.runtime.model.Village;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes the economy block of a village once per tick.
 * <p>
 * The village is sanitised, production is derived from the resources in its collection
 * radius, consumption from its population and construction queue, the stock is mirrored from
 * storage and every resource is re-classified. Each step runs through the
 * {@link IntegrityGuard} so a failing step falls back to a neutral value; an unexpected
 * failure of the whole update resets the economy to defaults.
 */
public class VillageEconomyManager {

    private static final Logger LOG = LoggerFactory.getLogger(VillageEconomyManager.class);

    private final ProductionConsumptionEngine engine;
    private final SupplyDemandClassifier classifier;
    private final IntegrityGuard guard;

    public VillageEconomyManager(ProductionConsumptionEngine engine, SupplyDemandClassifier classifier,
                                 IntegrityGuard guard) {
        this.engine = engine;
        this.classifier = classifier;
        this.guard = guard;
    }

    /**
     * Updates production, consumption, stock and supply/demand status of a village.
     *
     * @param village the village to update.
     * @param time    the current game time.
     * @param terrain the terrain grid.
     */
    public void updateVillageEconomy(Village village, GameTime time, TerrainGrid terrain) {
        String id = village.getId();
        try {
            guard.sanitize(village);
            Economy economy = village.getEconomy();

            ResourceAmounts available = guard.safeCalculation(
                    () -> terrain.availableInRadius(village.getX(), village.getY(), village.getCollectionRadius()),
                    new ResourceAmounts(), "getAvailableResources", id);
            economy.getProduction().copyFrom(guard.safeCalculation(
                    () -> engine.computeProduction(village, available),
                    new ResourceAmounts(), "calculateProduction", id));
            economy.getConsumption().copyFrom(guard.safeCalculation(
                    () -> engine.computeConsumption(village),
                    new ResourceAmounts(), "calculateConsumption", id));
            engine.syncStock(village);

            Map<ResourceType, BalanceCategory> status = guard.safeCalculation(
                    () -> classifier.evaluateVillageBalance(village),
                    economy.getSupplyDemandStatus(), "evaluateVillageBalance", id);
            for (Map.Entry<ResourceType, BalanceCategory> entry : Map.copyOf(status).entrySet()) {
                economy.setStatus(entry.getKey(), entry.getValue());
            }

            village.setLastUpdateTime(time.currentTick());
            guard.sanitize(village);
        } catch (RuntimeException e) {
            LOG.error("Economy update failed for village {}", id, e);
            guard.resetToDefaults(village);
        }
    }

    /**
     * @param villages the villages.
     * @return villages whose stored status marks any resource as shortage or critical.
     */
    public List<Village> getResourceShortageVillages(Collection<Village> villages) {
        return villages.stream()
                .filter(v -> v.getEconomy().getSupplyDemandStatus().values().stream()
                        .anyMatch(c -> c == BalanceCategory.SHORTAGE || c == BalanceCategory.CRITICAL))
                .toList();
    }

    /**
     * @param villages the villages.
     * @return villages whose stored status marks any resource as surplus.
     */
    public List<Village> getResourceSurplusVillages(Collection<Village> villages) {
        return villages.stream()
                .filter(v -> v.getEconomy().getSupplyDemandStatus().containsValue(BalanceCategory.SURPLUS))
                .toList();
    }
}
