package org.villecon.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The economy block owned by a single {@link Village}: per-tick production and consumption
 * rates, the stock mirror of the village storage with its capacity, building bookkeeping and
 * the latest supply/demand category of every resource.
 */
public final class Economy {

    private final ResourceAmounts production = new ResourceAmounts();
    private final ResourceAmounts consumption = new ResourceAmounts();
    private final ResourceAmounts stock = new ResourceAmounts();
    private final BuildingState buildings = new BuildingState();
    private final EnumMap<ResourceType, BalanceCategory> supplyDemandStatus = new EnumMap<>(ResourceType.class);
    private double stockCapacity;

    public Economy(double stockCapacity) {
        this.stockCapacity = stockCapacity;
        resetStatus();
    }

    public ResourceAmounts getProduction() {
        return production;
    }

    public ResourceAmounts getConsumption() {
        return consumption;
    }

    public ResourceAmounts getStock() {
        return stock;
    }

    public double getStockCapacity() {
        return stockCapacity;
    }

    public void setStockCapacity(double stockCapacity) {
        this.stockCapacity = stockCapacity;
    }

    public BuildingState getBuildings() {
        return buildings;
    }

    /**
     * @param r the resource.
     * @return the category last assigned by the classifier, {@link BalanceCategory#BALANCED} if none.
     */
    public BalanceCategory getStatus(ResourceType r) {
        return supplyDemandStatus.getOrDefault(r, BalanceCategory.BALANCED);
    }

    public void setStatus(ResourceType r, BalanceCategory category) {
        supplyDemandStatus.put(r, category);
    }

    public Map<ResourceType, BalanceCategory> getSupplyDemandStatus() {
        return Collections.unmodifiableMap(supplyDemandStatus);
    }

    /**
     * Sets every resource to {@link BalanceCategory#BALANCED}.
     */
    public void resetStatus() {
        for (ResourceType r : ResourceType.values()) {
            supplyDemandStatus.put(r, BalanceCategory.BALANCED);
        }
    }
}
