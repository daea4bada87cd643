package org.villecon.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.villecon.runtime.Config;

/**
 * A settlement on the terrain grid.
 * <p>
 * Identity, position and the economy block are fixed at construction. Population, storage
 * and collection radius are mutable and stored as given: the integrity layer is responsible
 * for repairing values that arrive out of range from external input.
 * {@link #setStored(ResourceType, double)} keeps {@code storage} and {@code economy.stock} in sync;
 * writes through {@link #getStorage()} bypass that mirror.
 */
public final class Village {

    /** Population of a freshly founded village. */
    public static final double FOUNDING_POPULATION = 10.0;

    private final String id;
    private final int x;
    private final int y;
    private final ResourceAmounts storage;
    private final Economy economy;
    private final ArrayDeque<Double> populationHistory = new ArrayDeque<>();
    private double population;
    private int collectionRadius;
    private long lastUpdateTime;
    private int starvationTicks;

    /**
     * Creates a village.
     *
     * @param id               identity used in logs and error records; must not be blank.
     * @param x                column on the terrain grid.
     * @param y                row on the terrain grid.
     * @param population       initial population.
     * @param storage          initial storage, copied; the stock mirror starts equal to it.
     * @param collectionRadius harvest radius in tiles, must be positive.
     * @param stockCapacity    initial storage capacity.
     */
    public Village(String id, int x, int y, double population, ResourceAmounts storage,
                   int collectionRadius, double stockCapacity) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Village id must not be blank");
        }
        if (storage == null) {
            throw new IllegalArgumentException("Storage must not be null");
        }
        if (collectionRadius <= 0) {
            throw new IllegalArgumentException("Collection radius must be positive, got " + collectionRadius);
        }
        this.id = id;
        this.x = x;
        this.y = y;
        this.population = population;
        this.storage = storage.copy();
        this.collectionRadius = collectionRadius;
        this.economy = new Economy(stockCapacity);
        this.economy.getStock().copyFrom(this.storage);
    }

    /**
     * Founds a new village at the given position with the standard starting population and supplies.
     *
     * @param x             column.
     * @param y             row.
     * @param stockCapacity initial storage capacity.
     * @return the new village, identified as {@code "x,y"}.
     */
    public static Village founded(int x, int y, double stockCapacity) {
        return new Village(idFor(x, y), x, y, FOUNDING_POPULATION, ResourceAmounts.of(5, 5, 2), 1, stockCapacity);
    }

    /**
     * @return the canonical identity of a village at {@code (x, y)}.
     */
    public static String idFor(int x, int y) {
        return x + "," + y;
    }

    public String getId() {
        return id;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public double getPopulation() {
        return population;
    }

    public void setPopulation(double population) {
        this.population = population;
    }

    /**
     * @return the raw storage. Prefer {@link #setStored(ResourceType, double)} for writes.
     */
    public ResourceAmounts getStorage() {
        return storage;
    }

    public double getStored(ResourceType r) {
        return storage.get(r);
    }

    /**
     * Sets a storage value and mirrors it into the economy stock.
     *
     * @param r     the resource.
     * @param value the new amount.
     */
    public void setStored(ResourceType r, double value) {
        storage.set(r, value);
        economy.getStock().set(r, value);
    }

    /**
     * Copies every storage value into the economy stock.
     */
    public void syncStockFromStorage() {
        economy.getStock().copyFrom(storage);
    }

    public int getCollectionRadius() {
        return collectionRadius;
    }

    public void setCollectionRadius(int collectionRadius) {
        this.collectionRadius = collectionRadius;
    }

    public Economy getEconomy() {
        return economy;
    }

    public long getLastUpdateTime() {
        return lastUpdateTime;
    }

    public void setLastUpdateTime(long lastUpdateTime) {
        this.lastUpdateTime = lastUpdateTime;
    }

    public int getStarvationTicks() {
        return starvationTicks;
    }

    public void setStarvationTicks(int starvationTicks) {
        this.starvationTicks = starvationTicks;
    }

    /**
     * Appends a population sample, dropping the oldest once the history is full.
     *
     * @param value the population to record.
     */
    public void recordPopulation(double value) {
        populationHistory.addLast(value);
        while (populationHistory.size() > Config.POPULATION_HISTORY_SIZE) {
            populationHistory.removeFirst();
        }
    }

    /**
     * @return the population history, oldest first.
     */
    public List<Double> getPopulationHistory() {
        return Collections.unmodifiableList(new ArrayList<>(populationHistory));
    }

    /**
     * Replaces the history, e.g. when loading externally supplied state. Only the newest entries are kept.
     *
     * @param history samples, oldest first.
     */
    public void replacePopulationHistory(List<Double> history) {
        populationHistory.clear();
        for (Double value : history) {
            recordPopulation(value);
        }
    }

    /**
     * @param other another village.
     * @return the Euclidean distance between both positions.
     */
    public double distanceTo(Village other) {
        double dx = (double) x - other.x;
        double dy = (double) y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return "Village{" + id + ", population=" + population + ", storage=" + storage
                + ", radius=" + collectionRadius + "}";
    }
}
