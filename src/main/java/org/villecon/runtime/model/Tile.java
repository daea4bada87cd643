package org.villecon.runtime.model;

/**
 * A single terrain cell with harvestable resources.
 * <p>
 * For every resource the tile holds the current and maximum amount, the depletion state
 * ({@code current / max}, 0 when the maximum is 0) and a recovery timer. Setting an amount
 * through {@link #setResource(ResourceType, double)} clamps it to {@code [0, max]} and
 * recomputes the depletion state, so {@code 0 <= current <= max} holds at all times.
 */
public final class Tile {

    private static final int RESOURCE_COUNT = ResourceType.values().length;

    private final TerrainType type;
    private final double[] resources = new double[RESOURCE_COUNT];
    private final double[] maxResources = new double[RESOURCE_COUNT];
    private final double[] depletionState = new double[RESOURCE_COUNT];
    private final double[] recoveryTimer = new double[RESOURCE_COUNT];
    private long lastHarvestTime;

    /**
     * Creates a tile that starts fully stocked.
     *
     * @param type     the terrain type.
     * @param capacity the maximum amount per resource; negative or non-finite values are treated as 0.
     */
    public Tile(TerrainType type, ResourceAmounts capacity) {
        this(type, capacity, capacity);
    }

    /**
     * Creates a tile with an explicit current stock.
     *
     * @param type         the terrain type.
     * @param initial      the current amount per resource, clamped to {@code [0, max]}.
     * @param capacity     the maximum amount per resource; negative or non-finite values are treated as 0.
     */
    public Tile(TerrainType type, ResourceAmounts initial, ResourceAmounts capacity) {
        if (type == null) {
            throw new IllegalArgumentException("Terrain type must not be null");
        }
        this.type = type;
        for (ResourceType r : ResourceType.values()) {
            double max = capacity.get(r);
            maxResources[r.ordinal()] = Double.isFinite(max) && max > 0 ? max : 0.0;
            setResource(r, initial.get(r));
        }
    }

    public TerrainType getType() {
        return type;
    }

    public double getResource(ResourceType r) {
        return resources[r.ordinal()];
    }

    public double getMaxResource(ResourceType r) {
        return maxResources[r.ordinal()];
    }

    public double getDepletionState(ResourceType r) {
        return depletionState[r.ordinal()];
    }

    public double getRecoveryTimer(ResourceType r) {
        return recoveryTimer[r.ordinal()];
    }

    public long getLastHarvestTime() {
        return lastHarvestTime;
    }

    /**
     * Sets the current amount of a resource, clamped to {@code [0, max]}. Non-finite values become 0.
     *
     * @param r      the resource.
     * @param amount the requested amount.
     * @return the amount actually stored.
     */
    public double setResource(ResourceType r, double amount) {
        int i = r.ordinal();
        double max = maxResources[i];
        double clamped = Double.isFinite(amount) ? Math.max(0.0, Math.min(max, amount)) : 0.0;
        resources[i] = clamped;
        depletionState[i] = max > 0 ? clamped / max : 0.0;
        return clamped;
    }

    public void setRecoveryTimer(ResourceType r, double value) {
        recoveryTimer[r.ordinal()] = value;
    }

    public void setLastHarvestTime(long tick) {
        this.lastHarvestTime = tick;
    }

    /**
     * @param r the resource.
     * @return {@code true} if the tile can never hold this resource.
     */
    public boolean isBarren(ResourceType r) {
        return maxResources[r.ordinal()] == 0.0;
    }

    @Override
    public String toString() {
        return "Tile{" + type.key() + ", food=" + resources[0] + "/" + maxResources[0]
                + ", wood=" + resources[1] + "/" + maxResources[1]
                + ", ore=" + resources[2] + "/" + maxResources[2] + "}";
    }
}
