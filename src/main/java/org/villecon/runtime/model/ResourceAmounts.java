package org.villecon.runtime.model;

import java.util.Arrays;

/**
 * A mutable amount per {@link ResourceType}, used for storage, stock, production and consumption.
 * <p>
 * Values are stored verbatim; range checks are the responsibility of the integrity layer.
 */
public final class ResourceAmounts {

    private final double[] values = new double[ResourceType.values().length];

    /**
     * Creates an all-zero instance.
     */
    public ResourceAmounts() {
    }

    public ResourceAmounts(double food, double wood, double ore) {
        values[ResourceType.FOOD.ordinal()] = food;
        values[ResourceType.WOOD.ordinal()] = wood;
        values[ResourceType.ORE.ordinal()] = ore;
    }

    public static ResourceAmounts of(double food, double wood, double ore) {
        return new ResourceAmounts(food, wood, ore);
    }

    public double get(ResourceType type) {
        return values[type.ordinal()];
    }

    public void set(ResourceType type, double value) {
        values[type.ordinal()] = value;
    }

    public void add(ResourceType type, double delta) {
        values[type.ordinal()] += delta;
    }

    /**
     * Overwrites every value with the corresponding value of {@code other}.
     * @param other the source amounts.
     */
    public void copyFrom(ResourceAmounts other) {
        System.arraycopy(other.values, 0, values, 0, values.length);
    }

    public void clear() {
        Arrays.fill(values, 0.0);
    }

    public double total() {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    public ResourceAmounts copy() {
        ResourceAmounts copy = new ResourceAmounts();
        copy.copyFrom(this);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceAmounts that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("{food=%.3f, wood=%.3f, ore=%.3f}",
                get(ResourceType.FOOD), get(ResourceType.WOOD), get(ResourceType.ORE));
    }
}
