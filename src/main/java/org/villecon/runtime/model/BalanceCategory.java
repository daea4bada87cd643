package org.villecon.runtime.model;

/**
 * Supply/demand category of one resource in one village.
 * <p>
 * Constants are declared from worst to best so that {@link #compareTo(Enum)} and
 * {@link #isWorseThan(BalanceCategory)} reflect the ordering
 * {@code CRITICAL < SHORTAGE < BALANCED < SURPLUS}.
 */
public enum BalanceCategory {
    CRITICAL("critical"),
    SHORTAGE("shortage"),
    BALANCED("balanced"),
    SURPLUS("surplus");

    private final String label;

    BalanceCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @param other the category to compare with.
     * @return {@code true} if this category describes a strictly worse supply situation.
     */
    public boolean isWorseThan(BalanceCategory other) {
        return compareTo(other) < 0;
    }
}
