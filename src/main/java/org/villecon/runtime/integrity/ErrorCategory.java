package org.villecon.runtime.integrity;

/**
 * Classification of problems recorded in the {@link EconomyErrorLog}.
 */
public enum ErrorCategory {
    /** A numeric operation threw or produced a non-finite result. */
    CALCULATION("calculation"),
    /** A village field violated an invariant and was repaired. */
    DATA_INTEGRITY("data_integrity"),
    /** A village economy had to be reset to defaults. */
    STATE_INCONSISTENCY("state_inconsistency"),
    /** Validation itself failed. */
    VALIDATION("validation");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
