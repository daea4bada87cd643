package org.villecon.runtime.model;

/**
 * Direction of a village's recent population history. Derived, never stored.
 */
public enum PopulationTrend {
    GROWING,
    STABLE,
    DECLINING
}
