package org.villecon.runtime.integrity;

import java.util.Map;

/**
 * Aggregate view of the {@link EconomyErrorLog}.
 *
 * @param totalErrors  entries currently held in the log.
 * @param byCategory   entry count per category, every category present.
 * @param byVillage    entry count per village id, entries without a village omitted.
 * @param recentErrors entries recorded within the recent window (one hour).
 */
public record ErrorStatistics(
        int totalErrors,
        Map<ErrorCategory, Integer> byCategory,
        Map<String, Integer> byVillage,
        int recentErrors) {
}
