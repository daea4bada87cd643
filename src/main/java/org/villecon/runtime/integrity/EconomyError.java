package org.villecon.runtime.integrity;

import java.time.Instant;

/**
 * A single entry of the {@link EconomyErrorLog}.
 *
 * @param timestamp when the error was recorded.
 * @param category  the error category.
 * @param villageId the affected village, or {@code null} if not village-specific.
 * @param context   the operation or field involved, e.g. {@code "calculateProduction"} or {@code "population"}.
 * @param message   human-readable description.
 */
public record EconomyError(
        Instant timestamp,
        ErrorCategory category,
        String villageId,
        String context,
        String message) {
}
