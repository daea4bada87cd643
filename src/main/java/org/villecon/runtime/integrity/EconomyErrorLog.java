package org.villecon.runtime.integrity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, append-only log of economy errors.
 * <p>
 * When the configured size is exceeded, the oldest entries are dropped. The log is safe to
 * read from other threads while the simulation appends to it.
 */
public class EconomyErrorLog {

    static final Duration RECENT_WINDOW = Duration.ofHours(1);

    private final ConcurrentLinkedDeque<EconomyError> errors = new ConcurrentLinkedDeque<>();
    private final AtomicLong totalRecorded = new AtomicLong();
    private final int maxErrors;
    private final Clock clock;

    public EconomyErrorLog(int maxErrors) {
        this(maxErrors, Clock.systemUTC());
    }

    public EconomyErrorLog(int maxErrors, Clock clock) {
        if (maxErrors <= 0) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
        this.maxErrors = maxErrors;
        this.clock = clock;
    }

    /**
     * Appends an error.
     *
     * @param category  the error category.
     * @param villageId the affected village, may be {@code null}.
     * @param context   the operation or field involved.
     * @param message   human-readable description.
     */
    public void record(ErrorCategory category, String villageId, String context, String message) {
        errors.add(new EconomyError(clock.instant(), category, villageId, context, message));
        totalRecorded.incrementAndGet();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    public List<EconomyError> getErrors() {
        return new ArrayList<>(errors);
    }

    /**
     * @param villageId the village identity.
     * @return the entries recorded for this village, oldest first.
     */
    public List<EconomyError> getVillageErrors(String villageId) {
        List<EconomyError> result = new ArrayList<>();
        for (EconomyError error : errors) {
            if (villageId.equals(error.villageId())) {
                result.add(error);
            }
        }
        return result;
    }

    public ErrorStatistics getStatistics() {
        Map<ErrorCategory, Integer> byCategory = new EnumMap<>(ErrorCategory.class);
        for (ErrorCategory category : ErrorCategory.values()) {
            byCategory.put(category, 0);
        }
        Map<String, Integer> byVillage = new LinkedHashMap<>();
        Instant recentSince = clock.instant().minus(RECENT_WINDOW);
        int total = 0;
        int recent = 0;
        for (EconomyError error : errors) {
            total++;
            byCategory.merge(error.category(), 1, Integer::sum);
            if (error.villageId() != null) {
                byVillage.merge(error.villageId(), 1, Integer::sum);
            }
            if (error.timestamp().isAfter(recentSince)) {
                recent++;
            }
        }
        return new ErrorStatistics(total, byCategory, byVillage, recent);
    }

    /**
     * @return the number of errors ever recorded, including dropped and cleared ones.
     */
    public long getTotalRecorded() {
        return totalRecorded.get();
    }

    public int size() {
        return errors.size();
    }

    public void clear() {
        errors.clear();
    }
}
