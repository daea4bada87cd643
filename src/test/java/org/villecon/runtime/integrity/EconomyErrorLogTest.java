package org.villecon.runtime.integrity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link EconomyErrorLog}.
 */
public class EconomyErrorLogTest {

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    @Tag("unit")
    void dropsOldestEntriesBeyondCapacity() {
        EconomyErrorLog log = new EconomyErrorLog(3);

        for (int i = 0; i < 5; i++) {
            log.record(ErrorCategory.CALCULATION, "v", "step" + i, "failed");
        }

        assertThat(log.size()).isEqualTo(3);
        assertThat(log.getTotalRecorded()).isEqualTo(5);
        assertThat(log.getErrors()).extracting(EconomyError::context).containsExactly("step2", "step3", "step4");
    }

    @Test
    @Tag("unit")
    void filtersByVillage() {
        EconomyErrorLog log = new EconomyErrorLog(10);
        log.record(ErrorCategory.DATA_INTEGRITY, "1,1", "population", "fixed");
        log.record(ErrorCategory.CALCULATION, null, "plugin", "failed");
        log.record(ErrorCategory.VALIDATION, "2,2", "validate", "failed");
        log.record(ErrorCategory.CALCULATION, "1,1", "harvest", "failed");

        assertThat(log.getVillageErrors("1,1")).extracting(EconomyError::context)
                .containsExactly("population", "harvest");
        assertThat(log.getVillageErrors("9,9")).isEmpty();
    }

    @Test
    @Tag("unit")
    void statisticsCountCategoriesVillagesAndRecentEntries() {
        MutableClock clock = new MutableClock();
        EconomyErrorLog log = new EconomyErrorLog(10, clock);
        log.record(ErrorCategory.DATA_INTEGRITY, "1,1", "population", "fixed");
        clock.advance(Duration.ofHours(2));
        log.record(ErrorCategory.CALCULATION, "1,1", "harvest", "failed");
        log.record(ErrorCategory.CALCULATION, null, "plugin", "failed");

        ErrorStatistics statistics = log.getStatistics();

        assertThat(statistics.totalErrors()).isEqualTo(3);
        assertThat(statistics.byCategory())
                .containsEntry(ErrorCategory.CALCULATION, 2)
                .containsEntry(ErrorCategory.DATA_INTEGRITY, 1)
                .containsEntry(ErrorCategory.VALIDATION, 0)
                .containsEntry(ErrorCategory.STATE_INCONSISTENCY, 0);
        assertThat(statistics.byVillage()).containsOnly(entry("1,1", 2));
        assertThat(statistics.recentErrors()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void clearKeepsLifetimeCounter() {
        EconomyErrorLog log = new EconomyErrorLog(10);
        log.record(ErrorCategory.CALCULATION, "v", "x", "failed");

        log.clear();

        assertThat(log.size()).isZero();
        assertThat(log.getStatistics().totalErrors()).isZero();
        assertThat(log.getTotalRecorded()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new EconomyErrorLog(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
