package org.villecon.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator-facing counters of the simulation loop.
 * <p>
 * Counts processed ticks, ticks that exceeded the processing budget and errors detected by the
 * integrity layer. The counters are informational only and never stop the simulation. They may
 * be read from any thread.
 */
public class TickHealthMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(TickHealthMonitor.class);

    private final long budgetNanos;
    private final AtomicLong ticksProcessed = new AtomicLong();
    private final AtomicLong slowTicks = new AtomicLong();
    private final AtomicLong errorsDetected = new AtomicLong();
    private final AtomicLong lastTickNanos = new AtomicLong();
    private final AtomicLong maxTickNanos = new AtomicLong();

    public TickHealthMonitor(Duration tickBudget) {
        if (tickBudget.isNegative() || tickBudget.isZero()) {
            throw new IllegalArgumentException("Tick budget must be positive, got " + tickBudget);
        }
        this.budgetNanos = tickBudget.toNanos();
    }

    /**
     * Records a processed tick.
     *
     * @param tick           the tick number.
     * @param elapsedNanos   wall-clock processing time.
     * @param errorsInTick   errors the integrity layer recorded during the tick.
     */
    public void recordTick(long tick, long elapsedNanos, long errorsInTick) {
        ticksProcessed.incrementAndGet();
        lastTickNanos.set(elapsedNanos);
        maxTickNanos.accumulateAndGet(elapsedNanos, Math::max);
        if (elapsedNanos > budgetNanos) {
            slowTicks.incrementAndGet();
            LOG.warn("Tick {} took {} ms, exceeding the budget of {} ms",
                    tick, elapsedNanos / 1_000_000.0, budgetNanos / 1_000_000.0);
        }
        if (errorsInTick > 0) {
            errorsDetected.addAndGet(errorsInTick);
        }
    }

    public long getTicksProcessed() {
        return ticksProcessed.get();
    }

    public long getSlowTicks() {
        return slowTicks.get();
    }

    public long getErrorsDetected() {
        return errorsDetected.get();
    }

    /**
     * @return {@code true} while no error has been detected. Slow ticks do not affect health.
     */
    public boolean isHealthy() {
        return errorsDetected.get() == 0;
    }

    /**
     * Returns the current counters.
     * <ul>
     *   <li>ticks_processed</li>
     *   <li>slow_ticks</li>
     *   <li>errors_detected</li>
     *   <li>last_tick_ms</li>
     *   <li>max_tick_ms</li>
     * </ul>
     *
     * @return metric names mapped to their values, in a stable order.
     */
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("ticks_processed", ticksProcessed.get());
        metrics.put("slow_ticks", slowTicks.get());
        metrics.put("errors_detected", errorsDetected.get());
        metrics.put("last_tick_ms", lastTickNanos.get() / 1_000_000.0);
        metrics.put("max_tick_ms", maxTickNanos.get() / 1_000_000.0);
        return metrics;
    }

    public void reset() {
        ticksProcessed.set(0);
        slowTicks.set(0);
        errorsDetected.set(0);
        lastTickNanos.set(0);
        maxTickNanos.set(0);
    }
}
