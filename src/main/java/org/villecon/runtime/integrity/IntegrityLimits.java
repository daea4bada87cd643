package org.villecon.runtime.integrity;

import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Hard caps enforced by the {@link IntegrityGuard}.
 *
 * @param maxPopulation         upper bound of a village population.
 * @param maxResource           upper bound of any storage or stock value.
 * @param maxRate               upper bound of any production or consumption rate.
 * @param maxBuildings          upper bound of building count and target.
 * @param maxConstructionQueue  upper bound of buildings under construction.
 * @param maxCollectionRadius   upper bound of the collection radius.
 * @param maxStockCapacity      upper bound of the storage capacity.
 * @param errorLogSize          entries kept by the error log before the oldest are dropped.
 */
public record IntegrityLimits(
        double maxPopulation,
        double maxResource,
        double maxRate,
        int maxBuildings,
        int maxConstructionQueue,
        int maxCollectionRadius,
        double maxStockCapacity,
        int errorLogSize) {

    /** Population assigned when the stored value is unusable. */
    public static final double DEFAULT_POPULATION = 1.0;

    /** Collection radius assigned when the stored value is unusable. */
    public static final int DEFAULT_COLLECTION_RADIUS = 1;

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.of(
            "maxPopulation", 1000,
            "maxResource", 100000,
            "maxRate", 10000,
            "maxBuildings", 500,
            "maxConstructionQueue", 3,
            "maxCollectionRadius", 10,
            "maxStockCapacity", 200000,
            "errorLogSize", 1000
    ));

    public IntegrityLimits {
        if (!(maxPopulation >= 1) || !(maxResource > 0) || !(maxRate > 0) || !(maxStockCapacity > 0)
                || !Double.isFinite(maxPopulation) || !Double.isFinite(maxResource)
                || !Double.isFinite(maxRate) || !Double.isFinite(maxStockCapacity)) {
            throw new IllegalArgumentException("Integrity limits must be finite and positive");
        }
        if (maxBuildings < 0 || maxConstructionQueue < 0 || maxCollectionRadius < DEFAULT_COLLECTION_RADIUS) {
            throw new IllegalArgumentException("Integrity limits for buildings, queue and radius out of range");
        }
        if (errorLogSize <= 0) {
            throw new IllegalArgumentException("errorLogSize must be positive, got " + errorLogSize);
        }
    }

    public static IntegrityLimits defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Parses limits from a configuration block such as {@code villecon.integrity}.
     *
     * @param options the configuration block; missing keys use defaults.
     * @return the validated limits.
     */
    public static IntegrityLimits fromConfig(Config options) {
        Config c = options.withFallback(DEFAULTS);
        try {
            return new IntegrityLimits(
                    c.getDouble("maxPopulation"),
                    c.getDouble("maxResource"),
                    c.getDouble("maxRate"),
                    c.getInt("maxBuildings"),
                    c.getInt("maxConstructionQueue"),
                    c.getInt("maxCollectionRadius"),
                    c.getDouble("maxStockCapacity"),
                    c.getInt("errorLogSize"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for integrity limits: " + e.getMessage(), e);
        }
    }
}
