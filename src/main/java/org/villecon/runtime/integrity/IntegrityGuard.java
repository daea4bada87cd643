package org.villecon.runtime.integrity;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.model.BuildingState;
import org.villecon.runtime.model.Economy;
import org.villecon.runtime.model.ResourceAmounts;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps village state numerically sound.
 * <p>
 * {@link #validate(Village)} reports invariant violations without touching the village,
 * {@link #correct(Village)} repairs them by clamping or substituting safe defaults, and
 * {@link #attempt(Supplier, String, String)} runs a fallible computation and turns exceptions,
 * {@code null} and non-finite numbers into a failed {@link CalculationResult}. Every repair and
 * failure is appended to the shared {@link EconomyErrorLog}.
 */
public class IntegrityGuard {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrityGuard.class);

    private static final double MIRROR_TOLERANCE = 1e-9;

    private final IntegrityLimits limits;
    private final EconomyParameters parameters;
    private final EconomyErrorLog errorLog;

    public IntegrityGuard(IntegrityLimits limits, EconomyParameters parameters, EconomyErrorLog errorLog) {
        this.limits = limits;
        this.parameters = parameters;
        this.errorLog = errorLog;
    }

    public IntegrityLimits getLimits() {
        return limits;
    }

    public EconomyErrorLog getErrorLog() {
        return errorLog;
    }

    /**
     * Checks every invariant of a village without modifying it.
     *
     * @param village the village to inspect.
     * @return the validation outcome.
     */
    public ValidationResult validate(Village village) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        try {
            checkRange(errors, "population", village.getPopulation(), 0, limits.maxPopulation());
            Economy economy = village.getEconomy();
            for (ResourceType r : ResourceType.values()) {
                double stored = village.getStored(r);
                double stock = economy.getStock().get(r);
                checkRange(errors, "storage." + r.key(), stored, 0, limits.maxResource());
                checkRange(errors, "stock." + r.key(), stock, 0, limits.maxResource());
                if (Double.isFinite(stored) && Double.isFinite(stock) && Math.abs(stored - stock) > MIRROR_TOLERANCE) {
                    errors.add("stock." + r.key() + " (" + stock + ") does not match storage (" + stored + ")");
                }
                checkRange(errors, "production." + r.key(), economy.getProduction().get(r), 0, limits.maxRate());
                checkRange(errors, "consumption." + r.key(), economy.getConsumption().get(r), 0, limits.maxRate());
            }
            checkRange(errors, "stock.capacity", economy.getStockCapacity(), 0, limits.maxStockCapacity());

            BuildingState buildings = economy.getBuildings();
            checkRange(errors, "buildings.count", buildings.getCount(), 0, limits.maxBuildings());
            checkRange(errors, "buildings.targetCount", buildings.getTargetCount(), 0, limits.maxBuildings());
            checkRange(errors, "buildings.constructionQueue", buildings.getConstructionQueue(), 0,
                    limits.maxConstructionQueue());
            checkRange(errors, "buildings.constructionProgress", buildings.getConstructionProgress(), 0, Double.MAX_VALUE);
            checkRange(errors, "collectionRadius", village.getCollectionRadius(), 1, limits.maxCollectionRadius());

            for (Double sample : village.getPopulationHistory()) {
                if (sample == null || !Double.isFinite(sample)) {
                    errors.add("populationHistory contains a non-finite entry");
                    break;
                }
            }

            if (buildings.getCount() > village.getPopulation()) {
                warnings.add("buildings.count (" + buildings.getCount() + ") exceeds population (" + village.getPopulation() + ")");
            }
            double foodProduction = economy.getProduction().get(ResourceType.FOOD);
            double foodConsumption = economy.getConsumption().get(ResourceType.FOOD);
            if (foodProduction > 0 && foodConsumption > foodProduction * 10) {
                warnings.add("food consumption is more than ten times production");
            }
        } catch (RuntimeException e) {
            errorLog.record(ErrorCategory.VALIDATION, village.getId(), "validate", e.toString());
            errors.add("validation failed: " + e.getMessage());
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /**
     * Repairs every invariant violation of a village in place.
     * <p>
     * Non-finite values are replaced by defaults (population 1, amounts and rates 0, capacity the
     * base capacity plus building bonus, radius 1); out-of-range values are clamped. The stock is
     * re-synchronised from storage afterwards.
     *
     * @param village the village to repair.
     * @return {@code true} if anything was changed.
     */
    public boolean correct(Village village) {
        String id = village.getId();
        boolean changed = false;

        double population = village.getPopulation();
        double fixedPopulation = Double.isFinite(population) && population >= 0
                ? Math.min(population, limits.maxPopulation())
                : IntegrityLimits.DEFAULT_POPULATION;
        if (fixedPopulation != population) {
            village.setPopulation(fixedPopulation);
            changed |= logCorrection(id, "population", population, fixedPopulation);
        }

        Economy economy = village.getEconomy();
        ResourceAmounts storage = village.getStorage();
        for (ResourceType r : ResourceType.values()) {
            changed |= clampAmount(id, "storage." + r.key(), storage, r, limits.maxResource());
            changed |= clampAmount(id, "production." + r.key(), economy.getProduction(), r, limits.maxRate());
            changed |= clampAmount(id, "consumption." + r.key(), economy.getConsumption(), r, limits.maxRate());
            double stock = economy.getStock().get(r);
            if (!(Math.abs(stock - storage.get(r)) <= MIRROR_TOLERANCE)) {
                economy.getStock().set(r, storage.get(r));
                changed |= logCorrection(id, "stock." + r.key(), stock, storage.get(r));
            } else if (stock != storage.get(r)) {
                economy.getStock().set(r, storage.get(r));
            }
        }

        BuildingState buildings = economy.getBuildings();
        int count = clampInt(buildings.getCount(), limits.maxBuildings());
        if (count != buildings.getCount()) {
            changed |= logCorrection(id, "buildings.count", buildings.getCount(), count);
            buildings.setCount(count);
        }
        int target = clampInt(buildings.getTargetCount(), limits.maxBuildings());
        if (target != buildings.getTargetCount()) {
            changed |= logCorrection(id, "buildings.targetCount", buildings.getTargetCount(), target);
            buildings.setTargetCount(target);
        }
        int queue = clampInt(buildings.getConstructionQueue(), limits.maxConstructionQueue());
        if (queue != buildings.getConstructionQueue()) {
            changed |= logCorrection(id, "buildings.constructionQueue", buildings.getConstructionQueue(), queue);
            buildings.setConstructionQueue(queue);
        }
        double progress = buildings.getConstructionProgress();
        if (!Double.isFinite(progress) || progress < 0) {
            buildings.setConstructionProgress(0.0);
            changed |= logCorrection(id, "buildings.constructionProgress", progress, 0.0);
        }

        double capacity = economy.getStockCapacity();
        double fixedCapacity = Double.isFinite(capacity)
                ? Math.max(0.0, Math.min(capacity, limits.maxStockCapacity()))
                : Math.min(parameters.storageCapacityFor(count), limits.maxStockCapacity());
        if (fixedCapacity != capacity) {
            economy.setStockCapacity(fixedCapacity);
            changed |= logCorrection(id, "stock.capacity", capacity, fixedCapacity);
        }

        int radius = village.getCollectionRadius();
        int fixedRadius = radius < 1 ? IntegrityLimits.DEFAULT_COLLECTION_RADIUS : Math.min(radius, limits.maxCollectionRadius());
        if (fixedRadius != radius) {
            village.setCollectionRadius(fixedRadius);
            changed |= logCorrection(id, "collectionRadius", radius, fixedRadius);
        }

        List<Double> history = village.getPopulationHistory();
        List<Double> cleaned = new ArrayList<>(history.size());
        for (Double sample : history) {
            if (sample != null && Double.isFinite(sample)) {
                cleaned.add(Math.max(0.0, Math.min(sample, limits.maxPopulation())));
            }
        }
        if (!cleaned.equals(history)) {
            village.replacePopulationHistory(cleaned);
            errorLog.record(ErrorCategory.DATA_INTEGRITY, id, "populationHistory", "removed or clamped invalid samples");
            changed = true;
        }

        return changed;
    }

    /**
     * Validates a village and repairs it if any invariant is violated.
     *
     * @param village the village to sanitise.
     * @return {@code true} if the village was changed.
     */
    public boolean sanitize(Village village) {
        ValidationResult result = validate(village);
        if (result.valid()) {
            return false;
        }
        LOG.debug("Village {} failed validation: {}", village.getId(), result.errors());
        return correct(village);
    }

    /**
     * Runs a computation, capturing exceptions, {@code null} results and non-finite numbers as failures.
     *
     * @param calculation the computation.
     * @param context     name of the operation, used in the error log.
     * @param villageId   affected village, may be {@code null}.
     * @param <T>         the result type.
     * @return the result of the computation.
     */
    public <T> CalculationResult<T> attempt(Supplier<T> calculation, String context, String villageId) {
        String failure;
        try {
            T value = calculation.get();
            failure = describeInvalid(value);
            if (failure == null) {
                return CalculationResult.success(value);
            }
        } catch (RuntimeException e) {
            failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }
        errorLog.record(ErrorCategory.CALCULATION, villageId, context, failure);
        LOG.warn("Calculation '{}' failed for village {}: {}", context, villageId, failure);
        return CalculationResult.failure(failure);
    }

    /**
     * Runs a computation and returns its result, or {@code fallback} if it fails.
     *
     * @param calculation the computation.
     * @param fallback    the value used when the computation fails.
     * @param context     name of the operation.
     * @param villageId   affected village, may be {@code null}.
     * @param <T>         the result type.
     * @return the computed value or the fallback.
     */
    public <T> T safeCalculation(Supplier<T> calculation, T fallback, String context, String villageId) {
        return attempt(calculation, context, villageId).orElse(fallback);
    }

    public <T> T safeCalculation(Supplier<T> calculation, T fallback, String context) {
        return safeCalculation(calculation, fallback, context, null);
    }

    /**
     * Re-initialises a village economy after an unrecoverable failure.
     * <p>
     * Production and consumption are zeroed, every status becomes balanced, the building target
     * and construction queue are cleared while completed buildings are kept, and the stock is
     * re-synchronised from storage with the base capacity.
     *
     * @param village the village to reset.
     */
    public void resetToDefaults(Village village) {
        Economy economy = village.getEconomy();
        economy.getProduction().clear();
        economy.getConsumption().clear();
        economy.resetStatus();
        BuildingState buildings = economy.getBuildings();
        buildings.setCount(clampInt(buildings.getCount(), limits.maxBuildings()));
        buildings.setTargetCount(0);
        buildings.setConstructionQueue(0);
        buildings.setConstructionProgress(0.0);
        ResourceAmounts storage = village.getStorage();
        for (ResourceType r : ResourceType.values()) {
            double value = storage.get(r);
            storage.set(r, Double.isFinite(value) ? Math.max(0.0, Math.min(value, limits.maxResource())) : 0.0);
        }
        village.syncStockFromStorage();
        economy.setStockCapacity(parameters.baseStorageCapacity());
        errorLog.record(ErrorCategory.STATE_INCONSISTENCY, village.getId(), "resetToDefaults",
                "economy reset to defaults");
        LOG.error("Economy of village {} reset to defaults", village.getId());
    }

    private boolean clampAmount(String villageId, String field, ResourceAmounts amounts, ResourceType r, double max) {
        double value = amounts.get(r);
        double fixed = Double.isFinite(value) ? Math.max(0.0, Math.min(value, max)) : 0.0;
        if (fixed == value) {
            return false;
        }
        amounts.set(r, fixed);
        return logCorrection(villageId, field, value, fixed);
    }

    private boolean logCorrection(String villageId, String field, double from, double to) {
        String message = field + " corrected from " + from + " to " + to;
        errorLog.record(ErrorCategory.DATA_INTEGRITY, villageId, field, message);
        LOG.warn("Village {}: {}", villageId, message);
        return true;
    }

    private static int clampInt(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    private static void checkRange(List<String> errors, String field, double value, double min, double max) {
        if (!Double.isFinite(value)) {
            errors.add(field + " is not a finite number: " + value);
        } else if (value < min) {
            errors.add(field + " (" + value + ") is below " + min);
        } else if (value > max) {
            errors.add(field + " (" + value + ") exceeds " + max);
        }
    }

    private static String describeInvalid(Object value) {
        if (value == null) {
            return "result is null";
        }
        if (value instanceof Number number && !Double.isFinite(number.doubleValue())) {
            return "result is not finite: " + number;
        }
        if (value instanceof ResourceAmounts amounts) {
            for (ResourceType r : ResourceType.values()) {
                if (!Double.isFinite(amounts.get(r))) {
                    return "result for " + r.key() + " is not finite: " + amounts.get(r);
                }
            }
        }
        return null;
    }
}
