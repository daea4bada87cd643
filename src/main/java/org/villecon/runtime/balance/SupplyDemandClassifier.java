package org.villecon.runtime.balance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.villecon.runtime.Config;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.Economy;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;

/**
 * Classifies the supply situation of each resource and matches villages in need with suppliers.
 * <p>
 * With a positive consumption the category depends on the production/consumption ratio and on
 * how many time units the stock lasts:
 * <ul>
 *   <li>critical: ratio below the critical threshold, or less than one unit of stock;</li>
 *   <li>surplus: ratio at least the surplus threshold and more than ten units of stock;</li>
 *   <li>shortage: ratio below the shortage threshold and less than five units of stock;</li>
 *   <li>balanced otherwise.</li>
 * </ul>
 * Without consumption the ratio is undefined and fixed absolute stock bands apply instead.
 * For a fixed consumption and stock the category never worsens as production increases.
 * <p>
 * All queries are read-only over the villages passed in.
 */
public class SupplyDemandClassifier {

    private final EconomyParameters parameters;

    public SupplyDemandClassifier(EconomyParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Classifies one resource.
     *
     * @param production  production rate.
     * @param consumption consumption rate.
     * @param stock       current stock.
     * @return the balance category.
     */
    public BalanceCategory classify(double production, double consumption, double stock) {
        if (!(consumption > 0)) {
            if (stock > Config.IDLE_STOCK_SURPLUS_BAND) {
                return BalanceCategory.SURPLUS;
            }
            if (stock > Config.IDLE_STOCK_BALANCED_BAND) {
                return BalanceCategory.BALANCED;
            }
            if (stock > Config.IDLE_STOCK_SHORTAGE_BAND) {
                return BalanceCategory.SHORTAGE;
            }
            return BalanceCategory.CRITICAL;
        }

        double ratio = production / consumption;
        double stockDays = stock / consumption;
        if (!(ratio >= parameters.criticalThreshold()) || !(stockDays >= Config.CRITICAL_STOCK_DAYS)) {
            return BalanceCategory.CRITICAL;
        }
        if (ratio >= parameters.surplusThreshold() && stockDays > Config.SURPLUS_STOCK_DAYS) {
            return BalanceCategory.SURPLUS;
        }
        if (ratio < parameters.shortageThreshold() && stockDays < Config.SHORTAGE_STOCK_DAYS) {
            return BalanceCategory.SHORTAGE;
        }
        return BalanceCategory.BALANCED;
    }

    /**
     * Classifies every resource of a village from its current economy figures.
     *
     * @param village the village.
     * @return the category per resource.
     */
    public Map<ResourceType, BalanceCategory> evaluateVillageBalance(Village village) {
        Economy economy = village.getEconomy();
        Map<ResourceType, BalanceCategory> result = new EnumMap<>(ResourceType.class);
        for (ResourceType r : ResourceType.values()) {
            result.put(r, classify(economy.getProduction().get(r), economy.getConsumption().get(r), economy.getStock().get(r)));
        }
        return result;
    }

    /**
     * Describes the balance of one resource in one village.
     *
     * @param village  the village.
     * @param resource the resource.
     * @return the balance record.
     */
    public VillageResourceBalance describe(Village village, ResourceType resource) {
        Economy economy = village.getEconomy();
        double production = economy.getProduction().get(resource);
        double consumption = economy.getConsumption().get(resource);
        double stock = economy.getStock().get(resource);
        return new VillageResourceBalance(
                village,
                resource,
                classify(production, consumption, stock),
                production,
                consumption,
                stock,
                production - consumption,
                stockDays(stock, consumption));
    }

    /**
     * Buckets all villages by their category for one resource.
     *
     * @param villages the villages.
     * @param resource the resource.
     * @return the comparison.
     */
    public BalanceComparison calculateResourceBalance(Collection<Village> villages, ResourceType resource) {
        Map<BalanceCategory, List<VillageResourceBalance>> buckets = new EnumMap<>(BalanceCategory.class);
        for (BalanceCategory category : BalanceCategory.values()) {
            buckets.put(category, new ArrayList<>());
        }
        for (Village village : villages) {
            VillageResourceBalance balance = describe(village, resource);
            buckets.get(balance.category()).add(balance);
        }
        return new BalanceComparison(resource, buckets);
    }

    /**
     * Buckets all villages by category, for every resource.
     *
     * @param villages the villages.
     * @return the comparison per resource.
     */
    public Map<ResourceType, BalanceComparison> compareVillageBalances(Collection<Village> villages) {
        Map<ResourceType, BalanceComparison> result = new EnumMap<>(ResourceType.class);
        for (ResourceType r : ResourceType.values()) {
            result.put(r, calculateResourceBalance(villages, r));
        }
        return result;
    }

    /**
     * The {@code has*} queries read the status stored on the village by the last economy update,
     * not a fresh classification of its figures.
     *
     * @param village the village.
     * @return whether any resource is in shortage; critical resources do not count.
     */
    public boolean hasResourceShortage(Village village) {
        return village.getEconomy().getSupplyDemandStatus().containsValue(BalanceCategory.SHORTAGE);
    }

    public boolean hasResourceSurplus(Village village) {
        return village.getEconomy().getSupplyDemandStatus().containsValue(BalanceCategory.SURPLUS);
    }

    public boolean hasCriticalShortage(Village village) {
        return village.getEconomy().getSupplyDemandStatus().containsValue(BalanceCategory.CRITICAL);
    }

    /**
     * Splits villages into shortage, surplus and critical groups by their stored status and adds the
     * per-resource comparison. A village may appear in several groups.
     *
     * @param villages the villages.
     * @return the overview.
     */
    public SupplyDemandOverview identifySupplyDemandVillages(Collection<Village> villages) {
        List<Village> shortage = new ArrayList<>();
        List<Village> surplus = new ArrayList<>();
        List<Village> critical = new ArrayList<>();
        for (Village village : villages) {
            if (hasResourceShortage(village)) {
                shortage.add(village);
            }
            if (hasResourceSurplus(village)) {
                surplus.add(village);
            }
            if (hasCriticalShortage(village)) {
                critical.add(village);
            }
        }
        return new SupplyDemandOverview(List.copyOf(shortage), List.copyOf(surplus), List.copyOf(critical),
                compareVillageBalances(villages));
    }

    /**
     * Finds villages that can supply a resource to a village in need, using the configured search distance.
     *
     * @param needy      the village in shortage.
     * @param candidates potential suppliers; the needy village itself is ignored.
     * @param resource   the resource needed.
     * @return suppliers, best first.
     * @see #findSuppliers(Village, Collection, ResourceType, double)
     */
    public List<SupplierCandidate> findSuppliers(Village needy, Collection<Village> candidates, ResourceType resource) {
        return findSuppliers(needy, candidates, resource, parameters.supplierSearchDistance());
    }

    /**
     * Finds villages that can supply a resource to a village in need.
     * <p>
     * A candidate qualifies if its stored status for the resource is surplus and it lies within
     * {@code maxDistance}. Its spare amount is the production surplus plus a tenth of the stock
     * exceeding three units of consumption; the supply capacity discounts that amount linearly
     * with distance down to 10%. Candidates with no capacity are dropped.
     *
     * @param needy       the village in shortage.
     * @param candidates  potential suppliers; the needy village itself is ignored.
     * @param resource    the resource needed.
     * @param maxDistance maximum Euclidean distance, must be positive.
     * @return suppliers sorted by supply capacity descending, ties by distance ascending.
     */
    public List<SupplierCandidate> findSuppliers(Village needy, Collection<Village> candidates,
                                                 ResourceType resource, double maxDistance) {
        if (!(maxDistance > 0)) {
            throw new IllegalArgumentException("maxDistance must be positive, got " + maxDistance);
        }
        List<SupplierCandidate> result = new ArrayList<>();
        for (Village candidate : candidates) {
            if (candidate == needy || candidate.getId().equals(needy.getId())) {
                continue;
            }
            double distance = needy.distanceTo(candidate);
            if (distance > maxDistance) {
                continue;
            }
            Economy economy = candidate.getEconomy();
            if (economy.getStatus(resource) != BalanceCategory.SURPLUS) {
                continue;
            }
            double production = economy.getProduction().get(resource);
            double consumption = economy.getConsumption().get(resource);
            double stock = economy.getStock().get(resource);
            double available = Math.max(0.0, production - consumption)
                    + Math.max(0.0, stock - consumption * Config.SUPPLIER_RESERVE_DAYS) * Config.SUPPLIER_STOCK_SHARE;
            double capacity = available * Math.max(Config.SUPPLIER_MIN_DISTANCE_FACTOR, 1.0 - distance / maxDistance);
            if (capacity > 0) {
                result.add(new SupplierCandidate(candidate, distance, available, capacity));
            }
        }
        result.sort(Comparator.comparingDouble(SupplierCandidate::supplyCapacity).reversed()
                .thenComparingDouble(SupplierCandidate::distance));
        return result;
    }

    /**
     * @param stock       current stock.
     * @param consumption consumption rate.
     * @return the time units the stock lasts.
     */
    public static double stockDays(double stock, double consumption) {
        if (consumption > 0) {
            return stock / consumption;
        }
        return stock > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }
}
