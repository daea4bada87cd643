package org.villecon.runtime.balance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.ResourceType;

/**
 * All villages bucketed by their balance category for a single resource.
 *
 * @param resource the resource compared.
 * @param buckets  the balances per category; every category is present, possibly empty.
 */
public record BalanceComparison(ResourceType resource, Map<BalanceCategory, List<VillageResourceBalance>> buckets) {

    public BalanceComparison {
        Map<BalanceCategory, List<VillageResourceBalance>> copy = new EnumMap<>(BalanceCategory.class);
        for (BalanceCategory category : BalanceCategory.values()) {
            copy.put(category, List.copyOf(buckets.getOrDefault(category, List.of())));
        }
        buckets = Collections.unmodifiableMap(copy);
    }

    /**
     * @param category the category.
     * @return the villages in that category, in input order.
     */
    public List<VillageResourceBalance> get(BalanceCategory category) {
        return buckets.get(category);
    }
}
