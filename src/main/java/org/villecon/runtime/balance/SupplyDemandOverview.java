package org.villecon.runtime.balance;

import java.util.List;
import java.util.Map;

import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;

/**
 * Result of {@link SupplyDemandClassifier#identifySupplyDemandVillages(java.util.Collection)}.
 *
 * @param shortageVillages villages with at least one resource in shortage or critical.
 * @param surplusVillages  villages with at least one resource in surplus.
 * @param criticalVillages villages with at least one critical resource.
 * @param balances         the per-resource comparison of all villages.
 */
public record SupplyDemandOverview(
        List<Village> shortageVillages,
        List<Village> surplusVillages,
        List<Village> criticalVillages,
        Map<ResourceType, BalanceComparison> balances) {
}
