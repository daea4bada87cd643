package org.villecon.runtime.balance;

import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;

/**
 * Balance of one resource in one village, as used for cross-village ranking.
 *
 * @param village     the village.
 * @param resource    the resource.
 * @param category    the computed balance category.
 * @param production  production rate.
 * @param consumption consumption rate.
 * @param stock       current stock.
 * @param netBalance  {@code production - consumption}.
 * @param stockDays   time units the stock lasts at the current consumption; positive infinity
 *                    when nothing is consumed but something is stored, 0 when both are 0.
 */
public record VillageResourceBalance(
        Village village,
        ResourceType resource,
        BalanceCategory category,
        double production,
        double consumption,
        double stock,
        double netBalance,
        double stockDays) {
}
