package org.villecon.runtime.balance;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.villecon.runtime.EconomyParameters;
import org.villecon.runtime.model.BalanceCategory;
import org.villecon.runtime.model.Economy;
import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.Village;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SupplyDemandClassifier}.
 */
public class SupplyDemandClassifierTest {

    private final SupplyDemandClassifier classifier = new SupplyDemandClassifier(EconomyParameters.defaults());

    /**
     * Builds a village whose stored status matches its figures, as after an economy update.
     */
    private Village village(int x, int y, ResourceType resource, double production, double consumption,
                            double stock) {
        Village village = Village.founded(x, y, 1_000);
        Economy economy = village.getEconomy();
        economy.getProduction().set(resource, production);
        economy.getConsumption().set(resource, consumption);
        village.setStored(resource, stock);
        classifier.evaluateVillageBalance(village).forEach(economy::setStatus);
        return village;
    }

    @Test
    @Tag("unit")
    void idleResourcesUseStockBands() {
        assertThat(classifier.classify(0, 0, 60)).isEqualTo(BalanceCategory.SURPLUS);
        assertThat(classifier.classify(3, 0, 30)).isEqualTo(BalanceCategory.BALANCED);
        assertThat(classifier.classify(0, 0, 10)).isEqualTo(BalanceCategory.SHORTAGE);
        assertThat(classifier.classify(0, 0, 5)).isEqualTo(BalanceCategory.CRITICAL);
        assertThat(classifier.classify(0, 0, 0)).isEqualTo(BalanceCategory.CRITICAL);
    }

    @Test
    @Tag("unit")
    void consumedResourcesUseRatioAndStockDays() {
        assertThat(classifier.classify(10, 10, 50)).isEqualTo(BalanceCategory.BALANCED);
        assertThat(classifier.classify(2, 10, 100)).isEqualTo(BalanceCategory.CRITICAL);
        assertThat(classifier.classify(10, 10, 5)).isEqualTo(BalanceCategory.CRITICAL);
        assertThat(classifier.classify(20, 10, 150)).isEqualTo(BalanceCategory.SURPLUS);
        assertThat(classifier.classify(20, 10, 100)).isEqualTo(BalanceCategory.BALANCED);
        assertThat(classifier.classify(5, 10, 30)).isEqualTo(BalanceCategory.SHORTAGE);
        assertThat(classifier.classify(5, 10, 60)).isEqualTo(BalanceCategory.BALANCED);
        assertThat(classifier.classify(Double.NaN, 10, 60)).isEqualTo(BalanceCategory.CRITICAL);
    }

    @Test
    @Tag("unit")
    void moreProductionNeverWorsensCategory() {
        double[] consumptions = {0.5, 2, 10, 40};
        double[] stocks = {0, 3, 25, 80, 400};
        for (double consumption : consumptions) {
            for (double stock : stocks) {
                BalanceCategory previous = BalanceCategory.CRITICAL;
                for (double production = 0; production <= 100; production += 0.25) {
                    BalanceCategory current = classifier.classify(production, consumption, stock);
                    assertThat(current.isWorseThan(previous))
                            .as("production %s consumption %s stock %s", production, consumption, stock)
                            .isFalse();
                    previous = current;
                }
            }
        }
    }

    @Test
    @Tag("unit")
    void describeReportsNetBalanceAndStockDays() {
        Village village = village(0, 0, ResourceType.FOOD, 12, 4, 20);

        VillageResourceBalance balance = classifier.describe(village, ResourceType.FOOD);

        assertThat(balance.category()).isEqualTo(BalanceCategory.BALANCED);
        assertThat(balance.netBalance()).isEqualTo(8.0);
        assertThat(balance.stockDays()).isEqualTo(5.0);
        assertThat(SupplyDemandClassifier.stockDays(10, 0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(SupplyDemandClassifier.stockDays(0, 0)).isZero();
    }

    @Test
    @Tag("unit")
    void evaluatesEveryResourceOfVillage() {
        Village village = village(0, 0, ResourceType.FOOD, 30, 10, 200);

        Map<ResourceType, BalanceCategory> status = classifier.evaluateVillageBalance(village);

        assertThat(status).containsEntry(ResourceType.FOOD, BalanceCategory.SURPLUS)
                .containsEntry(ResourceType.WOOD, BalanceCategory.CRITICAL)
                .containsEntry(ResourceType.ORE, BalanceCategory.CRITICAL);
        assertThat(classifier.hasResourceSurplus(village)).isTrue();
        assertThat(classifier.hasResourceShortage(village)).isFalse();
        assertThat(classifier.hasCriticalShortage(village)).isTrue();
    }

    @Test
    @Tag("unit")
    void statusQueriesReadStoredStatusNotFigures() {
        Village village = village(0, 0, ResourceType.FOOD, 1, 10, 2);
        village.getEconomy().resetStatus();
        village.getEconomy().setStatus(ResourceType.WOOD, BalanceCategory.SHORTAGE);

        assertThat(classifier.evaluateVillageBalance(village)).containsEntry(ResourceType.FOOD, BalanceCategory.CRITICAL);
        assertThat(classifier.hasResourceShortage(village)).isTrue();
        assertThat(classifier.hasCriticalShortage(village)).isFalse();
        assertThat(classifier.hasResourceSurplus(village)).isFalse();

        SupplyDemandOverview overview = classifier.identifySupplyDemandVillages(List.of(village));
        assertThat(overview.shortageVillages()).containsExactly(village);
        assertThat(overview.criticalVillages()).isEmpty();
    }

    @Test
    @Tag("unit")
    void comparisonBucketsVillagesByCategory() {
        Village rich = village(0, 0, ResourceType.FOOD, 30, 10, 200);
        Village poor = village(1, 1, ResourceType.FOOD, 5, 10, 30);
        Village starving = village(2, 2, ResourceType.FOOD, 1, 10, 2);

        BalanceComparison comparison = classifier.calculateResourceBalance(List.of(rich, poor, starving),
                ResourceType.FOOD);

        assertThat(comparison.get(BalanceCategory.SURPLUS)).extracting(VillageResourceBalance::village)
                .containsExactly(rich);
        assertThat(comparison.get(BalanceCategory.SHORTAGE)).extracting(VillageResourceBalance::village)
                .containsExactly(poor);
        assertThat(comparison.get(BalanceCategory.CRITICAL)).extracting(VillageResourceBalance::village)
                .containsExactly(starving);
        assertThat(comparison.get(BalanceCategory.BALANCED)).isEmpty();

        SupplyDemandOverview overview = classifier.identifySupplyDemandVillages(List.of(rich, poor, starving));
        assertThat(overview.surplusVillages()).containsExactly(rich);
        assertThat(overview.shortageVillages()).containsExactly(poor);
        assertThat(overview.criticalVillages()).containsExactly(rich, poor, starving);
        assertThat(overview.balances()).containsOnlyKeys(ResourceType.values());
    }

    @Test
    @Tag("unit")
    void suppliersAreRankedByDistanceDiscountedCapacity() {
        Village needy = village(0, 0, ResourceType.FOOD, 1, 10, 2);
        Village supplierA = village(3, 4, ResourceType.FOOD, 30, 10, 200);
        Village supplierB = village(1, 0, ResourceType.FOOD, 20, 10, 120);
        Village tooFar = village(20, 0, ResourceType.FOOD, 30, 10, 200);
        Village balanced = village(2, 0, ResourceType.FOOD, 10, 10, 50);

        List<SupplierCandidate> suppliers = classifier.findSuppliers(needy,
                List.of(needy, tooFar, supplierB, balanced, supplierA), ResourceType.FOOD);

        assertThat(suppliers).extracting(SupplierCandidate::village).containsExactly(supplierA, supplierB);
        assertThat(suppliers.get(0).distance()).isEqualTo(5.0);
        assertThat(suppliers.get(0).availableSupply()).isCloseTo(37.0, within(1e-9));
        assertThat(suppliers.get(0).supplyCapacity()).isCloseTo(18.5, within(1e-9));
        assertThat(suppliers.get(1).supplyCapacity()).isCloseTo(17.1, within(1e-9));
    }

    @Test
    @Tag("unit")
    void suppliersAreChosenByStoredStatus() {
        Village needy = village(0, 0, ResourceType.FOOD, 1, 10, 2);
        Village strongButFlagged = village(1, 0, ResourceType.FOOD, 10, 1, 100);
        strongButFlagged.getEconomy().setStatus(ResourceType.FOOD, BalanceCategory.CRITICAL);
        Village balancedButFlagged = village(2, 0, ResourceType.FOOD, 10, 10, 50);
        balancedButFlagged.getEconomy().setStatus(ResourceType.FOOD, BalanceCategory.SURPLUS);

        List<SupplierCandidate> suppliers = classifier.findSuppliers(needy,
                List.of(strongButFlagged, balancedButFlagged), ResourceType.FOOD);

        assertThat(suppliers).extracting(SupplierCandidate::village).containsExactly(balancedButFlagged);
        assertThat(suppliers.get(0).availableSupply()).isCloseTo(2.0, within(1e-9));
        assertThat(suppliers.get(0).supplyCapacity()).isCloseTo(1.6, within(1e-9));
        assertThat(classifier.findSuppliers(needy, List.of(strongButFlagged), ResourceType.FOOD)).isEmpty();
    }

    @Test
    @Tag("unit")
    void equalCapacityPrefersCloserSupplier() {
        Village needy = village(0, 0, ResourceType.WOOD, 0, 10, 0);
        Village near = village(0, 9, ResourceType.WOOD, 30, 10, 200);
        Village edge = village(0, 10, ResourceType.WOOD, 30, 10, 200);

        List<SupplierCandidate> suppliers = classifier.findSuppliers(needy, List.of(edge, near), ResourceType.WOOD);

        assertThat(suppliers).extracting(SupplierCandidate::village).containsExactly(near, edge);
        assertThat(suppliers.get(0).supplyCapacity()).isEqualTo(suppliers.get(1).supplyCapacity());
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveSearchDistance() {
        Village needy = village(0, 0, ResourceType.FOOD, 0, 10, 0);

        assertThatThrownBy(() -> classifier.findSuppliers(needy, List.of(), ResourceType.FOOD, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
