package com.bomengine.engine;

import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.dto.CapacityOverview;
import com.bomengine.dto.ProductionReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executor;

import static com.bomengine.BomFixtures.AS_OF;
import static com.bomengine.BomFixtures.component;
import static com.bomengine.BomFixtures.dailyDeductions;
import static com.bomengine.BomFixtures.material;
import static com.bomengine.BomFixtures.product;
import static com.bomengine.BomFixtures.productWithoutRecipe;
import static com.bomengine.BomFixtures.simpleProduct;
import static org.assertj.core.api.Assertions.assertThat;

class ReportAggregatorTest {

    private final Executor direct = Runnable::run;
    private final AvailabilityCalculator availabilityCalculator = new AvailabilityCalculator();
    private final ReportAggregator aggregator =
        new ReportAggregator(availabilityCalculator, new StockAlertEngine(new UsageForecaster()));

    @Test
    void capacityOverview_groupsProductsByBottleneck() {
        Material cocoa = material("Cocoa", "10", "20");
        Material milk = material("Milk", "1000", "20");
        Product cake = product("Cake", component(cocoa, "1"), component(milk, "1"));
        Product drink = product("Drink", component(cocoa, "2"), component(milk, "1"));
        Product bread = product("Bread", component(milk, "5"));

        CapacityOverview overview = aggregator.computeCapacityOverview(
            List.of(cake, drink, bread, simpleProduct("Card"), productWithoutRecipe("Ghost")), direct);

        assertThat(overview.getTotalBomProducts()).isEqualTo(3);
        assertThat(overview.getProductCapacities())
            .extracting(CapacityOverview.ProductCapacitySummary::getCurrentCapacity)
            .containsExactly(10, 5, 200);
        assertThat(overview.getCriticalBottlenecks()).hasSize(2);
        assertThat(overview.getCriticalBottlenecks().get(0).getMaterialName()).isEqualTo("Cocoa");
        assertThat(overview.getCriticalBottlenecks().get(0).getAffectsProducts()).containsExactly("Cake", "Drink");
        assertThat(overview.getCriticalBottlenecks().get(1).getAffectsProducts()).containsExactly("Bread");
    }

    @Test
    void productionReport_composesOverviewDashboardAndLowStock() {
        Material cocoa = material("Cocoa", "10", "20");
        Material milk = material("Milk", "1000", "20");
        Product cake = product("Cake", component(cocoa, "1"), component(milk, "1"));

        ProductionReport report = aggregator.buildProductionReport(
            List.of(cake), List.of(cocoa, milk), dailyDeductions(milk, "10", 30), 30, 10, AS_OF, direct);

        assertThat(report.getCapacityOverview().getTotalBomProducts()).isEqualTo(1);
        assertThat(report.getAlertDashboard().getSummary().getActiveAlerts()).isEqualTo(1);
        assertThat(report.getAlertDashboard().getActiveAlerts().get(0).getActiveRecipeCount()).isEqualTo(1);
        assertThat(report.getLowStockMaterialsInActiveRecipes()).singleElement()
            .satisfies(m -> assertThat(m.getMaterialName()).isEqualTo("Cocoa"));
        assertThat(report.getGeneratedAt()).isEqualTo(AS_OF);
    }
}
