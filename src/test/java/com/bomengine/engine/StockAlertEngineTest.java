package com.bomengine.engine;

import com.bomengine.domain.InventoryTransaction;
import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.domain.Recipe;
import com.bomengine.dto.ActiveAlertReport;
import com.bomengine.dto.AlertDashboard;
import com.bomengine.dto.AlertSeverity;
import com.bomengine.dto.LowStockMaterial;
import com.bomengine.dto.PredictiveAlertReport;
import com.bomengine.dto.PredictiveSeverity;
import com.bomengine.dto.ReorderPriority;
import com.bomengine.dto.ReorderReport;
import com.bomengine.dto.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.bomengine.BomFixtures.AS_OF;
import static com.bomengine.BomFixtures.component;
import static com.bomengine.BomFixtures.dailyDeductions;
import static com.bomengine.BomFixtures.material;
import static com.bomengine.BomFixtures.product;
import static org.assertj.core.api.Assertions.assertThat;

class StockAlertEngineTest {

    private final StockAlertEngine engine = new StockAlertEngine(new UsageForecaster());

    @Test
    void classify_severityBoundaries() {
        assertThat(engine.classify(material("A", "0", "20"))).isEqualTo(AlertSeverity.OUT_OF_STOCK);
        assertThat(engine.classify(material("B", "10", "20"))).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(engine.classify(material("C", "10.01", "20"))).isEqualTo(AlertSeverity.LOW);
        assertThat(engine.classify(material("D", "20", "20"))).isEqualTo(AlertSeverity.LOW);
        assertThat(engine.classify(material("E", "20.01", "20"))).isNull();
        assertThat(engine.classify(material("F", "5", "0"))).isNull();
    }

    @Test
    void activeAlerts_sortedWorstFirstWithFullSummary() {
        Material low = material("Low", "15", "20");
        Material out = material("Out", "0", "20");
        Material fine = material("Fine", "50", "20");
        Product cake = product("Cake", component(out, "1"), component(low, "1"));
        Product pie = product("Pie", component(out, "2"));
        List<Recipe> recipes = List.of(cake.getActiveRecipe(), pie.getActiveRecipe());

        ActiveAlertReport report = engine.computeActiveAlerts(List.of(low, out, fine), recipes);

        assertThat(report.getTotalAlerts()).isEqualTo(2);
        assertThat(report.getAlerts()).extracting(ActiveAlertReport.StockAlert::getSeverity)
            .containsExactly(AlertSeverity.OUT_OF_STOCK, AlertSeverity.LOW);
        assertThat(report.getAlerts().get(0).getActiveRecipeCount()).isEqualTo(2);
        assertThat(report.getAlerts().get(0).getActionRequired()).startsWith("URGENT");
        assertThat(report.getAlerts().get(1).getActiveRecipeCount()).isEqualTo(1);
        assertThat(report.getSeveritySummary())
            .containsEntry(AlertSeverity.OUT_OF_STOCK, 1L)
            .containsEntry(AlertSeverity.CRITICAL, 0L)
            .containsEntry(AlertSeverity.LOW, 1L);
    }

    @Test
    void predictiveAlerts_respectForecastHorizon() {
        Material butter = material("Butter", "50", "20");
        List<InventoryTransaction> history = dailyDeductions(butter, "2", 30);

        PredictiveAlertReport week = engine.computePredictiveAlerts(List.of(butter), history, 7, 30, AS_OF);
        PredictiveAlertReport month = engine.computePredictiveAlerts(List.of(butter), history, 30, 30, AS_OF);

        assertThat(week.getAlerts()).isEmpty();
        assertThat(month.getAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.getAverageDailyUsage()).isEqualTo(2.0);
            assertThat(alert.getDaysUntilStockout()).isEqualTo(25.0);
            assertThat(alert.getDaysUntilReorderLevel()).isEqualTo(15.0);
            assertThat(alert.getBasedOnUsageDays()).isEqualTo(30);
            assertThat(alert.getSeverity()).isEqualTo(PredictiveSeverity.WARNING);
            assertThat(alert.getPredictedStockoutDate()).isEqualTo(LocalDate.of(2025, 7, 25));
            assertThat(alert.getRecommendedReorderQuantity()).isEqualTo(60.0);
        });
        assertThat(month.getForecastPeriodDays()).isEqualTo(30);
    }

    @Test
    void predictiveAlerts_criticalWithinThreeDays_sortedByUrgency() {
        Material butter = material("Butter", "12", "20");
        Material yeast = material("Yeast", "4", "1");
        Material idle = material("Idle", "1", "10");
        List<InventoryTransaction> history = new ArrayList<>(dailyDeductions(butter, "2", 30));
        history.addAll(dailyDeductions(yeast, "2", 30));

        PredictiveAlertReport report = engine.computePredictiveAlerts(List.of(butter, yeast, idle), history, 7, 30, AS_OF);

        assertThat(report.getAlerts()).extracting(PredictiveAlertReport.PredictiveAlert::getMaterialName)
            .containsExactly("Yeast", "Butter");
        assertThat(report.getAlerts()).extracting(PredictiveAlertReport.PredictiveAlert::getSeverity)
            .containsExactly(PredictiveSeverity.CRITICAL, PredictiveSeverity.WARNING);
    }

    @Test
    void reorderRecommendations_rankedByDaysToStockout() {
        Material butter = material("Butter", "50", "20", "3");
        Material cream = material("Cream", "10", "5", "1");
        Material salt = material("Salt", "200", "20", "1");
        Material pepper = material("Pepper", "5", "20", "4");
        List<InventoryTransaction> history = new ArrayList<>();
        history.addAll(dailyDeductions(butter, "2", 30));
        history.addAll(dailyDeductions(cream, "2", 30));
        history.addAll(dailyDeductions(salt, "2", 30));

        ReorderReport report = engine.computeReorderRecommendations(
            List.of(butter, cream, salt, pepper), history, 30, 30, AS_OF);

        assertThat(report.getRecommendations()).extracting(ReorderReport.ReorderRecommendation::getMaterialName)
            .containsExactly("Cream", "Butter", "Pepper");
        ReorderReport.ReorderRecommendation creamLine = report.getRecommendations().get(0);
        assertThat(creamLine.getRecommendedOrderQuantity()).isEqualTo(50.0);
        assertThat(creamLine.getDaysToStockout()).isEqualTo(5.0);
        assertThat(creamLine.getPriority()).isEqualTo(ReorderPriority.URGENT);
        ReorderReport.ReorderRecommendation butterLine = report.getRecommendations().get(1);
        assertThat(butterLine.getRecommendedOrderQuantity()).isEqualTo(10.0);
        assertThat(butterLine.getEstimatedCost()).isEqualTo(30.0);
        assertThat(butterLine.getPriority()).isEqualTo(ReorderPriority.SOON);
        ReorderReport.ReorderRecommendation pepperLine = report.getRecommendations().get(2);
        assertThat(pepperLine.getDaysToStockout()).isNull();
        assertThat(pepperLine.getRecommendedOrderQuantity()).isZero();
        assertThat(pepperLine.getPriority()).isEqualTo(ReorderPriority.NORMAL);
        assertThat(report.getTotalEstimatedCost()).isEqualTo(80.0);
        assertThat(report.getPrioritySummary())
            .containsEntry(ReorderPriority.URGENT, 1L)
            .containsEntry(ReorderPriority.SOON, 1L)
            .containsEntry(ReorderPriority.NORMAL, 1L);
    }

    @Test
    void reorderRecommendations_outOfStockIsUrgent() {
        Material empty = material("Empty", "0", "10", "2");

        ReorderReport report = engine.computeReorderRecommendations(List.of(empty), List.of(), 30, 30, AS_OF);

        assertThat(report.getRecommendations()).singleElement()
            .satisfies(r -> assertThat(r.getPriority()).isEqualTo(ReorderPriority.URGENT));
    }

    @Test
    void dashboard_combinesReportsAndSlicesTopN() {
        Material out = material("Out", "0", "20");
        Material critical = material("Critical", "5", "20");
        Material butter = material("Butter", "4", "1");
        List<InventoryTransaction> history = dailyDeductions(butter, "2", 30);

        AlertDashboard dashboard = engine.computeDashboard(
            List.of(out, critical, butter), List.of(), history, 30, 1, AS_OF);

        assertThat(dashboard.getSummary().getActiveAlerts()).isEqualTo(2);
        assertThat(dashboard.getSummary().getOutOfStockCount()).isEqualTo(1);
        assertThat(dashboard.getSummary().getCriticalCount()).isEqualTo(1);
        assertThat(dashboard.getSummary().getPredictiveAlerts()).isEqualTo(1);
        assertThat(dashboard.getActiveAlerts()).hasSize(1);
        assertThat(dashboard.getActiveAlerts().get(0).getMaterialName()).isEqualTo("Out");
        assertThat(dashboard.getReorderRecommendations()).hasSize(1);
        assertThat(dashboard.getGeneratedAt()).isEqualTo(AS_OF);
    }

    @Test
    void dashboard_isIdempotent() {
        Material butter = material("Butter", "50", "20", "3");
        Material out = material("Out", "0", "20");
        List<InventoryTransaction> history = dailyDeductions(butter, "2", 30);

        AlertDashboard first = engine.computeDashboard(List.of(butter, out), List.of(), history, 30, 10, AS_OF);
        AlertDashboard second = engine.computeDashboard(List.of(butter, out), List.of(), history, 30, 10, AS_OF);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void lowStockInActiveRecipes_listsAffectedProducts() {
        Material critical = material("Critical", "5", "20");
        Material low = material("Low", "18", "20");
        Material unused = material("Unused", "0", "20");
        Material fine = material("Fine", "100", "20");
        Product cake = product("Cake", component(low, "1"), component(critical, "1"), component(fine, "1"));

        List<LowStockMaterial> result = engine.findLowStockMaterialsInActiveRecipes(
            List.of(critical, low, unused, fine), List.of(cake));

        assertThat(result).extracting(LowStockMaterial::getMaterialName).containsExactly("Critical", "Low");
        assertThat(result).extracting(LowStockMaterial::getPriority).containsExactly(RiskLevel.HIGH, RiskLevel.MEDIUM);
        assertThat(result.get(0).getAffectedProducts()).singleElement()
            .satisfies(p -> assertThat(p.getProductName()).isEqualTo("Cake"));
    }
}
