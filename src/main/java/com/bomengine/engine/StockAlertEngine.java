package com.bomengine.engine;

import com.bomengine.domain.InventoryTransaction;
import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.domain.Recipe;
import com.bomengine.domain.StockStatus;
import com.bomengine.dto.ActiveAlertReport;
import com.bomengine.dto.AlertDashboard;
import com.bomengine.dto.AlertSeverity;
import com.bomengine.dto.LowStockMaterial;
import com.bomengine.dto.PredictiveAlertReport;
import com.bomengine.dto.PredictiveSeverity;
import com.bomengine.dto.ReorderPriority;
import com.bomengine.dto.ReorderReport;
import com.bomengine.dto.RiskLevel;
import com.bomengine.dto.UsageProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a tenant's material snapshot (plus usage history) into active alerts,
 * predictive stockout alerts and reorder recommendations.
 */
@Component
@RequiredArgsConstructor
public class StockAlertEngine {

    public static final int DEFAULT_FORECAST_DAYS = 7;
    public static final int DEFAULT_TARGET_DAYS_OF_STOCK = 30;

    private static final double CRITICAL_STOCKOUT_DAYS = 3.0;
    private static final double URGENT_STOCKOUT_DAYS = 7.0;

    private final UsageForecaster usageForecaster;

    public AlertSeverity classify(Material material) {
        StockStatus status = material.getStockStatus();
        return switch (status) {
            case OUT_OF_STOCK -> AlertSeverity.OUT_OF_STOCK;
            case CRITICAL -> AlertSeverity.CRITICAL;
            case LOW -> AlertSeverity.LOW;
            case NORMAL -> null;
        };
    }

    public ActiveAlertReport computeActiveAlerts(List<Material> materials, List<Recipe> activeRecipes) {
        List<ActiveAlertReport.StockAlert> alerts = new ArrayList<>();
        for (Material material : materials) {
            AlertSeverity severity = classify(material);
            if (severity == null) {
                continue;
            }
            int recipeCount = (int) activeRecipes.stream()
                .filter(r -> r.isActive() && r.usesMaterial(material.getId()))
                .count();
            alerts.add(ActiveAlertReport.StockAlert.builder()
                .materialId(material.getId())
                .materialName(material.getName())
                .sku(material.getSku())
                .category(material.getCategory())
                .unit(material.getUnit())
                .severity(severity)
                .currentStock(material.getStockQuantity())
                .reorderLevel(material.getReorderLevel())
                .activeRecipeCount(recipeCount)
                .message(alertMessage(material, severity, recipeCount))
                .actionRequired(actionRequired(severity, recipeCount))
                .build());
        }

        alerts.sort(Comparator.comparing(ActiveAlertReport.StockAlert::getSeverity)
            .thenComparing(a -> a.getMaterialId().toString()));

        Map<AlertSeverity, Long> summary = new EnumMap<>(AlertSeverity.class);
        for (AlertSeverity severity : AlertSeverity.values()) {
            summary.put(severity, alerts.stream().filter(a -> a.getSeverity() == severity).count());
        }

        return ActiveAlertReport.builder()
            .alerts(alerts)
            .totalAlerts(alerts.size())
            .severitySummary(summary)
            .build();
    }

    public PredictiveAlertReport computePredictiveAlerts(List<Material> materials, List<InventoryTransaction> history,
                                                         int forecastDays, int usageWindowDays, Instant asOf) {
        List<PredictiveAlertReport.PredictiveAlert> alerts = new ArrayList<>();
        for (Material material : materials) {
            UsageProfile usage = usageForecaster.profile(material, history, usageWindowDays, asOf);
            if (!usage.hasUsage()) {
                continue;
            }
            double average = usage.getAverageDailyUsage();
            double daysToStockout = usageForecaster.projectDaysToStockout(material, average);
            if (daysToStockout > forecastDays) {
                continue;
            }
            alerts.add(PredictiveAlertReport.PredictiveAlert.builder()
                .materialId(material.getId())
                .materialName(material.getName())
                .sku(material.getSku())
                .unit(material.getUnit())
                .currentStock(material.getStockQuantity())
                .reorderLevel(material.getReorderLevel())
                .averageDailyUsage(round(average))
                .basedOnUsageDays(usage.getObservedDays())
                .daysUntilStockout(round(daysToStockout))
                .daysUntilReorderLevel(round(usageForecaster.projectDaysToReorderLevel(material, average)))
                .predictedStockoutDate(LocalDate.ofInstant(asOf, ZoneOffset.UTC).plusDays((long) Math.floor(daysToStockout)))
                .severity(daysToStockout <= CRITICAL_STOCKOUT_DAYS ? PredictiveSeverity.CRITICAL : PredictiveSeverity.WARNING)
                .recommendedReorderQuantity(round(average * usageWindowDays))
                .message(String.format(Locale.ROOT, "Will run out in %.1f days at current usage rate", daysToStockout))
                .build());
        }

        alerts.sort(Comparator.comparingDouble(PredictiveAlertReport.PredictiveAlert::getDaysUntilStockout)
            .thenComparing(a -> a.getMaterialId().toString()));

        return PredictiveAlertReport.builder()
            .alerts(alerts)
            .totalAlerts(alerts.size())
            .forecastPeriodDays(forecastDays)
            .usageWindowDays(usageWindowDays)
            .generatedAt(asOf)
            .build();
    }

    public ReorderReport computeReorderRecommendations(List<Material> materials, List<InventoryTransaction> history,
                                                       int targetDaysOfStock, int usageWindowDays, Instant asOf) {
        List<Ranked> ranked = new ArrayList<>();
        for (Material material : materials) {
            double average = usageForecaster.computeAverageDailyUsage(material, history, usageWindowDays, asOf);
            double stock = material.getStockQuantity().doubleValue();
            double quantity = Math.max(0.0, targetDaysOfStock * average - stock);
            if (quantity <= 0.0 && classify(material) == null) {
                continue;
            }
            double daysToStockout = usageForecaster.projectDaysToStockout(material, average);
            double unitCost = BatchPlanner.unitCostOf(material).doubleValue();
            ranked.add(new Ranked(daysToStockout, ReorderReport.ReorderRecommendation.builder()
                .materialId(material.getId())
                .materialName(material.getName())
                .sku(material.getSku())
                .supplier(material.getSupplier())
                .category(material.getCategory())
                .unit(material.getUnit())
                .currentStock(material.getStockQuantity())
                .reorderLevel(material.getReorderLevel())
                .averageDailyUsage(round(average))
                .daysToStockout(Double.isInfinite(daysToStockout) ? null : round(daysToStockout))
                .recommendedOrderQuantity(round(quantity))
                .unitCost(material.getUnitCost())
                .estimatedCost(round(quantity * unitCost))
                .priority(priority(material, daysToStockout, targetDaysOfStock))
                .build()));
        }

        List<ReorderReport.ReorderRecommendation> recommendations = ranked.stream()
            .sorted(Comparator.comparingDouble(Ranked::daysToStockout)
                .thenComparing(r -> r.recommendation().getMaterialId().toString()))
            .map(Ranked::recommendation)
            .toList();

        Map<ReorderPriority, Long> summary = new EnumMap<>(ReorderPriority.class);
        for (ReorderPriority priority : ReorderPriority.values()) {
            summary.put(priority, recommendations.stream().filter(r -> r.getPriority() == priority).count());
        }
        double totalCost = recommendations.stream().mapToDouble(ReorderReport.ReorderRecommendation::getEstimatedCost).sum();

        return ReorderReport.builder()
            .recommendations(recommendations)
            .totalMaterials(recommendations.size())
            .totalEstimatedCost(round(totalCost))
            .targetDaysOfStock(targetDaysOfStock)
            .prioritySummary(summary)
            .generatedAt(asOf)
            .build();
    }

    public AlertDashboard computeDashboard(List<Material> materials, List<Recipe> activeRecipes,
                                           List<InventoryTransaction> history, int usageWindowDays,
                                           int topN, Instant asOf) {
        ActiveAlertReport active = computeActiveAlerts(materials, activeRecipes);
        PredictiveAlertReport predictive = computePredictiveAlerts(
            materials, history, DEFAULT_FORECAST_DAYS, usageWindowDays, asOf);
        ReorderReport reorder = computeReorderRecommendations(
            materials, history, DEFAULT_TARGET_DAYS_OF_STOCK, usageWindowDays, asOf);

        return AlertDashboard.builder()
            .summary(AlertDashboard.Summary.builder()
                .activeAlerts(active.getTotalAlerts())
                .predictiveAlerts(predictive.getTotalAlerts())
                .reorderRecommendations(reorder.getTotalMaterials())
                .outOfStockCount(active.getSeveritySummary().get(AlertSeverity.OUT_OF_STOCK))
                .criticalCount(active.getSeveritySummary().get(AlertSeverity.CRITICAL))
                .lowCount(active.getSeveritySummary().get(AlertSeverity.LOW))
                .build())
            .activeAlerts(top(active.getAlerts(), topN))
            .predictiveAlerts(top(predictive.getAlerts(), topN))
            .reorderRecommendations(top(reorder.getRecommendations(), topN))
            .totalReorderCost(reorder.getTotalEstimatedCost())
            .generatedAt(asOf)
            .build();
    }

    /**
     * Materials at or below reorder level that an active recipe depends on, most severe first.
     */
    public List<LowStockMaterial> findLowStockMaterialsInActiveRecipes(List<Material> materials, List<Product> products) {
        List<LowStockMaterial> result = new ArrayList<>();
        for (Material material : materials) {
            if (!material.isAtOrBelowReorderLevel()) {
                continue;
            }
            List<LowStockMaterial.AffectedProduct> affected = products.stream()
                .filter(p -> p.getActiveRecipe() != null && p.getActiveRecipe().isActive()
                    && p.getActiveRecipe().usesMaterial(material.getId()))
                .map(p -> LowStockMaterial.AffectedProduct.builder()
                    .productId(p.getId())
                    .productName(p.getName())
                    .recipeId(p.getActiveRecipe().getId())
                    .recipeName(p.getActiveRecipe().getName())
                    .build())
                .toList();
            if (affected.isEmpty()) {
                continue;
            }
            StockStatus status = material.getStockStatus();
            result.add(LowStockMaterial.builder()
                .materialId(material.getId())
                .materialName(material.getName())
                .unit(material.getUnit())
                .currentStock(material.getStockQuantity())
                .reorderLevel(material.getReorderLevel())
                .stockStatus(status)
                .priority(status == StockStatus.LOW ? RiskLevel.MEDIUM : RiskLevel.HIGH)
                .affectedProducts(affected)
                .build());
        }
        result.sort(Comparator.comparing(LowStockMaterial::getPriority)
            .thenComparing(LowStockMaterial::getStockStatus)
            .thenComparing(m -> m.getMaterialId().toString()));
        return result;
    }

    private ReorderPriority priority(Material material, double daysToStockout, int targetDaysOfStock) {
        if (material.getStockQuantity().signum() <= 0 || daysToStockout <= URGENT_STOCKOUT_DAYS) {
            return ReorderPriority.URGENT;
        }
        if (daysToStockout <= targetDaysOfStock) {
            return ReorderPriority.SOON;
        }
        return ReorderPriority.NORMAL;
    }

    private String alertMessage(Material material, AlertSeverity severity, int recipeCount) {
        String base = switch (severity) {
            case OUT_OF_STOCK -> "Material is completely out of stock";
            case CRITICAL -> "Stock is at or below half of reorder level (" + material.getReorderLevel() + " " + material.getUnit() + ")";
            case LOW -> "Stock is at or below reorder level (" + material.getReorderLevel() + " " + material.getUnit() + ")";
        };
        return recipeCount > 0 ? base + "; used in " + recipeCount + " active recipe(s)" : base;
    }

    private String actionRequired(AlertSeverity severity, int recipeCount) {
        if (severity == AlertSeverity.OUT_OF_STOCK) {
            return recipeCount > 0
                ? "URGENT: Production halted - immediate reorder required"
                : "Immediate reorder required";
        }
        if (recipeCount > 0) {
            return "Priority reorder - affects production";
        }
        return severity == AlertSeverity.CRITICAL ? "Reorder as soon as possible" : "Consider reordering soon";
    }

    private static <T> List<T> top(List<T> items, int n) {
        return items.size() <= n ? items : items.subList(0, n);
    }

    private static double round(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return value;
        }
        return Math.round(value * 10000.0) / 10000.0;
    }

    private record Ranked(double daysToStockout, ReorderReport.ReorderRecommendation recommendation) {}
}
