package com.bomengine.engine;

import com.bomengine.domain.InventoryTransaction;
import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.domain.Recipe;
import com.bomengine.dto.BottleneckMaterial;
import com.bomengine.dto.BulkAvailabilityResponse;
import com.bomengine.dto.CapacityOverview;
import com.bomengine.dto.ProductionReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;

@Component
@RequiredArgsConstructor
public class ReportAggregator {

    private final AvailabilityCalculator availabilityCalculator;
    private final StockAlertEngine stockAlertEngine;

    /**
     * Current capacity of every BOM product that has an active recipe, plus the
     * materials that bind at least one of them.
     */
    public CapacityOverview computeCapacityOverview(List<Product> products, Executor executor) {
        List<Product> bomProducts = products.stream()
            .filter(p -> p.isBomManaged() && p.getActiveRecipe() != null)
            .toList();

        List<BulkAvailabilityResponse.Entry> entries = availabilityCalculator.computeBulkAvailability(bomProducts, executor);

        List<CapacityOverview.ProductCapacitySummary> capacities = new ArrayList<>();
        Map<UUID, BottleneckGroup> bottlenecks = new LinkedHashMap<>();
        for (BulkAvailabilityResponse.Entry entry : entries) {
            if (entry.isFailed()) {
                capacities.add(CapacityOverview.ProductCapacitySummary.builder()
                    .productId(entry.getProductId())
                    .productName(entry.getProductName())
                    .currentCapacity(0)
                    .error(entry.getError())
                    .build());
                continue;
            }
            BottleneckMaterial bottleneck = entry.getAvailability().getBottleneckMaterial();
            capacities.add(CapacityOverview.ProductCapacitySummary.builder()
                .productId(entry.getProductId())
                .productName(entry.getProductName())
                .currentCapacity(entry.getAvailableQuantity())
                .bottleneckMaterial(bottleneck != null ? bottleneck.getMaterialName() : null)
                .recipeName(entry.getAvailability().getRecipeName())
                .build());
            if (bottleneck != null) {
                bottlenecks.computeIfAbsent(bottleneck.getMaterialId(), id -> new BottleneckGroup(bottleneck))
                    .products.add(entry.getProductName());
            }
        }

        return CapacityOverview.builder()
            .totalBomProducts(bomProducts.size())
            .productCapacities(capacities)
            .criticalBottlenecks(bottlenecks.values().stream().map(BottleneckGroup::toDto).toList())
            .build();
    }

    public ProductionReport buildProductionReport(List<Product> products, List<Material> materials,
                                                  List<InventoryTransaction> history, int usageWindowDays,
                                                  int topN, Instant asOf, Executor executor) {
        List<Recipe> activeRecipes = products.stream()
            .map(Product::getActiveRecipe)
            .filter(r -> r != null && r.isActive())
            .toList();

        return ProductionReport.builder()
            .capacityOverview(computeCapacityOverview(products, executor))
            .alertDashboard(stockAlertEngine.computeDashboard(materials, activeRecipes, history, usageWindowDays, topN, asOf))
            .lowStockMaterialsInActiveRecipes(stockAlertEngine.findLowStockMaterialsInActiveRecipes(materials, products))
            .generatedAt(asOf)
            .build();
    }

    private static final class BottleneckGroup {
        private final UUID materialId;
        private final String materialName;
        private final List<String> products = new ArrayList<>();

        private BottleneckGroup(BottleneckMaterial bottleneck) {
            this.materialId = bottleneck.getMaterialId();
            this.materialName = bottleneck.getMaterialName();
        }

        private CapacityOverview.CriticalBottleneck toDto() {
            return CapacityOverview.CriticalBottleneck.builder()
                .materialId(materialId)
                .materialName(materialName)
                .affectsProducts(List.copyOf(products))
                .build();
        }
    }
}
