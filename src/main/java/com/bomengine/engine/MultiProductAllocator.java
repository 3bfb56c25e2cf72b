package com.bomengine.engine;

import com.bomengine.domain.Product;
import com.bomengine.domain.ProductionRequest;
import com.bomengine.dto.BatchRequirements;
import com.bomengine.dto.MaterialShortage;
import com.bomengine.dto.MultiProductPlan;
import com.bomengine.exception.BomEngineException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregates material demand across several production requests that share stock.
 * Feasibility is reported, never resolved: every plan entry keeps its requested quantity.
 */
@Component
@RequiredArgsConstructor
public class MultiProductAllocator {

    private final BatchPlanner batchPlanner;

    public MultiProductPlan planMultiProduct(List<ProductionRequest> requests) {
        Map<UUID, Demand> demandByMaterial = new LinkedHashMap<>();
        List<MultiProductPlan.PlanEntry> entries = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;

        for (ProductionRequest request : requests) {
            Product product = request.getProduct();
            BatchRequirements requirements;
            try {
                requirements = batchPlanner.computeBatchRequirements(product, request.getQuantity());
            } catch (BomEngineException ex) {
                entries.add(MultiProductPlan.PlanEntry.builder()
                    .productId(product.getId())
                    .productName(product.getName())
                    .quantity(request.getQuantity())
                    .canProduce(false)
                    .error(ex.getMessage())
                    .build());
                continue;
            }

            BigDecimal productCost = BigDecimal.ZERO;
            for (BatchRequirements.MaterialRequirement requirement : requirements.getMaterialRequirements()) {
                Demand demand = demandByMaterial.computeIfAbsent(requirement.getMaterialId(), id -> new Demand(requirement));
                demand.add(product, requirement.getTotalRequired());
                productCost = productCost.add(requirement.getTotalRequired().multiply(requirement.getUnitCost()));
            }
            totalCost = totalCost.add(productCost);

            entries.add(MultiProductPlan.PlanEntry.builder()
                .productId(product.getId())
                .productName(product.getName())
                .quantity(request.getQuantity())
                .canProduce(requirements.isCanProduce())
                .totalCost(BatchPlanner.money(productCost))
                .shortages(requirements.getShortages())
                .build());
        }

        Map<UUID, BigDecimal> aggregated = new LinkedHashMap<>();
        List<MultiProductPlan.AggregatedMaterialRequirement> lines = new ArrayList<>();
        List<MaterialShortage> shortages = new ArrayList<>();
        for (Map.Entry<UUID, Demand> entry : demandByMaterial.entrySet()) {
            Demand demand = entry.getValue();
            boolean sufficient = demand.totalRequired.compareTo(demand.currentStock) <= 0;
            aggregated.put(entry.getKey(), demand.totalRequired);
            lines.add(demand.toLine(sufficient));
            if (!sufficient) {
                shortages.add(MaterialShortage.builder()
                    .materialId(entry.getKey())
                    .materialName(demand.materialName)
                    .unit(demand.unit)
                    .currentStock(demand.currentStock)
                    .totalRequired(demand.totalRequired)
                    .shortage(demand.totalRequired.subtract(demand.currentStock))
                    .build());
            }
        }

        return MultiProductPlan.builder()
            .totalProducts(requests.size())
            .productionPlan(entries)
            .aggregatedMaterialRequirements(aggregated)
            .materialRequirements(lines)
            .materialShortages(shortages)
            .feasible(shortages.isEmpty())
            .totalProductionCost(BatchPlanner.money(totalCost))
            .build();
    }

    private static final class Demand {
        private final UUID materialId;
        private final String materialName;
        private final String unit;
        private final BigDecimal currentStock;
        private final BigDecimal unitCost;
        private final List<MultiProductPlan.ProductUsage> usedIn = new ArrayList<>();
        private BigDecimal totalRequired = BigDecimal.ZERO;

        private Demand(BatchRequirements.MaterialRequirement first) {
            this.materialId = first.getMaterialId();
            this.materialName = first.getMaterialName();
            this.unit = first.getUnit();
            this.currentStock = first.getCurrentStock();
            this.unitCost = first.getUnitCost();
        }

        private void add(Product product, BigDecimal required) {
            totalRequired = totalRequired.add(required);
            usedIn.add(MultiProductPlan.ProductUsage.builder()
                .productId(product.getId())
                .productName(product.getName())
                .quantityRequired(required)
                .build());
        }

        private MultiProductPlan.AggregatedMaterialRequirement toLine(boolean sufficient) {
            return MultiProductPlan.AggregatedMaterialRequirement.builder()
                .materialId(materialId)
                .materialName(materialName)
                .unit(unit)
                .currentStock(currentStock)
                .totalRequired(totalRequired)
                .remainingAfterProduction(currentStock.subtract(totalRequired))
                .sufficient(sufficient)
                .unitCost(unitCost)
                .usedInProducts(List.copyOf(usedIn))
                .build();
        }
    }
}
