package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class MultiProductPlan {
    int totalProducts;
    List<PlanEntry> productionPlan;
    Map<UUID, BigDecimal> aggregatedMaterialRequirements;
    List<AggregatedMaterialRequirement> materialRequirements;
    List<MaterialShortage> materialShortages;
    boolean feasible;
    BigDecimal totalProductionCost;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PlanEntry {
        UUID productId;
        String productName;
        int quantity;
        boolean canProduce;
        BigDecimal totalCost;
        List<MaterialShortage> shortages;
        String error;
    }

    @Value
    @Builder
    public static class AggregatedMaterialRequirement {
        UUID materialId;
        String materialName;
        String unit;
        BigDecimal currentStock;
        BigDecimal totalRequired;
        BigDecimal remainingAfterProduction;
        boolean sufficient;
        BigDecimal unitCost;
        List<ProductUsage> usedInProducts;
    }

    @Value
    @Builder
    public static class ProductUsage {
        UUID productId;
        String productName;
        BigDecimal quantityRequired;
    }
}
