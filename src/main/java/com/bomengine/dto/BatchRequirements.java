package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BatchRequirements {
    UUID productId;
    String productName;
    UUID recipeId;
    String recipeName;
    int requestedQuantity;
    boolean canProduce;
    List<MaterialRequirement> materialRequirements;
    List<MaterialShortage> shortages;
    BigDecimal totalMaterialCost;
    BigDecimal costPerUnit;

    @Value
    @Builder
    public static class MaterialRequirement {
        UUID materialId;
        String materialName;
        String unit;
        BigDecimal quantityPerUnit;
        BigDecimal wastePercentage;
        BigDecimal effectiveQuantityPerUnit;
        BigDecimal totalRequired;
        BigDecimal currentStock;
        BigDecimal remainingAfterProduction;
        boolean sufficient;
        BigDecimal shortage;
        BigDecimal unitCost;
        BigDecimal totalCost;
    }
}
