package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AvailabilityResult {
    UUID productId;
    String productName;
    UUID recipeId;
    String recipeName;
    int availableQuantity;
    boolean canProduce;
    BottleneckMaterial bottleneckMaterial;
    List<ComponentStatus> components;
    BigDecimal yieldQuantity;
    String yieldUnit;
    String message;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ComponentStatus {
        UUID materialId;
        String materialName;
        String unit;
        BigDecimal quantityRequired;
        BigDecimal wastePercentage;
        BigDecimal effectiveQuantity;
        BigDecimal availableStock;
        boolean sufficient;
        Integer maxProducible;
        boolean constraining;
        boolean limiting;
    }
}
