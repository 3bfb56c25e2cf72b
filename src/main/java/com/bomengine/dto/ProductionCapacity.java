package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ProductionCapacity {
    UUID productId;
    String productName;
    int availableQuantity;
    boolean canProduce;
    ProductionStockStatus stockStatus;
    String unit;
    UUID recipeId;
    BottleneckMaterial bottleneckMaterial;
    List<AvailabilityResult.ComponentStatus> componentsStatus;
}
