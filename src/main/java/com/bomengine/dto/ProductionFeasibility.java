package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class ProductionFeasibility {
    UUID productId;
    String productName;
    UUID recipeId;
    int requestedQuantity;
    int availableQuantity;
    boolean feasible;
    int shortage;
    BottleneckMaterial bottleneckMaterial;
}
