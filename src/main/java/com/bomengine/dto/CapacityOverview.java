package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CapacityOverview {
    int totalBomProducts;
    List<ProductCapacitySummary> productCapacities;
    List<CriticalBottleneck> criticalBottlenecks;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProductCapacitySummary {
        UUID productId;
        String productName;
        int currentCapacity;
        String bottleneckMaterial;
        String recipeName;
        String error;
    }

    @Value
    @Builder
    public static class CriticalBottleneck {
        UUID materialId;
        String materialName;
        List<String> affectsProducts;
    }
}
