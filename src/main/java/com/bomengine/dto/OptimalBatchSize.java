package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class OptimalBatchSize {
    UUID productId;
    String productName;
    int maximumProducible;
    BottleneckMaterial bottleneckMaterial;
    List<Integer> suggestedBatches;
    List<BatchOption> batchOptions;
    String recommendation;

    @Value
    @Builder
    public static class BatchOption {
        int batchSize;
        BigDecimal totalCost;
        BigDecimal costPerUnit;
        double utilizationPercentage;
    }
}
