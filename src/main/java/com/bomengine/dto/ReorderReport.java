package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ReorderReport {
    List<ReorderRecommendation> recommendations;
    int totalMaterials;
    double totalEstimatedCost;
    int targetDaysOfStock;
    Map<ReorderPriority, Long> prioritySummary;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;

    @Value
    @Builder
    public static class ReorderRecommendation {
        UUID materialId;
        String materialName;
        String sku;
        String supplier;
        String category;
        String unit;
        BigDecimal currentStock;
        BigDecimal reorderLevel;
        double averageDailyUsage;
        // null when there is no recorded usage
        Double daysToStockout;
        double recommendedOrderQuantity;
        BigDecimal unitCost;
        double estimatedCost;
        ReorderPriority priority;
    }
}
