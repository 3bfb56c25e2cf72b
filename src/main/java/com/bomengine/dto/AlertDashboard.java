package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AlertDashboard {
    Summary summary;
    List<ActiveAlertReport.StockAlert> activeAlerts;
    List<PredictiveAlertReport.PredictiveAlert> predictiveAlerts;
    List<ReorderReport.ReorderRecommendation> reorderRecommendations;
    double totalReorderCost;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;

    @Value
    @Builder
    public static class Summary {
        int activeAlerts;
        int predictiveAlerts;
        int reorderRecommendations;
        long outOfStockCount;
        long criticalCount;
        long lowCount;
    }
}
