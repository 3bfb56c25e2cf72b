package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ActiveAlertReport {
    List<StockAlert> alerts;
    int totalAlerts;
    Map<AlertSeverity, Long> severitySummary;

    @Value
    @Builder
    public static class StockAlert {
        UUID materialId;
        String materialName;
        String sku;
        String category;
        String unit;
        AlertSeverity severity;
        BigDecimal currentStock;
        BigDecimal reorderLevel;
        int activeRecipeCount;
        String message;
        String actionRequired;
    }
}
