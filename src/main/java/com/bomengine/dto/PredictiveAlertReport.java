package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PredictiveAlertReport {
    List<PredictiveAlert> alerts;
    int totalAlerts;
    int forecastPeriodDays;
    int usageWindowDays;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;

    @Value
    @Builder
    public static class PredictiveAlert {
        UUID materialId;
        String materialName;
        String sku;
        String unit;
        BigDecimal currentStock;
        BigDecimal reorderLevel;
        double averageDailyUsage;
        int basedOnUsageDays;
        double daysUntilStockout;
        double daysUntilReorderLevel;
        LocalDate predictedStockoutDate;
        PredictiveSeverity severity;
        double recommendedReorderQuantity;
        String message;
    }
}
