package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ProductionSimulation {
    boolean success;
    String message;
    UUID productId;
    String productName;
    int quantity;
    List<MaterialChange> materialChanges;
    List<MaterialShortage> shortages;
    BigDecimal productionCost;
    BigDecimal costPerUnit;

    @Value
    @Builder
    public static class MaterialChange {
        UUID materialId;
        String materialName;
        String unit;
        BigDecimal beforeProduction;
        BigDecimal consumed;
        BigDecimal afterProduction;
        boolean belowReorderLevel;
    }
}
