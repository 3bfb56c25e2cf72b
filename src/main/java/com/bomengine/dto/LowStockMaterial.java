package com.bomengine.dto;

import com.bomengine.domain.StockStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class LowStockMaterial {
    UUID materialId;
    String materialName;
    String unit;
    BigDecimal currentStock;
    BigDecimal reorderLevel;
    StockStatus stockStatus;
    RiskLevel priority;
    List<AffectedProduct> affectedProducts;

    @Value
    @Builder
    public static class AffectedProduct {
        UUID productId;
        String productName;
        UUID recipeId;
        String recipeName;
    }
}
