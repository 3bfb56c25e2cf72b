package com.bomengine.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class Material {

    private static final BigDecimal HALF = new BigDecimal("0.5");

    UUID id;
    UUID tenantId;
    String name;
    String sku;
    String category;
    String supplier;
    String unit;

    @Builder.Default
    BigDecimal stockQuantity = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal reorderLevel = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal unitCost = BigDecimal.ZERO;

    public StockStatus getStockStatus() {
        if (stockQuantity.signum() <= 0) {
            return StockStatus.OUT_OF_STOCK;
        }
        if (stockQuantity.compareTo(reorderLevel.multiply(HALF)) <= 0) {
            return StockStatus.CRITICAL;
        }
        if (stockQuantity.compareTo(reorderLevel) <= 0) {
            return StockStatus.LOW;
        }
        return StockStatus.NORMAL;
    }

    public boolean isAtOrBelowReorderLevel() {
        return getStockStatus() != StockStatus.NORMAL;
    }
}
