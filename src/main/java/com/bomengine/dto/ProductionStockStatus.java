package com.bomengine.dto;

public enum ProductionStockStatus {
    OUT_OF_STOCK,
    LOW_STOCK,
    MODERATE_STOCK,
    IN_STOCK
}
