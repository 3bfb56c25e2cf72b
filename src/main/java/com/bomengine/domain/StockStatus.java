package com.bomengine.domain;

public enum StockStatus {
    OUT_OF_STOCK,
    CRITICAL,
    LOW,
    NORMAL
}
