package com.bomengine.domain;

public enum TransactionType {
    RESTOCK,
    DEDUCTION,
    ADJUSTMENT,
    PRODUCTION,
    SALE,
    WASTE
}
