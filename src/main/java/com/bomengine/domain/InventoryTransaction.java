package com.bomengine.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class InventoryTransaction {
    UUID id;
    UUID materialId;
    TransactionType type;
    BigDecimal quantityChange;
    String reason;
    Instant createdAt;

    public boolean isConsumption() {
        return quantityChange != null && quantityChange.signum() < 0;
    }
}
