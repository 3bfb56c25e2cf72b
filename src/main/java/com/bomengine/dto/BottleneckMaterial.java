package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BottleneckMaterial {
    UUID materialId;
    String materialName;
    String unit;
    BigDecimal requiredPerUnit;
    BigDecimal availableStock;
    int maxUnits;
}
