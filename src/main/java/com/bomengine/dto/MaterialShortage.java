package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class MaterialShortage {
    UUID materialId;
    String materialName;
    String unit;
    BigDecimal currentStock;
    BigDecimal totalRequired;
    BigDecimal shortage;
}
