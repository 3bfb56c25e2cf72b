package com.bomengine.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class Recipe {
    UUID id;
    UUID productId;
    String name;

    @Builder.Default
    BigDecimal yieldQuantity = BigDecimal.ONE;

    @Builder.Default
    String yieldUnit = "pcs";

    boolean active;

    @Singular
    List<RecipeComponent> components;

    public boolean usesMaterial(UUID materialId) {
        return components.stream().anyMatch(c -> c.getMaterialId().equals(materialId));
    }
}
