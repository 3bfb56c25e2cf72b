package com.bomengine.domain;

import com.bomengine.engine.EffectiveQuantity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of a recipe: how much of a material one yield unit consumes.
 */
@Value
@Builder
public class RecipeComponent {
    UUID materialId;
    Material material;
    BigDecimal quantityRequired;

    @Builder.Default
    BigDecimal wastePercentage = BigDecimal.ZERO;

    public BigDecimal getEffectiveQuantity() {
        return EffectiveQuantity.of(quantityRequired, wastePercentage);
    }
}
