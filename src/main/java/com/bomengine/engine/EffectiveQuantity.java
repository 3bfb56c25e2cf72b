package com.bomengine.engine;

import java.math.BigDecimal;

/**
 * Waste-adjusted component requirement: {@code quantityRequired × (1 + wastePercentage / 100)}.
 * Exact decimal arithmetic, so a 10% allowance on 2.0 is exactly 2.2.
 */
public final class EffectiveQuantity {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private EffectiveQuantity() {
    }

    public static BigDecimal of(BigDecimal quantityRequired, BigDecimal wastePercentage) {
        if (quantityRequired == null) {
            return BigDecimal.ZERO;
        }
        if (wastePercentage == null || wastePercentage.signum() == 0) {
            return quantityRequired;
        }
        // q + q*w/100 keeps the scale finite; dividing by 100 always terminates
        return quantityRequired.add(quantityRequired.multiply(wastePercentage).divide(HUNDRED));
    }
}
