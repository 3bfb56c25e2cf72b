package com.bomengine.engine;

import com.bomengine.domain.InventoryTransaction;
import com.bomengine.domain.Material;
import com.bomengine.dto.UsageProfile;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Consumption rate of a material derived from its transaction log, and the
 * stockout horizon that rate implies.
 */
@Component
public class UsageForecaster {

    /**
     * Total consumption inside {@code [asOf - windowDays, asOf]} divided by the number of
     * distinct (UTC) days the material shows any activity in that window. Dividing by observed
     * days rather than the nominal window keeps a short history from diluting the rate.
     */
    public UsageProfile profile(Material material, List<InventoryTransaction> history, int windowDays, Instant asOf) {
        Instant from = asOf.minus(Duration.ofDays(windowDays));
        Set<LocalDate> observedDays = new HashSet<>();
        BigDecimal totalUsage = BigDecimal.ZERO;

        for (InventoryTransaction tx : history) {
            if (!material.getId().equals(tx.getMaterialId()) || tx.getCreatedAt() == null) {
                continue;
            }
            if (tx.getCreatedAt().isBefore(from) || tx.getCreatedAt().isAfter(asOf)) {
                continue;
            }
            observedDays.add(LocalDate.ofInstant(tx.getCreatedAt(), ZoneOffset.UTC));
            if (tx.isConsumption()) {
                totalUsage = totalUsage.add(tx.getQuantityChange().abs());
            }
        }

        double usage = totalUsage.doubleValue();
        double average = observedDays.isEmpty() ? 0.0 : usage / observedDays.size();
        return UsageProfile.builder()
            .materialId(material.getId())
            .windowDays(windowDays)
            .observedDays(observedDays.size())
            .totalUsage(usage)
            .averageDailyUsage(average)
            .build();
    }

    public double computeAverageDailyUsage(Material material, List<InventoryTransaction> history,
                                           int windowDays, Instant asOf) {
        return profile(material, history, windowDays, asOf).getAverageDailyUsage();
    }

    /**
     * Days until stock reaches zero; positive infinity when nothing is being consumed.
     */
    public double projectDaysToStockout(Material material, double averageDailyUsage) {
        if (averageDailyUsage <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, material.getStockQuantity().doubleValue()) / averageDailyUsage;
    }

    // negative once the material is already below its reorder level
    public double projectDaysToReorderLevel(Material material, double averageDailyUsage) {
        if (averageDailyUsage <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return material.getStockQuantity().subtract(material.getReorderLevel()).doubleValue() / averageDailyUsage;
    }
}
