package com.bomengine.dto;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class UsageProfile {
    UUID materialId;
    int windowDays;
    int observedDays;
    double totalUsage;
    double averageDailyUsage;

    public boolean hasUsage() {
        return averageDailyUsage > 0.0;
    }
}
