package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ProductionReport {
    CapacityOverview capacityOverview;
    AlertDashboard alertDashboard;
    List<LowStockMaterial> lowStockMaterialsInActiveRecipes;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}
