package com.bomengine.service;

import com.bomengine.domain.TenantSnapshot;
import com.bomengine.dto.ProductionReport;
import com.bomengine.engine.ReportAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductionReportService {

    private final BomSnapshotService    snapshotService;
    private final BomCalculationService calculationService;
    private final ReportAggregator      reportAggregator;
    private final Clock                 clock;

    @Value("${bom.alerts.usage-window-days:30}")
    private int usageWindowDays;

    @Value("${bom.alerts.dashboard-top-n:10}")
    private int dashboardTopN;

    public ProductionReport productionOverview(UUID tenantId) {
        TenantSnapshot snapshot = snapshotService.loadTenantSnapshot(tenantId, usageWindowDays, clock.instant());
        ProductionReport report = reportAggregator.buildProductionReport(
            snapshot.getProducts(), snapshot.getMaterials(), snapshot.getHistory(),
            usageWindowDays, dashboardTopN, snapshot.getAsOf(), calculationService.executor());
        log.info("Production report built | tenantId={} | bomProducts={} | bottlenecks={} | lowStock={}",
                 tenantId, report.getCapacityOverview().getTotalBomProducts(),
                 report.getCapacityOverview().getCriticalBottlenecks().size(),
                 report.getLowStockMaterialsInActiveRecipes().size());
        return report;
    }
}
