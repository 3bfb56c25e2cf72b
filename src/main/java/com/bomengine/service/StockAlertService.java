package com.bomengine.service;

import com.bomengine.domain.TenantSnapshot;
import com.bomengine.dto.ActiveAlertReport;
import com.bomengine.dto.AlertDashboard;
import com.bomengine.dto.LowStockMaterial;
import com.bomengine.dto.PredictiveAlertReport;
import com.bomengine.dto.ReorderReport;
import com.bomengine.engine.StockAlertEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StockAlertService {

    private final BomSnapshotService snapshotService;
    private final StockAlertEngine   alertEngine;
    private final Clock              clock;

    @Value("${bom.alerts.usage-window-days:30}")
    private int usageWindowDays;

    @Value("${bom.alerts.dashboard-top-n:10}")
    private int dashboardTopN;

    public ActiveAlertReport activeAlerts(UUID tenantId) {
        TenantSnapshot snapshot = snapshot(tenantId);
        ActiveAlertReport report = alertEngine.computeActiveAlerts(snapshot.getMaterials(), snapshot.getActiveRecipes());
        log.info("Active alerts computed | tenantId={} | alerts={} | summary={}",
                 tenantId, report.getTotalAlerts(), report.getSeveritySummary());
        return report;
    }

    public PredictiveAlertReport predictiveAlerts(UUID tenantId, int forecastDays) {
        TenantSnapshot snapshot = snapshot(tenantId);
        PredictiveAlertReport report = alertEngine.computePredictiveAlerts(
            snapshot.getMaterials(), snapshot.getHistory(), forecastDays, usageWindowDays, snapshot.getAsOf());
        log.info("Predictive alerts computed | tenantId={} | forecastDays={} | alerts={}",
                 tenantId, forecastDays, report.getTotalAlerts());
        return report;
    }

    public ReorderReport reorderRecommendations(UUID tenantId, int targetDaysOfStock) {
        TenantSnapshot snapshot = snapshot(tenantId);
        ReorderReport report = alertEngine.computeReorderRecommendations(
            snapshot.getMaterials(), snapshot.getHistory(), targetDaysOfStock, usageWindowDays, snapshot.getAsOf());
        log.info("Reorder recommendations computed | tenantId={} | targetDays={} | materials={} | cost={}",
                 tenantId, targetDaysOfStock, report.getTotalMaterials(), report.getTotalEstimatedCost());
        return report;
    }

    public AlertDashboard dashboard(UUID tenantId) {
        TenantSnapshot snapshot = snapshot(tenantId);
        AlertDashboard dashboard = alertEngine.computeDashboard(
            snapshot.getMaterials(), snapshot.getActiveRecipes(), snapshot.getHistory(),
            usageWindowDays, dashboardTopN, snapshot.getAsOf());
        log.info("Alert dashboard computed | tenantId={} | active={} | predictive={} | reorder={}",
                 tenantId, dashboard.getSummary().getActiveAlerts(), dashboard.getSummary().getPredictiveAlerts(),
                 dashboard.getSummary().getReorderRecommendations());
        return dashboard;
    }

    public List<LowStockMaterial> lowStockInActiveRecipes(UUID tenantId) {
        TenantSnapshot snapshot = snapshot(tenantId);
        List<LowStockMaterial> materials = alertEngine.findLowStockMaterialsInActiveRecipes(
            snapshot.getMaterials(), snapshot.getProducts());
        log.info("Low stock materials in active recipes | tenantId={} | count={}", tenantId, materials.size());
        return materials;
    }

    private TenantSnapshot snapshot(UUID tenantId) {
        return snapshotService.loadTenantSnapshot(tenantId, usageWindowDays, clock.instant());
    }
}
